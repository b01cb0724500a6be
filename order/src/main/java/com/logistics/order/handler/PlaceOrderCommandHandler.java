package com.logistics.order.handler;

import org.springframework.stereotype.Component;

import com.logistics.order.domain.OrderAggregate;
import com.logistics.order.domain.OrderAlreadyExistsException;
import com.logistics.order.service.OrderEventStore;
import com.logistics.shared.commands.Commands.PlaceOrderCommand;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class PlaceOrderCommandHandler implements CommandHandler<PlaceOrderCommand> {

    private final OrderEventStore eventStore;

    @Override
    public Class<PlaceOrderCommand> commandType() {
        return PlaceOrderCommand.class;
    }

    @Override
    public void handle(PlaceOrderCommand command) {
        if (command.orderId() == null) {
            throw new IllegalArgumentException("PlaceOrderCommand requires an order id");
        }
        if (!eventStore.getEvents(command.orderId()).isEmpty()) {
            throw new OrderAlreadyExistsException(command.orderId());
        }

        OrderAggregate order = new OrderAggregate();
        eventStore.append(command.orderId(),
                order.place(command.orderId(), command.customerName(), command.address(), command.total()));

        log.info("Order placed: orderId={}, customerName={}, total={}",
                command.orderId(), command.customerName(), command.total());
    }
}
