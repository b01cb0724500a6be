package com.logistics.order.handler;

import java.util.List;

import org.springframework.stereotype.Component;

import com.logistics.order.domain.OrderAggregate;
import com.logistics.order.service.OrderEventStore;
import com.logistics.shared.commands.Commands.FailDeliveryCommand;
import com.logistics.shared.events.OrderEvent;

@Component
public class FailDeliveryCommandHandler extends ExistingOrderCommandHandler<FailDeliveryCommand> {

    public FailDeliveryCommandHandler(OrderEventStore eventStore) {
        super(eventStore);
    }

    @Override
    public Class<FailDeliveryCommand> commandType() {
        return FailDeliveryCommand.class;
    }

    @Override
    protected List<OrderEvent> execute(OrderAggregate order, FailDeliveryCommand command) {
        return order.failDelivery(command.reason());
    }
}
