package com.logistics.order.handler;

import java.util.List;

import org.springframework.stereotype.Component;

import com.logistics.order.domain.OrderAggregate;
import com.logistics.order.service.OrderEventStore;
import com.logistics.shared.commands.Commands.ShipOrderCommand;
import com.logistics.shared.events.OrderEvent;

@Component
public class ShipOrderCommandHandler extends ExistingOrderCommandHandler<ShipOrderCommand> {

    public ShipOrderCommandHandler(OrderEventStore eventStore) {
        super(eventStore);
    }

    @Override
    public Class<ShipOrderCommand> commandType() {
        return ShipOrderCommand.class;
    }

    @Override
    protected List<OrderEvent> execute(OrderAggregate order, ShipOrderCommand command) {
        return order.shipOrder(command.courierName());
    }
}
