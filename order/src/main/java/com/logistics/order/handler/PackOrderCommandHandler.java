package com.logistics.order.handler;

import java.util.List;

import org.springframework.stereotype.Component;

import com.logistics.order.domain.OrderAggregate;
import com.logistics.order.service.OrderEventStore;
import com.logistics.shared.commands.Commands.PackOrderCommand;
import com.logistics.shared.events.OrderEvent;

@Component
public class PackOrderCommandHandler extends ExistingOrderCommandHandler<PackOrderCommand> {

    public PackOrderCommandHandler(OrderEventStore eventStore) {
        super(eventStore);
    }

    @Override
    public Class<PackOrderCommand> commandType() {
        return PackOrderCommand.class;
    }

    @Override
    protected List<OrderEvent> execute(OrderAggregate order, PackOrderCommand command) {
        return order.packOrder(command.warehouseId(), command.weight());
    }
}
