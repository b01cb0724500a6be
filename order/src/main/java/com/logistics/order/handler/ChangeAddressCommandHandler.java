package com.logistics.order.handler;

import java.util.List;

import org.springframework.stereotype.Component;

import com.logistics.order.domain.OrderAggregate;
import com.logistics.order.service.OrderEventStore;
import com.logistics.shared.commands.Commands.ChangeAddressCommand;
import com.logistics.shared.events.OrderEvent;

@Component
public class ChangeAddressCommandHandler extends ExistingOrderCommandHandler<ChangeAddressCommand> {

    public ChangeAddressCommandHandler(OrderEventStore eventStore) {
        super(eventStore);
    }

    @Override
    public Class<ChangeAddressCommand> commandType() {
        return ChangeAddressCommand.class;
    }

    @Override
    protected List<OrderEvent> execute(OrderAggregate order, ChangeAddressCommand command) {
        return order.changeAddress(command.newAddress());
    }
}
