package com.logistics.order.handler;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.springframework.stereotype.Component;

import com.logistics.order.domain.OrderAggregate;
import com.logistics.order.service.OrderEventStore;
import com.logistics.shared.commands.Commands.MarkOrderDeliveredCommand;
import com.logistics.shared.events.OrderEvent;

@Component
public class MarkOrderDeliveredCommandHandler extends ExistingOrderCommandHandler<MarkOrderDeliveredCommand> {

    private final Clock clock;

    public MarkOrderDeliveredCommandHandler(OrderEventStore eventStore, Clock clock) {
        super(eventStore);
        this.clock = clock;
    }

    @Override
    public Class<MarkOrderDeliveredCommand> commandType() {
        return MarkOrderDeliveredCommand.class;
    }

    @Override
    protected List<OrderEvent> execute(OrderAggregate order, MarkOrderDeliveredCommand command) {
        Instant deliveredAt = command.deliveredAt() != null ? command.deliveredAt() : clock.instant();
        return order.markDelivered(deliveredAt);
    }
}
