package com.logistics.order.handler;

import java.util.List;

import com.logistics.order.domain.OrderAggregate;
import com.logistics.order.domain.OrderNotFoundException;
import com.logistics.order.service.OrderEventStore;
import com.logistics.order.service.StoredEvent;
import com.logistics.shared.commands.OrderCommand;
import com.logistics.shared.events.OrderEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Template for commands against an order that must already exist.
 *
 * The history is read fresh on every call, so a retried command sees
 * whatever a concurrent writer appended in between.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class ExistingOrderCommandHandler<C extends OrderCommand> implements CommandHandler<C> {

    protected final OrderEventStore eventStore;

    @Override
    public void handle(C command) {
        List<StoredEvent> history = eventStore.getEvents(command.orderId());
        if (history.isEmpty()) {
            throw new OrderNotFoundException(command.orderId());
        }

        OrderAggregate order = OrderAggregate.fromHistory(history.stream().map(StoredEvent::event).toList());
        List<OrderEvent> produced = execute(order, command);
        eventStore.append(command.orderId(), produced);

        log.info("Command handled: command={}, orderId={}, version={}, status={}",
                command.getClass().getSimpleName(), command.orderId(), order.getVersion(), order.getStatus());
    }

    /**
     * Apply the command to the rebuilt aggregate.
     *
     * @return the events to append, exactly as returned by the aggregate
     */
    protected abstract List<OrderEvent> execute(OrderAggregate order, C command);
}
