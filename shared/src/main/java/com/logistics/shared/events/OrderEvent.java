package com.logistics.shared.events;

import java.util.UUID;

import com.logistics.shared.events.Events.DeliveryAddressChanged;
import com.logistics.shared.events.Events.DeliveryAttemptFailed;
import com.logistics.shared.events.Events.OrderDelivered;
import com.logistics.shared.events.Events.OrderPacked;
import com.logistics.shared.events.Events.OrderPlaced;
import com.logistics.shared.events.Events.OrderShipped;

/**
 * Base type of every fact recorded about an order.
 *
 * The set of events is closed. Code that consumes events (aggregate replay,
 * read-model projection) implements {@link Visitor}, so adding an event kind
 * breaks compilation at every consumer until it handles the new kind.
 */
public sealed interface OrderEvent
        permits OrderPlaced, OrderPacked, OrderShipped,
                DeliveryAddressChanged, DeliveryAttemptFailed, OrderDelivered {

    UUID orderId();

    /** Flat type tag stored next to the payload (see {@link EventTypes}). */
    String type();

    void accept(Visitor visitor);

    interface Visitor {
        void visit(OrderPlaced event);

        void visit(OrderPacked event);

        void visit(OrderShipped event);

        void visit(DeliveryAddressChanged event);

        void visit(DeliveryAttemptFailed event);

        void visit(OrderDelivered event);
    }
}
