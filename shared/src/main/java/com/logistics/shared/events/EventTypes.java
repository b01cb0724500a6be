package com.logistics.shared.events;

import java.util.Map;

import com.logistics.shared.events.Events.DeliveryAddressChanged;
import com.logistics.shared.events.Events.DeliveryAttemptFailed;
import com.logistics.shared.events.Events.OrderDelivered;
import com.logistics.shared.events.Events.OrderPacked;
import com.logistics.shared.events.Events.OrderPlaced;
import com.logistics.shared.events.Events.OrderShipped;

/**
 * Canonical event type tags.
 * These strings are persisted with every event record. Renaming one is a
 * breaking change for the stored log.
 */
public final class EventTypes {

    private EventTypes() {}

    public static final String ORDER_PLACED             = "OrderPlaced";
    public static final String ORDER_PACKED             = "OrderPacked";
    public static final String ORDER_SHIPPED            = "OrderShipped";
    public static final String DELIVERY_ADDRESS_CHANGED = "DeliveryAddressChanged";
    public static final String DELIVERY_ATTEMPT_FAILED  = "DeliveryAttemptFailed";
    public static final String ORDER_DELIVERED          = "OrderDelivered";

    private static final Map<String, Class<? extends OrderEvent>> TYPE_MAP = Map.of(
            ORDER_PLACED, OrderPlaced.class,
            ORDER_PACKED, OrderPacked.class,
            ORDER_SHIPPED, OrderShipped.class,
            DELIVERY_ADDRESS_CHANGED, DeliveryAddressChanged.class,
            DELIVERY_ATTEMPT_FAILED, DeliveryAttemptFailed.class,
            ORDER_DELIVERED, OrderDelivered.class
    );

    /**
     * Resolve the payload class for a stored type tag.
     *
     * @return the event class, or {@code null} when the tag is unknown
     */
    public static Class<? extends OrderEvent> eventClassOf(String type) {
        return type == null ? null : TYPE_MAP.get(type);
    }
}
