package com.logistics.shared.events;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * All order event payloads.
 *
 * Each record carries the order id plus the minimal fields needed to replay it.
 * Serialized form is the flat JSON object of the record components; the type
 * tag travels separately in the event record.
 *
 * Naming: {Noun}{PastTense} (OrderPlaced, OrderPacked, ...).
 */
public final class Events {

    private Events() {}

    // ─── Lifecycle ─────────────────────────────────────────────────────────────

    public record OrderPlaced(UUID orderId, String customerName, String address, BigDecimal total)
            implements OrderEvent {

        @Override
        public String type() {
            return EventTypes.ORDER_PLACED;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    public record OrderPacked(UUID orderId, String warehouseId, double weight) implements OrderEvent {

        @Override
        public String type() {
            return EventTypes.ORDER_PACKED;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    public record OrderShipped(UUID orderId, String courierName) implements OrderEvent {

        @Override
        public String type() {
            return EventTypes.ORDER_SHIPPED;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    // ─── Delivery ──────────────────────────────────────────────────────────────

    public record DeliveryAddressChanged(UUID orderId, String newAddress) implements OrderEvent {

        @Override
        public String type() {
            return EventTypes.DELIVERY_ADDRESS_CHANGED;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    public record DeliveryAttemptFailed(UUID orderId, String reason) implements OrderEvent {

        @Override
        public String type() {
            return EventTypes.DELIVERY_ATTEMPT_FAILED;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }

    public record OrderDelivered(UUID orderId, Instant deliveredAt) implements OrderEvent {

        @Override
        public String type() {
            return EventTypes.ORDER_DELIVERED;
        }

        @Override
        public void accept(Visitor visitor) {
            visitor.visit(this);
        }
    }
}
