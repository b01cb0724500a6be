package com.logistics.order.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.logistics.shared.events.Events.DeliveryAddressChanged;
import com.logistics.shared.events.Events.DeliveryAttemptFailed;
import com.logistics.shared.events.Events.OrderDelivered;
import com.logistics.shared.events.Events.OrderPacked;
import com.logistics.shared.events.Events.OrderPlaced;
import com.logistics.shared.events.Events.OrderShipped;
import com.logistics.shared.events.OrderEvent;
import com.logistics.shared.events.OrderStatus;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Order write model, rebuilt from its own event history for every command.
 *
 * Lifecycle:
 *   NONE → PLACED → PACKED → SHIPPED → FAILED | DELIVERED
 * The delivery address can change any time before SHIPPED.
 *
 * Each mutating method validates the transition, applies the new event to
 * this instance and returns it. Replay goes through the same {@link #apply}
 * path, so a rebuilt aggregate is indistinguishable from the live one.
 * Instances are not thread-safe; one instance serves one command.
 */
@Getter
public class OrderAggregate {

    private UUID id;
    private String customerName;
    private String address;
    private BigDecimal total;
    private String warehouseId;
    private Double weight;
    private String courierName;
    private Instant deliveredAt;
    private String lastFailureReason;
    private OrderStatus status = OrderStatus.NONE;

    /** Number of events applied so far; equals the stored version of the last one. */
    private int version;

    @Getter(AccessLevel.NONE)
    private final Applier applier = new Applier();

    /** Rebuild an aggregate by replaying its ordered history. */
    public static OrderAggregate fromHistory(List<? extends OrderEvent> history) {
        OrderAggregate aggregate = new OrderAggregate();
        aggregate.loadFromHistory(history);
        return aggregate;
    }

    public void loadFromHistory(List<? extends OrderEvent> history) {
        history.forEach(this::apply);
    }

    // ─── Commands ─────────────────────────────────────────────────────────────

    public List<OrderEvent> place(UUID orderId, String customerName, String address, BigDecimal total) {
        return create(new OrderPlaced(orderId, customerName, address, total));
    }

    public List<OrderEvent> create(OrderPlaced placed) {
        if (status != OrderStatus.NONE) {
            throw new InvalidOrderStateException(placed.orderId(), status, "Order already placed");
        }
        return emit(placed);
    }

    public List<OrderEvent> packOrder(String warehouseId, double weight) {
        if (status.isBefore(OrderStatus.PLACED) || status.isAtLeast(OrderStatus.SHIPPED)
                || status == OrderStatus.PACKED) {
            throw new InvalidOrderStateException(id, status, "Order can only be packed once, after placement and before shipping");
        }
        return emit(new OrderPacked(id, warehouseId, weight));
    }

    public List<OrderEvent> shipOrder(String courierName) {
        if (status != OrderStatus.PACKED) {
            throw new InvalidOrderStateException(id, status, "Only a packed order can be shipped");
        }
        return emit(new OrderShipped(id, courierName));
    }

    public List<OrderEvent> changeAddress(String newAddress) {
        if (status == OrderStatus.NONE || status.isAtLeast(OrderStatus.SHIPPED)) {
            throw new InvalidOrderStateException(id, status, "Address can only change before shipping");
        }
        return emit(new DeliveryAddressChanged(id, newAddress));
    }

    public List<OrderEvent> failDelivery(String reason) {
        if (status != OrderStatus.SHIPPED) {
            throw new InvalidOrderStateException(id, status, "Delivery can only fail for a shipped order");
        }
        return emit(new DeliveryAttemptFailed(id, reason));
    }

    public List<OrderEvent> markDelivered(Instant at) {
        if (status != OrderStatus.SHIPPED) {
            throw new InvalidOrderStateException(id, status, "Only a shipped order can be delivered");
        }
        return emit(new OrderDelivered(id, at));
    }

    // ─── State transitions ────────────────────────────────────────────────────

    private List<OrderEvent> emit(OrderEvent event) {
        apply(event);
        return List.of(event);
    }

    private void apply(OrderEvent event) {
        event.accept(applier);
        version++;
    }

    private class Applier implements OrderEvent.Visitor {

        @Override
        public void visit(OrderPlaced event) {
            id = event.orderId();
            customerName = event.customerName();
            address = event.address();
            total = event.total();
            status = OrderStatus.PLACED;
        }

        @Override
        public void visit(OrderPacked event) {
            warehouseId = event.warehouseId();
            weight = event.weight();
            status = OrderStatus.PACKED;
        }

        @Override
        public void visit(OrderShipped event) {
            courierName = event.courierName();
            status = OrderStatus.SHIPPED;
        }

        @Override
        public void visit(DeliveryAddressChanged event) {
            address = event.newAddress();
        }

        @Override
        public void visit(DeliveryAttemptFailed event) {
            lastFailureReason = event.reason();
            status = OrderStatus.FAILED;
        }

        @Override
        public void visit(OrderDelivered event) {
            deliveredAt = event.deliveredAt();
            status = OrderStatus.DELIVERED;
        }
    }
}
