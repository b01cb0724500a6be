package com.logistics.order.domain;

import com.logistics.shared.events.Events.*;
import com.logistics.shared.events.OrderEvent;
import com.logistics.shared.events.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit Tests: OrderAggregate state machine and replay.
 */
class OrderAggregateTest {

    private static final UUID ORDER_ID = UUID.fromString("3f1c2a9e-0d4b-4a53-9a57-1c1f5b0e7a11");
    private static final Instant DELIVERED_AT = Instant.parse("2024-05-01T10:15:30Z");

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private OrderAggregate placed() {
        OrderAggregate order = new OrderAggregate();
        order.place(ORDER_ID, "Alice", "1 Main St", new BigDecimal("10.00"));
        return order;
    }

    private OrderAggregate packed() {
        OrderAggregate order = placed();
        order.packOrder("WH1", 2.5);
        return order;
    }

    private OrderAggregate shipped() {
        OrderAggregate order = packed();
        order.shipOrder("DHL");
        return order;
    }

    // ─── Placement ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("place: emits OrderPlaced and moves to PLACED")
    void place_shouldEmitOrderPlaced() {
        OrderAggregate order = new OrderAggregate();

        List<OrderEvent> events = order.place(ORDER_ID, "Alice", "1 Main St", new BigDecimal("10.00"));

        assertThat(events).containsExactly(new OrderPlaced(ORDER_ID, "Alice", "1 Main St", new BigDecimal("10.00")));
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PLACED);
        assertThat(order.getId()).isEqualTo(ORDER_ID);
        assertThat(order.getVersion()).isEqualTo(1);
    }

    @Test
    @DisplayName("place: a second placement is an invalid state")
    void place_twice_shouldFail() {
        OrderAggregate order = placed();

        assertThatThrownBy(() -> order.place(ORDER_ID, "Bob", "2 Oak Ave", BigDecimal.ONE))
                .isInstanceOf(InvalidOrderStateException.class)
                .satisfies(e -> assertThat(((InvalidOrderStateException) e).getCurrentStatus()).isEqualTo(OrderStatus.PLACED));
        assertThat(order.getCustomerName()).isEqualTo("Alice");
    }

    // ─── Packing / Shipping ───────────────────────────────────────────────────

    @Test
    @DisplayName("packOrder then shipOrder: PACKED then SHIPPED")
    void packThenShip_shouldReachShipped() {
        OrderAggregate order = placed();

        assertThat(order.packOrder("WH1", 2.5)).containsExactly(new OrderPacked(ORDER_ID, "WH1", 2.5));
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PACKED);

        assertThat(order.shipOrder("DHL")).containsExactly(new OrderShipped(ORDER_ID, "DHL"));
        assertThat(order.getStatus()).isEqualTo(OrderStatus.SHIPPED);
        assertThat(order.getCourierName()).isEqualTo("DHL");
        assertThat(order.getVersion()).isEqualTo(3);
    }

    @Test
    @DisplayName("packOrder: before placement is an invalid state")
    void pack_beforePlace_shouldFail() {
        assertThatThrownBy(() -> new OrderAggregate().packOrder("WH1", 1.0))
                .isInstanceOf(InvalidOrderStateException.class);
    }

    @Test
    @DisplayName("packOrder: packing twice is an invalid state")
    void pack_twice_shouldFail() {
        OrderAggregate order = packed();

        assertThatThrownBy(() -> order.packOrder("WH2", 1.0))
                .isInstanceOf(InvalidOrderStateException.class);
        assertThat(order.getWarehouseId()).isEqualTo("WH1");
    }

    @Test
    @DisplayName("packOrder: after shipping is an invalid state")
    void pack_afterShip_shouldFail() {
        assertThatThrownBy(() -> shipped().packOrder("WH1", 1.0))
                .isInstanceOf(InvalidOrderStateException.class);
    }

    @Test
    @DisplayName("shipOrder: before packing is an invalid state")
    void ship_beforePack_shouldFail() {
        assertThatThrownBy(() -> placed().shipOrder("DHL"))
                .isInstanceOf(InvalidOrderStateException.class);
    }

    // ─── Address ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("changeAddress: allowed repeatedly before shipping, status unchanged")
    void changeAddress_twice_shouldKeepLastValue() {
        OrderAggregate order = placed();

        order.changeAddress("2 Oak Ave");
        List<OrderEvent> events = order.changeAddress("3 Elm Rd");

        assertThat(events).containsExactly(new DeliveryAddressChanged(ORDER_ID, "3 Elm Rd"));
        assertThat(order.getAddress()).isEqualTo("3 Elm Rd");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PLACED);
    }

    @Test
    @DisplayName("changeAddress: allowed while packed")
    void changeAddress_whilePacked_shouldSucceed() {
        OrderAggregate order = packed();

        order.changeAddress("2 Oak Ave");

        assertThat(order.getAddress()).isEqualTo("2 Oak Ave");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PACKED);
    }

    @Test
    @DisplayName("changeAddress: after shipping is an invalid state")
    void changeAddress_afterShip_shouldFail() {
        OrderAggregate order = shipped();

        assertThatThrownBy(() -> order.changeAddress("2 Oak Ave"))
                .isInstanceOf(InvalidOrderStateException.class);
        assertThat(order.getAddress()).isEqualTo("1 Main St");
    }

    // ─── Delivery outcomes ────────────────────────────────────────────────────

    @Test
    @DisplayName("failDelivery: SHIPPED to FAILED, then markDelivered is rejected")
    void failDelivery_thenDeliver_shouldFail() {
        OrderAggregate order = shipped();

        assertThat(order.failDelivery("no answer")).containsExactly(new DeliveryAttemptFailed(ORDER_ID, "no answer"));
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(order.getLastFailureReason()).isEqualTo("no answer");

        assertThatThrownBy(() -> order.markDelivered(DELIVERED_AT))
                .isInstanceOf(InvalidOrderStateException.class);
    }

    @Test
    @DisplayName("markDelivered: SHIPPED to DELIVERED")
    void markDelivered_shouldReachDelivered() {
        OrderAggregate order = shipped();

        assertThat(order.markDelivered(DELIVERED_AT)).containsExactly(new OrderDelivered(ORDER_ID, DELIVERED_AT));
        assertThat(order.getStatus()).isEqualTo(OrderStatus.DELIVERED);
        assertThat(order.getDeliveredAt()).isEqualTo(DELIVERED_AT);
    }

    @Test
    @DisplayName("failDelivery / markDelivered: rejected unless SHIPPED")
    void terminalOutcomes_whenNotShipped_shouldFail() {
        assertThatThrownBy(() -> packed().failDelivery("no answer")).isInstanceOf(InvalidOrderStateException.class);
        assertThatThrownBy(() -> placed().markDelivered(DELIVERED_AT)).isInstanceOf(InvalidOrderStateException.class);

        OrderAggregate delivered = shipped();
        delivered.markDelivered(DELIVERED_AT);
        assertThatThrownBy(() -> delivered.failDelivery("late")).isInstanceOf(InvalidOrderStateException.class);
        assertThatThrownBy(() -> delivered.markDelivered(DELIVERED_AT)).isInstanceOf(InvalidOrderStateException.class);
    }

    // ─── Replay ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("fromHistory: replayed state equals the incrementally built state")
    void replay_shouldMatchLiveState() {
        OrderAggregate live = new OrderAggregate();
        List<OrderEvent> history = new ArrayList<>();
        history.addAll(live.place(ORDER_ID, "Alice", "1 Main St", new BigDecimal("10.00")));
        history.addAll(live.changeAddress("2 Oak Ave"));
        history.addAll(live.packOrder("WH1", 2.5));
        history.addAll(live.shipOrder("DHL"));
        history.addAll(live.failDelivery("no answer"));

        OrderAggregate replayed = OrderAggregate.fromHistory(history);

        assertThat(replayed)
                .usingRecursiveComparison()
                .ignoringFields("applier")
                .isEqualTo(live);
        assertThat(replayed.getVersion()).isEqualTo(5);
    }

    @Test
    @DisplayName("fromHistory: replay does not re-emit events; new commands continue from replayed state")
    void replay_thenCommand_shouldEmitOnlyNewEvent() {
        OrderAggregate order = OrderAggregate.fromHistory(List.of(
                new OrderPlaced(ORDER_ID, "Alice", "1 Main St", new BigDecimal("10.00")),
                new OrderPacked(ORDER_ID, "WH1", 2.5)));

        List<OrderEvent> events = order.shipOrder("DHL");

        assertThat(events).hasSize(1);
        assertThat(order.getVersion()).isEqualTo(3);
    }

    @Test
    @DisplayName("mutating calls return immutable event lists")
    void returnedEvents_shouldBeImmutable() {
        List<OrderEvent> events = new OrderAggregate().place(ORDER_ID, "Alice", "1 Main St", BigDecimal.TEN);

        assertThatThrownBy(events::clear).isInstanceOf(UnsupportedOperationException.class);
    }
}
