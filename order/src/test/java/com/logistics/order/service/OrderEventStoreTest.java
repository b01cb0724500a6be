package com.logistics.order.service;

import com.logistics.order.config.JacksonConfig;
import com.logistics.order.domain.OrderEventRecord;
import com.logistics.order.repository.OrderEventRecordRepository;
import com.logistics.shared.events.Events.*;
import com.logistics.shared.events.OrderEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.AdditionalAnswers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Event store against an embedded database.
 *
 * Runs without a test-managed transaction so every append commits on its own,
 * as it does in production.
 */
@DataJpaTest
@Import({JacksonConfig.class, EventSerializer.class, OrderEventStore.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class OrderEventStoreTest {

    @Autowired OrderEventStore eventStore;
    @Autowired OrderEventRecordRepository repository;
    @Autowired EventSerializer serializer;

    private final UUID orderA = UUID.randomUUID();
    private final UUID orderB = UUID.randomUUID();

    @BeforeEach
    void cleanLog() {
        repository.deleteAll();
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static OrderPlaced placed(UUID id) {
        return new OrderPlaced(id, "Alice", "1 Main St", new BigDecimal("10.00"));
    }

    // ─── append / getEvents ───────────────────────────────────────────────────

    @Test
    @DisplayName("append: versions start at 1 and are gap-free per aggregate")
    void append_shouldAssignGapFreeVersions() {
        eventStore.append(orderA, List.of(placed(orderA)));
        eventStore.append(orderA, List.of(new OrderPacked(orderA, "WH1", 2.5), new OrderShipped(orderA, "DHL")));

        List<StoredEvent> history = eventStore.getEvents(orderA);

        assertThat(history).extracting(StoredEvent::version).containsExactly(1, 2, 3);
        assertThat(history).extracting(StoredEvent::event).containsExactly(
                placed(orderA), new OrderPacked(orderA, "WH1", 2.5), new OrderShipped(orderA, "DHL"));
        assertThat(history).allSatisfy(e -> {
            assertThat(e.aggregateId()).isEqualTo(orderA);
            assertThat(e.createdAt()).isNotNull();
        });
    }

    @Test
    @DisplayName("append: empty batch is a no-op")
    void append_empty_shouldDoNothing() {
        eventStore.append(orderA, List.of());

        assertThat(repository.count()).isZero();
        assertThat(eventStore.getEvents(orderA)).isEmpty();
    }

    @Test
    @DisplayName("append: type tag and flat payload are stored with the record")
    void append_shouldPersistTypeTagAndPayload() {
        eventStore.append(orderA, List.of(new OrderShipped(orderA, "DHL")));

        OrderEventRecord record = repository.findByAggregateIdOrderByGlobalSequenceAsc(orderA).get(0);
        assertThat(record.getEventType()).isEqualTo("OrderShipped");
        assertThat(record.getPayload()).contains("\"courierName\":\"DHL\"");
        assertThat(record.getGlobalSequence()).isPositive();
    }

    @Test
    @DisplayName("getEvents: unknown aggregate has an empty history")
    void getEvents_unknown_shouldBeEmpty() {
        assertThat(eventStore.getEvents(UUID.randomUUID())).isEmpty();
    }

    // ─── Global order ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("global sequence increases in append order across aggregates")
    void globalSequence_shouldFollowAppendOrder() {
        eventStore.append(orderA, List.of(placed(orderA)));
        eventStore.append(orderB, List.of(placed(orderB)));
        eventStore.append(orderA, List.of(new DeliveryAddressChanged(orderA, "2 Oak Ave")));

        List<StoredEvent> all = eventStore.getEventsSince(0, 100);

        assertThat(all).extracting(StoredEvent::aggregateId).containsExactly(orderA, orderB, orderA);
        assertThat(all).extracting(StoredEvent::globalSequence).isSorted().doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("getEventsSince: exclusive cursor, capped page size")
    void getEventsSince_shouldPageAfterCursor() {
        eventStore.append(orderA, List.of(placed(orderA)));
        eventStore.append(orderB, List.of(placed(orderB)));
        eventStore.append(orderA, List.of(new OrderPacked(orderA, "WH1", 1.0)));

        List<StoredEvent> firstPage = eventStore.getEventsSince(0, 2);
        assertThat(firstPage).hasSize(2);

        List<StoredEvent> secondPage = eventStore.getEventsSince(firstPage.get(1).globalSequence(), 2);
        assertThat(secondPage).hasSize(1);
        assertThat(secondPage.get(0).event()).isEqualTo(new OrderPacked(orderA, "WH1", 1.0));

        assertThat(eventStore.getEventsSince(secondPage.get(0).globalSequence(), 2)).isEmpty();
    }

    // ─── Concurrency ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("append from a stale baseline fails with ConcurrencyConflictException and writes nothing")
    void append_staleBaseline_shouldConflict() {
        eventStore.append(orderA, List.of(placed(orderA)));

        // Second writer read the history before the first append committed
        OrderEventRecordRepository staleView = mock(OrderEventRecordRepository.class, AdditionalAnswers.delegatesTo(repository));
        doReturn(0).when(staleView).findMaxVersionByAggregateId(orderA);
        OrderEventStore racingStore = new OrderEventStore(staleView, serializer);

        List<OrderEvent> losing = List.of(new OrderPacked(orderA, "WH1", 2.5), new OrderShipped(orderA, "DHL"));
        assertThatThrownBy(() -> racingStore.append(orderA, losing))
                .isInstanceOf(ConcurrencyConflictException.class)
                .satisfies(e -> assertThat(((ConcurrencyConflictException) e).getAggregateId()).isEqualTo(orderA));

        assertThat(eventStore.getEvents(orderA)).extracting(StoredEvent::event).containsExactly(placed(orderA));
    }

    @Test
    @DisplayName("append after a lost race succeeds once history is reloaded")
    void append_afterConflict_shouldSucceedWithFreshBaseline() {
        eventStore.append(orderA, List.of(placed(orderA)));
        OrderEventRecordRepository staleView = mock(OrderEventRecordRepository.class, AdditionalAnswers.delegatesTo(repository));
        doReturn(0).when(staleView).findMaxVersionByAggregateId(orderA);

        assertThatThrownBy(() -> new OrderEventStore(staleView, serializer)
                .append(orderA, List.of(new DeliveryAddressChanged(orderA, "2 Oak Ave"))))
                .isInstanceOf(ConcurrencyConflictException.class);

        eventStore.append(orderA, List.of(new DeliveryAddressChanged(orderA, "2 Oak Ave")));

        assertThat(eventStore.getEvents(orderA)).extracting(StoredEvent::version).containsExactly(1, 2);
    }
}
