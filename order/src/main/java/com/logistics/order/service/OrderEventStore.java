package com.logistics.order.service;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.logistics.order.domain.OrderEventRecord;
import com.logistics.order.repository.OrderEventRecordRepository;
import com.logistics.shared.events.OrderEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Order Event Store Service
 *
 * Versions are derived from the stored maximum at append time, never from
 * the caller. A concurrent writer that took the same version is rejected by
 * the (aggregate_id, version) unique constraint, which fails the whole batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderEventStore {

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final OrderEventRecordRepository repository;
    private final EventSerializer serializer;

    /**
     * Append events to an order's log in one transaction.
     *
     * @throws ConcurrencyConflictException if another append took one of the versions first
     */
    @Transactional
    public void append(UUID aggregateId, List<? extends OrderEvent> events) {
        if (events.isEmpty()) {
            return;
        }

        int baseVersion = repository.findMaxVersionByAggregateId(aggregateId);
        Instant now = Instant.now();
        List<OrderEventRecord> records = new ArrayList<>(events.size());
        int version = baseVersion;
        for (OrderEvent event : events) {
            records.add(OrderEventRecord.builder()
                    .aggregateId(aggregateId)
                    .version(++version)
                    .eventType(event.type())
                    .payload(serializer.serialize(event))
                    .createdAt(now)
                    .build());
        }

        try {
            repository.saveAllAndFlush(records);
        } catch (DataIntegrityViolationException e) {
            if (isUniqueViolation(e)) {
                log.debug("Version race lost: aggregateId={}, baseVersion={}", aggregateId, baseVersion);
                throw new ConcurrencyConflictException(aggregateId, baseVersion + 1, e);
            }
            throw e;
        }

        log.debug("Events appended: aggregateId={}, versions={}..{}, types={}",
                aggregateId, baseVersion + 1, version, events.stream().map(OrderEvent::type).toList());
    }

    /**
     * Full history of one order in log order; empty if the order is unknown.
     */
    @Transactional(readOnly = true)
    public List<StoredEvent> getEvents(UUID aggregateId) {
        return repository.findByAggregateIdOrderByGlobalSequenceAsc(aggregateId).stream()
                .map(this::toStoredEvent)
                .toList();
    }

    /**
     * Next page of the global log, strictly after {@code fromExclusiveSequence}.
     */
    @Transactional(readOnly = true)
    public List<StoredEvent> getEventsSince(long fromExclusiveSequence, int maxCount) {
        return repository.findByGlobalSequenceGreaterThanOrderByGlobalSequenceAsc(
                        fromExclusiveSequence, PageRequest.of(0, maxCount)).stream()
                .map(this::toStoredEvent)
                .toList();
    }

    private StoredEvent toStoredEvent(OrderEventRecord record) {
        return new StoredEvent(
                record.getGlobalSequence(),
                record.getAggregateId(),
                record.getVersion(),
                serializer.deserialize(record.getEventType(), record.getPayload()),
                record.getCreatedAt());
    }

    private static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof DuplicateKeyException) {
                return true;
            }
            if (t instanceof SQLException sql && UNIQUE_VIOLATION_SQL_STATE.equals(sql.getSQLState())) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
