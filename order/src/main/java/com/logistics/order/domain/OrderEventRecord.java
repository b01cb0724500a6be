package com.logistics.order.domain;

import java.time.Instant;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Order event log, append-only.
 *
 * Every state change of an order is one immutable row. The log is the source
 * of truth: aggregates are rebuilt from it and the read model is projected
 * from it.
 *
 * Two counters, both owned by the database:
 *  - global_sequence: identity column, orders events across all orders
 *  - version: 1-based and gap-free within one order; the unique constraint on
 *    (aggregate_id, version) rejects the loser of a concurrent append
 */
@Entity
@Table(name = "event_records",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_event_records_aggregate_version", columnNames = {"aggregate_id", "version"})
    },
    indexes = {
        @Index(name = "idx_event_records_type", columnList = "event_type")
    })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "global_sequence")
    private Long globalSequence;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "version", nullable = false)
    private int version;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;            // Flat JSON of the event's fields

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
