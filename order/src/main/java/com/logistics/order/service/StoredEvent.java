package com.logistics.order.service;

import java.time.Instant;
import java.util.UUID;

import com.logistics.shared.events.OrderEvent;

/**
 * A decoded event together with its position in the log.
 */
public record StoredEvent(long globalSequence, UUID aggregateId, int version, OrderEvent event, Instant createdAt) {
}
