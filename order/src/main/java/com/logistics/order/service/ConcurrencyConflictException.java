package com.logistics.order.service;

import java.util.UUID;

import lombok.Getter;

/**
 * Another writer appended to the same order between our history read and our
 * append. Reloading the history and re-running the command may succeed.
 */
@Getter
public class ConcurrencyConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final UUID aggregateId;
    private final int expectedVersion;

    public ConcurrencyConflictException(UUID aggregateId, int expectedVersion, Throwable cause) {
        super(String.format("Concurrent append detected: aggregateId=%s, version=%d already taken",
                aggregateId, expectedVersion), cause);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
    }
}
