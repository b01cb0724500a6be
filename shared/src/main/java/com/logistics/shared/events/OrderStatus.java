package com.logistics.shared.events;

/**
 * Order lifecycle status. Declaration order is the progression order:
 * NONE → PLACED → PACKED → SHIPPED → {FAILED | DELIVERED}.
 */
public enum OrderStatus {
    NONE,
    PLACED,
    PACKED,
    SHIPPED,
    FAILED,
    DELIVERED;

    public boolean isBefore(OrderStatus other) {
        return compareTo(other) < 0;
    }

    public boolean isAtLeast(OrderStatus other) {
        return compareTo(other) >= 0;
    }
}
