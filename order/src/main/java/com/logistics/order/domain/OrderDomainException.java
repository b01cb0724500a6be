package com.logistics.order.domain;

import java.util.UUID;

import lombok.Getter;

/**
 * A command was rejected by the order's business rules.
 * Redelivering the same command cannot succeed.
 */
@Getter
public abstract class OrderDomainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final UUID orderId;

    protected OrderDomainException(UUID orderId, String message) {
        super(message);
        this.orderId = orderId;
    }
}
