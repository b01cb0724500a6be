package com.logistics.order.domain;

import java.util.UUID;

import com.logistics.shared.events.OrderStatus;

import lombok.Getter;

@Getter
public class InvalidOrderStateException extends OrderDomainException {

    private static final long serialVersionUID = 1L;

    private final OrderStatus currentStatus;

    public InvalidOrderStateException(UUID orderId, OrderStatus currentStatus, String message) {
        super(orderId, String.format("%s: orderId=%s, status=%s", message, orderId, currentStatus));
        this.currentStatus = currentStatus;
    }
}
