package com.logistics.order.domain;

import java.util.UUID;

public class OrderAlreadyExistsException extends OrderDomainException {

    private static final long serialVersionUID = 1L;

    public OrderAlreadyExistsException(UUID orderId) {
        super(orderId, "Order " + orderId + " already exists");
    }
}
