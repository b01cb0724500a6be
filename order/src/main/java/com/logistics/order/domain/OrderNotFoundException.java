package com.logistics.order.domain;

import java.util.UUID;

public class OrderNotFoundException extends OrderDomainException {

    private static final long serialVersionUID = 1L;

    public OrderNotFoundException(UUID orderId) {
        super(orderId, "Order " + orderId + " not found");
    }
}
