package com.logistics.query.api;

import com.logistics.shared.readmodel.ProblematicOrder;

import java.time.Instant;
import java.util.UUID;

public record ProblematicOrderResponse(UUID orderId, String customerName, String address,
                                       String reason, Instant failedAt) {

    public static ProblematicOrderResponse from(ProblematicOrder order) {
        return new ProblematicOrderResponse(order.getOrderId(), order.getCustomerName(),
                order.getAddress(), order.getReason(), order.getFailedAt());
    }
}
