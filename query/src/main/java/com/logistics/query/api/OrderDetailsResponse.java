package com.logistics.query.api;

import com.logistics.shared.events.OrderStatus;
import com.logistics.shared.readmodel.OrderDetailsView;
import com.logistics.shared.readmodel.StatusHistoryEntry;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderDetailsResponse {
    private UUID orderId;
    private String customerName;
    private String address;
    private BigDecimal total;
    private OrderStatus status;
    private String warehouseId;
    private Double weight;
    private String courierName;
    private Instant createdAt;
    private Instant shippedAt;
    private Instant deliveredAt;
    private List<StatusChange> statusHistory;

    public record StatusChange(OrderStatus status, Instant at) {
        static StatusChange from(StatusHistoryEntry entry) {
            return new StatusChange(entry.getStatus(), entry.getAt());
        }
    }

    public static OrderDetailsResponse from(OrderDetailsView view) {
        return OrderDetailsResponse.builder()
                .orderId(view.getOrderId())
                .customerName(view.getCustomerName())
                .address(view.getAddress())
                .total(view.getTotal())
                .status(view.getStatus())
                .warehouseId(view.getWarehouseId())
                .weight(view.getWeight())
                .courierName(view.getCourierName())
                .createdAt(view.getCreatedAt())
                .shippedAt(view.getShippedAt())
                .deliveredAt(view.getDeliveredAt())
                .statusHistory(view.getStatusHistory().stream().map(StatusChange::from).toList())
                .build();
    }
}
