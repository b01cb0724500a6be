package com.logistics.shared.readmodel;

import com.logistics.shared.events.OrderStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Order details read model: denormalized current state of one order.
 *
 * Written only by the projector, one row per order, mutated in place as
 * events are applied. Eventually consistent with the event log.
 */
@Entity
@Table(name = "order_details_view", indexes = {
    @Index(name = "idx_order_details_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDetailsView {

    @Id
    @Column(name = "order_id", nullable = false)
    private UUID orderId;

    @Column(name = "customer_name", nullable = false, length = 500)
    private String customerName;

    @Column(name = "address", nullable = false, length = 2000)
    private String address;

    @Column(name = "total", nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private OrderStatus status;

    @Column(name = "warehouse_id", length = 128)
    private String warehouseId;

    @Column(name = "weight")
    private Double weight;

    @Column(name = "courier_name", length = 256)
    private String courierName;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "shipped_at")
    private Instant shippedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "last_status_change_at")
    private Instant lastStatusChangeAt;

    /** Status transitions in the order they were projected. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_status_history", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<StatusHistoryEntry> statusHistory = new ArrayList<>();

    /** Move to a new status and record the transition. */
    public void recordStatus(OrderStatus newStatus, Instant at) {
        this.status = newStatus;
        this.lastStatusChangeAt = at;
        this.statusHistory.add(new StatusHistoryEntry(newStatus, at));
    }
}
