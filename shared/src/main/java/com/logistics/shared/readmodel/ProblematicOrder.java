package com.logistics.shared.readmodel;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Orders whose last delivery attempt failed. A row exists while the order is
 * FAILED and is removed when the order is delivered.
 */
@Entity
@Table(name = "problematic_orders", indexes = {
    @Index(name = "idx_problematic_orders_failed_at", columnList = "failed_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProblematicOrder {

    @Id
    @Column(name = "order_id", nullable = false)
    private UUID orderId;

    @Column(name = "customer_name", nullable = false, length = 500)
    private String customerName;

    @Column(name = "address", nullable = false, length = 2000)
    private String address;

    @Column(name = "reason", nullable = false, length = 2000)
    private String reason;

    @Column(name = "failed_at", nullable = false)
    private Instant failedAt;
}
