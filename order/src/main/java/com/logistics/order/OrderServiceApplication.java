package com.logistics.order;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Order Service entry point
 *
 * Command side: event store, aggregate, command handlers, Kafka command ingress.
 * Also runs the read-model projector against the same database.
 *
 * Port: 8081 (see application.yml)
 */
@SpringBootApplication
@EntityScan(basePackages = {"com.logistics.order.domain", "com.logistics.shared.readmodel"})
@EnableJpaRepositories(basePackages = {"com.logistics.order.repository", "com.logistics.shared.readmodel"})
public class OrderServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}
