package com.logistics.query;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Query Service entry point
 *
 * Serves the projected read model and turns HTTP submissions into command
 * envelopes on the command topic. Never writes the event log.
 *
 * Port: 8082 (see application.yml)
 */
@SpringBootApplication
@EntityScan(basePackages = "com.logistics.shared.readmodel")
@EnableJpaRepositories(basePackages = "com.logistics.shared.readmodel")
public class QueryServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(QueryServiceApplication.class, args);
    }
}
