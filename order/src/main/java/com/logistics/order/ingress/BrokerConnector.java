package com.logistics.order.ingress;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.logistics.order.support.CancellationSignal;

import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;

/**
 * Waits for the command broker at startup with a bounded number of probes.
 */
@Slf4j
@Component
public class BrokerConnector {

    private final BrokerProbe probe;
    private final int maxAttempts;
    private final IntervalFunction interval;

    public BrokerConnector(BrokerProbe probe,
                           @Value("${ingress.connect.max-attempts:30}") int maxAttempts,
                           @Value("${ingress.connect.delay-ms:2000}") long delayMs) {
        this.probe = probe;
        this.maxAttempts = maxAttempts;
        this.interval = IntervalFunction.of(Duration.ofMillis(delayMs));
    }

    /**
     * Probe until the broker answers.
     *
     * @throws IngressStartupException when all attempts fail, or on cancellation
     */
    public void connect(CancellationSignal cancellation) {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (cancellation.isCancelled()) {
                throw new IngressStartupException("Broker connect cancelled after " + (attempt - 1) + " attempts");
            }
            try {
                probe.probe();
                log.info("Command broker reachable: attempt={}/{}", attempt, maxAttempts);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IngressStartupException("Interrupted while connecting to broker", e);
            } catch (Exception e) {
                lastFailure = e;
                log.warn("Command broker not reachable: attempt={}/{}, error={}", attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                awaitNextAttempt(cancellation, attempt);
            }
        }
        throw new IngressStartupException("Command broker unreachable after " + maxAttempts + " attempts", lastFailure);
    }

    private void awaitNextAttempt(CancellationSignal cancellation, int attempt) {
        try {
            if (cancellation.await(Duration.ofMillis(interval.apply(attempt)))) {
                throw new IngressStartupException("Broker connect cancelled after " + attempt + " attempts");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngressStartupException("Interrupted while connecting to broker", e);
        }
    }
}
