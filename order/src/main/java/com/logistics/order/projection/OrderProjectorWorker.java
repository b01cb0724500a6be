package com.logistics.order.projection;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import com.logistics.order.support.CancellationSignal;

import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Background loop driving {@link OrderProjector}.
 *
 * A full page is followed immediately by the next one; otherwise the loop
 * waits for the poll interval. Failed cycles back off exponentially from the
 * poll interval. One worker per projection name.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "projector.enabled", havingValue = "true", matchIfMissing = true)
public class OrderProjectorWorker implements SmartLifecycle {

    private static final Duration MAX_FAILURE_BACKOFF = Duration.ofSeconds(30);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

    private final OrderProjector projector;
    private final Duration pollInterval;
    private final IntervalFunction failureBackoff;
    private final Counter batchFailedCounter;

    private volatile CancellationSignal cancellation;
    private volatile Thread thread;

    public OrderProjectorWorker(OrderProjector projector,
                                MeterRegistry meterRegistry,
                                @Value("${projector.poll-interval-ms:2000}") long pollIntervalMs) {
        this.projector = projector;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.failureBackoff = IntervalFunction.ofExponentialBackoff(pollInterval, 2.0, MAX_FAILURE_BACKOFF);
        this.batchFailedCounter = Counter.builder("projector.batches.failed")
                .tag("projection", projector.getProjectionName())
                .description("Projection cycles rolled back")
                .register(meterRegistry);
    }

    @Override
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        CancellationSignal signal = new CancellationSignal();
        cancellation = signal;
        thread = new Thread(() -> runLoop(signal), "order-projector");
        thread.setDaemon(true);
        thread.start();
        log.info("Projector started: projection={}, batchSize={}, pollInterval={}ms",
                projector.getProjectionName(), projector.getBatchSize(), pollInterval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (thread == null) {
            return;
        }
        cancellation.cancel();
        try {
            thread.join(STOP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Projector did not stop within {}ms: projection={}", STOP_TIMEOUT.toMillis(), projector.getProjectionName());
        }
        thread = null;
        log.info("Projector stopped: projection={}", projector.getProjectionName());
    }

    @Override
    public boolean isRunning() {
        return thread != null;
    }

    void runLoop(CancellationSignal signal) {
        int consecutiveFailures = 0;
        while (!signal.isCancelled()) {
            Duration wait;
            try {
                int applied = projector.runOnce();
                consecutiveFailures = 0;
                if (applied >= projector.getBatchSize()) {
                    continue;
                }
                wait = pollInterval;
            } catch (RuntimeException e) {
                consecutiveFailures++;
                batchFailedCounter.increment();
                wait = Duration.ofMillis(failureBackoff.apply(consecutiveFailures));
                log.error("Projection cycle failed, batch rolled back: projection={}, consecutiveFailures={}, retryIn={}ms, error={}",
                        projector.getProjectionName(), consecutiveFailures, wait.toMillis(), e.getMessage(), e);
            }

            try {
                if (signal.await(wait)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
