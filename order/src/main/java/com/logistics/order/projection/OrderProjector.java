package com.logistics.order.projection;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import com.logistics.order.service.OrderEventStore;
import com.logistics.order.service.StoredEvent;
import com.logistics.shared.readmodel.ProjectionCheckpoint;
import com.logistics.shared.readmodel.ProjectionCheckpointRepository;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Incremental projector of the event log into the order read model.
 *
 * One cycle = one transaction:
 *  1. Load the checkpoint (created at 0 on first use)
 *  2. Read the next page of events after it
 *  3. Apply them in global-sequence order
 *  4. Advance the checkpoint to the last applied event
 *
 * A failure anywhere rolls back the read-model writes and the checkpoint
 * together, so the next cycle sees the same page again.
 */
@Slf4j
@Component
public class OrderProjector {

    private final OrderEventStore eventStore;
    private final OrderReadModelProjection projection;
    private final ProjectionCheckpointRepository checkpointRepository;
    private final TransactionTemplate transactionTemplate;
    private final Counter eventsAppliedCounter;

    @Getter
    private final String projectionName;
    @Getter
    private final int batchSize;

    public OrderProjector(OrderEventStore eventStore,
                          OrderReadModelProjection projection,
                          ProjectionCheckpointRepository checkpointRepository,
                          TransactionTemplate transactionTemplate,
                          MeterRegistry meterRegistry,
                          @Value("${projector.name:OrderProjections}") String projectionName,
                          @Value("${projector.batch-size:500}") int batchSize) {
        this.eventStore = eventStore;
        this.projection = projection;
        this.checkpointRepository = checkpointRepository;
        this.transactionTemplate = transactionTemplate;
        this.projectionName = projectionName;
        this.batchSize = batchSize;
        this.eventsAppliedCounter = Counter.builder("projector.events.applied")
                .tag("projection", projectionName)
                .description("Events applied to the read model")
                .register(meterRegistry);
    }

    /**
     * Project the next page of events.
     *
     * @return number of events applied; 0 when the read model is caught up
     */
    public int runOnce() {
        Integer applied = transactionTemplate.execute(status -> {
            ProjectionCheckpoint checkpoint = checkpointRepository.findById(projectionName)
                    .orElseGet(() -> checkpointRepository.save(ProjectionCheckpoint.initial(projectionName)));

            List<StoredEvent> batch = eventStore.getEventsSince(checkpoint.getLastProcessedGlobalSequence(), batchSize);
            if (batch.isEmpty()) {
                return 0;
            }

            for (StoredEvent event : batch) {
                projection.apply(event);
            }

            long from = checkpoint.getLastProcessedGlobalSequence();
            checkpoint.advanceTo(batch.get(batch.size() - 1).globalSequence());
            checkpointRepository.save(checkpoint);

            log.debug("Projection batch applied: projection={}, events={}, checkpoint={}..{}",
                    projectionName, batch.size(), from, checkpoint.getLastProcessedGlobalSequence());
            return batch.size();
        });

        int count = applied != null ? applied : 0;
        eventsAppliedCounter.increment(count);
        return count;
    }
}
