package com.logistics.shared.readmodel;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Persisted cursor of a named projection: the global sequence of the last
 * event whose effects are committed in the read model.
 *
 * Advanced only in the same transaction as the read-model writes it covers.
 */
@Entity
@Table(name = "projection_checkpoints")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectionCheckpoint {

    @Id
    @Column(name = "projection_name", length = 256)
    private String projectionName;

    @Column(name = "last_processed_global_sequence", nullable = false)
    private long lastProcessedGlobalSequence;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ProjectionCheckpoint initial(String projectionName) {
        return ProjectionCheckpoint.builder()
                .projectionName(projectionName)
                .lastProcessedGlobalSequence(0L)
                .updatedAt(Instant.now())
                .build();
    }

    public void advanceTo(long globalSequence) {
        if (globalSequence < lastProcessedGlobalSequence) {
            throw new IllegalArgumentException("Checkpoint " + projectionName + " cannot move backwards: "
                    + lastProcessedGlobalSequence + " -> " + globalSequence);
        }
        this.lastProcessedGlobalSequence = globalSequence;
        this.updatedAt = Instant.now();
    }
}
