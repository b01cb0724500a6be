package com.logistics.shared.readmodel;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProjectionCheckpointRepository extends JpaRepository<ProjectionCheckpoint, String> {
}
