package com.logistics.shared.readmodel;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ProblematicOrderRepository extends JpaRepository<ProblematicOrder, UUID> {

    /** Orders that failed within {@code [from, to)}, oldest first. */
    @Query("SELECT p FROM ProblematicOrder p WHERE p.failedAt >= :from AND p.failedAt < :to ORDER BY p.failedAt ASC")
    List<ProblematicOrder> findFailedBetween(@Param("from") Instant from, @Param("to") Instant to);
}
