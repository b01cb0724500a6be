package com.logistics.order.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.logistics.order.domain.OrderEventRecord;

@Repository
public interface OrderEventRecordRepository extends JpaRepository<OrderEventRecord, Long> {

    List<OrderEventRecord> findByAggregateIdOrderByGlobalSequenceAsc(UUID aggregateId);

    @Query("SELECT COALESCE(MAX(e.version), 0) FROM OrderEventRecord e WHERE e.aggregateId = :aggregateId")
    int findMaxVersionByAggregateId(@Param("aggregateId") UUID aggregateId);

    List<OrderEventRecord> findByGlobalSequenceGreaterThanOrderByGlobalSequenceAsc(long globalSequence, Pageable pageable);
}
