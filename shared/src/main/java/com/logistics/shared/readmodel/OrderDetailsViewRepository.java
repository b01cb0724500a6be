package com.logistics.shared.readmodel;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface OrderDetailsViewRepository extends JpaRepository<OrderDetailsView, UUID> {
}
