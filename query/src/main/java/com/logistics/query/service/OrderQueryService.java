package com.logistics.query.service;

import com.logistics.shared.readmodel.OrderDetailsView;
import com.logistics.shared.readmodel.OrderDetailsViewRepository;
import com.logistics.shared.readmodel.ProblematicOrder;
import com.logistics.shared.readmodel.ProblematicOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of the platform. Answers from the projected tables only, so
 * results lag the event log by at most one projector cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class OrderQueryService {

    private final OrderDetailsViewRepository orderDetailsRepository;
    private final ProblematicOrderRepository problematicOrderRepository;
    private final Clock clock;

    public Optional<OrderDetailsView> getOrder(UUID orderId) {
        Optional<OrderDetailsView> view = orderDetailsRepository.findById(orderId);
        if (view.isEmpty()) {
            log.debug("Order not in read model: orderId={}", orderId);
        }
        return view;
    }

    /** Problematic orders whose delivery failed during the current UTC day. */
    public List<ProblematicOrder> getFailedToday() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        Instant from = today.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        List<ProblematicOrder> failed = problematicOrderRepository.findFailedBetween(from, to);
        log.debug("Failed deliveries today: day={}, count={}", today, failed.size());
        return failed;
    }
}
