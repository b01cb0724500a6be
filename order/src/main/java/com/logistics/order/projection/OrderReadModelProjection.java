package com.logistics.order.projection;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

import org.springframework.stereotype.Component;

import com.logistics.order.service.StoredEvent;
import com.logistics.shared.events.Events.DeliveryAddressChanged;
import com.logistics.shared.events.Events.DeliveryAttemptFailed;
import com.logistics.shared.events.Events.OrderDelivered;
import com.logistics.shared.events.Events.OrderPacked;
import com.logistics.shared.events.Events.OrderPlaced;
import com.logistics.shared.events.Events.OrderShipped;
import com.logistics.shared.events.OrderEvent;
import com.logistics.shared.events.OrderStatus;
import com.logistics.shared.readmodel.OrderDetailsView;
import com.logistics.shared.readmodel.OrderDetailsViewRepository;
import com.logistics.shared.readmodel.ProblematicOrder;
import com.logistics.shared.readmodel.ProblematicOrderRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies single events to the order read model.
 *
 * Must run inside the projector's batch transaction. Timestamps come from the
 * stored event, so projecting the same range twice yields the same rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderReadModelProjection {

    private final OrderDetailsViewRepository orderDetailsRepository;
    private final ProblematicOrderRepository problematicOrderRepository;

    public void apply(StoredEvent stored) {
        stored.event().accept(new Applier(stored.createdAt()));
        log.debug("Projected: globalSequence={}, orderId={}, type={}",
                stored.globalSequence(), stored.aggregateId(), stored.event().type());
    }

    private class Applier implements OrderEvent.Visitor {

        private final Instant at;

        Applier(Instant at) {
            this.at = at;
        }

        @Override
        public void visit(OrderPlaced event) {
            OrderDetailsView view = orderDetailsRepository.findById(event.orderId())
                    .orElseGet(() -> OrderDetailsView.builder().orderId(event.orderId()).build());
            view.setCustomerName(event.customerName());
            view.setAddress(event.address());
            view.setTotal(event.total());
            view.setCreatedAt(at);
            view.getStatusHistory().clear();
            view.recordStatus(OrderStatus.PLACED, at);
            orderDetailsRepository.save(view);
        }

        @Override
        public void visit(OrderPacked event) {
            update(event, view -> {
                view.setWarehouseId(event.warehouseId());
                view.setWeight(event.weight());
                view.recordStatus(OrderStatus.PACKED, at);
            });
        }

        @Override
        public void visit(OrderShipped event) {
            update(event, view -> {
                view.setCourierName(event.courierName());
                view.setShippedAt(at);
                view.recordStatus(OrderStatus.SHIPPED, at);
            });
        }

        @Override
        public void visit(DeliveryAddressChanged event) {
            update(event, view -> view.setAddress(event.newAddress()));
        }

        @Override
        public void visit(DeliveryAttemptFailed event) {
            update(event, view -> {
                view.recordStatus(OrderStatus.FAILED, at);

                ProblematicOrder problem = problematicOrderRepository.findById(event.orderId())
                        .orElseGet(() -> ProblematicOrder.builder().orderId(event.orderId()).build());
                problem.setCustomerName(view.getCustomerName());
                problem.setAddress(view.getAddress());
                problem.setReason(event.reason());
                problem.setFailedAt(at);
                problematicOrderRepository.save(problem);
            });
        }

        @Override
        public void visit(OrderDelivered event) {
            update(event, view -> {
                view.setDeliveredAt(event.deliveredAt());
                view.recordStatus(OrderStatus.DELIVERED, at);
                problematicOrderRepository.findById(event.orderId())
                        .ifPresent(problematicOrderRepository::delete);
            });
        }

        private void update(OrderEvent event, Consumer<OrderDetailsView> change) {
            Optional<OrderDetailsView> view = orderDetailsRepository.findById(event.orderId());
            if (view.isEmpty()) {
                // Not reachable while events arrive in log order; OrderPlaced always comes first
                log.warn("No read model row for event, skipping: orderId={}, type={}", event.orderId(), event.type());
                return;
            }
            change.accept(view.get());
            orderDetailsRepository.save(view.get());
        }
    }
}
