package com.logistics.query.api;

import com.logistics.query.service.OrderQueryService;
import com.logistics.shared.commands.CommandType;
import com.logistics.shared.commands.Commands.*;
import com.logistics.shared.commands.OrderCommand;
import com.logistics.shared.kafka.CommandPublisher;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Order REST Controller
 *
 * CQRS: writes go out as commands, reads come from the projected read model.
 *
 * Write endpoints: POST /api/orders, POST /api/orders/{id}/{action}
 *   → Validated → CommandPublisher → command topic → order service ingress
 *   → 202 Accepted; the effect shows up in the read model once projected
 *
 * Read endpoints: GET /api/orders/{id}, GET /api/orders/failed
 *   → OrderQueryService → projected read model
 */
@Slf4j
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderQueryService queryService;
    private final CommandPublisher commandPublisher;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    /**
     * POST /api/orders
     * Submit a new order. The id is taken from the body or assigned here so
     * the caller can follow the Location header.
     */
    @PostMapping
    public ResponseEntity<CommandAcceptedResponse> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        UUID orderId = request.getOrderId() != null ? request.getOrderId() : UUID.randomUUID();
        return submit(new PlaceOrderCommand(orderId, request.getCustomerName(), request.getAddress(), request.getTotal()));
    }

    @PostMapping("/{orderId}/pack")
    public ResponseEntity<CommandAcceptedResponse> packOrder(@PathVariable UUID orderId,
                                                             @Valid @RequestBody PackOrderRequest request) {
        return submit(new PackOrderCommand(orderId, request.getWarehouseId(), request.getWeight()));
    }

    @PostMapping("/{orderId}/ship")
    public ResponseEntity<CommandAcceptedResponse> shipOrder(@PathVariable UUID orderId,
                                                             @Valid @RequestBody ShipOrderRequest request) {
        return submit(new ShipOrderCommand(orderId, request.getCourierName()));
    }

    @PostMapping("/{orderId}/change-address")
    public ResponseEntity<CommandAcceptedResponse> changeAddress(@PathVariable UUID orderId,
                                                                 @Valid @RequestBody ChangeAddressRequest request) {
        return submit(new ChangeAddressCommand(orderId, request.getNewAddress()));
    }

    @PostMapping("/{orderId}/fail-delivery")
    public ResponseEntity<CommandAcceptedResponse> failDelivery(@PathVariable UUID orderId,
                                                                @Valid @RequestBody FailDeliveryRequest request) {
        return submit(new FailDeliveryCommand(orderId, request.getReason()));
    }

    /**
     * POST /api/orders/{orderId}/deliver
     * Body is optional; without {@code deliveredAt} the order service records its own handling time.
     */
    @PostMapping("/{orderId}/deliver")
    public ResponseEntity<CommandAcceptedResponse> markDelivered(@PathVariable UUID orderId,
                                                                 @RequestBody(required = false) MarkDeliveredRequest request) {
        Instant deliveredAt = request != null ? request.getDeliveredAt() : null;
        return submit(new MarkOrderDeliveredCommand(orderId, deliveredAt));
    }

    private ResponseEntity<CommandAcceptedResponse> submit(OrderCommand command) {
        String commandType = CommandType.of(command).wireName();
        commandPublisher.publishAndWait(command);
        log.info("Command accepted: commandType={}, orderId={}", commandType, command.orderId());

        return ResponseEntity
                .accepted()
                .location(URI.create("/api/orders/" + command.orderId()))
                .body(new CommandAcceptedResponse(command.orderId(), commandType));
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    /**
     * GET /api/orders/{orderId}
     * Returns the projected order, including its status history.
     */
    @GetMapping("/{orderId}")
    public ResponseEntity<OrderDetailsResponse> getOrder(@PathVariable UUID orderId) {
        return queryService.getOrder(orderId)
                .map(OrderDetailsResponse::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/orders/failed
     * Orders whose last delivery attempt failed today (UTC) and are not delivered yet.
     */
    @GetMapping("/failed")
    public ResponseEntity<List<ProblematicOrderResponse>> getFailedToday() {
        return ResponseEntity.ok(queryService.getFailedToday().stream()
                .map(ProblematicOrderResponse::from)
                .toList());
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
class PlaceOrderRequest {
    private UUID orderId;
    @NotBlank private String customerName;
    @NotBlank private String address;
    @NotNull @PositiveOrZero @Digits(integer = 10, fraction = 2) private BigDecimal total;
}

@Data
class PackOrderRequest {
    @NotBlank private String warehouseId;
    @NotNull @Positive private Double weight;
}

@Data
class ShipOrderRequest {
    @NotBlank private String courierName;
}

@Data
class ChangeAddressRequest {
    @NotBlank private String newAddress;
}

@Data
class FailDeliveryRequest {
    @NotBlank private String reason;
}

@Data
class MarkDeliveredRequest {
    private Instant deliveredAt;
}
