package com.logistics.shared.commands;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Command payloads carried inside a {@link CommandEnvelope}.
 *
 * Validated with Bean Validation at the ingress; a violation is a malformed
 * message, not a domain fault.
 */
public final class Commands {

    private Commands() {}

    public record PlaceOrderCommand(
            UUID orderId,
            @NotBlank String customerName,
            @NotBlank String address,
            @NotNull @PositiveOrZero @Digits(integer = 10, fraction = 2) BigDecimal total) implements OrderCommand {

        /** The order id is optional on the wire; the ingress assigns one when it is missing. */
        public PlaceOrderCommand withOrderId(UUID id) {
            return new PlaceOrderCommand(id, customerName, address, total);
        }
    }

    public record PackOrderCommand(
            @NotNull UUID orderId,
            @NotBlank String warehouseId,
            @NotNull @Positive Double weight) implements OrderCommand {
    }

    public record ShipOrderCommand(
            @NotNull UUID orderId,
            @NotBlank String courierName) implements OrderCommand {
    }

    public record ChangeAddressCommand(
            @NotNull UUID orderId,
            @NotBlank String newAddress) implements OrderCommand {
    }

    public record FailDeliveryCommand(
            @NotNull UUID orderId,
            @NotBlank String reason) implements OrderCommand {
    }

    /** {@code deliveredAt} may be omitted; the handler then records the handling time. */
    public record MarkOrderDeliveredCommand(
            @NotNull UUID orderId,
            Instant deliveredAt) implements OrderCommand {
    }
}
