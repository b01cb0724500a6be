package com.logistics.order.ingress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.order.domain.OrderDomainException;
import com.logistics.order.handler.CommandDispatcher;
import com.logistics.order.service.ConcurrencyConflictException;
import com.logistics.shared.commands.CommandEnvelope;
import com.logistics.shared.commands.CommandType;
import com.logistics.shared.commands.Commands.PlaceOrderCommand;
import com.logistics.shared.commands.OrderCommand;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns one raw command message into a delivery decision.
 *
 * Flow:
 *  1. Parse the {@code {commandType, payload}} envelope
 *  2. Bind and validate the payload as the matching command record
 *  3. Dispatch under the command-dispatch retry (concurrency conflicts only)
 *  4. Classify the outcome
 *
 * Classification:
 *  - success                                  → ACK
 *  - malformed envelope/payload, unknown type → REJECT
 *  - domain fault (not found, invalid state)  → REJECT
 *  - conflict still present after all retries → REQUEUE
 *  - anything else                            → REQUEUE
 *
 * Transport-agnostic; {@link CommandIngressConsumer} maps the result onto Kafka.
 */
@Slf4j
@Component
public class CommandIngress {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final CommandDispatcher dispatcher;
    private final Retry dispatchRetry;
    private final MeterRegistry meterRegistry;
    private final Timer dispatchTimer;

    public CommandIngress(ObjectMapper objectMapper,
                          Validator validator,
                          CommandDispatcher dispatcher,
                          Retry commandDispatchRetry,
                          MeterRegistry meterRegistry) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.dispatcher = dispatcher;
        this.dispatchRetry = commandDispatchRetry;
        this.meterRegistry = meterRegistry;
        this.dispatchTimer = Timer.builder("commands.dispatch.duration")
                .description("Command dispatch time including conflict retries")
                .register(meterRegistry);
    }

    public IngressResult handle(String message) {
        return handle(message, null);
    }

    /**
     * @param deliveryId stable identity of the transport message (same on every
     *                   redelivery); seeds the id of a PlaceOrder that carries none.
     *                   When {@code null} a random id is assigned.
     */
    public IngressResult handle(String message, String deliveryId) {
        OrderCommand command;
        try {
            command = parse(message, deliveryId);
        } catch (MalformedCommandException e) {
            log.warn("Rejecting malformed command: reason={}", e.getMessage());
            return count("unknown", IngressResult.reject(e.getMessage()));
        }

        String commandType = CommandType.of(command).wireName();
        try {
            dispatchTimer.record(() -> dispatchRetry.executeRunnable(() -> dispatcher.dispatch(command)));
            log.debug("Command accepted: commandType={}, orderId={}", commandType, command.orderId());
            return count(commandType, IngressResult.ack());
        } catch (OrderDomainException e) {
            log.warn("Rejecting command: commandType={}, orderId={}, reason={}",
                    commandType, command.orderId(), e.getMessage());
            return count(commandType, IngressResult.reject(e.getMessage()));
        } catch (ConcurrencyConflictException e) {
            log.warn("Conflict retries exhausted, requeueing: commandType={}, orderId={}",
                    commandType, command.orderId());
            return count(commandType, IngressResult.requeue(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Command dispatch failed, requeueing: commandType={}, orderId={}, error={}",
                    commandType, command.orderId(), e.getMessage(), e);
            return count(commandType, IngressResult.requeue(e.getMessage()));
        }
    }

    /**
     * Decode and validate a raw envelope.
     *
     * @throws MalformedCommandException if the message can never be a valid command
     */
    OrderCommand parse(String message, String deliveryId) {
        if (message == null || message.isBlank()) {
            throw new MalformedCommandException("Empty message");
        }

        CommandEnvelope envelope;
        try {
            envelope = objectMapper.readValue(message, CommandEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new MalformedCommandException("Unparseable envelope: " + e.getOriginalMessage(), e);
        }
        if (envelope == null || envelope.commandType() == null || envelope.commandType().isBlank()) {
            throw new MalformedCommandException("Envelope has no commandType");
        }

        CommandType type = CommandType.fromWireName(envelope.commandType())
                .orElseThrow(() -> new MalformedCommandException("Unknown commandType: " + envelope.commandType()));
        if (envelope.payload() == null || !envelope.payload().isObject()) {
            throw new MalformedCommandException("Envelope payload for " + type.wireName() + " is not an object");
        }

        OrderCommand command;
        try {
            command = objectMapper.treeToValue(envelope.payload(), type.commandClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedCommandException("Invalid " + type.wireName() + " payload: " + e.getMessage(), e);
        }

        if (command instanceof PlaceOrderCommand place && place.orderId() == null) {
            command = place.withOrderId(assignedOrderId(deliveryId));
        }

        Set<ConstraintViolation<OrderCommand>> violations = validator.validate(command);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new MalformedCommandException("Invalid " + type.wireName() + " payload: " + details);
        }
        return command;
    }

    /** Name-based, so a redelivered PlaceOrder resolves to the order it already created. */
    static UUID assignedOrderId(String deliveryId) {
        return deliveryId == null
                ? UUID.randomUUID()
                : UUID.nameUUIDFromBytes(("order-command:" + deliveryId).getBytes(StandardCharsets.UTF_8));
    }

    private IngressResult count(String commandType, IngressResult result) {
        Counter.builder("commands.ingress")
                .tag("commandType", commandType)
                .tag("outcome", result.outcome().name())
                .register(meterRegistry)
                .increment();
        return result;
    }
}
