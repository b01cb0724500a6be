package com.logistics.order.ingress;

import com.logistics.order.config.JacksonConfig;
import com.logistics.order.config.ResilienceConfig;
import com.logistics.order.domain.InvalidOrderStateException;
import com.logistics.order.domain.OrderNotFoundException;
import com.logistics.order.handler.CommandDispatcher;
import com.logistics.order.service.ConcurrencyConflictException;
import com.logistics.shared.commands.Commands.*;
import com.logistics.shared.commands.OrderCommand;
import com.logistics.shared.events.OrderStatus;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit Tests: CommandIngress message classification.
 *
 * Real Jackson, Bean Validation and resilience4j; the dispatcher is mocked.
 */
@ExtendWith(MockitoExtension.class)
class CommandIngressTest {

    private static final UUID ORDER_ID = UUID.fromString("c0a80101-0000-4000-8000-00000000002a");

    @Mock CommandDispatcher dispatcher;

    ValidatorFactory validatorFactory;
    SimpleMeterRegistry meterRegistry;
    CommandIngress ingress;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        meterRegistry = new SimpleMeterRegistry();
        Retry retry = Retry.of("test-dispatch", ResilienceConfig.commandDispatchRetryConfig(3, 1));
        ingress = new CommandIngress(new JacksonConfig().objectMapper(), validatorFactory.getValidator(),
                dispatcher, retry, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static String envelope(String commandType, String payload) {
        return "{\"commandType\":\"" + commandType + "\",\"payload\":" + payload + "}";
    }

    private static String packOrder() {
        return envelope("PackOrder", "{\"orderId\":\"" + ORDER_ID + "\",\"warehouseId\":\"WH1\",\"weight\":2.5}");
    }

    // ─── Happy path ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("valid PlaceOrder: dispatched once and acknowledged")
    void placeOrder_shouldDispatchAndAck() {
        String message = envelope("PlaceOrder",
                "{\"orderId\":\"" + ORDER_ID + "\",\"customerName\":\"Alice\",\"address\":\"1 Main St\",\"total\":10.00}");

        IngressResult result = ingress.handle(message);

        assertThat(result.outcome()).isEqualTo(IngressOutcome.ACK);
        ArgumentCaptor<OrderCommand> captor = ArgumentCaptor.forClass(OrderCommand.class);
        verify(dispatcher).dispatch(captor.capture());
        assertThat(captor.getValue()).isInstanceOfSatisfying(PlaceOrderCommand.class, cmd -> {
            assertThat(cmd.orderId()).isEqualTo(ORDER_ID);
            assertThat(cmd.customerName()).isEqualTo("Alice");
            assertThat(cmd.total()).isEqualByComparingTo(new BigDecimal("10.00"));
        });
    }

    @Test
    @DisplayName("PlaceOrder without orderId: a fresh id is assigned")
    void placeOrder_withoutId_shouldAssignId() {
        IngressResult result = ingress.handle(envelope("PlaceOrder",
                "{\"customerName\":\"Alice\",\"address\":\"1 Main St\",\"total\":10.00}"));

        assertThat(result.outcome()).isEqualTo(IngressOutcome.ACK);
        ArgumentCaptor<OrderCommand> captor = ArgumentCaptor.forClass(OrderCommand.class);
        verify(dispatcher).dispatch(captor.capture());
        assertThat(captor.getValue().orderId()).isNotNull();
    }

    @Test
    @DisplayName("MarkDelivered with ISO instant: parsed and dispatched")
    void markDelivered_shouldParseInstant() {
        IngressResult result = ingress.handle(envelope("MarkDelivered",
                "{\"orderId\":\"" + ORDER_ID + "\",\"deliveredAt\":\"2024-05-01T10:15:30Z\"}"));

        assertThat(result.outcome()).isEqualTo(IngressOutcome.ACK);
        verify(dispatcher).dispatch(argThat(cmd -> cmd instanceof MarkOrderDeliveredCommand delivered
                && delivered.deliveredAt().toString().equals("2024-05-01T10:15:30Z")));
    }

    @Test
    @DisplayName("envelope and payload property names match regardless of case")
    void propertyNames_shouldBeCaseInsensitive() {
        String message = "{\"CommandType\":\"PackOrder\",\"Payload\":{\"OrderId\":\"" + ORDER_ID
                + "\",\"WAREHOUSEID\":\"WH1\",\"Weight\":2.5}}";

        IngressResult result = ingress.handle(message);

        assertThat(result.outcome()).isEqualTo(IngressOutcome.ACK);
        verify(dispatcher).dispatch(new PackOrderCommand(ORDER_ID, "WH1", 2.5));
    }

    @Test
    @DisplayName("PlaceOrder without orderId redelivered: same delivery resolves to the same id")
    void placeOrder_withoutId_redelivered_shouldReuseId() {
        String message = envelope("PlaceOrder", "{\"customerName\":\"Alice\",\"address\":\"1 Main St\",\"total\":10.00}");

        ingress.handle(message, "order-commands-0@7");
        ingress.handle(message, "order-commands-0@7");
        ingress.handle(message, "order-commands-0@8");

        ArgumentCaptor<OrderCommand> captor = ArgumentCaptor.forClass(OrderCommand.class);
        verify(dispatcher, times(3)).dispatch(captor.capture());
        UUID first = captor.getAllValues().get(0).orderId();
        assertThat(captor.getAllValues().get(1).orderId()).isEqualTo(first);
        assertThat(captor.getAllValues().get(2).orderId()).isNotEqualTo(first);
    }

    // ─── Malformed input ──────────────────────────────────────────────────────

    @Test
    @DisplayName("unparseable JSON: rejected without dispatch")
    void badJson_shouldReject() {
        IngressResult result = ingress.handle("{\"commandType\": \"PackOrder\", ");

        assertThat(result.outcome()).isEqualTo(IngressOutcome.REJECT);
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("unknown commandType: rejected without dispatch")
    void unknownType_shouldReject() {
        IngressResult result = ingress.handle(envelope("CancelOrder", "{\"orderId\":\"" + ORDER_ID + "\"}"));

        assertThat(result.outcome()).isEqualTo(IngressOutcome.REJECT);
        assertThat(result.reason()).contains("CancelOrder");
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("missing commandType or payload: rejected")
    void missingFields_shouldReject() {
        assertThat(ingress.handle("{\"payload\":{}}").outcome()).isEqualTo(IngressOutcome.REJECT);
        assertThat(ingress.handle("{\"commandType\":\"PackOrder\"}").outcome()).isEqualTo(IngressOutcome.REJECT);
        assertThat(ingress.handle("").outcome()).isEqualTo(IngressOutcome.REJECT);
        assertThat(ingress.handle(null).outcome()).isEqualTo(IngressOutcome.REJECT);
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("payload failing validation: rejected without dispatch")
    void invalidPayload_shouldReject() {
        IngressResult result = ingress.handle(envelope("PackOrder",
                "{\"orderId\":\"" + ORDER_ID + "\",\"warehouseId\":\"\",\"weight\":-1}"));

        assertThat(result.outcome()).isEqualTo(IngressOutcome.REJECT);
        assertThat(result.reason()).contains("warehouseId").contains("weight");
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("PlaceOrder total with more than 2 decimals: rejected without dispatch")
    void placeOrder_subCentTotal_shouldReject() {
        IngressResult result = ingress.handle(envelope("PlaceOrder",
                "{\"orderId\":\"" + ORDER_ID + "\",\"customerName\":\"Alice\",\"address\":\"1 Main St\",\"total\":10.005}"));

        assertThat(result.outcome()).isEqualTo(IngressOutcome.REJECT);
        assertThat(result.reason()).contains("total");
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("payload with wrong field types: rejected without dispatch")
    void wrongTypes_shouldReject() {
        IngressResult result = ingress.handle(envelope("FailDelivery",
                "{\"orderId\":\"not-a-uuid\",\"reason\":\"no answer\"}"));

        assertThat(result.outcome()).isEqualTo(IngressOutcome.REJECT);
        verifyNoInteractions(dispatcher);
    }

    // ─── Domain faults ────────────────────────────────────────────────────────

    @Test
    @DisplayName("PackOrder for unknown id: rejected permanently, not retried")
    void notFound_shouldRejectWithoutRetry() {
        doThrow(new OrderNotFoundException(ORDER_ID)).when(dispatcher).dispatch(any());

        IngressResult result = ingress.handle(packOrder());

        assertThat(result.outcome()).isEqualTo(IngressOutcome.REJECT);
        verify(dispatcher, times(1)).dispatch(any());
    }

    @Test
    @DisplayName("invalid state transition: rejected permanently, not retried")
    void invalidState_shouldReject() {
        doThrow(new InvalidOrderStateException(ORDER_ID, OrderStatus.SHIPPED, "Order can only be packed once"))
                .when(dispatcher).dispatch(any());

        assertThat(ingress.handle(packOrder()).outcome()).isEqualTo(IngressOutcome.REJECT);
        verify(dispatcher, times(1)).dispatch(any());
    }

    // ─── Concurrency conflicts ────────────────────────────────────────────────

    @Test
    @DisplayName("conflict then success: retried and acknowledged after 2 attempts")
    void conflictOnce_shouldRetryAndAck() {
        doThrow(new ConcurrencyConflictException(ORDER_ID, 2, null))
                .doNothing()
                .when(dispatcher).dispatch(any());

        IngressResult result = ingress.handle(packOrder());

        assertThat(result.outcome()).isEqualTo(IngressOutcome.ACK);
        verify(dispatcher, times(2)).dispatch(any());
    }

    @Test
    @DisplayName("conflict on every attempt: requeued after exactly 3 attempts")
    void conflictAlways_shouldRequeue() {
        doThrow(new ConcurrencyConflictException(ORDER_ID, 2, null)).when(dispatcher).dispatch(any());

        IngressResult result = ingress.handle(packOrder());

        assertThat(result.outcome()).isEqualTo(IngressOutcome.REQUEUE);
        verify(dispatcher, times(3)).dispatch(any());
    }

    @Test
    @DisplayName("unclassified runtime fault: requeued without conflict retries")
    void unexpectedFault_shouldRequeue() {
        doThrow(new IllegalStateException("connection reset")).when(dispatcher).dispatch(any());

        IngressResult result = ingress.handle(packOrder());

        assertThat(result.outcome()).isEqualTo(IngressOutcome.REQUEUE);
        verify(dispatcher, times(1)).dispatch(any());
    }

    // ─── Metrics ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("outcomes are counted by command type")
    void outcomes_shouldBeCounted() {
        ingress.handle(packOrder());
        ingress.handle("garbage");

        assertThat(meterRegistry.get("commands.ingress")
                .tag("commandType", "PackOrder").tag("outcome", "ACK").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("commands.ingress")
                .tag("commandType", "unknown").tag("outcome", "REJECT").counter().count()).isEqualTo(1.0);
    }
}
