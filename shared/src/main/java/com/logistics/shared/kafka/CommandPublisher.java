package com.logistics.shared.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logistics.shared.commands.CommandEnvelope;
import com.logistics.shared.commands.CommandType;
import com.logistics.shared.commands.OrderCommand;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for command envelopes.
 *
 * Wraps Spring's KafkaTemplate with:
 *  - Envelope serialization ({@code {commandType, payload}})
 *  - The order id as record key, so commands for one order land on one partition
 *  - A {@code command-type} header for log/trace tooling
 *  - Micrometer metrics (publish count by outcome, latency)
 */
@Slf4j
public class CommandPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public CommandPublisher(KafkaTemplate<String, String> kafkaTemplate,
                            ObjectMapper objectMapper,
                            MeterRegistry meterRegistry,
                            String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
        this.publishSuccessCounter = Counter.builder("commands.published")
                .tag("status", "success")
                .description("Command envelopes published successfully")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("commands.published")
                .tag("status", "error")
                .description("Command envelope publish failures")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("commands.publish.duration")
                .description("Time to publish a command envelope")
                .register(meterRegistry);
    }

    /**
     * Publish a command to the command topic.
     *
     * @return future completing when the broker acknowledges the record
     */
    public CompletableFuture<SendResult<String, String>> publish(OrderCommand command) {
        CommandType type = CommandType.of(command);
        Timer.Sample sample = Timer.start();
        String value;
        try {
            value = objectMapper.writeValueAsString(
                    new CommandEnvelope(type.wireName(), objectMapper.valueToTree(command)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to serialize command: commandType={}, orderId={}", type.wireName(), command.orderId(), e);
            publishErrorCounter.increment();
            return CompletableFuture.failedFuture(e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, String.valueOf(command.orderId()), value);
        record.headers().add(new RecordHeader("command-type", type.wireName().getBytes(StandardCharsets.UTF_8)));

        return kafkaTemplate.send(record)
                .whenComplete((result, ex) -> {
                    sample.stop(publishTimer);
                    if (ex == null) {
                        publishSuccessCounter.increment();
                        log.debug("Command published: topic={}, commandType={}, orderId={}, partition={}, offset={}",
                                topic, type.wireName(), command.orderId(),
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    } else {
                        publishErrorCounter.increment();
                        log.error("Failed to publish command: topic={}, commandType={}, orderId={}, error={}",
                                topic, type.wireName(), command.orderId(), ex.getMessage(), ex);
                    }
                });
    }

    /**
     * Synchronous publish. Blocks until the broker acknowledges.
     */
    public void publishAndWait(OrderCommand command) {
        try {
            publish(command).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandPublishException("Interrupted while publishing " + command.getClass().getSimpleName(), e);
        } catch (Exception e) {
            throw new CommandPublishException("Failed to publish command: " + command.getClass().getSimpleName(), e);
        }
    }

    public static class CommandPublishException extends RuntimeException {
        public CommandPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
