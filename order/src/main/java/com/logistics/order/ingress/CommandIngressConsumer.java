package com.logistics.order.ingress;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka listener for the command topic.
 *
 * Manual acknowledgment (AckMode.MANUAL_IMMEDIATE):
 *  - ACK     → commit the offset
 *  - REJECT  → copy the record to the dead-letter topic, then commit
 *  - REQUEUE → nack; the record is redelivered after the redelivery delay
 *
 * The container is not auto-started; {@link CommandIngressLifecycle} starts it
 * once the broker is reachable.
 */
@Slf4j
@Component
public class CommandIngressConsumer {

    public static final String LISTENER_ID = "command-ingress";

    static final String HEADER_REJECT_REASON = "x-reject-reason";
    static final String HEADER_ORIGINAL_TOPIC = "x-original-topic";
    static final String HEADER_ORIGINAL_OFFSET = "x-original-offset";

    private static final long DEAD_LETTER_SEND_TIMEOUT_SECONDS = 10;

    private final CommandIngress ingress;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String deadLetterTopic;
    private final Duration redeliveryDelay;
    private final Counter deadLetteredCounter;

    public CommandIngressConsumer(CommandIngress ingress,
                                  KafkaTemplate<String, String> kafkaTemplate,
                                  MeterRegistry meterRegistry,
                                  @Value("${ingress.dead-letter-topic:dlq.order-commands}") String deadLetterTopic,
                                  @Value("${ingress.redelivery-delay-ms:1000}") long redeliveryDelayMs) {
        this.ingress = ingress;
        this.kafkaTemplate = kafkaTemplate;
        this.deadLetterTopic = deadLetterTopic;
        this.redeliveryDelay = Duration.ofMillis(redeliveryDelayMs);
        this.deadLetteredCounter = Counter.builder("commands.dead-lettered")
                .description("Command messages routed to the dead-letter topic")
                .register(meterRegistry);
    }

    @KafkaListener(
            id = LISTENER_ID,
            topics = "${ingress.topic:order-commands}",
            groupId = "${ingress.consumer-group:order-service}",
            containerFactory = "kafkaListenerContainerFactory",
            autoStartup = "false"
    )
    public void onCommand(ConsumerRecord<String, String> record, Acknowledgment ack) {
        IngressResult result = ingress.handle(record.value(), deliveryId(record));

        switch (result.outcome()) {
            case ACK -> ack.acknowledge();
            case REJECT -> {
                if (deadLetter(record, result.reason())) {
                    ack.acknowledge();
                } else {
                    ack.nack(redeliveryDelay);
                }
            }
            case REQUEUE -> {
                log.info("Command requeued: topic={}, partition={}, offset={}, reason={}",
                        record.topic(), record.partition(), record.offset(), result.reason());
                ack.nack(redeliveryDelay);
            }
        }
    }

    /**
     * @return true once the dead-letter topic has the record
     */
    private boolean deadLetter(ConsumerRecord<String, String> record, String reason) {
        ProducerRecord<String, String> dlq = new ProducerRecord<>(deadLetterTopic, record.key(), record.value());
        dlq.headers().add(header(HEADER_REJECT_REASON, reason != null ? reason : "rejected"));
        dlq.headers().add(header(HEADER_ORIGINAL_TOPIC, record.topic()));
        dlq.headers().add(header(HEADER_ORIGINAL_OFFSET, String.valueOf(record.offset())));

        try {
            kafkaTemplate.send(dlq).get(DEAD_LETTER_SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            deadLetteredCounter.increment();
            log.warn("Command dead-lettered: topic={}, partition={}, offset={}, reason={}",
                    record.topic(), record.partition(), record.offset(), reason);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while dead-lettering: topic={}, offset={}", record.topic(), record.offset());
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.error("Dead-letter publish failed, record will be redelivered: topic={}, offset={}, error={}",
                    record.topic(), record.offset(), e.getMessage(), e);
            return false;
        }
    }

    private static RecordHeader header(String name, String value) {
        return new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8));
    }

    /** Topic, partition and offset: unchanged across redeliveries of the same record. */
    static String deliveryId(ConsumerRecord<String, String> record) {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }
}
