package com.logistics.order.ingress;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Component;

import com.logistics.order.support.CancellationSignal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Starts command consumption only after the broker answers.
 *
 * Runs after the listener registry has started and stops before it. Stopping
 * only closes the listener container; the admin connection is a singleton
 * closed at context shutdown, so a stopped ingress can be started again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "ingress.enabled", havingValue = "true", matchIfMissing = true)
public class CommandIngressLifecycle implements SmartLifecycle {

    private final BrokerConnector brokerConnector;
    private final KafkaListenerEndpointRegistry listenerRegistry;

    private volatile CancellationSignal cancellation = new CancellationSignal();
    private volatile boolean running;

    @Override
    public void start() {
        cancellation = new CancellationSignal();
        brokerConnector.connect(cancellation);

        listenerContainer().start();
        running = true;
        log.info("Command ingress started: listenerId={}", CommandIngressConsumer.LISTENER_ID);
    }

    @Override
    public void stop() {
        cancellation.cancel();
        MessageListenerContainer container = listenerRegistry.getListenerContainer(CommandIngressConsumer.LISTENER_ID);
        if (container != null && container.isRunning()) {
            container.stop();
        }
        running = false;
        log.info("Command ingress stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 50;
    }

    private MessageListenerContainer listenerContainer() {
        MessageListenerContainer container = listenerRegistry.getListenerContainer(CommandIngressConsumer.LISTENER_ID);
        if (container == null) {
            throw new IngressStartupException("No listener container registered as " + CommandIngressConsumer.LISTENER_ID);
        }
        return container;
    }
}
