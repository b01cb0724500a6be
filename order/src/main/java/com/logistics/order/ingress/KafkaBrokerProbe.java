package com.logistics.order.ingress;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.common.Node;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Probes the Kafka cluster through the admin client's cluster metadata call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaBrokerProbe implements BrokerProbe {

    private static final long DESCRIBE_TIMEOUT_SECONDS = 5;

    private final AdminClient adminClient;

    @Override
    public void probe() throws Exception {
        Collection<Node> nodes = adminClient.describeCluster().nodes().get(DESCRIBE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        if (nodes.isEmpty()) {
            throw new IllegalStateException("Kafka cluster reported no brokers");
        }
        log.debug("Kafka cluster reachable: brokers={}", nodes.size());
    }
}
