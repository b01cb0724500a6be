package com.logistics.order.ingress;

/**
 * One connectivity check against the command broker.
 */
@FunctionalInterface
public interface BrokerProbe {

    /**
     * @throws Exception if the broker cannot be reached right now
     */
    void probe() throws Exception;
}
