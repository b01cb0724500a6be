package com.logistics.order.ingress;

/**
 * What the transport should do with a consumed command message.
 */
public enum IngressOutcome {
    /** Handled; remove from the topic. */
    ACK,
    /** Can never succeed; route to the dead-letter topic, never redeliver. */
    REJECT,
    /** May succeed later; redeliver. */
    REQUEUE
}
