package com.logistics.order.ingress;

public record IngressResult(IngressOutcome outcome, String reason) {

    public static IngressResult ack() {
        return new IngressResult(IngressOutcome.ACK, null);
    }

    public static IngressResult reject(String reason) {
        return new IngressResult(IngressOutcome.REJECT, reason);
    }

    public static IngressResult requeue(String reason) {
        return new IngressResult(IngressOutcome.REQUEUE, reason);
    }
}
