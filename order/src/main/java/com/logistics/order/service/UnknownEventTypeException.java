package com.logistics.order.service;

public class UnknownEventTypeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnknownEventTypeException(String eventType) {
        super("Unknown event type in event log: " + eventType);
    }
}
