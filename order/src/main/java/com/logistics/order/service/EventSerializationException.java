package com.logistics.order.service;

public class EventSerializationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
