package com.logistics.order.ingress;

public class MalformedCommandException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedCommandException(String message) {
        super(message);
    }

    public MalformedCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
