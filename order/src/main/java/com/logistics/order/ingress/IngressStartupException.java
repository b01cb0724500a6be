package com.logistics.order.ingress;

/**
 * The command broker could not be reached during startup. Fatal: the
 * application context fails to start.
 */
public class IngressStartupException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public IngressStartupException(String message) {
        super(message);
    }

    public IngressStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
