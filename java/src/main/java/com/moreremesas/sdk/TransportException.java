package com.moreremesas.sdk;

/**
 * Network or IO failure that survived the configured retry budget. Callers may retry at their own discretion.
 */
public final class TransportException extends RemesasException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
