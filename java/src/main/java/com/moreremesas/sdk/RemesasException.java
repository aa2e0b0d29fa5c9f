package com.moreremesas.sdk;

/**
 * Base exception thrown by the MoreRemesas Java SDK.
 */
public class RemesasException extends Exception {

    private static final long serialVersionUID = 1L;

    public RemesasException(String message) {
        super(message);
    }

    public RemesasException(String message, Throwable cause) {
        super(message, cause);
    }
}
