package com.moreremesas.sdk;

/**
 * Authentication was rejected by the server, or automatic authentication was attempted without credentials.
 */
public final class AuthException extends RemesasException {

    private static final long serialVersionUID = 1L;

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
