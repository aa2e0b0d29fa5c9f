package com.moreremesas.sdk;

/**
 * Raised when the web service answers with a non-2xx status (after retries) or with a body that is not valid XML.
 * The message carries the status and the request URL but never authentication material.
 */
public final class ServerException extends RemesasException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String url;

    public ServerException(int statusCode, String url, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, url) : message);
        this.statusCode = statusCode;
        this.url = url;
    }

    public ServerException(int statusCode, String url, String message, Throwable cause) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, url) : message, cause);
        this.statusCode = statusCode;
        this.url = url;
    }

    /**
     * @return HTTP status code of the last attempt.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the endpoint URL the request was posted to.
     */
    public String getUrl() {
        return url;
    }

    private static String defaultMessage(int status, String url) {
        return "HTTP " + status + " at " + url;
    }
}
