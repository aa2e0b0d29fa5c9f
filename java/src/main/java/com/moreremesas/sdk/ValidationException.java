package com.moreremesas.sdk;

import java.util.List;

/**
 * Local precondition failure. Nothing is sent over the wire when this is thrown before dispatch.
 */
public final class ValidationException extends RemesasException {

    private static final long serialVersionUID = 1L;

    private final List<String> missingFields;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> missingFields) {
        super(message);
        this.missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    /**
     * @return required keys absent from the payload, in declaration order; empty for other validation failures.
     */
    public List<String> getMissingFields() {
        return missingFields;
    }
}
