package com.moreremesas.sdk;

import com.moreremesas.sdk.xml.Fields;

/**
 * Normalized view of a vendor business result.
 *
 * @param code    the {@code ResponseCode}, empty when the response had none.
 * @param message the most specific human readable message available.
 * @param details the first entry of the {@code Messages} block; empty when there is none.
 */
public record ResponseError(String code, String message, Fields details) {

    public ResponseError {
        code = code == null ? "" : code;
        message = message == null ? "" : message;
        details = details == null ? new Fields() : details;
    }

    public boolean isSuccess() {
        return ResponseCodes.SUCCESS.equals(code);
    }
}
