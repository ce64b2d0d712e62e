package com.ryuqq.retry.application.payload;

/**
 * Raised when an opaque payload is not a JSON object.
 *
 * @author Retry Ledger Team
 * @since 1.0.0
 */
public class PayloadParseException extends RuntimeException {

    public PayloadParseException(String message) {
        super(message);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
