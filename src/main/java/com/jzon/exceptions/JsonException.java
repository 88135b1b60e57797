package com.jzon.exceptions;

/**
 * Root of the unchecked exceptions thrown by jzon.
 */
public sealed abstract class JsonException extends RuntimeException
    permits JsonCursorException, JsonDecodeException, JsonDerivationException {

    protected JsonException(String message) {
        super(message);
    }

    protected JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
