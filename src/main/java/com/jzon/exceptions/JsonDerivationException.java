package com.jzon.exceptions;

/**
 * A type's shape cannot be turned into an encoder or decoder.
 * <p>
 * This is thrown while codecs are being derived, before any JSON is read or written.
 */
public final class JsonDerivationException extends JsonException {
    public JsonDerivationException(String message) {
        super(message);
    }

    public JsonDerivationException(String message, Throwable cause) {
        super(message, cause);
    }
}
