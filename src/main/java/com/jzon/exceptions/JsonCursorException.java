package com.jzon.exceptions;

import com.jzon.cursor.CursorError;

/**
 * Raised only when a caller asks for a failed cursor result to be unwrapped.
 */
public final class JsonCursorException extends JsonException {
    private final CursorError error;

    public JsonCursorException(CursorError error) {
        super(error.message());
        this.error = error;
    }

    public CursorError error() {
        return error;
    }
}
