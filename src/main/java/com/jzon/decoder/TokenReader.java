package com.jzon.decoder;

import com.fasterxml.jackson.core.JsonToken;

import java.io.Closeable;
import java.io.IOException;

/**
 * A stream of JSON tokens, with one token of pushback.
 */
public interface TokenReader extends Closeable {
    /**
     * Advances to the next token.
     *
     * @return the token, or {@code null} at the end of the input
     */
    JsonToken next() throws IOException;

    /**
     * @return the token last returned by {@link #next()}
     */
    JsonToken current();

    /**
     * The text of the current token: the name of a {@link JsonToken#FIELD_NAME},
     * the value of a {@link JsonToken#VALUE_STRING}, or the literal of a number.
     */
    String text() throws IOException;

    /**
     * Makes the next call to {@link #next()} return the current token again.
     */
    void retract();
}
