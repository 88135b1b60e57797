package com.jzon.decoder;

import com.fasterxml.jackson.core.JsonToken;
import com.jzon.exceptions.JsonDecodeException;

import java.io.IOException;

/**
 * Token-level primitives shared by all decoders.
 * Failures are reported as {@link com.jzon.exceptions.JsonDecodeException}s carrying the caller's trace.
 */
public final class Lexer {
    private Lexer() {
    }

    public static JsonToken next(DecodeTrace trace, TokenReader in) {
        try {
            JsonToken token = in.next();
            if (token == null) {
                throw trace.fail("unexpected end of input");
            }
            return token;
        } catch (IOException e) {
            throw new JsonDecodeException(trace.push(new TraceStep.Message("malformed: " + e.getMessage())), e);
        }
    }

    public static String text(DecodeTrace trace, TokenReader in) {
        try {
            return in.text();
        } catch (IOException e) {
            throw new JsonDecodeException(trace.push(new TraceStep.Message("malformed: " + e.getMessage())), e);
        }
    }

    /**
     * Consumes the next token, which must be {@code expected}.
     */
    public static void expect(DecodeTrace trace, TokenReader in, JsonToken expected) {
        JsonToken token = next(trace, in);
        if (token != expected) {
            throw trace.fail("expected " + describe(expected) + " got " + describe(token));
        }
    }

    /**
     * Consumes one complete value without decoding it.
     */
    public static void skipValue(DecodeTrace trace, TokenReader in) {
        JsonToken token = next(trace, in);
        if (token == JsonToken.FIELD_NAME || token == JsonToken.END_OBJECT || token == JsonToken.END_ARRAY) {
            throw trace.fail("expected value got " + describe(token));
        }
        int depth = token.isStructStart() ? 1 : 0;
        while (depth > 0) {
            token = next(trace, in);
            if (token.isStructStart()) {
                depth++;
            } else if (token.isStructEnd()) {
                depth--;
            }
        }
    }

    /**
     * Call after the opening {@code {}. Returns {@code true} if the object has an entry,
     * leaving it unread; otherwise consumes the closing brace.
     */
    public static boolean firstField(DecodeTrace trace, TokenReader in) {
        return nextField(trace, in);
    }

    /**
     * Call after an entry's value. Returns {@code true} if another entry follows,
     * leaving it unread; otherwise consumes the closing brace.
     */
    public static boolean nextField(DecodeTrace trace, TokenReader in) {
        JsonToken token = next(trace, in);
        if (token == JsonToken.END_OBJECT) {
            return false;
        }
        if (token == JsonToken.FIELD_NAME) {
            in.retract();
            return true;
        }
        throw trace.fail("expected field or '}' got " + describe(token));
    }

    /**
     * Same as {@link #nextField} for arrays: leaves the next element unread or consumes {@code ]}.
     */
    public static boolean nextElement(DecodeTrace trace, TokenReader in) {
        JsonToken token = next(trace, in);
        if (token == JsonToken.END_ARRAY) {
            return false;
        }
        in.retract();
        return true;
    }

    /**
     * Reads the next key.
     *
     * @return the key's index in {@code matcher}, or -1 if it is not one of the candidates
     */
    public static int field(DecodeTrace trace, TokenReader in, FieldMatcher matcher) {
        return matcher.indexOf(fieldName(trace, in));
    }

    public static String fieldName(DecodeTrace trace, TokenReader in) {
        expect(trace, in, JsonToken.FIELD_NAME);
        return text(trace, in);
    }

    /**
     * Reads a string value.
     *
     * @return its index in {@code matcher}, or -1
     */
    public static int enumeration(DecodeTrace trace, TokenReader in, FieldMatcher matcher) {
        expect(trace, in, JsonToken.VALUE_STRING);
        return matcher.indexOf(text(trace, in));
    }

    static String describe(JsonToken token) {
        if (token == null) {
            return "end of input";
        }
        return switch (token) {
            case START_OBJECT -> "'{'";
            case END_OBJECT -> "'}'";
            case START_ARRAY -> "'['";
            case END_ARRAY -> "']'";
            case FIELD_NAME -> "field";
            case VALUE_STRING -> "string";
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> "number";
            case VALUE_TRUE, VALUE_FALSE -> "boolean";
            case VALUE_NULL -> "null";
            default -> token.name();
        };
    }
}
