package com.jzon.exceptions;

import com.jzon.decoder.DecodeTrace;

/**
 * The input could not be decoded.
 * The message is the rendered {@link DecodeTrace}, root first, ending with what went wrong,
 * e.g. {@code .user.name(missing)}.
 */
public final class JsonDecodeException extends JsonException {
    private final DecodeTrace trace;

    public JsonDecodeException(DecodeTrace trace) {
        super(trace.render());
        this.trace = trace;
    }

    public JsonDecodeException(DecodeTrace trace, Throwable cause) {
        super(trace.render(), cause);
        this.trace = trace;
    }

    public DecodeTrace trace() {
        return trace;
    }
}
