package com.jzon.codec;

import com.jzon.decoder.JsonDecoder;
import com.jzon.encoder.JsonEncoder;

import java.util.Objects;
import java.util.function.Function;

/**
 * An encoder and a decoder for the same type.
 */
public record JsonCodec<A>(JsonEncoder<A> encoder, JsonDecoder<A> decoder) {
    public JsonCodec {
        Objects.requireNonNull(encoder, "encoder");
        Objects.requireNonNull(decoder, "decoder");
    }

    public String toJson(A value) {
        return encoder.toJson(value);
    }

    public String toJsonPretty(A value) {
        return encoder.toJsonPretty(value);
    }

    public A decode(String json) {
        return decoder.decode(json);
    }

    /**
     * Decoding maps with {@code f}, encoding with {@code g}.
     */
    public <B> JsonCodec<B> xmap(Function<? super A, ? extends B> f, Function<? super B, ? extends A> g) {
        return new JsonCodec<>(encoder.xmap(f, g), decoder.xmap(f, g));
    }
}
