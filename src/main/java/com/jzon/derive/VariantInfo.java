package com.jzon.derive;

import com.jzon.codec.JsonCodec;
import com.jzon.decoder.JsonDecoder;
import com.jzon.encoder.JsonEncoder;

import java.util.Objects;
import java.util.Optional;

/**
 * One variant of a sum type.
 *
 * @param type    values that are instances of this class are encoded as this variant
 * @param hint    the tag to use instead of the class's simple name, if any
 * @param encoder may be null when only a decoder is derived
 * @param decoder may be null when only an encoder is derived
 */
public record VariantInfo<A>(
    Class<? extends A> type,
    Optional<String> hint,
    JsonEncoder<Object> encoder,
    JsonDecoder<Object> decoder
) {
    public VariantInfo {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(hint, "hint");
    }

    @SuppressWarnings("unchecked")
    public static <A, V extends A> VariantInfo<A> of(Class<V> type, JsonEncoder<V> encoder, JsonDecoder<V> decoder) {
        return new VariantInfo<>(type, Optional.empty(), (JsonEncoder<Object>) encoder, (JsonDecoder<Object>) decoder);
    }

    public static <A, V extends A> VariantInfo<A> of(Class<V> type, JsonCodec<V> codec) {
        return of(type, codec.encoder(), codec.decoder());
    }

    /**
     * The name that identifies this variant in JSON.
     */
    public String tag() {
        return hint.orElse(type.getSimpleName());
    }

    public VariantInfo<A> hinted(String tag) {
        return new VariantInfo<>(type, Optional.of(tag), encoder, decoder);
    }
}
