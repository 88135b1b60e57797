package com.jzon.derive;

import com.jzon.codec.JsonCodec;
import com.jzon.decoder.JsonDecoder;
import com.jzon.encoder.JsonEncoder;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * One field of a product type.
 *
 * @param label    the field's own name
 * @param rename   the JSON key to use instead of {@code label}, if any
 * @param accessor reads the field from an instance
 * @param encoder  may be null when only a decoder is derived
 * @param decoder  may be null when only an encoder is derived
 */
public record FieldInfo<A>(
    String label,
    Optional<String> rename,
    Function<? super A, Object> accessor,
    JsonEncoder<Object> encoder,
    JsonDecoder<Object> decoder
) {
    public FieldInfo {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(rename, "rename");
        Objects.requireNonNull(accessor, "accessor");
    }

    @SuppressWarnings("unchecked")
    public static <A, F> FieldInfo<A> of(String label, Function<? super A, ? extends F> accessor, JsonEncoder<F> encoder, JsonDecoder<F> decoder) {
        return new FieldInfo<>(
            label,
            Optional.empty(),
            value -> accessor.apply(value),
            (JsonEncoder<Object>) encoder,
            (JsonDecoder<Object>) decoder);
    }

    public static <A, F> FieldInfo<A> of(String label, Function<? super A, ? extends F> accessor, JsonCodec<F> codec) {
        return of(label, accessor, codec.encoder(), codec.decoder());
    }

    /**
     * The key this field is written under.
     */
    public String jsonName() {
        return rename.orElse(label);
    }

    public FieldInfo<A> renamed(String jsonName) {
        return new FieldInfo<>(label, Optional.of(jsonName), accessor, encoder, decoder);
    }
}
