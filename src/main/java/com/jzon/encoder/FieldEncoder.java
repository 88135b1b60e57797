package com.jzon.encoder;

import java.util.function.Function;

/**
 * Turns a map key into the string used as a JSON object key.
 */
@FunctionalInterface
public interface FieldEncoder<K> {
    FieldEncoder<String> STRING = key -> key;

    String unsafeEncodeField(K key);

    default <B> FieldEncoder<B> contramap(Function<? super B, ? extends K> f) {
        return key -> unsafeEncodeField(f.apply(key));
    }

    /**
     * Only {@code g} takes part in encoding; {@code f} is accepted so the signature mirrors
     * the decoder side.
     */
    default <B> FieldEncoder<B> xmap(Function<? super K, ? extends B> f, Function<? super B, ? extends K> g) {
        return contramap(g);
    }
}
