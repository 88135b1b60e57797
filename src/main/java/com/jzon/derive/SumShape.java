package com.jzon.derive;

import com.jzon.codec.JsonCodec;
import com.jzon.decoder.JsonDecoder;
import com.jzon.encoder.JsonEncoder;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.Optional;

/**
 * What {@link Derivation} needs to know about a sum type: its closed set of variants and,
 * optionally, the name of a discriminator field.
 * <p>
 * Without a discriminator a value is written as a single-key object, {@code {"Tag":{...}}}.
 * With one, the tag is written as a field of the variant's own object, {@code {"type":"Tag",...}}.
 */
public record SumShape<A>(
    String typeName,
    ImmutableList<VariantInfo<A>> variants,
    Optional<String> discriminator
) {
    public SumShape {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(variants, "variants");
        Objects.requireNonNull(discriminator, "discriminator");
    }

    public static <A> Builder<A> builder(String typeName) {
        return new Builder<>(typeName);
    }

    public static final class Builder<A> {
        private final String typeName;
        private final MutableList<VariantInfo<A>> variants = Lists.mutable.empty();
        private String discriminator;

        private Builder(String typeName) {
            this.typeName = typeName;
        }

        public <V extends A> Builder<A> variant(Class<V> type, JsonEncoder<V> encoder, JsonDecoder<V> decoder) {
            return variant(VariantInfo.of(type, encoder, decoder));
        }

        public <V extends A> Builder<A> variant(Class<V> type, JsonCodec<V> codec) {
            return variant(VariantInfo.of(type, codec));
        }

        public Builder<A> variant(VariantInfo<A> variant) {
            variants.add(variant);
            return this;
        }

        public Builder<A> discriminator(String fieldName) {
            this.discriminator = fieldName;
            return this;
        }

        public SumShape<A> build() {
            return new SumShape<>(typeName, variants.toImmutable(), Optional.ofNullable(discriminator));
        }
    }
}
