package com.jzon.derive;

import com.jzon.codec.JsonCodec;
import com.jzon.decoder.JsonDecoder;
import com.jzon.encoder.JsonEncoder;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;
import java.util.function.Function;

/**
 * What {@link Derivation} needs to know about a product type: its fields in declaration order
 * and how to construct an instance from their values.
 *
 * @param constructor   receives the field values in the order of {@code fields}
 * @param noExtraFields reject input objects that have keys no field claims
 */
public record ProductShape<A>(
    String typeName,
    ImmutableList<FieldInfo<A>> fields,
    Function<Object[], A> constructor,
    boolean noExtraFields
) {
    public ProductShape {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(constructor, "constructor");
    }

    public static <A> Builder<A> builder(String typeName, Function<Object[], A> constructor) {
        return new Builder<>(typeName, constructor);
    }

    public static final class Builder<A> {
        private final String typeName;
        private final Function<Object[], A> constructor;
        private final MutableList<FieldInfo<A>> fields = Lists.mutable.empty();
        private boolean noExtraFields;

        private Builder(String typeName, Function<Object[], A> constructor) {
            this.typeName = typeName;
            this.constructor = constructor;
        }

        public <F> Builder<A> field(String label, Function<? super A, ? extends F> accessor, JsonEncoder<F> encoder, JsonDecoder<F> decoder) {
            return field(FieldInfo.of(label, accessor, encoder, decoder));
        }

        public <F> Builder<A> field(String label, Function<? super A, ? extends F> accessor, JsonCodec<F> codec) {
            return field(FieldInfo.of(label, accessor, codec));
        }

        public Builder<A> field(FieldInfo<A> field) {
            fields.add(field);
            return this;
        }

        public Builder<A> noExtraFields() {
            this.noExtraFields = true;
            return this;
        }

        public ProductShape<A> build() {
            return new ProductShape<>(typeName, fields.toImmutable(), constructor, noExtraFields);
        }
    }
}
