package com.jzon.derive;

import com.jzon.codec.JsonCodec;
import com.jzon.decoder.FieldMatcher;
import com.jzon.decoder.JsonDecoder;
import com.jzon.encoder.JsonEncoder;
import com.jzon.exceptions.JsonDerivationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds encoders and decoders for product and sum types from their {@link ProductShape}s and {@link SumShape}s.
 *
 * <h2>Products</h2>
 * A product is written as an object with one entry per field, in declaration order:
 * <pre>{@code
 * {"name":"Ada","age":36}
 * }</pre>
 * Fields whose encoder reports nothing, such as empty optionals, are omitted.
 *
 * <h2>Sums</h2>
 * Without a discriminator each value is wrapped in an object keyed by its variant's tag:
 * <pre>{@code
 * {"Circle":{"radius":1.5}}
 * }</pre>
 * With a discriminator the tag becomes a field of the variant's own object:
 * <pre>{@code
 * {"shape":"Circle","radius":1.5}
 * }</pre>
 * Every variant of a discriminated sum must therefore encode as a JSON object.
 */
public final class Derivation {
    private static final Logger LOGGER = LoggerFactory.getLogger(Derivation.class);

    private Derivation() {
    }

    public static <A> JsonEncoder<A> encoder(ProductShape<A> shape) {
        requireEncoders(shape);
        LOGGER.debug("Deriving encoder for product {} with {} fields", shape.typeName(), shape.fields().size());
        return new ProductEncoder<>(shape);
    }

    public static <A> JsonDecoder<A> decoder(ProductShape<A> shape) {
        requireDecoders(shape);
        requireDistinctNames(shape);
        LOGGER.debug("Deriving decoder for product {} with {} fields", shape.typeName(), shape.fields().size());
        return new ProductDecoder<>(shape);
    }

    public static <A> JsonCodec<A> codec(ProductShape<A> shape) {
        return new JsonCodec<>(encoder(shape), decoder(shape));
    }

    public static <A> JsonEncoder<A> encoder(SumShape<A> shape) {
        requireVariants(shape);
        for (VariantInfo<A> variant : shape.variants()) {
            if (variant.encoder() == null) {
                throw new JsonDerivationException("No encoder for variant " + variant.tag() + " of " + shape.typeName());
            }
        }
        LOGGER.debug("Deriving encoder for sum {} with variants {}", shape.typeName(), shape.variants().collect(VariantInfo::tag));
        return shape.discriminator()
            .<JsonEncoder<A>>map(name -> new DiscriminatedSumEncoder<>(shape, name))
            .orElseGet(() -> new WrappedSumEncoder<>(shape));
    }

    public static <A> JsonDecoder<A> decoder(SumShape<A> shape) {
        requireVariants(shape);
        for (VariantInfo<A> variant : shape.variants()) {
            if (variant.decoder() == null) {
                throw new JsonDerivationException("No decoder for variant " + variant.tag() + " of " + shape.typeName());
            }
        }
        LOGGER.debug("Deriving decoder for sum {} with variants {}", shape.typeName(), shape.variants().collect(VariantInfo::tag));
        return shape.discriminator()
            .<JsonDecoder<A>>map(name -> new DiscriminatedSumDecoder<>(shape, name))
            .orElseGet(() -> new WrappedSumDecoder<>(shape));
    }

    public static <A> JsonCodec<A> codec(SumShape<A> shape) {
        return new JsonCodec<>(encoder(shape), decoder(shape));
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not an instance of any variant
     */
    static <A> VariantInfo<A> variantOf(SumShape<A> shape, A value) {
        for (VariantInfo<A> variant : shape.variants()) {
            if (variant.type().isInstance(value)) {
                return variant;
            }
        }
        throw new IllegalArgumentException("Value of " + (value == null ? "null" : value.getClass().getName())
            + " is not a variant of " + shape.typeName());
    }

    static FieldMatcher tagMatcher(SumShape<?> shape) {
        return new FieldMatcher(shape.variants().collect(VariantInfo::tag));
    }

    private static void requireEncoders(ProductShape<?> shape) {
        for (FieldInfo<?> field : shape.fields()) {
            if (field.encoder() == null) {
                throw new JsonDerivationException("No encoder for field " + field.label() + " of " + shape.typeName());
            }
        }
    }

    private static void requireDecoders(ProductShape<?> shape) {
        for (FieldInfo<?> field : shape.fields()) {
            if (field.decoder() == null) {
                throw new JsonDerivationException("No decoder for field " + field.label() + " of " + shape.typeName());
            }
        }
    }

    private static void requireDistinctNames(ProductShape<?> shape) {
        if (shape.fields().collect(FieldInfo::jsonName).toSet().size() != shape.fields().size()) {
            throw new JsonDerivationException("Duplicate field names in " + shape.typeName() + ": " + shape.fields().collect(FieldInfo::jsonName));
        }
    }

    private static void requireVariants(SumShape<?> shape) {
        if (shape.variants().isEmpty()) {
            throw new JsonDerivationException("Sum type " + shape.typeName() + " has no variants");
        }
        if (shape.variants().collect(VariantInfo::tag).toSet().size() != shape.variants().size()) {
            throw new JsonDerivationException("Duplicate variant tags in " + shape.typeName() + ": " + shape.variants().collect(VariantInfo::tag));
        }
    }
}
