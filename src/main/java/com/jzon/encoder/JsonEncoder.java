package com.jzon.encoder;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.function.Function;

/**
 * Writes values of type {@code A} as JSON text.
 * <p>
 * Implementations write straight to the supplied {@link Writer}; nested values are
 * encoded by calling their own encoder's {@link #unsafeEncode} on the same writer.
 */
@FunctionalInterface
public interface JsonEncoder<A> {
    void unsafeEncode(A value, Indent indent, Writer out) throws IOException;

    /**
     * When this returns {@code true}, an enclosing object omits the field entirely
     * instead of writing it. Used to make empty optionals disappear.
     */
    default boolean isNothing(A value) {
        return false;
    }

    default String encode(A value, Indent indent) {
        StringWriter out = new StringWriter(64);
        try {
            unsafeEncode(value, indent, out);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    default String toJson(A value) {
        return encode(value, Indent.COMPACT);
    }

    default String toJsonPretty(A value) {
        return encode(value, Indent.pretty(0));
    }

    default <B> JsonEncoder<B> contramap(Function<? super B, ? extends A> f) {
        JsonEncoder<A> self = this;
        return new JsonEncoder<>() {
            @Override
            public void unsafeEncode(B value, Indent indent, Writer out) throws IOException {
                self.unsafeEncode(f.apply(value), indent, out);
            }

            @Override
            public boolean isNothing(B value) {
                return self.isNothing(f.apply(value));
            }
        };
    }

    /**
     * Only {@code g} takes part in encoding. {@code f} is the direction that
     * {@link com.jzon.decoder.JsonDecoder#xmap} uses, so a codec can pass both functions to both halves.
     */
    default <B> JsonEncoder<B> xmap(Function<? super A, ? extends B> f, Function<? super B, ? extends A> g) {
        return contramap(g);
    }

    @SuppressWarnings("unchecked")
    default <B extends A> JsonEncoder<B> narrow() {
        return (JsonEncoder<B>) this;
    }
}
