package com.jzon.encoder;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Encoders for the JDK's scalar and container types.
 */
public final class JsonEncoders {
    private JsonEncoders() {
    }

    public static final JsonEncoder<String> STRING = (value, indent, out) -> {
        out.write('"');
        writeEscaped(value, out);
        out.write('"');
    };

    public static final JsonEncoder<Boolean> BOOLEAN = explicit(String::valueOf);
    public static final JsonEncoder<Byte> BYTE = explicit(String::valueOf);
    public static final JsonEncoder<Short> SHORT = explicit(String::valueOf);
    public static final JsonEncoder<Integer> INTEGER = explicit(String::valueOf);
    public static final JsonEncoder<Long> LONG = explicit(String::valueOf);
    public static final JsonEncoder<BigInteger> BIG_INTEGER = explicit(BigInteger::toString);
    public static final JsonEncoder<BigDecimal> BIG_DECIMAL = explicit(BigDecimal::toString);

    /**
     * Non-finite values have no JSON representation, so they are written as quoted strings
     * ({@code "NaN"}, {@code "Infinity"}, {@code "-Infinity"}) which the matching decoder accepts.
     */
    public static final JsonEncoder<Double> DOUBLE = explicit(n -> n.isNaN() || n.isInfinite()
        ? "\"" + n + "\""
        : n.toString());

    public static final JsonEncoder<Float> FLOAT = DOUBLE.contramap(Float::doubleValue);
    public static final JsonEncoder<Character> CHARACTER = STRING.contramap(String::valueOf);

    private static <A> JsonEncoder<A> explicit(Function<A, String> f) {
        return (value, indent, out) -> out.write(f.apply(value));
    }

    public static <E extends Enum<E>> JsonEncoder<E> enumByName() {
        return STRING.contramap(Enum::name);
    }

    /**
     * An empty optional is written as {@code null}, or left out when it is an object field.
     */
    public static <A> JsonEncoder<Optional<A>> optional(JsonEncoder<A> encoder) {
        return new JsonEncoder<>() {
            @Override
            public void unsafeEncode(Optional<A> value, Indent indent, Writer out) throws IOException {
                if (value.isPresent()) {
                    encoder.unsafeEncode(value.get(), indent, out);
                } else {
                    out.write("null");
                }
            }

            @Override
            public boolean isNothing(Optional<A> value) {
                return value.isEmpty();
            }
        };
    }

    /**
     * Writes {@code null} for a null reference, otherwise delegates.
     */
    public static <A> JsonEncoder<A> nullable(JsonEncoder<A> encoder) {
        return new JsonEncoder<>() {
            @Override
            public void unsafeEncode(A value, Indent indent, Writer out) throws IOException {
                if (value == null) {
                    out.write("null");
                } else {
                    encoder.unsafeEncode(value, indent, out);
                }
            }

            @Override
            public boolean isNothing(A value) {
                return value != null && encoder.isNothing(value);
            }
        };
    }

    public static <A> JsonEncoder<Iterable<A>> iterable(JsonEncoder<A> encoder) {
        return (values, indent, out) -> {
            out.write('[');
            boolean first = true;
            for (A value : values) {
                if (first) {
                    first = false;
                } else if (indent.isCompact()) {
                    out.write(',');
                } else {
                    out.write(", ");
                }
                encoder.unsafeEncode(value, indent, out);
            }
            out.write(']');
        };
    }

    public static <A> JsonEncoder<List<A>> list(JsonEncoder<A> encoder) {
        return JsonEncoders.<A>iterable(encoder).narrow();
    }

    public static <A> JsonEncoder<Set<A>> set(JsonEncoder<A> encoder) {
        return JsonEncoders.<A>iterable(encoder).narrow();
    }

    public static <A> JsonEncoder<Collection<A>> collection(JsonEncoder<A> encoder) {
        return JsonEncoders.<A>iterable(encoder).narrow();
    }

    /**
     * Key/value pairs as a JSON object, in iteration order.
     * Pairs whose value {@link JsonEncoder#isNothing is nothing} are skipped.
     */
    public static <K, A> JsonEncoder<Iterable<? extends Map.Entry<K, A>>> keyList(FieldEncoder<K> keys, JsonEncoder<A> values) {
        return (entries, indent, out) -> {
            out.write('{');
            Indent nested = indent.bump();
            boolean first = true;
            for (Map.Entry<K, A> entry : entries) {
                if (values.isNothing(entry.getValue())) {
                    continue;
                }
                if (first) {
                    first = false;
                } else {
                    out.write(',');
                }
                nested.pad(out);
                STRING.unsafeEncode(keys.unsafeEncodeField(entry.getKey()), nested, out);
                indent.colon(out);
                values.unsafeEncode(entry.getValue(), nested, out);
            }
            if (!first) {
                indent.pad(out);
            }
            out.write('}');
        };
    }

    public static <K, A> JsonEncoder<Map<K, A>> map(FieldEncoder<K> keys, JsonEncoder<A> values) {
        return JsonEncoders.<K, A>keyList(keys, values).contramap(Map::entrySet);
    }

    public static <A> JsonEncoder<Map<String, A>> map(JsonEncoder<A> values) {
        return map(FieldEncoder.STRING, values);
    }

    static void writeEscaped(String s, Writer out) throws IOException {
        // Fast path: nothing to escape
        int len = s.length();
        boolean needsEscaping = false;
        for (int i = 0; i < len; i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < ' ') {
                needsEscaping = true;
                break;
            }
        }
        if (!needsEscaping) {
            out.write(s);
            return;
        }

        for (int i = 0; i < len; i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> out.write("\\\"");
                case '\\' -> out.write("\\\\");
                case '\b' -> out.write("\\b");
                case '\f' -> out.write("\\f");
                case '\n' -> out.write("\\n");
                case '\r' -> out.write("\\r");
                case '\t' -> out.write("\\t");
                default -> {
                    if (c < ' ') {
                        out.write(String.format("\\u%04x", (int) c));
                    } else {
                        out.write(c);
                    }
                }
            }
        }
    }
}
