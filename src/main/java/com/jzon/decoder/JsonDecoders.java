package com.jzon.decoder;

import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableOrderedMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.OrderedMaps;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decoders for the JDK's scalar and container types.
 */
public final class JsonDecoders {
    private JsonDecoders() {
    }

    public static final JsonDecoder<String> STRING = (trace, in) -> {
        Lexer.expect(trace, in, JsonToken.VALUE_STRING);
        return Lexer.text(trace, in);
    };

    public static final JsonDecoder<Boolean> BOOLEAN = (trace, in) -> {
        JsonToken token = Lexer.next(trace, in);
        if (token == JsonToken.VALUE_TRUE) {
            return true;
        } else if (token == JsonToken.VALUE_FALSE) {
            return false;
        }
        throw trace.fail("expected boolean got " + Lexer.describe(token));
    };

    public static final JsonDecoder<Long> LONG = (trace, in) -> {
        String literal = integerLiteral(trace, in);
        try {
            return Long.parseLong(literal);
        } catch (NumberFormatException e) {
            throw trace.fail("expected a 64-bit integer");
        }
    };

    public static final JsonDecoder<Integer> INTEGER = (trace, in) -> {
        long value = LONG.unsafeDecode(trace, in);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw trace.fail("expected a 32-bit integer");
        }
        return (int) value;
    };

    public static final JsonDecoder<Short> SHORT = (trace, in) -> {
        long value = LONG.unsafeDecode(trace, in);
        if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
            throw trace.fail("expected a 16-bit integer");
        }
        return (short) value;
    };

    public static final JsonDecoder<Byte> BYTE = (trace, in) -> {
        long value = LONG.unsafeDecode(trace, in);
        if (value < Byte.MIN_VALUE || value > Byte.MAX_VALUE) {
            throw trace.fail("expected an 8-bit integer");
        }
        return (byte) value;
    };

    public static final JsonDecoder<BigInteger> BIG_INTEGER = (trace, in) -> new BigInteger(integerLiteral(trace, in));

    public static final JsonDecoder<BigDecimal> BIG_DECIMAL = (trace, in) -> {
        JsonToken token = Lexer.next(trace, in);
        if (token != JsonToken.VALUE_NUMBER_INT && token != JsonToken.VALUE_NUMBER_FLOAT) {
            throw trace.fail("expected number got " + Lexer.describe(token));
        }
        return new BigDecimal(Lexer.text(trace, in));
    };

    /**
     * Also accepts the quoted non-finite forms written by {@link com.jzon.encoder.JsonEncoders#DOUBLE}.
     */
    public static final JsonDecoder<Double> DOUBLE = (trace, in) -> {
        JsonToken token = Lexer.next(trace, in);
        String text = Lexer.text(trace, in);
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return Double.parseDouble(text);
        }
        if (token == JsonToken.VALUE_STRING) {
            switch (text) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        throw trace.fail("expected number got " + Lexer.describe(token));
    };

    public static final JsonDecoder<Float> FLOAT = DOUBLE.map(Double::floatValue);

    public static final JsonDecoder<Character> CHARACTER = (trace, in) -> {
        String value = STRING.unsafeDecode(trace, in);
        if (value.length() != 1) {
            throw trace.fail("expected one character");
        }
        return value.charAt(0);
    };

    private static String integerLiteral(DecodeTrace trace, TokenReader in) {
        JsonToken token = Lexer.next(trace, in);
        if (token != JsonToken.VALUE_NUMBER_INT) {
            throw trace.fail("expected integer got " + Lexer.describe(token));
        }
        return Lexer.text(trace, in);
    }

    public static <E extends Enum<E>> JsonDecoder<E> enumByName(Class<E> type) {
        E[] constants = type.getEnumConstants();
        String[] names = new String[constants.length];
        for (int i = 0; i < constants.length; i++) {
            names[i] = constants[i].name();
        }
        FieldMatcher matcher = new FieldMatcher(names);
        return (trace, in) -> {
            int index = Lexer.enumeration(trace, in, matcher);
            if (index == -1) {
                throw trace.fail("invalid enumeration value '" + Lexer.text(trace, in) + "'");
            }
            return constants[index];
        };
    }

    /**
     * {@code null} and a missing field both decode to an empty optional.
     */
    public static <A> JsonDecoder<Optional<A>> optional(JsonDecoder<A> decoder) {
        return new JsonDecoder<>() {
            @Override
            public Optional<A> unsafeDecode(DecodeTrace trace, TokenReader in) {
                if (Lexer.next(trace, in) == JsonToken.VALUE_NULL) {
                    return Optional.empty();
                }
                in.retract();
                return Optional.of(decoder.unsafeDecode(trace, in));
            }

            @Override
            public Optional<A> unsafeDecodeMissing(DecodeTrace trace) {
                return Optional.empty();
            }
        };
    }

    /**
     * Reads {@code null} as a null reference. A missing field is still left to {@code decoder}.
     */
    public static <A> JsonDecoder<A> nullable(JsonDecoder<A> decoder) {
        return new JsonDecoder<>() {
            @Override
            public A unsafeDecode(DecodeTrace trace, TokenReader in) {
                if (Lexer.next(trace, in) == JsonToken.VALUE_NULL) {
                    return null;
                }
                in.retract();
                return decoder.unsafeDecode(trace, in);
            }

            @Override
            public A unsafeDecodeMissing(DecodeTrace trace) {
                return decoder.unsafeDecodeMissing(trace);
            }
        };
    }

    public static <A> JsonDecoder<List<A>> list(JsonDecoder<A> decoder) {
        return (trace, in) -> {
            Lexer.expect(trace, in, JsonToken.START_ARRAY);
            MutableList<A> elements = Lists.mutable.empty();
            int i = 0;
            while (Lexer.nextElement(trace, in)) {
                elements.add(decoder.unsafeDecode(trace.element(i), in));
                i++;
            }
            return elements.asUnmodifiable();
        };
    }

    public static <A> JsonDecoder<Set<A>> set(JsonDecoder<A> decoder) {
        return list(decoder).map(elements -> Collections.unmodifiableSet(new LinkedHashSet<>(elements)));
    }

    /**
     * Keeps the input's key order. When a key repeats, the last value wins.
     */
    public static <A> JsonDecoder<Map<String, A>> map(JsonDecoder<A> decoder) {
        return (trace, in) -> {
            Lexer.expect(trace, in, JsonToken.START_OBJECT);
            MutableOrderedMap<String, A> entries = OrderedMaps.adapt(new LinkedHashMap<>());
            if (Lexer.firstField(trace, in)) {
                do {
                    String key = Lexer.fieldName(trace, in);
                    entries.put(key, decoder.unsafeDecode(trace.field(key), in));
                } while (Lexer.nextField(trace, in));
            }
            return entries.asUnmodifiable();
        };
    }
}
