package com.jzon.derive;

import com.jzon.codec.JsonCodec;
import com.jzon.codec.JsonNodeCodec;
import com.jzon.decoder.DecodeTrace;
import com.jzon.decoder.JsonDecoder;
import com.jzon.decoder.JsonDecoders;
import com.jzon.decoder.TokenReader;
import com.jzon.encoder.JsonEncoder;
import com.jzon.encoder.JsonEncoders;
import com.jzon.exceptions.JsonDerivationException;
import com.jzon.json.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives codecs for records and sealed types by reflection, building the
 * {@link ProductShape}s and {@link SumShape}s that {@link Derivation} consumes.
 * <p>
 * Records become products, one field per component, in declaration order.
 * Sealed interfaces and classes become sums over their permitted subclasses.
 * Component types are resolved recursively:
 * <ul>
 *     <li>{@code String}, primitives and their boxes, {@code BigDecimal}, {@code BigInteger}</li>
 *     <li>enums, by constant name</li>
 *     <li>{@code Optional}, {@code List}, {@code Collection}, {@code Set} and {@code Map<String, ?>} of supported types</li>
 *     <li>{@link JsonNode}</li>
 *     <li>other records and sealed types, including the one being derived</li>
 * </ul>
 * Anything else is rejected with a {@link JsonDerivationException} when the codec is requested.
 * <p>
 * A component of reference type, other than {@code Optional}, may be null: it is written
 * as {@code null} and read back from {@code null}. A missing field is still an error.
 * <p>
 * Derived codecs are cached per class.
 */
public final class RecordDerivation {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecordDerivation.class);

    private static final Map<Class<?>, JsonCodec<?>> CACHE = new ConcurrentHashMap<>();

    private static final Map<Class<?>, JsonCodec<?>> SCALARS = Map.ofEntries(
        Map.entry(String.class, new JsonCodec<>(JsonEncoders.STRING, JsonDecoders.STRING)),
        Map.entry(Boolean.class, new JsonCodec<>(JsonEncoders.BOOLEAN, JsonDecoders.BOOLEAN)),
        Map.entry(boolean.class, new JsonCodec<>(JsonEncoders.BOOLEAN, JsonDecoders.BOOLEAN)),
        Map.entry(Byte.class, new JsonCodec<>(JsonEncoders.BYTE, JsonDecoders.BYTE)),
        Map.entry(byte.class, new JsonCodec<>(JsonEncoders.BYTE, JsonDecoders.BYTE)),
        Map.entry(Short.class, new JsonCodec<>(JsonEncoders.SHORT, JsonDecoders.SHORT)),
        Map.entry(short.class, new JsonCodec<>(JsonEncoders.SHORT, JsonDecoders.SHORT)),
        Map.entry(Integer.class, new JsonCodec<>(JsonEncoders.INTEGER, JsonDecoders.INTEGER)),
        Map.entry(int.class, new JsonCodec<>(JsonEncoders.INTEGER, JsonDecoders.INTEGER)),
        Map.entry(Long.class, new JsonCodec<>(JsonEncoders.LONG, JsonDecoders.LONG)),
        Map.entry(long.class, new JsonCodec<>(JsonEncoders.LONG, JsonDecoders.LONG)),
        Map.entry(Float.class, new JsonCodec<>(JsonEncoders.FLOAT, JsonDecoders.FLOAT)),
        Map.entry(float.class, new JsonCodec<>(JsonEncoders.FLOAT, JsonDecoders.FLOAT)),
        Map.entry(Double.class, new JsonCodec<>(JsonEncoders.DOUBLE, JsonDecoders.DOUBLE)),
        Map.entry(double.class, new JsonCodec<>(JsonEncoders.DOUBLE, JsonDecoders.DOUBLE)),
        Map.entry(Character.class, new JsonCodec<>(JsonEncoders.CHARACTER, JsonDecoders.CHARACTER)),
        Map.entry(char.class, new JsonCodec<>(JsonEncoders.CHARACTER, JsonDecoders.CHARACTER)),
        Map.entry(BigInteger.class, new JsonCodec<>(JsonEncoders.BIG_INTEGER, JsonDecoders.BIG_INTEGER)),
        Map.entry(BigDecimal.class, new JsonCodec<>(JsonEncoders.BIG_DECIMAL, JsonDecoders.BIG_DECIMAL)),
        Map.entry(JsonNode.class, JsonNodeCodec.CODEC)
    );

    private RecordDerivation() {
    }

    /**
     * @throws JsonDerivationException if {@code type} is not a record or sealed type,
     *                                 or refers to a type that cannot be encoded
     */
    @SuppressWarnings("unchecked")
    public static <A> JsonCodec<A> codec(Class<A> type) {
        JsonCodec<?> cached = CACHE.get(type);
        if (cached != null) {
            LOGGER.trace("Cache hit for {}", type.getName());
            return (JsonCodec<A>) cached;
        }
        if (!type.isRecord() && !type.isSealed()) {
            throw new JsonDerivationException(type.getName() + " is neither a record nor a sealed type");
        }
        return (JsonCodec<A>) derive(type);
    }

    public static <A> JsonEncoder<A> encoder(Class<A> type) {
        return codec(type).encoder();
    }

    public static <A> JsonDecoder<A> decoder(Class<A> type) {
        return codec(type).decoder();
    }

    // One scan at a time, so that a failed scan can take back what it cached.
    private static synchronized JsonCodec<?> derive(Class<?> type) {
        Scan scan = new Scan();
        try {
            return scan.derived(type);
        } catch (RuntimeException e) {
            scan.added.forEach(CACHE::remove);
            throw e;
        }
    }

    private static final class Scan {
        private final Set<Class<?>> inProgress = new HashSet<>();
        private final MutableList<Class<?>> added = Lists.mutable.empty();

        JsonCodec<?> derived(Class<?> type) {
            JsonCodec<?> cached = CACHE.get(type);
            if (cached != null) {
                return cached;
            }
            if (inProgress.contains(type)) {
                LOGGER.debug("Deferring recursive reference to {}", type.getName());
                return deferred(type);
            }
            inProgress.add(type);
            JsonCodec<?> codec = type.isRecord() ? record(type) : sealed(type);
            inProgress.remove(type);
            CACHE.put(type, codec);
            added.add(type);
            LOGGER.debug("Derived codec for {}", type.getName());
            return codec;
        }

        private JsonCodec<?> resolve(Type type, String where) {
            if (type instanceof Class<?> cls) {
                JsonCodec<?> scalar = SCALARS.get(cls);
                if (scalar != null) {
                    return scalar;
                } else if (cls.isEnum()) {
                    return enumCodec(cls);
                } else if (cls.isRecord() || cls.isSealed()) {
                    return derived(cls);
                }
            } else if (type instanceof ParameterizedType parameterized) {
                Type raw = parameterized.getRawType();
                Type[] args = parameterized.getActualTypeArguments();
                if (raw == Optional.class) {
                    return optional(resolve(args[0], where));
                } else if (raw == List.class || raw == Collection.class) {
                    return list(resolve(args[0], where));
                } else if (raw == Set.class) {
                    return set(resolve(args[0], where));
                } else if (raw == Map.class && args[0] == String.class) {
                    return map(resolve(args[1], where));
                }
            }
            throw new JsonDerivationException("Unsupported type " + type.getTypeName() + " for " + where);
        }

        @SuppressWarnings("unchecked")
        private JsonCodec<?> record(Class<?> type) {
            RecordComponent[] components = type.getRecordComponents();
            Constructor<?> constructor = canonicalConstructor(type, components);
            ProductShape.Builder<Object> builder = ProductShape.builder(type.getSimpleName(), values -> construct(constructor, values));
            for (RecordComponent component : components) {
                Method accessor = component.getAccessor();
                accessor.setAccessible(true);
                JsonCodec<Object> codec = (JsonCodec<Object>) resolve(component.getGenericType(), type.getSimpleName() + "." + component.getName());
                Class<?> raw = component.getType();
                if (raw == JsonNode.class) {
                    // the tree codec already reads null as JsonNode.NULL
                    codec = new JsonCodec<>(JsonEncoders.nullable(codec.encoder()), codec.decoder());
                } else if (!raw.isPrimitive() && raw != Optional.class) {
                    codec = nullable(codec);
                }
                FieldInfo<Object> field = FieldInfo.of(component.getName(), value -> access(accessor, value), codec);
                JsonField rename = component.getAnnotation(JsonField.class);
                builder.field(rename == null ? field : field.renamed(rename.value()));
            }
            if (type.isAnnotationPresent(JsonNoExtraFields.class)) {
                builder.noExtraFields();
            }
            return Derivation.codec(builder.build());
        }

        @SuppressWarnings("unchecked")
        private JsonCodec<?> sealed(Class<?> type) {
            SumShape.Builder<Object> builder = SumShape.builder(type.getSimpleName());
            JsonDiscriminator discriminator = type.getAnnotation(JsonDiscriminator.class);
            for (Class<?> subclass : type.getPermittedSubclasses()) {
                if (!subclass.isRecord() && !subclass.isSealed()) {
                    throw new JsonDerivationException("Variant " + subclass.getName() + " of " + type.getName() + " is neither a record nor a sealed type");
                }
                if (discriminator != null && subclass.isAnnotationPresent(JsonNoExtraFields.class)) {
                    throw new JsonDerivationException("Variant " + subclass.getName() + " of " + type.getName()
                        + " cannot reject extra fields because it is written with discriminator '" + discriminator.value() + "'");
                }
                if (discriminator != null && subclass.isSealed()) {
                    // the nested sum must write its tag as a sibling field under a different name
                    JsonDiscriminator nested = subclass.getAnnotation(JsonDiscriminator.class);
                    if (nested == null || nested.value().equals(discriminator.value())) {
                        throw new JsonDerivationException("Variant " + subclass.getName() + " of " + type.getName()
                            + " is written with discriminator '" + discriminator.value()
                            + "' and so needs a discriminator of its own with a different name");
                    }
                }
                JsonCodec<Object> codec = (JsonCodec<Object>) derived(subclass);
                VariantInfo<Object> variant = new VariantInfo<>(subclass, Optional.empty(), codec.encoder(), codec.decoder());
                JsonHint hint = subclass.getAnnotation(JsonHint.class);
                builder.variant(hint == null ? variant : variant.hinted(hint.value()));
            }
            if (discriminator != null) {
                builder.discriminator(discriminator.value());
            }
            return Derivation.codec(builder.build());
        }
    }

    /**
     * Stands in for a codec that is still being derived. Lookups happen on first use,
     * by which time the scan has finished and cached the real codec.
     */
    private static <A> JsonCodec<A> deferred(Class<A> type) {
        JsonEncoder<A> encoder = (value, indent, out) -> lookup(type).encoder().unsafeEncode(value, indent, out);
        JsonDecoder<A> decoder = new JsonDecoder<>() {
            @Override
            public A unsafeDecode(DecodeTrace trace, TokenReader in) {
                return lookup(type).decoder().unsafeDecode(trace, in);
            }

            @Override
            public A unsafeDecodeMissing(DecodeTrace trace) {
                return lookup(type).decoder().unsafeDecodeMissing(trace);
            }
        };
        return new JsonCodec<>(encoder, decoder);
    }

    @SuppressWarnings("unchecked")
    private static <A> JsonCodec<A> lookup(Class<A> type) {
        JsonCodec<?> codec = CACHE.get(type);
        if (codec == null) {
            throw new IllegalStateException("Codec for " + type.getName() + " was never completed");
        }
        return (JsonCodec<A>) codec;
    }

    private static <T> JsonCodec<Optional<T>> optional(JsonCodec<T> codec) {
        return new JsonCodec<>(JsonEncoders.optional(codec.encoder()), JsonDecoders.optional(codec.decoder()));
    }

    private static <T> JsonCodec<T> nullable(JsonCodec<T> codec) {
        return new JsonCodec<>(JsonEncoders.nullable(codec.encoder()), JsonDecoders.nullable(codec.decoder()));
    }

    private static <T> JsonCodec<List<T>> list(JsonCodec<T> codec) {
        return new JsonCodec<>(JsonEncoders.list(codec.encoder()), JsonDecoders.list(codec.decoder()));
    }

    private static <T> JsonCodec<Set<T>> set(JsonCodec<T> codec) {
        return new JsonCodec<>(JsonEncoders.set(codec.encoder()), JsonDecoders.set(codec.decoder()));
    }

    private static <T> JsonCodec<Map<String, T>> map(JsonCodec<T> codec) {
        return new JsonCodec<>(JsonEncoders.map(codec.encoder()), JsonDecoders.map(codec.decoder()));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static JsonCodec<?> enumCodec(Class<?> type) {
        return enumCodecOf((Class) type);
    }

    private static <E extends Enum<E>> JsonCodec<E> enumCodecOf(Class<E> type) {
        return new JsonCodec<>(JsonEncoders.enumByName(), JsonDecoders.enumByName(type));
    }

    private static Constructor<?> canonicalConstructor(Class<?> type, RecordComponent[] components) {
        Class<?>[] parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
        }
        try {
            Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor;
        } catch (NoSuchMethodException e) {
            throw new JsonDerivationException("Unexpected error accessing record constructor for " + type, e);
        }
    }

    private static Object construct(Constructor<?> constructor, Object[] values) {
        try {
            return constructor.newInstance(values);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException(e.getCause());
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Unable to construct " + constructor.getDeclaringClass().getName(), e);
        }
    }

    private static Object access(Method accessor, Object value) {
        try {
            return accessor.invoke(value);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException(e.getCause());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Unable to read " + accessor.getName(), e);
        }
    }
}
