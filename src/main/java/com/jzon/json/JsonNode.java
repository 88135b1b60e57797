package com.jzon.json;

import com.jzon.codec.JsonNodeCodec;
import com.jzon.cursor.CursorResult;
import com.jzon.cursor.JsonCursor;
import com.jzon.cursor.JsonTraversal;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.tuple.Tuples;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * An immutable JSON value.
 * <p>
 * Object equality ignores the order of fields; everything else compares structurally.
 * Every operation that "changes" a tree returns a new one.
 */
public sealed interface JsonNode {
    JsonNull NULL = new JsonNull();
    JsonBoolean TRUE = new JsonBoolean(true);
    JsonBoolean FALSE = new JsonBoolean(false);

    record JsonObject(ImmutableList<Pair<String, JsonNode>> fields) implements JsonNode {
        public JsonObject {
            Objects.requireNonNull(fields, "fields");
        }

        public static JsonObject empty() {
            return new JsonObject(Lists.immutable.empty());
        }

        @SafeVarargs
        public static JsonObject of(Pair<String, JsonNode>... fields) {
            return new JsonObject(Lists.immutable.with(fields));
        }

        /**
         * @return the value of the first field named {@code key}
         */
        public Optional<JsonNode> get(String key) {
            return Optional.ofNullable(fields.detect(pair -> pair.getOne().equals(key)))
                .map(Pair::getTwo);
        }

        public boolean containsKey(String key) {
            return fields.anySatisfy(pair -> pair.getOne().equals(key));
        }

        public ImmutableList<String> keys() {
            return fields.collect(Pair::getOne);
        }

        public ImmutableList<JsonNode> values() {
            return fields.collect(Pair::getTwo);
        }

        /**
         * Replaces the fields named {@code key} in place, or appends one if there are none.
         */
        public JsonObject with(String key, JsonNode value) {
            if (!containsKey(key)) {
                return new JsonObject(fields.newWith(Tuples.pair(key, value)));
            }
            return new JsonObject(fields.collect(pair -> pair.getOne().equals(key) ? Tuples.pair(key, value) : pair));
        }

        public JsonObject without(String key) {
            return new JsonObject(fields.reject(pair -> pair.getOne().equals(key)));
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            return o instanceof JsonObject that
                && fields.size() == that.fields.size()
                && fields.toBag().equals(that.fields.toBag());
        }

        @Override
        public int hashCode() {
            // Summing keeps the hash independent of field order
            return (int) fields.sumOfInt(Pair::hashCode);
        }

        @Override
        public String toString() {
            return toJson();
        }
    }

    record JsonArray(ImmutableList<JsonNode> elements) implements JsonNode {
        public JsonArray {
            Objects.requireNonNull(elements, "elements");
        }

        public static JsonArray empty() {
            return new JsonArray(Lists.immutable.empty());
        }

        public static JsonArray of(JsonNode... elements) {
            return new JsonArray(Lists.immutable.with(elements));
        }

        public JsonArray with(JsonNode element) {
            return new JsonArray(elements.newWith(element));
        }

        public JsonArray without(int index) {
            MutableList<JsonNode> remaining = elements.toList();
            remaining.remove(index);
            return new JsonArray(remaining.toImmutable());
        }

        public int size() {
            return elements.size();
        }

        @Override
        public String toString() {
            return toJson();
        }
    }

    record JsonString(String value) implements JsonNode {
        public JsonString {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Numbers compare by numeric value, so {@code 1} and {@code 1.0} are equal.
     */
    record JsonNumber(BigDecimal value) implements JsonNode {
        public JsonNumber {
            Objects.requireNonNull(value, "value");
        }

        public static JsonNumber of(long value) {
            return new JsonNumber(BigDecimal.valueOf(value));
        }

        /**
         * @throws NumberFormatException if {@code value} is not finite
         */
        public static JsonNumber of(double value) {
            return new JsonNumber(BigDecimal.valueOf(value));
        }

        public static JsonNumber of(BigInteger value) {
            return new JsonNumber(new BigDecimal(value));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof JsonNumber that && value.compareTo(that.value) == 0;
        }

        @Override
        public int hashCode() {
            return value.stripTrailingZeros().hashCode();
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {
        public static JsonBoolean of(boolean value) {
            return value ? TRUE : FALSE;
        }
    }

    record JsonNull() implements JsonNode {}

    static Pair<String, JsonNode> field(String key, JsonNode value) {
        return Tuples.pair(key, value);
    }

    static JsonNode parse(String json) {
        return JsonNodeCodec.DECODER.decode(json);
    }

    default JsonType type() {
        return JsonType.of(this);
    }

    default CursorResult<JsonNode> get(JsonCursor cursor) {
        return JsonTraversal.get(this, cursor);
    }

    default CursorResult<JsonNode> delete(JsonCursor cursor) {
        return JsonTraversal.delete(this, cursor);
    }

    /**
     * Post-order fold: each container is visited after all of its children.
     */
    default <A> A foldUp(A seed, BiFunction<A, JsonNode, A> f) {
        return JsonTraversal.foldUp(this, seed, f);
    }

    /**
     * Pre-order fold: each container is visited before its children.
     */
    default <A> A foldDown(A seed, BiFunction<A, JsonNode, A> f) {
        return JsonTraversal.foldDown(this, seed, f);
    }

    default JsonNode transformDown(Function<JsonNode, Optional<JsonNode>> rule) {
        return JsonTraversal.transformDownWithCursor(this, (node, cursor) -> rule.apply(node));
    }

    default JsonNode transformDownWithCursor(BiFunction<JsonNode, JsonCursor, Optional<JsonNode>> rule) {
        return JsonTraversal.transformDownWithCursor(this, rule);
    }

    default String toJson() {
        return JsonNodeCodec.ENCODER.toJson(this);
    }

    default String toJsonPretty() {
        return JsonNodeCodec.ENCODER.toJsonPretty(this);
    }
}
