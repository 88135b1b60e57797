package com.jzon.cursor;

import com.jzon.json.JsonType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * An immutable path into a {@link com.jzon.json.JsonNode} tree.
 * <p>
 * Composition is normalized as it is built: {@link Identity} is dropped from both sides
 * and chains are always nested to the left, so two cursors that describe the same steps
 * are {@code equals}, no matter how they were assembled.
 * <p>
 * {@link #toString()} renders the cursor in the syntax accepted by {@link CursorParser}.
 */
public sealed interface JsonCursor {
    record Identity() implements JsonCursor {
        @Override
        public String toString() {
            return ".";
        }
    }

    record Field(String name) implements JsonCursor {
        public Field {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return CursorParser.renderField(name);
        }
    }

    record Element(int index) implements JsonCursor {
        @Override
        public String toString() {
            return ".[" + index + "]";
        }
    }

    record Filter(JsonType type) implements JsonCursor {
        public Filter {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String toString() {
            return type.filterName();
        }
    }

    /**
     * Built directly, a right-nested chain is rotated to the left, so it is {@code equals}
     * to the same steps built with {@link #andThen}. {@link Identity} is not a step here;
     * {@link #andThen} is the way to drop it.
     */
    record Compose(JsonCursor prev, JsonCursor next) implements JsonCursor {
        public Compose {
            Objects.requireNonNull(prev, "prev");
            Objects.requireNonNull(next, "next");
            if (prev instanceof Identity || next instanceof Identity) {
                throw new IllegalArgumentException("Identity cannot be composed directly, use andThen: " + prev + " | " + next);
            }
            if (next instanceof Compose nested) {
                // nested.next() is never a Compose, having been through this constructor
                prev = new Compose(prev, nested.prev());
                next = nested.next();
            }
        }

        @Override
        public String toString() {
            return prev + " | " + next;
        }
    }

    JsonCursor IDENTITY = new Identity();

    static JsonCursor identity() {
        return IDENTITY;
    }

    static JsonCursor field(String name) {
        return new Field(name);
    }

    static JsonCursor element(int index) {
        return new Element(index);
    }

    static JsonCursor filter(JsonType type) {
        return new Filter(type);
    }

    /**
     * The {@code >>>} operator: this cursor, then {@code next} applied to its result.
     */
    default JsonCursor andThen(JsonCursor next) {
        if (next instanceof Identity) {
            return this;
        } else if (this instanceof Identity) {
            return next;
        } else {
            return new Compose(this, next);
        }
    }

    default JsonCursor downField(String name) {
        return andThen(field(name));
    }

    default JsonCursor downElement(int index) {
        return andThen(element(index));
    }

    default JsonCursor ofType(JsonType type) {
        return andThen(filter(type));
    }

    default JsonCursor isObject() {
        return ofType(JsonType.OBJECT);
    }

    default JsonCursor isArray() {
        return ofType(JsonType.ARRAY);
    }

    default JsonCursor isString() {
        return ofType(JsonType.STRING);
    }

    default JsonCursor isNumber() {
        return ofType(JsonType.NUMBER);
    }

    default JsonCursor isBoolean() {
        return ofType(JsonType.BOOLEAN);
    }

    default JsonCursor isNull() {
        return ofType(JsonType.NULL);
    }

    /**
     * @return the primitive steps of this cursor, root first; empty for {@link Identity}
     */
    default ImmutableList<JsonCursor> steps() {
        MutableList<JsonCursor> steps = Lists.mutable.empty();
        JsonCursor cursor = this;
        while (cursor instanceof Compose compose) {
            steps.add(compose.next());
            cursor = compose.prev();
        }
        if (!(cursor instanceof Identity)) {
            steps.add(cursor);
        }
        return steps.reverseThis().toImmutable();
    }
}
