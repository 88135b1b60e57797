package com.jzon.cursor;

import com.jzon.json.JsonNode;
import com.jzon.json.JsonType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Resolves, deletes, folds and rewrites {@link JsonNode} trees along {@link JsonCursor}s.
 */
public final class JsonTraversal {
    private JsonTraversal() {
    }

    public static CursorResult<JsonNode> get(JsonNode root, JsonCursor cursor) {
        JsonNode current = root;
        for (JsonCursor step : cursor.steps()) {
            CursorResult<JsonNode> next = step(current, step);
            if (!next.isSuccess()) {
                return next;
            }
            current = next.value();
        }
        return CursorResult.success(current);
    }

    /**
     * Removes the node the cursor points at.
     * <p>
     * A {@link JsonCursor.Filter} anywhere along the way acts as a guard:
     * if it does not match, the original tree comes back unchanged.
     * Deleting the root, or a cursor made only of matching filters, yields {@link JsonNode#NULL}.
     */
    public static CursorResult<JsonNode> delete(JsonNode root, JsonCursor cursor) {
        ImmutableList<JsonCursor> steps = cursor.steps();
        JsonNode current = root;
        for (JsonCursor step : steps) {
            if (step instanceof JsonCursor.Filter filter) {
                if (!filter.type().matches(current)) {
                    return CursorResult.success(root);
                }
            } else {
                CursorResult<JsonNode> next = step(current, step);
                if (!next.isSuccess()) {
                    return next;
                }
                current = next.value();
            }
        }
        ImmutableList<JsonCursor> path = steps.reject(step -> step instanceof JsonCursor.Filter);
        if (path.isEmpty()) {
            return CursorResult.success(JsonNode.NULL);
        }
        return CursorResult.success(remove(root, path, 0));
    }

    public static <A> A foldUp(JsonNode node, A seed, BiFunction<A, JsonNode, A> f) {
        A acc = seed;
        for (JsonNode child : children(node)) {
            acc = foldUp(child, acc, f);
        }
        return f.apply(acc, node);
    }

    public static <A> A foldDown(JsonNode node, A seed, BiFunction<A, JsonNode, A> f) {
        A acc = f.apply(seed, node);
        for (JsonNode child : children(node)) {
            acc = foldDown(child, acc, f);
        }
        return acc;
    }

    /**
     * Top-down rewrite. When {@code rule} matches a node, traversal continues into the
     * children of the replacement, not those of the original.
     */
    public static JsonNode transformDownWithCursor(JsonNode root, BiFunction<JsonNode, JsonCursor, Optional<JsonNode>> rule) {
        return transform(root, JsonCursor.identity(), rule);
    }

    private static JsonNode transform(JsonNode node, JsonCursor cursor, BiFunction<JsonNode, JsonCursor, Optional<JsonNode>> rule) {
        JsonNode current = rule.apply(node, cursor).orElse(node);
        if (current instanceof JsonNode.JsonObject obj) {
            return new JsonNode.JsonObject(obj.fields().collect(pair -> Tuples.pair(
                pair.getOne(),
                transform(pair.getTwo(), child(cursor, JsonType.OBJECT, JsonCursor.field(pair.getOne())), rule))));
        } else if (current instanceof JsonNode.JsonArray arr) {
            MutableList<JsonNode> elements = Lists.mutable.empty();
            for (int i = 0; i < arr.size(); i++) {
                elements.add(transform(arr.elements().get(i), child(cursor, JsonType.ARRAY, JsonCursor.element(i)), rule));
            }
            return new JsonNode.JsonArray(elements.toImmutable());
        } else {
            return current;
        }
    }

    /**
     * Children of the root are addressed without a type filter, matching how
     * cursors are written by hand: {@code field("a").isObject().downField("b")}.
     */
    private static JsonCursor child(JsonCursor parent, JsonType parentType, JsonCursor step) {
        if (parent instanceof JsonCursor.Identity) {
            return step;
        }
        return parent.ofType(parentType).andThen(step);
    }

    private static CursorResult<JsonNode> step(JsonNode node, JsonCursor step) {
        if (step instanceof JsonCursor.Field field) {
            if (!(node instanceof JsonNode.JsonObject obj)) {
                return mismatch(JsonType.OBJECT, node);
            }
            Optional<JsonNode> value = obj.get(field.name());
            if (value.isEmpty()) {
                return CursorResult.failure(new CursorError.NoSuchField(field.name()));
            }
            return CursorResult.success(value.get());
        } else if (step instanceof JsonCursor.Element element) {
            if (!(node instanceof JsonNode.JsonArray arr)) {
                return mismatch(JsonType.ARRAY, node);
            }
            int index = element.index();
            if (index < 0 || index >= arr.size()) {
                return CursorResult.failure(new CursorError.IndexOutOfBounds(index, arr.size()));
            }
            return CursorResult.success(arr.elements().get(index));
        } else if (step instanceof JsonCursor.Filter filter) {
            if (!filter.type().matches(node)) {
                return mismatch(filter.type(), node);
            }
            return CursorResult.success(node);
        } else if (step instanceof JsonCursor.Compose compose) {
            return get(node, compose);
        } else {
            return CursorResult.success(node);
        }
    }

    private static CursorResult<JsonNode> mismatch(JsonType expected, JsonNode actual) {
        return CursorResult.failure(new CursorError.TypeMismatch(expected, actual.type()));
    }

    // Callers have already walked the path, so every step is known to resolve.
    private static JsonNode remove(JsonNode node, ImmutableList<JsonCursor> path, int depth) {
        JsonCursor step = path.get(depth);
        boolean last = depth == path.size() - 1;
        if (step instanceof JsonCursor.Field field) {
            JsonNode.JsonObject obj = (JsonNode.JsonObject) node;
            if (last) {
                return obj.without(field.name());
            }
            int index = obj.fields().detectIndex(pair -> pair.getOne().equals(field.name()));
            MutableList<Pair<String, JsonNode>> fields = obj.fields().toList();
            Pair<String, JsonNode> target = fields.get(index);
            fields.set(index, Tuples.pair(target.getOne(), remove(target.getTwo(), path, depth + 1)));
            return new JsonNode.JsonObject(fields.toImmutable());
        } else {
            JsonNode.JsonArray arr = (JsonNode.JsonArray) node;
            int index = ((JsonCursor.Element) step).index();
            if (last) {
                return arr.without(index);
            }
            MutableList<JsonNode> elements = arr.elements().toList();
            elements.set(index, remove(elements.get(index), path, depth + 1));
            return new JsonNode.JsonArray(elements.toImmutable());
        }
    }

    private static ImmutableList<JsonNode> children(JsonNode node) {
        if (node instanceof JsonNode.JsonObject obj) {
            return obj.values();
        } else if (node instanceof JsonNode.JsonArray arr) {
            return arr.elements();
        } else {
            return Lists.immutable.empty();
        }
    }
}
