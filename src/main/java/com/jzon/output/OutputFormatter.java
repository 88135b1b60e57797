package com.jzon.output;

import com.jzon.json.JsonNode;
import org.eclipse.collections.api.tuple.Pair;

import java.util.Optional;

public class OutputFormatter {
    private final boolean prettyPrint;
    private final boolean sortKeys;

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public OutputFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String format(JsonNode node) {
        JsonNode output = sortKeys ? sorted(node) : node;
        return prettyPrint ? output.toJsonPretty() : output.toJson();
    }

    /**
     * Raw mode: strings are printed without quotes or escaping, everything else as JSON.
     */
    public String formatRaw(JsonNode node) {
        if (node instanceof JsonNode.JsonString s) {
            return s.value();
        }
        return format(node);
    }

    private static JsonNode sorted(JsonNode node) {
        return node.transformDown(n -> {
            if (n instanceof JsonNode.JsonObject obj) {
                // Stable, so duplicate keys keep their relative order
                return Optional.of(new JsonNode.JsonObject(obj.fields().toSortedListBy(Pair::getOne).toImmutable()));
            }
            return Optional.empty();
        });
    }
}
