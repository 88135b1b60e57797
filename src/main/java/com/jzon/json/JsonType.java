package com.jzon.json;

/**
 * The runtime variant of a {@link JsonNode}, used by cursor filters.
 */
public enum JsonType {
    NULL("nulls"),
    BOOLEAN("booleans"),
    NUMBER("numbers"),
    STRING("strings"),
    ARRAY("arrays"),
    OBJECT("objects");

    private final String filterName;

    JsonType(String filterName) {
        this.filterName = filterName;
    }

    /**
     * The jq builtin that selects values of this type, as written in cursor expressions.
     */
    public String filterName() {
        return filterName;
    }

    public boolean matches(JsonNode node) {
        return of(node) == this;
    }

    public static JsonType of(JsonNode node) {
        if (node instanceof JsonNode.JsonObject) {
            return OBJECT;
        } else if (node instanceof JsonNode.JsonArray) {
            return ARRAY;
        } else if (node instanceof JsonNode.JsonString) {
            return STRING;
        } else if (node instanceof JsonNode.JsonNumber) {
            return NUMBER;
        } else if (node instanceof JsonNode.JsonBoolean) {
            return BOOLEAN;
        } else {
            return NULL;
        }
    }

    public static JsonType fromFilterName(String name) {
        for (JsonType type : values()) {
            if (type.filterName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown type filter: " + name);
    }
}
