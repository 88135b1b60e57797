package com.jzon.cursor;

import com.jzon.json.JsonType;

/**
 * Why a cursor could not be followed.
 */
public sealed interface CursorError {
    String message();

    record NoSuchField(String name) implements CursorError {
        @Override
        public String message() {
            return "No such field: '" + name + "'";
        }
    }

    record IndexOutOfBounds(int index, int size) implements CursorError {
        @Override
        public String message() {
            return "Index out of bounds: " + index + " (size " + size + ")";
        }
    }

    record TypeMismatch(JsonType expected, JsonType actual) implements CursorError {
        @Override
        public String message() {
            return "Expected " + expected.name().toLowerCase() + " but found " + actual.name().toLowerCase();
        }
    }
}
