package com.jzon.decoder;

/**
 * One location in a {@link DecodeTrace}.
 */
public sealed interface TraceStep {
    record ObjectAccess(String field) implements TraceStep {
        @Override
        public String toString() {
            return "." + field;
        }
    }

    record ArrayAccess(int index) implements TraceStep {
        @Override
        public String toString() {
            return "[" + index + "]";
        }
    }

    /**
     * Decoding entered the variant of a sum type with this tag.
     */
    record SumType(String tag) implements TraceStep {
        @Override
        public String toString() {
            return "{" + tag + "}";
        }
    }

    record Message(String text) implements TraceStep {
        @Override
        public String toString() {
            return "(" + text + ")";
        }
    }
}
