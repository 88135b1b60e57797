package com.jzon.encoder;

import java.io.IOException;
import java.io.Writer;

/**
 * How an encoder lays out its output: compact, or pretty-printed at a nesting level.
 * Each level of pretty-printing indents by two spaces.
 */
public record Indent(boolean pretty, int level) {
    public static final Indent COMPACT = new Indent(false, 0);

    public Indent {
        if (level < 0) {
            throw new IllegalArgumentException("Negative indent level: " + level);
        }
    }

    public static Indent pretty(int level) {
        return new Indent(true, level);
    }

    public boolean isCompact() {
        return !pretty;
    }

    /**
     * @return the indent for values nested one level deeper
     */
    public Indent bump() {
        return pretty ? new Indent(true, level + 1) : this;
    }

    /**
     * Starts a new line at this level; writes nothing when compact.
     */
    public void pad(Writer out) throws IOException {
        if (pretty) {
            out.write('\n');
            for (int i = 0; i < level; i++) {
                out.write("  ");
            }
        }
    }

    /**
     * The separator between an object key and its value.
     */
    public void colon(Writer out) throws IOException {
        out.write(pretty ? " : " : ":");
    }
}
