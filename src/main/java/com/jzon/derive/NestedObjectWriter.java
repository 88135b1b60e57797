package com.jzon.derive;

import com.jzon.encoder.Indent;

import java.io.IOException;
import java.io.Writer;

/**
 * Splices the body of a nested object into an object that is already open on {@code out}.
 * <p>
 * The nested encoder's opening {@code {} is swallowed. At the next significant character a
 * {@code ,} is injected, unless that character is the {@code }} of an empty object.
 * Everything after that is forwarded untouched. One instance serves one nested encode call.
 */
final class NestedObjectWriter extends Writer {
    private final Writer out;
    private final Indent indent;
    private boolean seenOpeningBrace;
    private boolean decided;

    /**
     * @param indent the indent of the enclosing object
     */
    NestedObjectWriter(Writer out, Indent indent) {
        this.out = out;
        this.indent = indent;
    }

    @Override
    public void write(char[] cbuf, int off, int len) throws IOException {
        if (decided) {
            out.write(cbuf, off, len);
            return;
        }
        for (int i = 0; i < len; i++) {
            char c = cbuf[off + i];
            if (c == ' ' || c == '\n') {
                continue;
            }
            if (!seenOpeningBrace) {
                if (c != '{') {
                    throw new IllegalStateException("Discriminated variant did not encode as a JSON object; it began with '" + c + "'");
                }
                seenOpeningBrace = true;
                continue;
            }
            decided = true;
            if (c == '}') {
                indent.pad(out);
            } else {
                out.write(',');
                indent.bump().pad(out);
            }
            out.write(cbuf, off + i, len - i);
            return;
        }
    }

    @Override
    public void flush() throws IOException {
        out.flush();
    }

    /**
     * Flushes but leaves {@code out} open; it belongs to the enclosing encoder.
     */
    @Override
    public void close() throws IOException {
        flush();
    }
}
