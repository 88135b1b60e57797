package com.jzon.derive;

import com.jzon.encoder.Indent;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;

import static org.junit.jupiter.api.Assertions.*;

public class NestedObjectWriterTest {

    @Test
    public void testNonEmptyBodyGetsOneComma() throws IOException {
        StringWriter out = new StringWriter();
        Writer nested = new NestedObjectWriter(out, Indent.COMPACT);
        nested.write("{\"a\":1,\"b\":\"x y\"}");

        assertEquals(",\"a\":1,\"b\":\"x y\"}", out.toString());
    }

    @Test
    public void testEmptyBodyGetsNoComma() throws IOException {
        StringWriter out = new StringWriter();
        Writer nested = new NestedObjectWriter(out, Indent.COMPACT);
        nested.write("{}");

        assertEquals("}", out.toString());
    }

    @Test
    public void testPrettyBodyIsReindented() throws IOException {
        StringWriter out = new StringWriter();
        Writer nested = new NestedObjectWriter(out, Indent.pretty(1));
        nested.write("{\n    \"a\" : 1\n  }");

        assertEquals(",\n    \"a\" : 1\n  }", out.toString());
    }

    @Test
    public void testPrettyEmptyBody() throws IOException {
        StringWriter out = new StringWriter();
        Writer nested = new NestedObjectWriter(out, Indent.pretty(1));
        nested.write("{}");

        assertEquals("\n  }", out.toString());
    }

    @Test
    public void testBodySplitAcrossWrites() throws IOException {
        StringWriter out = new StringWriter();
        Writer nested = new NestedObjectWriter(out, Indent.COMPACT);
        nested.write('{');
        nested.write("");
        nested.write('"');
        nested.write("k\":true");
        nested.write('}');

        assertEquals(",\"k\":true}", out.toString());
    }

    @Test
    public void testNonObjectBodyIsRejected() {
        Writer nested = new NestedObjectWriter(new StringWriter(), Indent.COMPACT);
        assertThrows(IllegalStateException.class, () -> nested.write("[1]"));
    }
}
