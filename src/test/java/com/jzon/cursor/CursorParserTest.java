package com.jzon.cursor;

import com.jzon.json.JsonType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class CursorParserTest {
    private final CursorParser parser = new CursorParser();

    @Test
    public void testIdentity() {
        assertEquals(JsonCursor.identity(), parser.parse("."));
        assertEquals(JsonCursor.identity(), parser.parse(""));
        assertEquals(JsonCursor.identity(), parser.parse("  "));
    }

    @Test
    public void testFieldChain() {
        assertEquals(JsonCursor.field("a").downField("b").downElement(1), parser.parse(".a.b[1]"));
        assertEquals(JsonCursor.field("a").downField("b").downElement(1), parser.parse(".a.b.[1]"));
    }

    @Test
    public void testElement() {
        assertEquals(JsonCursor.element(0), parser.parse("[0]"));
        assertEquals(JsonCursor.element(3), parser.parse(".[3]"));
    }

    @Test
    public void testQuotedField() {
        assertEquals(JsonCursor.field("two words"), parser.parse(".\"two words\""));
        assertEquals(JsonCursor.field("a|b"), parser.parse(".\"a|b\""));
        assertEquals(JsonCursor.field("say \"hi\""), parser.parse(".\"say \\\"hi\\\"\""));
    }

    @Test
    public void testPipesAndFilters() {
        JsonCursor expected = JsonCursor.field("items").isArray().downElement(2).ofType(JsonType.STRING);
        assertEquals(expected, parser.parse(".items | arrays | .[2] | strings"));
        assertEquals(JsonCursor.filter(JsonType.OBJECT), parser.parse(". | objects"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        ".entities | objects | .hashtags | arrays | .[1]",
        ".\"two words\" | .[0]",
        ".\"say \\\"hi\\\"\"",
        "nulls",
        ".a-b | booleans | .c",
    })
    public void testToStringRoundTrip(String text) {
        JsonCursor cursor = parser.parse(text);
        assertEquals(text, cursor.toString());
        assertEquals(cursor, parser.parse(cursor.toString()));
    }

    @Test
    public void testUnsupportedCursor() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parser.parse("keys"));
        assertEquals("Unsupported cursor: keys", e.getMessage());
    }

    @Test
    public void testInvalidIndex() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parser.parse(".[x]"));
        assertEquals("Invalid array index: x", e.getMessage());
    }

    @Test
    public void testUnterminated() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(".\"abc"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse(".a[1"));
    }
}
