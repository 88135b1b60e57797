package com.jzon.cursor;

import com.jzon.json.JsonType;
import com.jzon.exceptions.JsonCursorException;
import com.jzon.json.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class JsonCursorTest {

    @Test
    public void testIdentityIsUnitOfComposition() {
        JsonCursor a = JsonCursor.field("a");

        assertEquals(a, JsonCursor.identity().andThen(a));
        assertEquals(a, a.andThen(JsonCursor.identity()));
        assertSame(JsonCursor.IDENTITY, JsonCursor.identity().andThen(JsonCursor.identity()));
    }

    @Test
    public void testCompositionIsNormalizedToTheLeft() {
        JsonCursor a = JsonCursor.field("a");
        JsonCursor b = JsonCursor.element(1);
        JsonCursor c = JsonCursor.filter(JsonType.STRING);

        JsonCursor left = a.andThen(b).andThen(c);
        JsonCursor right = a.andThen(b.andThen(c));

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
        assertEquals(new JsonCursor.Compose(new JsonCursor.Compose(a, b), c), right);
    }

    @Test
    public void testRightNestedComposeIsRotated() {
        JsonCursor a = JsonCursor.field("a");
        JsonCursor b = JsonCursor.element(1);
        JsonCursor c = JsonCursor.filter(JsonType.STRING);

        JsonCursor.Compose rightNested = new JsonCursor.Compose(a, new JsonCursor.Compose(b, c));

        assertEquals(a.andThen(b).andThen(c), rightNested);
        assertEquals(c, rightNested.next());
        assertEquals(List.of(a, b, c), rightNested.steps().toList());
    }

    @Test
    public void testComposeRejectsIdentity() {
        assertThrows(IllegalArgumentException.class,
            () -> new JsonCursor.Compose(JsonCursor.field("a"), JsonCursor.identity()));
        assertThrows(IllegalArgumentException.class,
            () -> new JsonCursor.Compose(JsonCursor.identity(), JsonCursor.field("a")));
    }

    @Test
    public void testBuildersMatchComposition() {
        JsonCursor built = JsonCursor.field("user").isObject().downField("tags").isArray().downElement(0);
        JsonCursor composed = JsonCursor.field("user")
            .andThen(JsonCursor.filter(JsonType.OBJECT))
            .andThen(JsonCursor.field("tags"))
            .andThen(JsonCursor.filter(JsonType.ARRAY))
            .andThen(JsonCursor.element(0));

        assertEquals(composed, built);
    }

    @Test
    public void testSteps() {
        JsonCursor cursor = JsonCursor.field("a").isObject().downElement(2);

        assertEquals(List.of(JsonCursor.field("a"), JsonCursor.filter(JsonType.OBJECT), JsonCursor.element(2)),
            cursor.steps().toList());
        assertTrue(JsonCursor.identity().steps().isEmpty());
    }

    @Test
    public void testToString() {
        assertEquals(".", JsonCursor.identity().toString());
        assertEquals(".entities | objects | .hashtags | arrays | .[1]",
            JsonCursor.field("entities").isObject().downField("hashtags").isArray().downElement(1).toString());
        assertEquals(".\"two words\"", JsonCursor.field("two words").toString());
    }

    @Test
    public void testResultCombinators() {
        CursorResult<JsonNode> found = JsonNode.parse("{\"a\":1}").get(JsonCursor.field("a"));
        CursorResult<JsonNode> missing = JsonNode.parse("{\"a\":1}").get(JsonCursor.field("b"));

        assertEquals(JsonType.NUMBER, found.map(JsonNode::type).value());
        assertEquals(JsonNode.NULL, missing.orElse(JsonNode.NULL));
        assertFalse(found.flatMap(node -> node.get(JsonCursor.field("x"))).isSuccess());
        assertThrows(NoSuchElementException.class, missing::value);
        assertThrows(NoSuchElementException.class, found::error);

        JsonCursorException e = assertThrows(JsonCursorException.class, missing::orElseThrow);
        assertEquals("No such field: 'b'", e.getMessage());
        assertEquals(new CursorError.NoSuchField("b"), e.error());
    }
}
