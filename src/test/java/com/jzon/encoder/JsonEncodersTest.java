package com.jzon.encoder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class JsonEncodersTest {

    @Test
    public void testStringEscaping() {
        assertEquals("\"plain\"", JsonEncoders.STRING.toJson("plain"));
        assertEquals("\"a\\\"b\\\\c\"", JsonEncoders.STRING.toJson("a\"b\\c"));
        assertEquals("\"\\b\\f\\n\\r\\t\"", JsonEncoders.STRING.toJson("\b\f\n\r\t"));
        assertEquals("\"\\u0000\\u001f\"", JsonEncoders.STRING.toJson("\u0000\u001f"));
    }

    @Test
    public void testNonAsciiIsNotEscaped() {
        assertEquals("\"café ☃ /\"", JsonEncoders.STRING.toJson("café ☃ /"));
    }

    @Test
    public void testScalars() {
        assertEquals("true", JsonEncoders.BOOLEAN.toJson(true));
        assertEquals("-7", JsonEncoders.BYTE.toJson((byte) -7));
        assertEquals("300", JsonEncoders.SHORT.toJson((short) 300));
        assertEquals("42", JsonEncoders.INTEGER.toJson(42));
        assertEquals("9223372036854775807", JsonEncoders.LONG.toJson(Long.MAX_VALUE));
        assertEquals("123456789012345678901234567890", JsonEncoders.BIG_INTEGER.toJson(new BigInteger("123456789012345678901234567890")));
        assertEquals("1.50", JsonEncoders.BIG_DECIMAL.toJson(new BigDecimal("1.50")));
        assertEquals("\"x\"", JsonEncoders.CHARACTER.toJson('x'));
    }

    @ParameterizedTest
    @CsvSource({
        "1.5, 1.5",
        "-0.25, -0.25",
        "NaN, \"NaN\"",
        "Infinity, \"Infinity\"",
        "-Infinity, \"-Infinity\"",
    })
    public void testDouble(double value, String expected) {
        assertEquals(expected, JsonEncoders.DOUBLE.toJson(value));
    }

    @Test
    public void testFloatGoesThroughDouble() {
        assertEquals("0.5", JsonEncoders.FLOAT.toJson(0.5f));
        assertEquals("\"NaN\"", JsonEncoders.FLOAT.toJson(Float.NaN));
    }

    @Test
    public void testOptional() {
        JsonEncoder<Optional<Integer>> encoder = JsonEncoders.optional(JsonEncoders.INTEGER);

        assertEquals("1", encoder.toJson(Optional.of(1)));
        assertEquals("null", encoder.toJson(Optional.empty()));
        assertTrue(encoder.isNothing(Optional.empty()));
        assertFalse(encoder.isNothing(Optional.of(1)));
    }

    @Test
    public void testNullable() {
        JsonEncoder<String> encoder = JsonEncoders.nullable(JsonEncoders.STRING);

        assertEquals("null", encoder.toJson(null));
        assertEquals("\"x\"", encoder.toJson("x"));
        assertFalse(encoder.isNothing(null));

        JsonEncoder<Optional<Integer>> optional = JsonEncoders.nullable(JsonEncoders.optional(JsonEncoders.INTEGER));
        assertTrue(optional.isNothing(Optional.empty()));
    }

    @Test
    public void testArrays() {
        JsonEncoder<List<Integer>> encoder = JsonEncoders.list(JsonEncoders.INTEGER);

        assertEquals("[]", encoder.toJson(List.of()));
        assertEquals("[1,2,3]", encoder.toJson(List.of(1, 2, 3)));
        assertEquals("[1, 2, 3]", encoder.toJsonPretty(List.of(1, 2, 3)));
        assertEquals("[\"a\",\"b\"]", JsonEncoders.set(JsonEncoders.STRING).toJson(new LinkedHashSet<>(List.of("a", "b"))));
    }

    @Test
    public void testMapCompact() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("a", 1);
        map.put("b", 2);

        assertEquals("{\"a\":1,\"b\":2}", JsonEncoders.map(JsonEncoders.INTEGER).toJson(map));
        assertEquals("{}", JsonEncoders.map(JsonEncoders.INTEGER).toJson(Map.of()));
    }

    @Test
    public void testMapPretty() {
        Map<String, List<Integer>> map = new LinkedHashMap<>();
        map.put("a", List.of(1, 2));
        map.put("b", List.of());

        assertEquals("{\n  \"a\" : [1, 2],\n  \"b\" : []\n}",
            JsonEncoders.map(JsonEncoders.list(JsonEncoders.INTEGER)).toJsonPretty(map));
    }

    @Test
    public void testNestedMapPretty() {
        Map<String, Map<String, Integer>> map = Map.of("outer", Map.of("inner", 1));

        assertEquals("{\n  \"outer\" : {\n    \"inner\" : 1\n  }\n}",
            JsonEncoders.map(JsonEncoders.map(JsonEncoders.INTEGER)).toJsonPretty(map));
    }

    @Test
    public void testMapSkipsNothingValues() {
        Map<String, Optional<String>> map = new LinkedHashMap<>();
        map.put("a", Optional.empty());
        map.put("b", Optional.of("x"));
        map.put("c", Optional.empty());

        JsonEncoder<Map<String, Optional<String>>> encoder = JsonEncoders.map(JsonEncoders.optional(JsonEncoders.STRING));
        assertEquals("{\"b\":\"x\"}", encoder.toJson(map));
        assertEquals("{\n  \"b\" : \"x\"\n}", encoder.toJsonPretty(map));

        map.remove("b");
        assertEquals("{}", encoder.toJson(map));
        assertEquals("{}", encoder.toJsonPretty(map));
    }

    @Test
    public void testMapWithFieldEncoder() {
        Map<Integer, String> map = new LinkedHashMap<>();
        map.put(1, "one");
        map.put(2, "two");

        FieldEncoder<Integer> keys = FieldEncoder.STRING.contramap(String::valueOf);
        assertEquals("{\"1\":\"one\",\"2\":\"two\"}", JsonEncoders.map(keys, JsonEncoders.STRING).toJson(map));
    }

    @Test
    public void testEnumByName() {
        assertEquals("\"SECONDS\"", JsonEncoders.<TimeUnit>enumByName().toJson(TimeUnit.SECONDS));
    }

    @Test
    public void testContramapAndXmap() {
        JsonEncoder<StringBuilder> viaContramap = JsonEncoders.STRING.contramap(StringBuilder::toString);
        assertEquals("\"abc\"", viaContramap.toJson(new StringBuilder("abc")));

        // Only the second function is used when encoding
        JsonEncoder<Integer> viaXmap = JsonEncoders.STRING.xmap(s -> {
            throw new AssertionError("decoding direction used while encoding");
        }, String::valueOf);
        assertEquals("\"7\"", viaXmap.toJson(7));
    }

    @Test
    public void testContramapKeepsIsNothing() {
        JsonEncoder<String> encoder = JsonEncoders.optional(JsonEncoders.STRING).contramap(Optional::ofNullable);
        assertTrue(encoder.isNothing(null));
        assertFalse(encoder.isNothing("x"));
    }

    @Test
    public void testIndent() throws IOException {
        Writer out = new StringWriter();
        Indent.pretty(2).pad(out);
        Indent.COMPACT.pad(out);
        Indent.pretty(0).colon(out);
        Indent.COMPACT.colon(out);

        assertEquals("\n     : :", out.toString());
        assertSame(Indent.COMPACT, Indent.COMPACT.bump());
        assertEquals(Indent.pretty(3), Indent.pretty(2).bump());
        assertThrows(IllegalArgumentException.class, () -> new Indent(true, -1));
    }
}
