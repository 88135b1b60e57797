package com.jzon.codec;

import com.fasterxml.jackson.core.JsonToken;
import com.jzon.decoder.DecodeTrace;
import com.jzon.decoder.JacksonTokenReader;
import com.jzon.decoder.JsonDecoder;
import com.jzon.decoder.Lexer;
import com.jzon.decoder.TokenReader;
import com.jzon.encoder.Indent;
import com.jzon.encoder.JsonEncoder;
import com.jzon.encoder.JsonEncoders;
import com.jzon.json.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.tuple.Tuples;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.math.BigDecimal;

/**
 * Reads and writes the {@link JsonNode} AST itself.
 * Object fields are written in insertion order, so a given tree always produces the same text.
 */
public final class JsonNodeCodec {
    private JsonNodeCodec() {
    }

    public static final JsonEncoder<JsonNode> ENCODER = JsonNodeCodec::encode;

    public static final JsonDecoder<JsonNode> DECODER = JsonNodeCodec::decode;

    public static final JsonCodec<JsonNode> CODEC = new JsonCodec<>(ENCODER, DECODER);

    public static JsonNode parse(InputStream input) throws IOException {
        try (TokenReader in = JacksonTokenReader.of(input)) {
            return DECODER.decode(in);
        }
    }

    private static void encode(JsonNode node, Indent indent, Writer out) throws IOException {
        if (node instanceof JsonNode.JsonObject obj) {
            if (obj.isEmpty()) {
                out.write("{}");
                return;
            }
            out.write('{');
            Indent nested = indent.bump();
            nested.pad(out);
            boolean first = true;
            for (Pair<String, JsonNode> field : obj.fields()) {
                if (first) {
                    first = false;
                } else {
                    out.write(',');
                    nested.pad(out);
                }
                JsonEncoders.STRING.unsafeEncode(field.getOne(), nested, out);
                indent.colon(out);
                encode(field.getTwo(), nested, out);
            }
            indent.pad(out);
            out.write('}');
        } else if (node instanceof JsonNode.JsonArray arr) {
            out.write('[');
            boolean first = true;
            for (JsonNode element : arr.elements()) {
                if (first) {
                    first = false;
                } else if (indent.isCompact()) {
                    out.write(',');
                } else {
                    out.write(", ");
                }
                encode(element, indent, out);
            }
            out.write(']');
        } else if (node instanceof JsonNode.JsonString s) {
            JsonEncoders.STRING.unsafeEncode(s.value(), indent, out);
        } else if (node instanceof JsonNode.JsonNumber n) {
            JsonEncoders.BIG_DECIMAL.unsafeEncode(n.value(), indent, out);
        } else if (node instanceof JsonNode.JsonBoolean b) {
            JsonEncoders.BOOLEAN.unsafeEncode(b.value(), indent, out);
        } else {
            out.write("null");
        }
    }

    private static JsonNode decode(DecodeTrace trace, TokenReader in) {
        JsonToken token = Lexer.next(trace, in);
        return switch (token) {
            case START_OBJECT -> decodeObject(trace, in);
            case START_ARRAY -> decodeArray(trace, in);
            case VALUE_STRING -> new JsonNode.JsonString(Lexer.text(trace, in));
            case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> new JsonNode.JsonNumber(new BigDecimal(Lexer.text(trace, in)));
            case VALUE_TRUE -> JsonNode.TRUE;
            case VALUE_FALSE -> JsonNode.FALSE;
            case VALUE_NULL -> JsonNode.NULL;
            default -> throw trace.fail("unexpected token " + token);
        };
    }

    private static JsonNode.JsonObject decodeObject(DecodeTrace trace, TokenReader in) {
        MutableList<Pair<String, JsonNode>> fields = Lists.mutable.empty();
        if (Lexer.firstField(trace, in)) {
            do {
                String key = Lexer.fieldName(trace, in);
                fields.add(Tuples.pair(key, decode(trace.field(key), in)));
            } while (Lexer.nextField(trace, in));
        }
        return new JsonNode.JsonObject(fields.toImmutable());
    }

    private static JsonNode.JsonArray decodeArray(DecodeTrace trace, TokenReader in) {
        MutableList<JsonNode> elements = Lists.mutable.empty();
        int i = 0;
        while (Lexer.nextElement(trace, in)) {
            elements.add(decode(trace.element(i), in));
            i++;
        }
        return new JsonNode.JsonArray(elements.toImmutable());
    }
}
