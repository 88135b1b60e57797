package com.jzon.decoder;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

/**
 * Reads tokens with Jackson's streaming parser.
 */
public class JacksonTokenReader implements TokenReader {
    private static final JsonFactory FACTORY = new JsonFactory();

    private final JsonParser parser;
    private boolean retracted;

    public JacksonTokenReader(JsonParser parser) {
        this.parser = parser;
    }

    public static JacksonTokenReader of(String json) throws IOException {
        return new JacksonTokenReader(FACTORY.createParser(json));
    }

    public static JacksonTokenReader of(Reader reader) throws IOException {
        return new JacksonTokenReader(FACTORY.createParser(reader));
    }

    public static JacksonTokenReader of(InputStream input) throws IOException {
        return new JacksonTokenReader(FACTORY.createParser(input));
    }

    @Override
    public JsonToken next() throws IOException {
        if (retracted) {
            retracted = false;
            return parser.currentToken();
        }
        return parser.nextToken();
    }

    @Override
    public JsonToken current() {
        return parser.currentToken();
    }

    @Override
    public String text() throws IOException {
        return parser.getText();
    }

    @Override
    public void retract() {
        retracted = true;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
