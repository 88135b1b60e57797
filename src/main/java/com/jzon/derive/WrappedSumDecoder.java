package com.jzon.derive;

import com.fasterxml.jackson.core.JsonToken;
import com.jzon.decoder.DecodeTrace;
import com.jzon.decoder.FieldMatcher;
import com.jzon.decoder.JsonDecoder;
import com.jzon.decoder.Lexer;
import com.jzon.decoder.TokenReader;

/**
 * Reads the single-entry object written by {@link WrappedSumEncoder}.
 */
final class WrappedSumDecoder<A> implements JsonDecoder<A> {
    private final SumShape<A> shape;
    private final FieldMatcher tags;

    WrappedSumDecoder(SumShape<A> shape) {
        this.shape = shape;
        this.tags = Derivation.tagMatcher(shape);
    }

    @Override
    public A unsafeDecode(DecodeTrace trace, TokenReader in) {
        Lexer.expect(trace, in, JsonToken.START_OBJECT);
        if (!Lexer.firstField(trace, in)) {
            throw trace.fail("expected non-empty object");
        }
        String tag = Lexer.fieldName(trace, in);
        int index = tags.indexOf(tag);
        if (index == -1) {
            throw trace.fail("invalid disambiguator");
        }
        VariantInfo<A> variant = shape.variants().get(index);
        @SuppressWarnings("unchecked")
        A value = (A) variant.decoder().unsafeDecode(trace.field(tag), in);
        Lexer.expect(trace, in, JsonToken.END_OBJECT);
        return value;
    }
}
