package com.jzon.derive;

import com.fasterxml.jackson.core.JsonToken;
import com.jzon.decoder.DecodeTrace;
import com.jzon.decoder.FieldMatcher;
import com.jzon.decoder.JsonDecoder;
import com.jzon.decoder.Lexer;
import com.jzon.decoder.RecordingTokenReader;
import com.jzon.decoder.TokenReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads an object whose variant is named by one of its own fields.
 * <p>
 * The discriminator may appear anywhere in the object. Everything read while looking for it
 * is recorded, then replayed to the variant's decoder so that it sees the whole object.
 */
final class DiscriminatedSumDecoder<A> implements JsonDecoder<A> {
    private static final Logger LOGGER = LoggerFactory.getLogger(DiscriminatedSumDecoder.class);

    private final SumShape<A> shape;
    private final String discriminator;
    private final FieldMatcher tags;
    private final FieldMatcher hintField;

    DiscriminatedSumDecoder(SumShape<A> shape, String discriminator) {
        this.shape = shape;
        this.discriminator = discriminator;
        this.tags = Derivation.tagMatcher(shape);
        this.hintField = new FieldMatcher(discriminator);
    }

    @Override
    public A unsafeDecode(DecodeTrace trace, TokenReader in) {
        try (RecordingTokenReader recording = new RecordingTokenReader(in)) {
            Lexer.expect(trace, recording, JsonToken.START_OBJECT);
            if (Lexer.firstField(trace, recording)) {
                do {
                    if (Lexer.field(trace, recording, hintField) == -1) {
                        Lexer.skipValue(trace, recording);
                        continue;
                    }
                    DecodeTrace hintTrace = trace.field(discriminator);
                    int index = Lexer.enumeration(hintTrace, recording, tags);
                    if (index == -1) {
                        throw hintTrace.fail("invalid disambiguator");
                    }
                    VariantInfo<A> variant = shape.variants().get(index);
                    if (LOGGER.isTraceEnabled()) {
                        LOGGER.trace("Replaying {} tokens for {} variant {}", recording.recordedTokens(), shape.typeName(), variant.tag());
                    }
                    recording.rewind();
                    @SuppressWarnings("unchecked")
                    A value = (A) variant.decoder().unsafeDecode(trace.variant(variant.tag()), recording);
                    return value;
                } while (Lexer.nextField(trace, recording));
            }
            throw trace.fail("missing hint '" + discriminator + "'");
        }
    }
}
