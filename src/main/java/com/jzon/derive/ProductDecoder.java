package com.jzon.derive;

import com.fasterxml.jackson.core.JsonToken;
import com.jzon.decoder.DecodeTrace;
import com.jzon.decoder.FieldMatcher;
import com.jzon.decoder.JsonDecoder;
import com.jzon.decoder.Lexer;
import com.jzon.decoder.TokenReader;
import com.jzon.decoder.TraceStep;
import com.jzon.exceptions.JsonDecodeException;

import java.util.function.Function;

/**
 * Reads an object into a product, matching keys against the field names.
 * <p>
 * Unknown keys are skipped, or rejected when the shape asks for no extra fields.
 * A key that appears twice is an error. Fields that never appear are filled from
 * their decoder's {@link JsonDecoder#unsafeDecodeMissing}.
 */
final class ProductDecoder<A> implements JsonDecoder<A> {
    private final String typeName;
    private final String[] names;
    private final FieldMatcher matcher;
    private final JsonDecoder<Object>[] decoders;
    private final Function<Object[], A> constructor;
    private final boolean noExtraFields;

    @SuppressWarnings("unchecked")
    ProductDecoder(ProductShape<A> shape) {
        int len = shape.fields().size();
        this.typeName = shape.typeName();
        this.names = new String[len];
        this.decoders = new JsonDecoder[len];
        for (int i = 0; i < len; i++) {
            FieldInfo<A> field = shape.fields().get(i);
            names[i] = field.jsonName();
            decoders[i] = field.decoder();
        }
        this.matcher = new FieldMatcher(names);
        this.constructor = shape.constructor();
        this.noExtraFields = shape.noExtraFields();
    }

    @Override
    public A unsafeDecode(DecodeTrace trace, TokenReader in) {
        if (names.length == 0) {
            if (noExtraFields) {
                Lexer.expect(trace, in, JsonToken.START_OBJECT);
                Lexer.expect(trace, in, JsonToken.END_OBJECT);
            } else {
                Lexer.skipValue(trace, in);
            }
            return construct(trace, new Object[0]);
        }

        Lexer.expect(trace, in, JsonToken.START_OBJECT);
        Object[] values = new Object[names.length];
        boolean[] seen = new boolean[names.length];
        if (Lexer.firstField(trace, in)) {
            do {
                String key = Lexer.fieldName(trace, in);
                int field = matcher.indexOf(key);
                if (field != -1) {
                    DecodeTrace fieldTrace = trace.field(names[field]);
                    if (seen[field]) {
                        throw fieldTrace.fail("duplicate");
                    }
                    values[field] = decoders[field].unsafeDecode(fieldTrace, in);
                    seen[field] = true;
                } else if (noExtraFields) {
                    throw trace.field(key).fail("invalid extra field");
                } else {
                    Lexer.skipValue(trace, in);
                }
            } while (Lexer.nextField(trace, in));
        }

        for (int i = 0; i < names.length; i++) {
            if (!seen[i]) {
                values[i] = decoders[i].unsafeDecodeMissing(trace.field(names[i]));
            }
        }
        return construct(trace, values);
    }

    private A construct(DecodeTrace trace, Object[] values) {
        try {
            return constructor.apply(values);
        } catch (JsonDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new JsonDecodeException(trace.push(new TraceStep.Message("cannot construct " + typeName + ": " + e.getMessage())), e);
        }
    }
}
