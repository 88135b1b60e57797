package com.jzon.decoder;

import com.jzon.exceptions.JsonDecodeException;

import java.io.IOException;
import java.io.Reader;
import java.util.function.Function;

/**
 * Reads values of type {@code A} from a stream of JSON tokens.
 * <p>
 * Decoders report problems by throwing {@link JsonDecodeException} with the
 * {@link DecodeTrace} they were given, extended with their own location.
 */
@FunctionalInterface
public interface JsonDecoder<A> {
    A unsafeDecode(DecodeTrace trace, TokenReader in);

    /**
     * Called by object decoders for a field that never appeared in the input.
     * Decoders for optional values override this to return an empty value.
     */
    default A unsafeDecodeMissing(DecodeTrace trace) {
        throw trace.fail("missing");
    }

    default A decode(String json) {
        try (TokenReader in = JacksonTokenReader.of(json)) {
            return decode(in);
        } catch (IOException e) {
            throw new JsonDecodeException(DecodeTrace.ROOT.push(new TraceStep.Message("malformed: " + e.getMessage())), e);
        }
    }

    default A decode(Reader reader) {
        try (TokenReader in = JacksonTokenReader.of(reader)) {
            return decode(in);
        } catch (IOException e) {
            throw new JsonDecodeException(DecodeTrace.ROOT.push(new TraceStep.Message("malformed: " + e.getMessage())), e);
        }
    }

    /**
     * Decodes one complete document: the value must be followed by the end of the input.
     */
    default A decode(TokenReader in) throws IOException {
        A value = unsafeDecode(DecodeTrace.ROOT, in);
        if (in.next() != null) {
            throw DecodeTrace.ROOT.fail("unexpected trailing content");
        }
        return value;
    }

    default <B> JsonDecoder<B> map(Function<? super A, ? extends B> f) {
        JsonDecoder<A> self = this;
        return new JsonDecoder<>() {
            @Override
            public B unsafeDecode(DecodeTrace trace, TokenReader in) {
                return f.apply(self.unsafeDecode(trace, in));
            }

            @Override
            public B unsafeDecodeMissing(DecodeTrace trace) {
                return f.apply(self.unsafeDecodeMissing(trace));
            }
        };
    }

    /**
     * Only {@code f} takes part in decoding; {@code g} is the direction
     * {@link com.jzon.encoder.JsonEncoder#xmap} uses.
     */
    default <B> JsonDecoder<B> xmap(Function<? super A, ? extends B> f, Function<? super B, ? extends A> g) {
        return map(f);
    }

    @SuppressWarnings("unchecked")
    default <B> JsonDecoder<B> widen() {
        return (JsonDecoder<B>) this;
    }
}
