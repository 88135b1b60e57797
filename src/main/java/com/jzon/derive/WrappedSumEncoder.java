package com.jzon.derive;

import com.jzon.encoder.Indent;
import com.jzon.encoder.JsonEncoder;
import com.jzon.encoder.JsonEncoders;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes a sum value as a single-entry object keyed by its variant's tag: {@code {"Tag":{...}}}.
 */
final class WrappedSumEncoder<A> implements JsonEncoder<A> {
    private final SumShape<A> shape;

    WrappedSumEncoder(SumShape<A> shape) {
        this.shape = shape;
    }

    @Override
    public void unsafeEncode(A value, Indent indent, Writer out) throws IOException {
        VariantInfo<A> variant = Derivation.variantOf(shape, value);
        out.write('{');
        Indent nested = indent.bump();
        nested.pad(out);
        JsonEncoders.STRING.unsafeEncode(variant.tag(), nested, out);
        indent.colon(out);
        variant.encoder().unsafeEncode(value, nested, out);
        indent.pad(out);
        out.write('}');
    }
}
