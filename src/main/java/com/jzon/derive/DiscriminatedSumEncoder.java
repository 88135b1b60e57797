package com.jzon.derive;

import com.jzon.encoder.Indent;
import com.jzon.encoder.JsonEncoder;
import com.jzon.encoder.JsonEncoders;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes the tag as the first field of the variant's own object: {@code {"type":"Tag",...}}.
 * The variant must encode as a JSON object.
 */
final class DiscriminatedSumEncoder<A> implements JsonEncoder<A> {
    private final SumShape<A> shape;
    private final String discriminator;

    DiscriminatedSumEncoder(SumShape<A> shape, String discriminator) {
        this.shape = shape;
        this.discriminator = discriminator;
    }

    @Override
    public void unsafeEncode(A value, Indent indent, Writer out) throws IOException {
        VariantInfo<A> variant = Derivation.variantOf(shape, value);
        Indent nested = indent.bump();
        out.write('{');
        nested.pad(out);
        JsonEncoders.STRING.unsafeEncode(discriminator, nested, out);
        indent.colon(out);
        JsonEncoders.STRING.unsafeEncode(variant.tag(), nested, out);
        variant.encoder().unsafeEncode(value, indent, new NestedObjectWriter(out, indent));
    }
}
