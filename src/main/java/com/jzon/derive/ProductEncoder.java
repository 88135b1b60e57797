package com.jzon.derive;

import com.jzon.encoder.Indent;
import com.jzon.encoder.JsonEncoder;
import com.jzon.encoder.JsonEncoders;

import java.io.IOException;
import java.io.Writer;
import java.util.function.Function;

/**
 * Writes a product as an object with one entry per field, in declaration order.
 * Fields whose encoder reports {@link JsonEncoder#isNothing nothing} are left out.
 */
final class ProductEncoder<A> implements JsonEncoder<A> {
    private final String[] names;
    private final Function<? super A, Object>[] accessors;
    private final JsonEncoder<Object>[] encoders;

    @SuppressWarnings("unchecked")
    ProductEncoder(ProductShape<A> shape) {
        int len = shape.fields().size();
        this.names = new String[len];
        this.accessors = new Function[len];
        this.encoders = new JsonEncoder[len];
        for (int i = 0; i < len; i++) {
            FieldInfo<A> field = shape.fields().get(i);
            names[i] = field.jsonName();
            accessors[i] = field.accessor();
            encoders[i] = field.encoder();
        }
    }

    @Override
    public void unsafeEncode(A value, Indent indent, Writer out) throws IOException {
        out.write('{');
        Indent nested = indent.bump();
        boolean first = true;
        for (int i = 0; i < names.length; i++) {
            Object fieldValue = accessors[i].apply(value);
            JsonEncoder<Object> encoder = encoders[i];
            if (encoder.isNothing(fieldValue)) {
                continue;
            }
            if (first) {
                first = false;
            } else {
                out.write(',');
            }
            nested.pad(out);
            JsonEncoders.STRING.unsafeEncode(names[i], nested, out);
            indent.colon(out);
            encoder.unsafeEncode(fieldValue, nested, out);
        }
        if (!first) {
            indent.pad(out);
        }
        out.write('}');
    }
}
