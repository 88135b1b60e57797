package com.jzon.derive;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Writes the variants of a sealed type with their tag in the named field,
 * {@code {"type":"Circle",...}}, instead of wrapping them as {@code {"Circle":{...}}}.
 * <p>
 * Cannot be combined with {@link JsonNoExtraFields} on any of the variants,
 * since their decoders would reject the discriminator field.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface JsonDiscriminator {
    String value();
}
