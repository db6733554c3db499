package com.questrail.protowire.codegen;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Bounds the length of a text, byte string, list, set or map component.
 *
 * <p>This changes the wire format: the Length Field shrinks to the narrowest
 * unsigned width that holds {@link #value()}. Adding, removing or changing the
 * bound breaks compatibility with existing encodings.</p>
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.RECORD_COMPONENT)
public @interface WireMaxLength
{
    long value();
}
