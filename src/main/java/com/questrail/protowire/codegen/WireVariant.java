package com.questrail.protowire.codegen;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Fixes the discriminant of a union variant: a record permitted by a
 * {@link WireType} sealed interface, or a constant of a {@link WireType} enum.
 *
 * <p>Variants without this annotation keep their 0-based declaration index.
 * Pinning discriminants keeps the wire format stable when variants are
 * reordered in source. Two variants of one union may not share a
 * discriminant.</p>
 *
 * <p>The discriminant width follows the largest discriminant of the union:
 * one byte up to 255, two bytes up to 65 535, four bytes beyond.</p>
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ ElementType.TYPE, ElementType.FIELD })
public @interface WireVariant
{
    /** Discriminant, between {@code 0} and {@code 4294967295}. */
    long value();
}
