package com.questrail.protowire.codegen;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * A {@code List} or {@code byte[]} component that always holds exactly
 * {@link #value()} elements. It is written without a Length Field; encoding a
 * value of any other size fails.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.RECORD_COMPONENT)
public @interface WireFixedLength
{
    int value();
}
