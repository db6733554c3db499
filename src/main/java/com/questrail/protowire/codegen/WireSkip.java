package com.questrail.protowire.codegen;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The record component is never written. On decode it receives the default
 * for its type ({@code 0}, {@code false}, {@code null}, {@code Optional.empty()}
 * or an empty mutable collection), or the result of {@link #defaultFactory()}.
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.RECORD_COMPONENT)
public @interface WireSkip
{
    /**
     * Name of a static no-argument method of the record that supplies the
     * value. Empty for the type's default.
     */
    String defaultFactory() default "";
}
