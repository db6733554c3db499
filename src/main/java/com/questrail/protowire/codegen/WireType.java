package com.questrail.protowire.codegen;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Generate a wire codec for the annotated type at compile time.
 *
 * <ul>
 *   <li>A {@code record} is encoded as its components in declaration order.</li>
 *   <li>A {@code sealed interface} whose permitted subtypes are records is a
 *       tagged union: a discriminant, then the fields of the selected record.
 *       Variants are numbered in {@code permits} order starting at {@code 0}.</li>
 *   <li>An {@code enum} is a tagged union of payload-less variants numbered in
 *       constant order.</li>
 * </ul>
 *
 * <p>The generated class is named after the type with nesting flattened by
 * {@code _} and the suffix {@code WireCodec} ({@code Outer.Inner} becomes
 * {@code Outer_InnerWireCodec}), and lives in the same package. Non-generic
 * types get a shared {@code INSTANCE}; generic ones a constructor taking one
 * codec per type parameter.</p>
 *
 * <h2>Proxy encodings</h2>
 * <p>With {@link #via} or {@link #asString} the type's own layout is ignored and
 * any kind of non-generic class qualifies. Conversions may throw; a
 * {@code WireException} fails the decode as thrown, anything else fails it with
 * kind {@code CUSTOM}.</p>
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target(ElementType.TYPE)
public @interface WireType
{
    /**
     * Encode values as this proxy type, which must have a codec of its own.
     * The annotated type declares the conversions
     * <pre>
     * P toWire()                 // instance method
     * static T fromWire(P proxy) // may throw
     * </pre>
     * {@code void.class} means no proxy.
     */
    Class<?> via() default void.class;

    /**
     * Encode values as the text of their {@code toString()}. Decoding calls a
     * static {@code fromString}, {@code parse} or {@code valueOf} method taking
     * one {@code String} (looked up in that order), which may throw. Enums
     * qualify through their implicit {@code valueOf}.
     */
    boolean asString() default false;
}
