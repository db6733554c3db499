package com.questrail.protowire.codegen.processor;

import javax.lang.model.element.TypeElement;
import java.util.List;

/**
 * TypeLayout
 * -----------------------------------------------------------------------------
 * Wire layout of one {@code @WireType}, as derived at compile time. All type
 * and expression strings are Java source text, valid inside the generated
 * codec class.
 *
 * @param kind               record, union, enum or proxy encoding
 * @param element            the annotated type
 * @param packageName        package of the annotated type and its codec
 * @param codecName          simple name of the generated codec class
 * @param typeText           the annotated type with its own type variables, e.g. {@code com.acme.Pair<A>}
 * @param typeName           name used in error messages
 * @param typeParameters     type parameter declarations, bounds included
 * @param typeVariables      type variable names, in declaration order
 * @param fields             record components (records only)
 * @param variants           arms or constants in declaration order (unions and enums)
 * @param discriminantWidth  discriminant size in bytes (unions and enums)
 * @param conversion         expression building the converting codec (proxy encodings only)
 */
record TypeLayout(
    Kind kind,
    TypeElement element,
    String packageName,
    String codecName,
    String typeText,
    String typeName,
    List<String> typeParameters,
    List<String> typeVariables,
    List<Field> fields,
    List<Variant> variants,
    int discriminantWidth,
    String conversion
) {
    enum Kind { RECORD, UNION, ENUM, PROXY }

    String qualifiedCodecName()
    {
        return packageName.isEmpty() ? codecName : packageName + "." + codecName;
    }

    boolean generic()
    {
        return !typeVariables.isEmpty();
    }

    /**
     * One record component.
     *
     * @param name        component name, also its accessor
     * @param codecField  name of the generated codec field; {@code null} if skipped
     * @param codecExpr   expression building the component's codec; {@code null} if skipped
     * @param valueType   boxed component type
     * @param defaultExpr expression supplying the value of a skipped component; {@code null} otherwise
     */
    record Field(String name, String codecField, String codecExpr, String valueType, String defaultExpr)
    {
        boolean skipped()
        {
            return defaultExpr != null;
        }
    }

    /**
     * One union arm or enum constant.
     *
     * @param name          arm simple name or constant name
     * @param discriminant  wire discriminant
     * @param reference     arm type ({@code com.acme.Left<L, R>}) or constant ({@code com.acme.Color.RED})
     * @param upcast        the arm type is not statically a subtype of {@link TypeLayout#typeText()}
     * @param fields        arm record components; empty for enum constants
     */
    record Variant(String name, long discriminant, String reference, boolean upcast, List<Field> fields)
    {
    }
}
