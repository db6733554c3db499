package com.questrail.protowire.codegen.processor;

import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Naming of generated codec classes: enclosing type names joined with
 * {@code _}, suffixed with {@code WireCodec}.
 */
final class CodecNames
{
    static final String SUFFIX = "WireCodec";

    private CodecNames() {}

    static String simpleName(TypeElement type)
    {
        Deque<String> names = new ArrayDeque<>();
        Element current = type;
        while (current instanceof TypeElement) {
            names.addFirst(current.getSimpleName().toString());
            current = current.getEnclosingElement();
        }
        return String.join("_", names) + SUFFIX;
    }

    static String packageName(TypeElement type, Elements elements)
    {
        return elements.getPackageOf(type).getQualifiedName().toString();
    }

    static String qualifiedName(TypeElement type, Elements elements)
    {
        String pkg = packageName(type, elements);
        return pkg.isEmpty() ? simpleName(type) : pkg + "." + simpleName(type);
    }

    /**
     * Name of the codec field for component {@code component} of union arm
     * {@code arm}, or of a record when {@code arm} is {@code null}.
     */
    static String codecField(String arm, String component)
    {
        if (arm == null) {
            return component + "Codec";
        }
        return Character.toLowerCase(arm.charAt(0)) + arm.substring(1)
                + Character.toUpperCase(component.charAt(0)) + component.substring(1) + "Codec";
    }

    static String typeVariableCodec(String typeVariable)
    {
        return "codec" + typeVariable;
    }
}
