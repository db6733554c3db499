package com.questrail.protowire.codegen.processor;

import javax.lang.model.element.Element;

/**
 * A type that cannot be given a wire codec. Reported as a compile error on
 * {@link #element()}.
 */
final class LayoutException extends RuntimeException
{
    private final transient Element element;

    LayoutException(Element element, String message)
    {
        super(message);
        this.element = element;
    }

    Element element()
    {
        return element;
    }
}
