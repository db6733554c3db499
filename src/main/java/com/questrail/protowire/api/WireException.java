package com.questrail.protowire.api;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Base type for all codec failures.
 *
 * <p>Besides the {@link WireErrorKind}, a {@code WireException} records
 * <em>where</em> it happened as a path of type and field names, built up while
 * the failure propagates outwards through nested codecs (for example
 * {@code Order.lines[3].sku}).</p>
 */
public abstract class WireException extends RuntimeException
{
    private final WireErrorKind kind;
    private final Deque<String> path = new ArrayDeque<>();

    protected WireException(WireErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public WireErrorKind kind()
    {
        return kind;
    }

    /**
     * Prepends a path segment. Called by enclosing codecs as the failure
     * unwinds, so segments accumulate innermost-last.
     *
     * @param segment a field name ({@code "sku"}), an index ({@code "[3]"}) or a type name
     * @return this exception
     */
    public WireException within(String segment)
    {
        Objects.requireNonNull(segment, "segment");
        path.addFirst(segment);
        return this;
    }

    /**
     * @return the location of the failure, or an empty string at top level
     */
    public String path()
    {
        StringBuilder sb = new StringBuilder();
        for (String segment : path) {
            if (sb.length() > 0 && !segment.startsWith("[")) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.toString();
    }

    @Override
    public String getMessage()
    {
        String p = path();
        return p.isEmpty() ? super.getMessage() : super.getMessage() + " (at " + p + ")";
    }
}
