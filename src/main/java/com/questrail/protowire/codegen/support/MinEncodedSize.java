package com.questrail.protowire.codegen.support;

import java.util.Objects;
import java.util.function.IntSupplier;

/**
 * Lazily computed, cached {@code minEncodedSize()} of a generated codec.
 *
 * <p>Recursive types reach their own size while computing it. The reentrant
 * call yields {@code 0}, which keeps the result a valid lower bound.</p>
 */
public final class MinEncodedSize
{
    private final IntSupplier computation;
    private final ThreadLocal<Boolean> computing = ThreadLocal.withInitial(() -> Boolean.FALSE);
    private volatile int cached = -1;

    public MinEncodedSize(IntSupplier computation)
    {
        this.computation = Objects.requireNonNull(computation, "computation");
    }

    public int get()
    {
        int value = cached;
        if (value >= 0) {
            return value;
        }
        if (computing.get()) {
            return 0;
        }
        computing.set(Boolean.TRUE);
        try {
            value = computation.getAsInt();
        }
        finally {
            computing.set(Boolean.FALSE);
        }
        cached = value;
        return value;
    }
}
