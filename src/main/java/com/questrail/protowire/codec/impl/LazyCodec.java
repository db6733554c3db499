package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * LazyCodec
 * -----------------------------------------------------------------------------
 * Explicit indirection to a codec that is looked up on first use.
 *
 * <p>Mutually recursive types need this: codec A holds a codec for B whose
 * codec holds one for A, so neither can be built eagerly in its static
 * initializer. Each read through the indirection enters one nesting level of
 * the decode budget, so a self-referential codec built by hand fails with
 * {@code NESTING_TOO_DEEP} instead of recursing without bound.
 * {@link #unnested} skips that level for delegates that enter their own.</p>
 *
 * <p>{@link #minEncodedSize()} and {@link #typeName()} follow the indirection
 * at most once per thread at a time. In a cycle the size contributes
 * {@code 0}, which is still a valid lower bound.</p>
 */
public final class LazyCodec<T> implements WireCodec<T>
{
    private final Supplier<? extends WireCodec<T>> supplier;
    private final boolean nests;
    private volatile WireCodec<T> delegate;
    private final ThreadLocal<Boolean> sizing = ThreadLocal.withInitial(() -> Boolean.FALSE);
    private final ThreadLocal<Boolean> naming = ThreadLocal.withInitial(() -> Boolean.FALSE);
    private volatile String name;

    public LazyCodec(Supplier<? extends WireCodec<T>> supplier)
    {
        this(supplier, true);
    }

    private LazyCodec(Supplier<? extends WireCodec<T>> supplier, boolean nests)
    {
        this.supplier = Objects.requireNonNull(supplier, "supplier");
        this.nests = nests;
    }

    /**
     * An indirection that does not count toward the nesting depth. Only for
     * delegates whose {@code read} enters a nesting level itself.
     */
    public static <T> LazyCodec<T> unnested(Supplier<? extends WireCodec<T>> supplier)
    {
        return new LazyCodec<>(supplier, false);
    }

    private WireCodec<T> delegate()
    {
        WireCodec<T> d = delegate;
        if (d == null) {
            d = Objects.requireNonNull(supplier.get(), "lazy codec supplier returned null");
            delegate = d;
        }
        return d;
    }

    @Override
    public CompletableFuture<Void> write(T value, WireWriter out)
    {
        return Futures.call(() -> delegate().write(value, out));
    }

    @Override
    public CompletableFuture<T> read(WireReader in, DecodeBudget budget)
    {
        if (!nests) {
            return Futures.call(() -> delegate().read(in, budget));
        }
        return Futures.call(() -> budget.nested(typeName(), () -> delegate().read(in, budget)));
    }

    @Override
    public int minEncodedSize()
    {
        if (sizing.get()) {
            return 0;
        }
        sizing.set(Boolean.TRUE);
        try {
            return delegate().minEncodedSize();
        }
        finally {
            sizing.set(Boolean.FALSE);
        }
    }

    // A codec whose name contains itself is shown as "..." at the point of recursion.
    @Override
    public String typeName()
    {
        String n = name;
        if (n != null) {
            return n;
        }
        if (naming.get()) {
            return "...";
        }
        naming.set(Boolean.TRUE);
        try {
            n = delegate().typeName();
        }
        finally {
            naming.set(Boolean.FALSE);
        }
        name = n;
        return n;
    }
}
