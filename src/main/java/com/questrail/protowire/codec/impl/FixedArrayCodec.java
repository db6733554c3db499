package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.budget.FallibleAllocation;
import com.questrail.protowire.internal.async.AsyncLoop;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A list of statically known size: its elements back to back, no Length Field.
 * Decoded lists are unmodifiable.
 */
public final class FixedArrayCodec<E> implements WireCodec<List<E>>
{
    private final WireCodec<E> element;
    private final int length;

    public FixedArrayCodec(WireCodec<E> element, int length)
    {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        this.element = Objects.requireNonNull(element, "element");
        this.length = length;
    }

    @Override
    public CompletableFuture<Void> write(List<E> value, WireWriter out)
    {
        return Futures.call(() -> {
            if (value.size() != length) {
                throw new IllegalArgumentException(typeName() + " cannot hold " + value.size() + " elements");
            }
            final Iterator<E> it = value.iterator();
            return AsyncLoop.repeat(length, i -> Futures.within(element.write(it.next(), out), () -> "[" + i + "]"));
        });
    }

    @Override
    public CompletableFuture<List<E>> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> {
            List<E> result = FallibleAllocation.arrayList(length, typeName());
            return AsyncLoop.repeat(length, i -> Futures.within(element.read(in, budget), () -> "[" + i + "]")
                            .thenAccept(result::add))
                    .thenApply(v -> Collections.unmodifiableList(result));
        });
    }

    @Override
    public int minEncodedSize()
    {
        return Sizes.times(length, element.minEncodedSize());
    }

    @Override
    public String typeName()
    {
        return element.typeName() + "[" + length + "]";
    }
}
