package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.budget.FallibleAllocation;
import com.questrail.protowire.codec.LengthPrefixedCodec;
import com.questrail.protowire.internal.async.AsyncLoop;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * CollectionCodec
 * -----------------------------------------------------------------------------
 * Dynamic single-element containers: a Length Field, then that many elements
 * in iteration order.
 *
 * <h2>Decoding</h2>
 * <ol>
 *   <li>Read the Length Field.</li>
 *   <li>{@link DecodeBudget#reserve Reserve} {@code length × element.minEncodedSize()}
 *       bytes. A hostile length fails here, before any element is read.</li>
 *   <li>Allocate the container through {@link FallibleAllocation}, with an
 *       initial capacity of at most
 *       {@link FallibleAllocation#MAX_INITIAL_CAPACITY}. It grows as elements
 *       arrive.</li>
 *   <li>Read and insert the elements one after another. Hash-based containers
 *       therefore compare equal to the original regardless of order.</li>
 * </ol>
 *
 * @param <E> element type
 * @param <C> container type
 */
public final class CollectionCodec<E, C extends Collection<E>> implements LengthPrefixedCodec<C>
{
    /** Creates the container for a reserved element count. */
    @FunctionalInterface
    public interface Allocator<C>
    {
        C allocate(int size, String typeName);
    }

    private final String kind;
    private final WireCodec<E> element;
    private final Allocator<C> allocator;
    private final LengthPrefix prefix;

    public CollectionCodec(String kind, WireCodec<E> element, Allocator<C> allocator, LengthPrefix prefix)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.element = Objects.requireNonNull(element, "element");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public static <E> CollectionCodec<E, List<E>> list(WireCodec<E> element)
    {
        return new CollectionCodec<>("List", element, FallibleAllocation::arrayList, LengthPrefix.UNBOUNDED);
    }

    public static <E> CollectionCodec<E, Set<E>> hashSet(WireCodec<E> element)
    {
        return new CollectionCodec<>("Set", element, FallibleAllocation::hashSet, LengthPrefix.UNBOUNDED);
    }

    // Elements must be mutually Comparable; a TreeSet needs no up-front capacity.
    public static <E> CollectionCodec<E, SortedSet<E>> sortedSet(WireCodec<E> element)
    {
        return new CollectionCodec<>("SortedSet", element, (size, typeName) -> new TreeSet<>(), LengthPrefix.UNBOUNDED);
    }

    @Override
    public CollectionCodec<E, C> withMaxLength(long max)
    {
        return new CollectionCodec<>(kind, element, allocator, LengthPrefix.forMax(max));
    }

    @Override
    public CompletableFuture<Void> write(C value, WireWriter out)
    {
        return Futures.call(() -> {
            final int size = value.size();
            final Iterator<E> it = value.iterator();
            return prefix.write(size, out, typeName()).thenCompose(v -> AsyncLoop.repeat(size,
                    i -> Futures.within(element.write(it.next(), out), () -> "[" + i + "]")));
        });
    }

    @Override
    public CompletableFuture<C> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> prefix.read(in, typeName()).thenCompose(length -> {
            int size = budget.reserve(length, element.minEncodedSize(), typeName());
            C result = allocator.allocate(size, typeName());
            return AsyncLoop.repeat(size, i -> Futures.within(element.read(in, budget), () -> "[" + i + "]")
                            .thenAccept(result::add))
                    .thenApply(v -> result);
        }));
    }

    @Override
    public int minEncodedSize()
    {
        return prefix.width();
    }

    @Override
    public String typeName()
    {
        return kind + "<" + element.typeName() + ">";
    }
}
