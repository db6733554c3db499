package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.budget.FallibleAllocation;
import com.questrail.protowire.codec.LengthPrefixedCodec;
import com.questrail.protowire.internal.async.AsyncLoop;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

/**
 * Maps: a Length Field giving the entry count, then each key followed by its
 * value, in iteration order. Decoding follows the same reserve-then-allocate
 * discipline as {@link CollectionCodec}, charging the key and value lower
 * bounds per entry.
 */
public final class MapCodec<K, V, M extends Map<K, V>> implements LengthPrefixedCodec<M>
{
    private final String kind;
    private final WireCodec<K> key;
    private final WireCodec<V> value;
    private final CollectionCodec.Allocator<M> allocator;
    private final LengthPrefix prefix;

    public MapCodec(String kind, WireCodec<K> key, WireCodec<V> value,
                    CollectionCodec.Allocator<M> allocator, LengthPrefix prefix)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    public static <K, V> MapCodec<K, V, Map<K, V>> hashMap(WireCodec<K> key, WireCodec<V> value)
    {
        return new MapCodec<>("Map", key, value, FallibleAllocation::hashMap, LengthPrefix.UNBOUNDED);
    }

    public static <K, V> MapCodec<K, V, SortedMap<K, V>> sortedMap(WireCodec<K> key, WireCodec<V> value)
    {
        return new MapCodec<>("SortedMap", key, value, (size, typeName) -> new TreeMap<>(), LengthPrefix.UNBOUNDED);
    }

    @Override
    public MapCodec<K, V, M> withMaxLength(long max)
    {
        return new MapCodec<>(kind, key, value, allocator, LengthPrefix.forMax(max));
    }

    @Override
    public CompletableFuture<Void> write(M map, WireWriter out)
    {
        return Futures.call(() -> {
            final int size = map.size();
            final Iterator<Map.Entry<K, V>> it = map.entrySet().iterator();
            return prefix.write(size, out, typeName()).thenCompose(v -> AsyncLoop.repeat(size, i -> {
                Map.Entry<K, V> entry = it.next();
                return Futures.within(key.write(entry.getKey(), out)
                        .thenCompose(w -> value.write(entry.getValue(), out)), () -> "[" + i + "]");
            }));
        });
    }

    @Override
    public CompletableFuture<M> read(WireReader in, DecodeBudget budget)
    {
        final int entrySize = Sizes.sum(key.minEncodedSize(), value.minEncodedSize());
        return Futures.call(() -> prefix.read(in, typeName()).thenCompose(length -> {
            int size = budget.reserve(length, entrySize, typeName());
            M result = allocator.allocate(size, typeName());
            return AsyncLoop.repeat(size, i -> Futures.within(key.read(in, budget)
                            .thenCompose(k -> value.read(in, budget).thenAccept(v -> result.put(k, v))),
                            () -> "[" + i + "]"))
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
        return kind + "<" + key.typeName() + ", " + value.typeName() + ">";
    }
}
