package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.Tuple2;
import com.questrail.protowire.api.Tuple3;
import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Tuples: elements encoded back to back in order, no Length Field.
 */
public final class TupleCodecs
{
    private TupleCodecs() {}

    public static final class Pair<A, B> implements WireCodec<Tuple2<A, B>>
    {
        private final WireCodec<A> first;
        private final WireCodec<B> second;

        public Pair(WireCodec<A> first, WireCodec<B> second)
        {
            this.first = Objects.requireNonNull(first, "first");
            this.second = Objects.requireNonNull(second, "second");
        }

        @Override
        public CompletableFuture<Void> write(Tuple2<A, B> value, WireWriter out)
        {
            return Futures.call(() -> Futures.within(first.write(value.first(), out), "0")
                    .thenCompose(v -> Futures.within(second.write(value.second(), out), "1")));
        }

        @Override
        public CompletableFuture<Tuple2<A, B>> read(WireReader in, DecodeBudget budget)
        {
            return Futures.call(() -> Futures.within(first.read(in, budget), "0")
                    .thenCompose(a -> Futures.within(second.read(in, budget), "1")
                            .thenApply(b -> new Tuple2<>(a, b))));
        }

        @Override
        public int minEncodedSize()
        {
            return Sizes.sum(first.minEncodedSize(), second.minEncodedSize());
        }

        @Override
        public String typeName()
        {
            return "(" + first.typeName() + ", " + second.typeName() + ")";
        }
    }

    public static final class Triple<A, B, C> implements WireCodec<Tuple3<A, B, C>>
    {
        private final WireCodec<A> first;
        private final WireCodec<B> second;
        private final WireCodec<C> third;

        public Triple(WireCodec<A> first, WireCodec<B> second, WireCodec<C> third)
        {
            this.first = Objects.requireNonNull(first, "first");
            this.second = Objects.requireNonNull(second, "second");
            this.third = Objects.requireNonNull(third, "third");
        }

        @Override
        public CompletableFuture<Void> write(Tuple3<A, B, C> value, WireWriter out)
        {
            return Futures.call(() -> Futures.within(first.write(value.first(), out), "0")
                    .thenCompose(v -> Futures.within(second.write(value.second(), out), "1"))
                    .thenCompose(v -> Futures.within(third.write(value.third(), out), "2")));
        }

        @Override
        public CompletableFuture<Tuple3<A, B, C>> read(WireReader in, DecodeBudget budget)
        {
            return Futures.call(() -> Futures.within(first.read(in, budget), "0")
                    .thenCompose(a -> Futures.within(second.read(in, budget), "1")
                            .thenCompose(b -> Futures.within(third.read(in, budget), "2")
                                    .thenApply(c -> new Tuple3<>(a, b, c)))));
        }

        @Override
        public int minEncodedSize()
        {
            return Sizes.sum(first.minEncodedSize(), second.minEncodedSize(), third.minEncodedSize());
        }

        @Override
        public String typeName()
        {
            return "(" + first.typeName() + ", " + second.typeName() + ", " + third.typeName() + ")";
        }
    }
}
