package com.questrail.protowire.codegen.support;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.codec.impl.LazyCodec;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * FieldSequence
 * -----------------------------------------------------------------------------
 * Runtime support for generated composite codecs: visits fields strictly in
 * declaration order, one after another, and labels failures with the field
 * name.
 *
 * <p>Decoding stops at the first failing field; later fields are not read and
 * no value is constructed.</p>
 */
public final class FieldSequence
{
    private FieldSequence() {}

    public static Writer writer(WireWriter out)
    {
        return new Writer(out);
    }

    public static Reader reader(WireReader in, DecodeBudget budget, int slots)
    {
        return new Reader(in, budget, slots);
    }

    /**
     * Runs {@code body} one nesting level deeper in {@code budget}.
     *
     * @see DecodeBudget#nested
     */
    public static <T> CompletableFuture<T> nested(DecodeBudget budget, String typeName,
                                                  Supplier<CompletableFuture<T>> body)
    {
        return budget.nested(typeName, body);
    }

    /**
     * Defers codec lookup to first use without entering a nesting level of its
     * own. Generated codecs enter their level when they read, so a reference
     * from one generated codec to another is already bounded.
     */
    public static <T> WireCodec<T> deferred(Supplier<? extends WireCodec<T>> supplier)
    {
        return LazyCodec.unnested(supplier);
    }

    /**
     * Labels failures of {@code future} with a variant name.
     */
    public static <T> CompletableFuture<T> variant(String name, CompletableFuture<T> future)
    {
        return Futures.within(future, name);
    }

    public static final class Writer
    {
        private final WireWriter out;
        private CompletableFuture<Void> tail = Futures.done();

        private Writer(WireWriter out)
        {
            this.out = out;
        }

        public <T> Writer field(String name, WireCodec<T> codec, T value)
        {
            tail = tail.thenCompose(v -> Futures.within(Futures.call(() -> codec.write(value, out)), name));
            return this;
        }

        /**
         * Writes raw bytes, used for discriminants.
         */
        public Writer raw(byte[] bytes)
        {
            tail = tail.thenCompose(v -> out.writeAll(bytes));
            return this;
        }

        public CompletableFuture<Void> end()
        {
            return tail;
        }
    }

    public static final class Reader
    {
        private final WireReader in;
        private final DecodeBudget budget;
        private final Object[] slots;
        private CompletableFuture<Void> tail = Futures.done();

        private Reader(WireReader in, DecodeBudget budget, int slots)
        {
            this.in = in;
            this.budget = budget;
            this.slots = new Object[slots];
        }

        /**
         * Reads the next field into {@code slot}.
         */
        public Reader field(int slot, String name, WireCodec<?> codec)
        {
            tail = tail.thenCompose(v -> Futures.within(Futures.call(() -> codec.read(in, budget)), name)
                    .thenAccept(value -> slots[slot] = value));
            return this;
        }

        public <T> CompletableFuture<T> build(Function<Object[], T> constructor)
        {
            return tail.thenApply(v -> constructor.apply(slots));
        }
    }
}
