package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Optional value: discriminant byte {@code 0} (absent) or {@code 1} (present,
 * followed by the payload). Any other discriminant is an unknown variant.
 */
public final class OptionalCodec<T> implements WireCodec<Optional<T>>
{
    private static final byte[] ABSENT = { 0 };
    private static final byte[] PRESENT = { 1 };

    private final WireCodec<T> payload;

    public OptionalCodec(WireCodec<T> payload)
    {
        this.payload = Objects.requireNonNull(payload, "payload");
    }

    @Override
    public CompletableFuture<Void> write(Optional<T> value, WireWriter out)
    {
        return Futures.call(() -> {
            if (value.isEmpty()) {
                return out.writeAll(ABSENT.clone());
            }
            T present = value.get();
            return out.writeAll(PRESENT.clone()).thenCompose(v -> payload.write(present, out));
        });
    }

    @Override
    public CompletableFuture<Optional<T>> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> in.readExact(1).thenCompose(tag -> {
            switch (tag[0]) {
                case 0:
                    return CompletableFuture.completedFuture(Optional.<T>empty());
                case 1:
                    return payload.read(in, budget).thenApply(Optional::of);
                default:
                    throw WireDecodeException.unknownVariant(tag[0] & 0xFF, typeName());
            }
        }));
    }

    @Override
    public int minEncodedSize()
    {
        return 1;
    }

    @Override
    public String typeName()
    {
        return "Optional<" + payload.typeName() + ">";
    }
}
