package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireResult;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link WireResult}: discriminant byte {@code 0} followed by the success
 * payload, or {@code 1} followed by the failure payload.
 */
public final class ResultCodec<T, E> implements WireCodec<WireResult<T, E>>
{
    private final WireCodec<T> ok;
    private final WireCodec<E> err;

    public ResultCodec(WireCodec<T> ok, WireCodec<E> err)
    {
        this.ok = Objects.requireNonNull(ok, "ok");
        this.err = Objects.requireNonNull(err, "err");
    }

    @Override
    public CompletableFuture<Void> write(WireResult<T, E> value, WireWriter out)
    {
        return Futures.call(() -> {
            if (value instanceof WireResult.Ok<T, E> success) {
                return out.writeAll(new byte[] { 0 }).thenCompose(v -> ok.write(success.value(), out));
            }
            WireResult.Err<T, E> failure = (WireResult.Err<T, E>) value;
            return out.writeAll(new byte[] { 1 }).thenCompose(v -> err.write(failure.error(), out));
        });
    }

    @Override
    public CompletableFuture<WireResult<T, E>> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> in.readExact(1).thenCompose(tag -> {
            switch (tag[0]) {
                case 0:
                    return ok.read(in, budget).thenApply(WireResult::<T, E>ok);
                case 1:
                    return err.read(in, budget).thenApply(WireResult::<T, E>err);
                default:
                    throw WireDecodeException.unknownVariant(tag[0] & 0xFF, typeName());
            }
        }));
    }

    @Override
    public int minEncodedSize()
    {
        return Sizes.sum(1, Math.min(ok.minEncodedSize(), err.minEncodedSize()));
    }

    @Override
    public String typeName()
    {
        return "Result<" + ok.typeName() + ", " + err.typeName() + ">";
    }
}
