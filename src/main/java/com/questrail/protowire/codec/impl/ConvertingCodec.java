package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.api.WireException;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * ConvertingCodec
 * -----------------------------------------------------------------------------
 * Encodes a value as a proxy value of another type. The wire format is exactly
 * the proxy's.
 *
 * <h2>Decoding</h2>
 * <p>The proxy is decoded first, then converted. A conversion that throws a
 * {@link WireException} fails the decode with that exception unchanged, so a
 * conversion can choose its own error kind. Any other exception, checked or
 * not, fails it with {@link WireErrorKind#CUSTOM} and the exception as cause.</p>
 *
 * @param <T> the value type
 * @param <P> the proxy type
 */
public final class ConvertingCodec<T, P> implements WireCodec<T>
{
    /** Proxy to value conversion, which may reject the proxy. */
    @FunctionalInterface
    public interface Conversion<P, T>
    {
        T convert(P proxy) throws Exception;
    }

    private final String typeName;
    private final WireCodec<P> proxy;
    private final Function<? super T, ? extends P> toProxy;
    private final Conversion<? super P, ? extends T> fromProxy;

    public ConvertingCodec(String typeName, WireCodec<P> proxy,
                           Function<? super T, ? extends P> toProxy,
                           Conversion<? super P, ? extends T> fromProxy)
    {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.proxy = Objects.requireNonNull(proxy, "proxy");
        this.toProxy = Objects.requireNonNull(toProxy, "toProxy");
        this.fromProxy = Objects.requireNonNull(fromProxy, "fromProxy");
    }

    @Override
    public CompletableFuture<Void> write(T value, WireWriter out)
    {
        return Futures.call(() -> proxy.write(toProxy.apply(value), out));
    }

    @Override
    public CompletableFuture<T> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> proxy.read(in, budget).thenApply(this::convert));
    }

    private T convert(P value)
    {
        try {
            return fromProxy.convert(value);
        }
        catch (WireException e) {
            throw e;
        }
        catch (Exception e) {
            throw new WireDecodeException(WireErrorKind.CUSTOM,
                    "invalid " + typeName + " from " + proxy.typeName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public int minEncodedSize()
    {
        return proxy.minEncodedSize();
    }

    @Override
    public String typeName()
    {
        return typeName;
    }
}
