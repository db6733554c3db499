package com.questrail.protowire.codec.impl;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

/**
 * Non-negative {@link Duration}: unsigned 64-bit seconds followed by an
 * unsigned 32-bit nanosecond adjustment.
 */
public final class DurationCodec implements WireCodec<Duration>
{
    public static final DurationCodec INSTANCE = new DurationCodec();

    private DurationCodec() {}

    @Override
    public CompletableFuture<Void> write(Duration value, WireWriter out)
    {
        return Futures.call(() -> {
            if (value.isNegative()) {
                throw new IllegalArgumentException("negative durations have no wire form: " + value);
            }
            byte[] bytes = new byte[12];
            System.arraycopy(BigEndian.encode(value.getSeconds(), 8), 0, bytes, 0, 8);
            System.arraycopy(BigEndian.encode(value.getNano(), 4), 0, bytes, 8, 4);
            return out.writeAll(bytes);
        });
    }

    @Override
    public CompletableFuture<Duration> read(WireReader in, DecodeBudget budget)
    {
        return Futures.call(() -> in.readExact(12).thenApply(bytes -> {
            long seconds = BigEndian.decodeUnsigned(Arrays.copyOfRange(bytes, 0, 8));
            long nanos = BigEndian.decodeUnsigned(Arrays.copyOfRange(bytes, 8, 12));
            if (seconds < 0) {
                throw new WireDecodeException(WireErrorKind.CUSTOM,
                        "duration of " + Long.toUnsignedString(seconds) + " seconds is out of range");
            }
            try {
                return Duration.ofSeconds(seconds, nanos);
            }
            catch (ArithmeticException e) {
                throw new WireDecodeException(WireErrorKind.CUSTOM, "duration is out of range", e);
            }
        }));
    }

    @Override
    public int minEncodedSize()
    {
        return 12;
    }

    @Override
    public String typeName()
    {
        return "Duration";
    }
}
