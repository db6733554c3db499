package com.questrail.protowire;

import com.questrail.protowire.api.WireCodec;
import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.api.WireException;
import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.config.WireConfig;
import com.questrail.protowire.internal.async.Futures;
import com.questrail.protowire.observability.NullObservabilitySink;
import com.questrail.protowire.observability.WireErrorEvent;
import com.questrail.protowire.observability.WireObservabilitySink;
import com.questrail.protowire.transport.ByteBufWireReader;
import com.questrail.protowire.transport.ByteBufWireWriter;
import com.questrail.protowire.transport.InputStreamWireReader;
import com.questrail.protowire.transport.OutputStreamWireWriter;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * WireProtocol
 * =============================================================================
 * Top-level entry point for reading and writing values.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Create a fresh {@link DecodeBudget} for every top-level decode</li>
 *   <li>Offer the blocking specialization over byte arrays and streams</li>
 *   <li>Report failed operations to the {@link WireObservabilitySink}</li>
 * </ul>
 *
 * <h2>Asynchronous and blocking use</h2>
 * <p>{@link #read} and {@link #write} return futures and suspend only on the
 * stream. {@link #decode}, {@link #encode}, {@link #readBlocking} and
 * {@link #writeBlocking} run the same codecs over readers and writers that
 * complete synchronously, and rethrow the {@link WireException} unwrapped.
 * The wire format and error taxonomy are identical.</p>
 *
 * <p>A {@code WireProtocol} holds no per-call state and may be shared.</p>
 */
public final class WireProtocol
{
    private final WireConfig config;
    private final WireObservabilitySink observability;

    public WireProtocol()
    {
        this(WireConfig.defaults(), NullObservabilitySink.INSTANCE);
    }

    public WireProtocol(WireConfig config, WireObservabilitySink observability)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    public WireConfig config()
    {
        return config;
    }

    /**
     * Budget for one top-level decode from {@code in}. {@link #read} also
     * consumes the decoded type's lower bound from it before reading.
     */
    public DecodeBudget newBudget(WireReader in)
    {
        long bytes = config.maxDecodeBytes();
        if (in.remainingHint().isPresent()) {
            bytes = Math.min(bytes, in.remainingHint().getAsLong());
        }
        return new DecodeBudget(bytes, config.maxNestingDepth());
    }

    /**
     * Decode one value of {@code codec}'s type from {@code in}.
     */
    public <T> CompletableFuture<T> read(WireCodec<T> codec, WireReader in)
    {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(in, "in");
        return observed("decode", codec, Futures.call(() -> {
            DecodeBudget budget = newBudget(in);
            budget.consume(codec.minEncodedSize());
            return codec.read(in, budget);
        }));
    }

    /**
     * Encode {@code value} to {@code out} and flush.
     */
    public <T> CompletableFuture<Void> write(WireCodec<T> codec, T value, WireWriter out)
    {
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(out, "out");
        return observed("encode", codec, Futures.call(() -> codec.write(value, out).thenCompose(v -> out.flush())));
    }

    /**
     * Decode a value that must occupy all of {@code bytes}.
     *
     * @throws WireDecodeException on malformed input, or with kind {@code CUSTOM}
     *         if bytes remain after the value
     */
    public <T> T decode(WireCodec<T> codec, byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        ByteBufWireReader in = ByteBufWireReader.of(bytes);
        T value = join(read(codec, in));
        long trailing = in.remainingHint().orElse(0);
        if (trailing > 0) {
            WireDecodeException e = new WireDecodeException(WireErrorKind.CUSTOM,
                    trailing + " trailing bytes after " + codec.typeName());
            report("decode", codec, e);
            throw e;
        }
        return value;
    }

    public <T> byte[] encode(WireCodec<T> codec, T value)
    {
        ByteBufWireWriter out = new ByteBufWireWriter();
        join(write(codec, value, out));
        return out.toByteArray();
    }

    /**
     * Read one value from a blocking stream. Bytes after the value are left
     * unread.
     */
    public <T> T readBlocking(WireCodec<T> codec, InputStream in)
    {
        return join(read(codec, new InputStreamWireReader(in)));
    }

    public <T> void writeBlocking(WireCodec<T> codec, T value, OutputStream out)
    {
        join(write(codec, value, new OutputStreamWireWriter(out)));
    }

    private <T, R> CompletableFuture<R> observed(String operation, WireCodec<T> codec, CompletableFuture<R> future)
    {
        return future.whenComplete((value, error) -> {
            if (error != null && Futures.unwrap(error) instanceof WireException wire) {
                wire.within(codec.typeName());
                report(operation, codec, wire);
            }
        });
    }

    private void report(String operation, WireCodec<?> codec, WireException e)
    {
        observability.onError(new WireErrorEvent(Instant.now(), operation, codec.typeName(), e));
    }

    private static <T> T join(CompletableFuture<T> future)
    {
        try {
            return future.join();
        }
        catch (RuntimeException e) {
            Throwable cause = Futures.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
