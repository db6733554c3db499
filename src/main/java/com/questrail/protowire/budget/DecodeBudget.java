package com.questrail.protowire.budget;

import com.questrail.protowire.api.WireDecodeException;
import com.questrail.protowire.api.WireErrorKind;
import com.questrail.protowire.internal.async.Futures;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * DecodeBudget
 * -----------------------------------------------------------------------------
 * Allocation-safety governor for one top-level decode call tree.
 *
 * <h2>Byte budget</h2>
 * <p>Before a codec allocates capacity for {@code n} elements whose encodings
 * are each at least {@code s} bytes long, it must {@link #reserve reserve}
 * {@code n × max(1, s)} bytes. The reservation is charged immediately and never
 * given back: every charged byte stands for a distinct byte of the encoding
 * (element lower bounds, text payload bytes), so the total charge can never
 * exceed the size of a well-formed input. A Length Field that claims more than
 * that fails here, before any element byte is consumed and before anything
 * proportional to the claim is allocated.</p>
 *
 * <p>The initial budget is at most the number of bytes the reader knows are
 * still available (for in-memory sources), and never more than the configured
 * limit. The top-level value's own lower bound is {@link #consume consumed}
 * before it is read, so its outermost Length Field is checked against the
 * bytes that follow it.</p>
 *
 * <h2>Nesting depth</h2>
 * <p>Generated codecs and {@code Codecs.lazy} indirections {@link #enter enter}
 * one level per value and {@link #exit exit} it when that value's decode
 * completes. Self-referential types therefore fail with {@link WireErrorKind#NESTING_TOO_DEEP} instead of
 * recursing without bound.</p>
 *
 * <p>A budget is confined to a single decode call tree. It is passed
 * explicitly to every nested decode and is not shared between concurrent
 * decodes, so it needs no synchronization.</p>
 */
public final class DecodeBudget
{
    /** Largest element count any in-memory container can be asked to hold. */
    public static final int MAX_ELEMENTS = Integer.MAX_VALUE - 8;

    private long remaining;
    private final int maxDepth;
    private int depth;

    public DecodeBudget(long bytes, int maxDepth)
    {
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must be non-negative");
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.remaining = bytes;
        this.maxDepth = maxDepth;
    }

    /**
     * @return the bytes that may still be reserved
     */
    public long remaining()
    {
        return remaining;
    }

    /**
     * @return current nesting depth of composite values being decoded
     */
    public int depth()
    {
        return depth;
    }

    public int maxDepth()
    {
        return maxDepth;
    }

    /**
     * Charges the budget for {@code count} elements of at least
     * {@code minElementSize} bytes each.
     *
     * @param count          the element count from a Length Field; negative values are
     *                       unsigned 64-bit counts beyond {@link Long#MAX_VALUE}
     * @param minElementSize lower bound of one element's encoded size
     * @param typeName       container type, for the error message
     * @return {@code count} as an {@code int}, safe to use as an initial capacity
     * @throws WireDecodeException {@link WireErrorKind#OVERSIZED_REQUEST} if the
     *         charge does not fit
     */
    public int reserve(long count, int minElementSize, String typeName)
    {
        if (count < 0 || count > MAX_ELEMENTS) {
            throw oversized(typeName, count, "exceeds the maximum container size");
        }
        final long unit = Math.max(1, minElementSize);
        final long charge;
        try {
            charge = Math.multiplyExact(count, unit);
        }
        catch (ArithmeticException e) {
            throw oversized(typeName, count, "overflows the decode budget");
        }
        if (charge > remaining) {
            throw oversized(typeName, count,
                    "needs at least " + charge + " bytes but only " + remaining + " remain in the decode budget");
        }
        remaining -= charge;
        return (int) count;
    }

    /**
     * Charges the lower bound of a value that is about to be read, up to what
     * remains. Used for the top-level value, whose bytes no enclosing
     * container has reserved. A shorter input is left to fail with
     * {@link WireErrorKind#END_OF_STREAM} when the value is read.
     */
    public void consume(int minEncodedSize)
    {
        remaining -= Math.min(remaining, Math.max(0, minEncodedSize));
    }

    /**
     * Runs {@code body} one nesting level deeper, giving the level back when
     * the body's future completes either way.
     */
    public <T> CompletableFuture<T> nested(String typeName, Supplier<CompletableFuture<T>> body)
    {
        try {
            enter(typeName);
        }
        catch (RuntimeException e) {
            return Futures.failed(e);
        }
        return Futures.call(body).whenComplete((value, error) -> exit());
    }

    /**
     * Enters one level of composite nesting.
     *
     * @throws WireDecodeException {@link WireErrorKind#NESTING_TOO_DEEP} past the maximum depth
     */
    public void enter(String typeName)
    {
        if (depth >= maxDepth) {
            throw new WireDecodeException(WireErrorKind.NESTING_TOO_DEEP,
                    typeName + " is nested deeper than " + maxDepth + " levels");
        }
        depth++;
    }

    /**
     * Leaves one level of nesting entered with {@link #enter(String)}.
     */
    public void exit()
    {
        if (depth == 0) {
            throw new IllegalStateException("exit() without matching enter()");
        }
        depth--;
    }

    private static WireDecodeException oversized(String typeName, long count, String reason)
    {
        String shown = count < 0 ? Long.toUnsignedString(count) : Long.toString(count);
        return new WireDecodeException(WireErrorKind.OVERSIZED_REQUEST,
                typeName + " length " + shown + " " + reason);
    }

    @Override
    public String toString()
    {
        return "DecodeBudget[remaining=" + remaining + ", depth=" + depth + "/" + maxDepth + "]";
    }
}
