package com.questrail.protowire.api;

import com.questrail.protowire.budget.DecodeBudget;
import com.questrail.protowire.transport.WireReader;
import com.questrail.protowire.transport.WireWriter;

import java.util.concurrent.CompletableFuture;

/**
 * WireCodec
 * -----------------------------------------------------------------------------
 * The codec contract: how values of one static type are written to and read
 * from the positional wire format.
 *
 * <p>The format carries no type tags and no field names. The reading side must
 * already know the static type of what it reads, which it expresses by picking
 * the codec.</p>
 *
 * <h2>Asynchronous model</h2>
 * <p>Both operations return futures and suspend only at {@link WireReader} /
 * {@link WireWriter} boundaries. Nested codecs are invoked strictly one after
 * another. Over in-memory or blocking streams every future is already
 * complete when returned.</p>
 *
 * <h2>Failures</h2>
 * <p>{@link #read} fails with a {@link WireDecodeException} and never produces a
 * partial value. {@link #write} fails with a {@link WireEncodeException}.
 * Implementations report failures through the returned future rather than by
 * throwing.</p>
 *
 * @param <T> the value type
 */
public interface WireCodec<T>
{
    /**
     * Append the encoding of {@code value} to {@code out}.
     */
    CompletableFuture<Void> write(T value, WireWriter out);

    /**
     * Consume exactly the encoding of one value from {@code in}.
     *
     * @param budget the allocation budget of the enclosing top-level decode
     */
    CompletableFuture<T> read(WireReader in, DecodeBudget budget);

    /**
     * Lower bound on the encoded size of any value of this type. Containers
     * multiply it with a Length Field to size their budget reservation.
     */
    default int minEncodedSize()
    {
        return 1;
    }

    /**
     * Name used in error messages and failure paths.
     */
    default String typeName()
    {
        return getClass().getSimpleName();
    }
}
