package com.questrail.protowire.internal.async;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongFunction;

/**
 * AsyncLoop
 * -----------------------------------------------------------------------------
 * Runs asynchronous steps strictly one after another.
 *
 * <p>Chaining {@code thenCompose} once per element would nest one stack frame
 * per already-completed step, which overflows for large containers read from
 * in-memory buffers. This loop iterates in place while steps complete
 * synchronously and only registers a continuation when a step is genuinely
 * pending, so the stack depth stays constant.</p>
 *
 * <p>Step {@code i + 1} is never started before step {@code i} has completed.
 * The first failure stops the loop and fails the returned future.</p>
 */
public final class AsyncLoop
{
    private AsyncLoop() {}

    /**
     * @param count number of steps to run
     * @param step  produces the future for step {@code i}; invoked once per index, in order
     * @return a future completing after the last step, or with the first failure
     */
    public static CompletableFuture<Void> repeat(long count, LongFunction<? extends CompletableFuture<?>> step)
    {
        Objects.requireNonNull(step, "step");
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        new Iteration(count, step, result).resume(0);
        return result;
    }

    private static final class Iteration
    {
        private final long count;
        private final LongFunction<? extends CompletableFuture<?>> step;
        private final CompletableFuture<Void> result;

        Iteration(long count, LongFunction<? extends CompletableFuture<?>> step, CompletableFuture<Void> result)
        {
            this.count = count;
            this.step = step;
            this.result = result;
        }

        void resume(long from)
        {
            long i = from;
            while (i < count) {
                final CompletableFuture<?> current;
                try {
                    current = step.apply(i);
                }
                catch (RuntimeException e) {
                    result.completeExceptionally(e);
                    return;
                }
                i++;

                if (!current.isDone()) {
                    final long next = i;
                    current.whenComplete((ignored, error) -> {
                        if (error != null) {
                            result.completeExceptionally(Futures.unwrap(error));
                        }
                        else {
                            resume(next);
                        }
                    });
                    return;
                }
                if (current.isCompletedExceptionally()) {
                    // Already done: the callback runs on this thread before whenComplete returns.
                    current.whenComplete((ignored, error) -> result.completeExceptionally(Futures.unwrap(error)));
                    return;
                }
            }
            result.complete(null);
        }
    }
}
