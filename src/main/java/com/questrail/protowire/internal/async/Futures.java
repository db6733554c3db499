package com.questrail.protowire.internal.async;

import com.questrail.protowire.api.WireException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Small helpers around {@link CompletableFuture} shared by codecs and
 * transports.
 */
public final class Futures
{
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private Futures() {}

    /**
     * @return an already completed {@code Void} future. Callers must not complete it again.
     */
    public static CompletableFuture<Void> done()
    {
        return DONE;
    }

    public static <T> CompletableFuture<T> failed(Throwable cause)
    {
        CompletableFuture<T> f = new CompletableFuture<>();
        f.completeExceptionally(cause);
        return f;
    }

    /**
     * Invokes {@code action}, turning a synchronously thrown exception into a
     * failed future so callers only ever observe one failure channel.
     */
    public static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> action)
    {
        try {
            return action.get();
        }
        catch (RuntimeException e) {
            return failed(e);
        }
    }

    /**
     * Strips the {@link CompletionException}/{@link ExecutionException} wrappers
     * that {@code CompletableFuture} adds when a failure crosses a dependent stage.
     */
    public static Throwable unwrap(Throwable t)
    {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Returns a future that mirrors {@code future}, but if it fails with a
     * {@link WireException}, the exception gets {@code segment} prepended to its path.
     */
    public static <T> CompletableFuture<T> within(CompletableFuture<T> future, String segment)
    {
        return within(future, () -> segment);
    }

    /**
     * Same as {@link #within(CompletableFuture, String)}, but builds the segment
     * only on failure. Used in per-element loops.
     */
    public static <T> CompletableFuture<T> within(CompletableFuture<T> future, Supplier<String> segment)
    {
        if (future.isDone() && !future.isCompletedExceptionally()) {
            return future;
        }
        CompletableFuture<T> out = new CompletableFuture<>();
        future.whenComplete((value, error) -> {
            if (error == null) {
                out.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof WireException wire) {
                wire.within(segment.get());
            }
            out.completeExceptionally(cause);
        });
        return out;
    }
}
