package io.replayflow.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Small {@link CompletableFuture} helpers shared by the sequence operators.
 */
final class Futures {
    private Futures() {
    }

    /**
     * Strips the {@link CompletionException} / {@link ExecutionException} wrappers added by
     * dependent stages so callers see the original failure.
     */
    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Cancels {@code source} when {@code dependent} is cancelled (or otherwise completed first).
     */
    static void propagateCancellation(CompletableFuture<?> dependent, CompletableFuture<?> source) {
        dependent.whenComplete((ignored, error) -> {
            if (dependent.isCancelled() && !source.isDone()) {
                source.cancel(false);
            }
        });
    }

    /**
     * Applies {@code fn} to the result of {@code source}; cancelling the returned future cancels
     * {@code source}.
     */
    static <S, R> CompletableFuture<R> derive(CompletableFuture<S> source, Function<? super S, ? extends R> fn) {
        CompletableFuture<R> out = source.thenApply(fn);
        propagateCancellation(out, source);
        return out;
    }

    /**
     * Invokes a step supplier, turning a synchronous throw or a {@code null} future into a failed future.
     */
    static <S> CompletableFuture<S> invoke(Supplier<? extends CompletableFuture<S>> step) {
        try {
            CompletableFuture<S> f = step.get();
            if (f == null) {
                return CompletableFuture.failedFuture(new NullPointerException("step returned null future"));
            }
            return f;
        } catch (RuntimeException | Error e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
