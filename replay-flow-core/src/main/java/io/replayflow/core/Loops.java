package io.replayflow.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Trampolined asynchronous loop.
 *
 * <p>Steps that complete synchronously are handled in a plain {@code while} loop, so a filter
 * skipping a million already-available elements runs in constant stack depth. Only a step that is
 * still pending when returned hands the loop over to its completion callback.
 */
final class Loops {
    private Loops() {
    }

    /**
     * Repeats {@code step} until {@code stop} accepts a step result, which becomes the result.
     *
     * <p>A failed step or a throwing {@code stop} completes the result exceptionally. Cancelling the
     * result cancels the step in flight and ends the loop.
     */
    static <S> CompletableFuture<S> repeatUntil(Supplier<? extends CompletableFuture<S>> step, Predicate<? super S> stop) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(stop, "stop");
        CompletableFuture<S> result = new CompletableFuture<>();
        AtomicReference<CompletableFuture<S>> inFlight = new AtomicReference<>();
        result.whenComplete((ignored, error) -> {
            CompletableFuture<S> pending = inFlight.get();
            if (result.isCancelled() && pending != null && !pending.isDone()) {
                pending.cancel(false);
            }
        });
        run(step, stop, result, inFlight);
        return result;
    }

    private static <S> void run(Supplier<? extends CompletableFuture<S>> step,
                                Predicate<? super S> stop,
                                CompletableFuture<S> result,
                                AtomicReference<CompletableFuture<S>> inFlight) {
        while (!result.isDone()) {
            CompletableFuture<S> f = Futures.invoke(step);
            if (!f.isDone()) {
                inFlight.set(f);
                if (result.isCancelled()) {
                    f.cancel(false);
                    return;
                }
                f.whenComplete((value, error) -> {
                    if (error != null) {
                        result.completeExceptionally(Futures.unwrap(error));
                    } else if (accept(stop, value, result)) {
                        run(step, stop, result, inFlight);
                    }
                });
                return;
            }
            S value;
            try {
                value = f.join();
            } catch (RuntimeException e) {
                result.completeExceptionally(Futures.unwrap(e));
                return;
            }
            if (!accept(stop, value, result)) {
                return;
            }
        }
    }

    /**
     * Returns {@code true} when the loop should continue.
     */
    private static <S> boolean accept(Predicate<? super S> stop, S value, CompletableFuture<S> result) {
        try {
            if (stop.test(value)) {
                result.complete(value);
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return false;
        }
    }
}
