package io.replayflow.core;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Factories for {@link Upstream} instances.
 */
public final class Upstreams {
    private Upstreams() {
    }

    /**
     * A blocking step producing the next element, or empty when exhausted.
     */
    @FunctionalInterface
    public interface BlockingStep<T> {
        Optional<T> next() throws Exception;
    }

    public static <T> Upstream<T> empty() {
        return fromIterable(List.of());
    }

    @SafeVarargs
    public static <T> Upstream<T> of(T... elements) {
        Objects.requireNonNull(elements, "elements");
        return fromIterable(Arrays.asList(elements));
    }

    /**
     * Upstream whose every advance completes immediately from {@code iterable.iterator()}.
     */
    public static <T> Upstream<T> fromIterable(Iterable<? extends T> iterable) {
        Objects.requireNonNull(iterable, "iterable");
        return new IteratorUpstream<>(iterable.iterator());
    }

    /**
     * Upstream whose first advance fails with {@code error}.
     */
    public static <T> Upstream<T> failed(Throwable error) {
        Objects.requireNonNull(error, "error");
        return new Upstream<>() {
            @Override
            public CompletableFuture<Optional<T>> advance() {
                return CompletableFuture.failedFuture(error);
            }

            @Override
            public void dispose() {
            }
        };
    }

    /**
     * Runs a blocking iterator on its own executor, one {@code next()} per advance. The executor
     * is shut down on dispose; an {@link AutoCloseable} iterator is closed.
     */
    public static <T> Upstream<T> fromIterator(Iterator<? extends T> iterator) {
        Objects.requireNonNull(iterator, "iterator");
        ExecutorService executor = BlockingExecutors.forUpstream("replay-flow-upstream");
        return new BlockingUpstream<>(iteratorStep(iterator), executor, () -> {
            try {
                closeIfCloseable(iterator);
            } finally {
                executor.shutdown();
            }
        });
    }

    /**
     * Runs a blocking iterator on {@code executor}, one {@code next()} per advance.
     */
    public static <T> Upstream<T> fromIterator(Iterator<? extends T> iterator, Executor executor) {
        Objects.requireNonNull(iterator, "iterator");
        return new BlockingUpstream<>(iteratorStep(iterator), executor, () -> closeIfCloseable(iterator));
    }

    /**
     * Runs {@code step} on {@code executor} for every advance. Checked exceptions thrown by the
     * step are delivered unchanged as the upstream failure.
     */
    public static <T> Upstream<T> blocking(BlockingStep<? extends T> step, Executor executor) {
        return new BlockingUpstream<>(step, executor, () -> {
        });
    }

    private static <T> BlockingStep<T> iteratorStep(Iterator<? extends T> iterator) {
        return () -> iterator.hasNext() ? Optional.of(iterator.next()) : Optional.empty();
    }

    private static void closeIfCloseable(Object candidate) throws Exception {
        if (candidate instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }

    @FunctionalInterface
    private interface Disposer {
        void dispose() throws Exception;
    }

    private static final class IteratorUpstream<T> implements Upstream<T> {
        private final Iterator<? extends T> iterator;

        private IteratorUpstream(Iterator<? extends T> iterator) {
            this.iterator = iterator;
        }

        @Override
        public CompletableFuture<Optional<T>> advance() {
            try {
                if (!iterator.hasNext()) {
                    return CompletableFuture.completedFuture(Optional.empty());
                }
                return CompletableFuture.completedFuture(Optional.of(iterator.next()));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        @Override
        public void dispose() throws Exception {
            closeIfCloseable(iterator);
        }
    }

    private static final class BlockingUpstream<T> implements Upstream<T> {
        private final BlockingStep<? extends T> step;
        private final Executor executor;
        private final Disposer disposer;

        private BlockingUpstream(BlockingStep<? extends T> step, Executor executor, Disposer disposer) {
            this.step = Objects.requireNonNull(step, "step");
            this.executor = Objects.requireNonNull(executor, "executor");
            this.disposer = disposer;
        }

        @Override
        public CompletableFuture<Optional<T>> advance() {
            CompletableFuture<Optional<T>> next = new CompletableFuture<>();
            try {
                executor.execute(() -> {
                    try {
                        Optional<? extends T> value = Objects.requireNonNull(step.next(), "step returned null");
                        next.complete(value.<T>map(v -> v));
                    } catch (Throwable t) {
                        next.completeExceptionally(t);
                    }
                });
            } catch (RejectedExecutionException e) {
                next.completeExceptionally(e);
            }
            return next;
        }

        @Override
        public void dispose() throws Exception {
            disposer.dispose();
        }
    }
}
