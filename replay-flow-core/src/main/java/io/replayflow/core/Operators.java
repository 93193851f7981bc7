package io.replayflow.core;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Upstream decorators behind the {@link LazySequence} composition operators.
 *
 * <p>Each decorator owns its source for one iteration and disposes it with itself.
 */
final class Operators {
    private Operators() {
    }

    static final class Mapped<T, R> implements Upstream<R> {
        private final Upstream<T> source;
        private final Function<? super T, ? extends R> selector;

        Mapped(Upstream<T> source, Function<? super T, ? extends R> selector) {
            this.source = source;
            this.selector = selector;
        }

        @Override
        public CompletableFuture<Optional<R>> advance() {
            return Futures.derive(source.advance(),
                    next -> next.map(v -> Objects.requireNonNull(selector.apply(v), "selector returned null")));
        }

        @Override
        public void dispose() throws Exception {
            source.dispose();
        }
    }

    static final class Filtered<T> implements Upstream<T> {
        private final Upstream<T> source;
        private final Predicate<? super T> predicate;

        Filtered(Upstream<T> source, Predicate<? super T> predicate) {
            this.source = source;
            this.predicate = predicate;
        }

        @Override
        public CompletableFuture<Optional<T>> advance() {
            return Loops.repeatUntil(source::advance, next -> next.isEmpty() || predicate.test(next.get()));
        }

        @Override
        public void dispose() throws Exception {
            source.dispose();
        }
    }

    static final class Tapped<T> implements Upstream<T> {
        private final Upstream<T> source;
        private final Consumer<? super T> effect;

        Tapped(Upstream<T> source, Consumer<? super T> effect) {
            this.source = source;
            this.effect = effect;
        }

        @Override
        public CompletableFuture<Optional<T>> advance() {
            return Futures.derive(source.advance(), next -> {
                next.ifPresent(effect);
                return next;
            });
        }

        @Override
        public void dispose() throws Exception {
            source.dispose();
        }
    }

    /**
     * Depth-first flattening: the current inner upstream is drained and disposed before the next
     * outer element is pulled.
     */
    static final class Flattened<T, R> implements Upstream<R> {
        private final Upstream<T> outer;
        private final Function<? super T, ? extends LazySequence<? extends R>> selector;
        private Upstream<? extends R> inner;

        Flattened(Upstream<T> outer, Function<? super T, ? extends LazySequence<? extends R>> selector) {
            this.outer = outer;
            this.selector = selector;
        }

        @Override
        public CompletableFuture<Optional<R>> advance() {
            return Loops.repeatUntil(this::step, Objects::nonNull);
        }

        // completes with null when the loop has to pull again
        private CompletableFuture<Optional<R>> step() {
            Upstream<? extends R> current = inner;
            if (current != null) {
                return Futures.derive(current.advance(), next -> {
                    if (next.isPresent()) {
                        return Optional.<R>of(next.get());
                    }
                    inner = null;
                    Disposal.quietly(current);
                    return null;
                });
            }
            return Futures.derive(outer.advance(), next -> {
                if (next.isEmpty()) {
                    return Optional.<R>empty();
                }
                LazySequence<? extends R> sequence = Objects.requireNonNull(selector.apply(next.get()), "selector returned null");
                inner = sequence.open();
                return null;
            });
        }

        @Override
        public void dispose() throws Exception {
            Upstream<? extends R> current = inner;
            inner = null;
            Disposal.quietly(current);
            outer.dispose();
        }
    }
}
