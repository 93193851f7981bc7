package io.replayflow.core.sync;

import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Synchronous, pull-based counterpart of {@link io.replayflow.core.LazySequence}.
 *
 * <p>Operators are deferred: nothing is pulled from the source until the sequence is iterated, and
 * every iteration re-runs the chain. {@link #share()} puts the source behind a
 * {@link ReplayableSequence} so forks and branches pull each element only once.
 *
 * <p>Not thread-safe. Confine a sequence and everything derived from it to one thread.
 *
 * @param <T> element type
 */
public final class SyncSequence<T> implements Iterable<T> {

    private final Supplier<? extends Iterator<T>> factory;

    private SyncSequence(Supplier<? extends Iterator<T>> factory) {
        this.factory = factory;
    }

    /**
     * Wraps {@code source} without copying it; each iteration calls {@code source.iterator()}.
     */
    public static <T> SyncSequence<T> from(Iterable<T> source) {
        Objects.requireNonNull(source, "source");
        return new SyncSequence<>(source::iterator);
    }

    @Override
    public Iterator<T> iterator() {
        return factory.get();
    }

    public Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }

    public <R> SyncSequence<R> map(Function<? super T, ? extends R> selector) {
        Objects.requireNonNull(selector, "selector");
        return new SyncSequence<R>(() -> stream().<R>map(selector).iterator());
    }

    public SyncSequence<T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new SyncSequence<>(() -> stream().filter(predicate).iterator());
    }

    public <R> SyncSequence<R> flatMap(Function<? super T, ? extends Iterable<? extends R>> selector) {
        Objects.requireNonNull(selector, "selector");
        return new SyncSequence<R>(() -> stream()
                .<R>flatMap(v -> StreamSupport.stream(selector.apply(v).spliterator(), false))
                .iterator());
    }

    /**
     * Runs {@code effect} on each element as it is pulled, passing the element through.
     */
    public SyncSequence<T> tap(Consumer<? super T> effect) {
        Objects.requireNonNull(effect, "effect");
        return new SyncSequence<>(() -> new Iterator<T>() {
            private final Iterator<T> source = SyncSequence.this.iterator();

            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public T next() {
                T value = source.next();
                effect.accept(value);
                return value;
            }
        });
    }

    public SharedSequence<T> share() {
        return new SharedSequence<>(ReplayableSequence.from(this));
    }

    public <A> A fold(A seed, BiFunction<A, ? super T, A> folder) {
        Objects.requireNonNull(folder, "folder");
        A acc = seed;
        for (T v : this) {
            acc = folder.apply(acc, v);
        }
        return acc;
    }

    public Optional<T> first() {
        Iterator<T> it = iterator();
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    public Optional<T> first(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        for (T v : this) {
            if (predicate.test(v)) return Optional.of(v);
        }
        return Optional.empty();
    }

    public T firstOrElse(Predicate<? super T> predicate, T fallback) {
        return first(predicate).orElse(fallback);
    }
}
