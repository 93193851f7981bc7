package io.replayflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A deferred, re-enterable recipe for an asynchronous sequence.
 *
 * <p>A {@code LazySequence} wraps a factory of {@link Upstream upstreams}. Composition operators
 * ({@link #map}, {@link #filter}, {@link #flatMap}, {@link #tap}) build new sequences without
 * running anything. Work happens only when the sequence is iterated: through {@link #open()} or a
 * terminal operation ({@link #fold}, {@link #first()}, {@link #toList()}, {@link #forEach}).
 *
 * <p>Every iteration invokes the factory again and re-runs the whole chain, side effects
 * included. To run the upstream once and consume it many times, {@link #share()} it:
 * <pre>{@code
 * SharedView<Order> orders = LazySequence.from(() -> fetchOrders())
 *         .tap(audit::record)
 *         .share();
 *
 * CompletableFuture<Long> total = orders.fork().fold(0L, (sum, o) -> sum + o.amount());
 * CompletableFuture<List<Order>> large = orders.filter(o -> o.amount() > 1_000).toList();
 * }</pre>
 *
 * <p>Terminal operations return a {@link CompletableFuture}. Cancelling it stops the iteration,
 * cancels the read in flight and disposes the upstream.
 *
 * @param <T> element type
 */
public final class LazySequence<T> {

    private final Supplier<? extends Upstream<T>> factory;

    private LazySequence(Supplier<? extends Upstream<T>> factory) {
        this.factory = factory;
    }

    /**
     * Creates a sequence that calls {@code factory} for every iteration.
     */
    public static <T> LazySequence<T> from(Supplier<? extends Upstream<T>> factory) {
        Objects.requireNonNull(factory, "factory");
        return new LazySequence<>(factory);
    }

    public static <T> LazySequence<T> fromIterable(Iterable<? extends T> iterable) {
        Objects.requireNonNull(iterable, "iterable");
        return new LazySequence<>(() -> Upstreams.fromIterable(iterable));
    }

    @SafeVarargs
    public static <T> LazySequence<T> of(T... elements) {
        return fromIterable(List.of(elements));
    }

    public static <T> LazySequence<T> empty() {
        return new LazySequence<>(Upstreams::empty);
    }

    /**
     * Starts a new iteration. The caller owns the returned upstream and must dispose it.
     */
    public Upstream<T> open() {
        return Objects.requireNonNull(factory.get(), "factory returned null upstream");
    }

    public <R> LazySequence<R> map(Function<? super T, ? extends R> selector) {
        Objects.requireNonNull(selector, "selector");
        return new LazySequence<>(() -> new Operators.Mapped<>(open(), selector));
    }

    public LazySequence<T> filter(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new LazySequence<>(() -> new Operators.Filtered<>(open(), predicate));
    }

    /**
     * Replaces each element with the elements of the sequence {@code selector} returns for it.
     * Inner sequences run to completion, in order, before the next element is pulled.
     */
    public <R> LazySequence<R> flatMap(Function<? super T, ? extends LazySequence<? extends R>> selector) {
        Objects.requireNonNull(selector, "selector");
        return new LazySequence<>(() -> new Operators.Flattened<T, R>(open(), selector));
    }

    /**
     * Runs {@code effect} on each element and passes the element through unchanged. A throwing
     * effect aborts the iteration.
     */
    public LazySequence<T> tap(Consumer<? super T> effect) {
        Objects.requireNonNull(effect, "effect");
        return new LazySequence<>(() -> new Operators.Tapped<>(open(), effect));
    }

    /**
     * Runs one iteration of this sequence through a {@link ReplayBuffer} that any number of
     * forks can read. The iteration starts on the first read.
     */
    public SharedView<T> share() {
        return share(ReplayOptions.defaults());
    }

    public SharedView<T> share(ReplayOptions options) {
        Objects.requireNonNull(options, "options");
        return new SharedView<>(new ReplayBuffer<>(this::open, options));
    }

    /**
     * Left fold over every element.
     */
    public <A> CompletableFuture<A> fold(A seed, BiFunction<A, ? super T, A> folder) {
        Objects.requireNonNull(folder, "folder");
        AtomicReference<A> acc = new AtomicReference<>(seed);
        return drain(next -> {
            if (next.isEmpty()) return true;
            acc.set(folder.apply(acc.get(), next.get()));
            return false;
        }, last -> acc.get());
    }

    /**
     * The first element, or empty for an empty sequence. Stops pulling after the first element.
     */
    public CompletableFuture<Optional<T>> first() {
        return drain(next -> true, last -> last);
    }

    /**
     * The first element matching {@code predicate}.
     */
    public CompletableFuture<Optional<T>> first(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return drain(next -> next.isEmpty() || predicate.test(next.get()), last -> last);
    }

    public CompletableFuture<List<T>> toList() {
        List<T> list = new ArrayList<>();
        return drain(next -> {
            if (next.isEmpty()) return true;
            list.add(next.get());
            return false;
        }, last -> Collections.unmodifiableList(list));
    }

    public CompletableFuture<Void> forEach(Consumer<? super T> action) {
        Objects.requireNonNull(action, "action");
        return drain(next -> {
            if (next.isEmpty()) return true;
            action.accept(next.get());
            return false;
        }, last -> null);
    }

    private <R> CompletableFuture<R> drain(Predicate<Optional<T>> stop, Function<Optional<T>, R> finish) {
        Upstream<T> upstream;
        try {
            upstream = open();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Optional<T>> loop = Loops.repeatUntil(upstream::advance, stop);
        CompletableFuture<R> result = new CompletableFuture<>();
        loop.whenComplete((last, error) -> {
            Disposal.quietly(upstream);
            if (error != null) {
                result.completeExceptionally(Futures.unwrap(error));
                return;
            }
            try {
                result.complete(finish.apply(last));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        Futures.propagateCancellation(result, loop);
        return result;
    }
}
