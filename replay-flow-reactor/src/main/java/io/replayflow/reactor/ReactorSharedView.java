package io.replayflow.reactor;

import io.replayflow.core.SharedView;
import reactor.core.publisher.Flux;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Reactor adapter over {@link SharedView}.
 */
public final class ReactorSharedView<T> {

    private final SharedView<T> delegate;

    public ReactorSharedView(SharedView<T> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public SharedView<T> delegate() {
        return delegate;
    }

    public Flux<T> fork() {
        return ReactorSequences.toFlux(delegate.fork());
    }

    /**
     * @return matching elements as {@code T1}, the rest as {@code T2}
     */
    public Tuple2<Flux<T>, Flux<T>> branch(Predicate<? super T> predicate) {
        SharedView.Branches<T> branches = delegate.branch(predicate);
        return Tuples.of(ReactorSequences.toFlux(branches.trueSide()), ReactorSequences.toFlux(branches.falseSide()));
    }
}
