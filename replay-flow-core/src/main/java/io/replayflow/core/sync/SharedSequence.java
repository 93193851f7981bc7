package io.replayflow.core.sync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Forks and branches over a {@link ReplayableSequence}; the source is pulled at most once.
 *
 * @param <T> element type
 */
public final class SharedSequence<T> {

    private final ReplayableSequence<T> sequence;

    SharedSequence(ReplayableSequence<T> sequence) {
        this.sequence = sequence;
    }

    public SyncSequence<T> fork() {
        return SyncSequence.from(sequence.cursor().iterable());
    }

    public List<SyncSequence<T>> fork(int count) {
        if (count <= 0) throw new IllegalArgumentException("count must be positive");
        List<SyncSequence<T>> forks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            forks.add(fork());
        }
        return Collections.unmodifiableList(forks);
    }

    public Branches<T> branch(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new Branches<>(fork().filter(predicate), fork().filter(v -> !predicate.test(v)));
    }

    public <R> SyncSequence<R> map(Function<? super T, ? extends R> selector) {
        return fork().map(selector);
    }

    public SyncSequence<T> filter(Predicate<? super T> predicate) {
        return fork().filter(predicate);
    }

    public SyncSequence<T> asSequence() {
        return fork();
    }

    public record Branches<T>(SyncSequence<T> trueSide, SyncSequence<T> falseSide) {
    }
}
