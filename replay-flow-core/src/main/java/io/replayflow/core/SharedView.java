package io.replayflow.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Handle on a {@link ReplayBuffer} that derives independent sequences from it.
 *
 * <p>Every sequence derived here reads the same buffer through its own cursor, starting at
 * index 0. However many forks and branches drain it, the upstream behind the buffer runs once,
 * and every reader sees the same elements in the same order, followed by the same completion or
 * failure.
 *
 * @param <T> element type
 * @see LazySequence#share()
 */
public final class SharedView<T> {

    private final ReplayBuffer<T> buffer;

    SharedView(ReplayBuffer<T> buffer) {
        this.buffer = buffer;
    }

    /**
     * Wraps an existing buffer.
     */
    public static <T> SharedView<T> over(ReplayBuffer<T> buffer) {
        return new SharedView<>(Objects.requireNonNull(buffer, "buffer"));
    }

    /**
     * An independent reader replaying the buffer from the start.
     */
    public LazySequence<T> fork() {
        return LazySequence.from(() -> new CursorUpstream<T>(buffer, null));
    }

    /**
     * {@code count} independent forks.
     */
    public List<LazySequence<T>> fork(int count) {
        if (count <= 0) throw new IllegalArgumentException("count must be positive");
        List<LazySequence<T>> forks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            forks.add(fork());
        }
        return Collections.unmodifiableList(forks);
    }

    /**
     * Splits the buffer in two by {@code predicate}. Each element is delivered to exactly one side,
     * and each side keeps the original relative order.
     */
    public Branches<T> branch(Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new Branches<>(
                LazySequence.from(() -> new CursorUpstream<T>(buffer, v -> predicate.test(v))),
                LazySequence.from(() -> new CursorUpstream<T>(buffer, v -> !predicate.test(v))));
    }

    public <R> LazySequence<R> map(Function<? super T, ? extends R> selector) {
        return fork().map(selector);
    }

    public LazySequence<T> filter(Predicate<? super T> predicate) {
        return fork().filter(predicate);
    }

    public LazySequence<T> asSequence() {
        return fork();
    }

    public ReplayBuffer<T> buffer() {
        return buffer;
    }

    /**
     * The two sides of a {@link #branch(Predicate)}.
     *
     * @param trueSide elements matching the predicate
     * @param falseSide elements not matching the predicate
     */
    public record Branches<T>(LazySequence<T> trueSide, LazySequence<T> falseSide) {
        public Branches {
            Objects.requireNonNull(trueSide, "trueSide");
            Objects.requireNonNull(falseSide, "falseSide");
        }
    }
}
