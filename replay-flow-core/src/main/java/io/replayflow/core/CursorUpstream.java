package io.replayflow.core;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Reads a {@link ReplayBuffer} from index 0 with a private cursor.
 *
 * <p>Elements rejected by {@code admit} are skipped. The buffer owns the real upstream, so
 * disposing a cursor releases nothing.
 */
final class CursorUpstream<T> implements Upstream<T> {

    private final ReplayBuffer<T> buffer;
    private final Predicate<? super T> admit;
    private int cursor;

    CursorUpstream(ReplayBuffer<T> buffer, Predicate<? super T> admit) {
        this.buffer = buffer;
        this.admit = admit;
    }

    @Override
    public CompletableFuture<Optional<T>> advance() {
        if (admit == null) {
            return read();
        }
        return Loops.repeatUntil(this::read, next -> next.isEmpty() || admit.test(next.get()));
    }

    private CompletableFuture<Optional<T>> read() {
        int index = cursor;
        return Futures.derive(buffer.tryGet(index), available -> {
            if (!available) {
                return Optional.empty();
            }
            T value = buffer.get(index);
            cursor = index + 1;
            return Optional.of(value);
        });
    }

    @Override
    public void dispose() {
    }
}
