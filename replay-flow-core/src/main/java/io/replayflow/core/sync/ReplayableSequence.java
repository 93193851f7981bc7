package io.replayflow.core.sync;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * On-demand buffer over an {@link Iterable} that supports any number of independent cursors.
 *
 * <p>Elements are pulled from the source only when a cursor first asks for them, and each source
 * element is pulled at most once. Cursors are immutable positions: advancing returns a new cursor,
 * so lookahead, backtracking and forking are free.
 *
 * <p>Not thread-safe.
 *
 * @param <T> element type
 */
public final class ReplayableSequence<T> {

    private final List<T> buffer = new ArrayList<>();
    private Iterator<? extends T> source;

    private ReplayableSequence(Iterator<? extends T> source) {
        this.source = source;
    }

    public static <T> ReplayableSequence<T> from(Iterable<? extends T> source) {
        Objects.requireNonNull(source, "source");
        return new ReplayableSequence<>(source.iterator());
    }

    /**
     * A cursor at position 0.
     */
    public Cursor<T> cursor() {
        return new Cursor<>(this, 0);
    }

    /**
     * Iterates the whole sequence from the start; buffered elements are reused.
     */
    public Iterable<T> iterable() {
        return cursor().iterable();
    }

    public Stream<T> stream() {
        return cursor().stream();
    }

    int buffered() {
        return buffer.size();
    }

    boolean ensureBuffered(int index) {
        if (index < 0) return false;
        if (index < buffer.size()) return true;
        if (source == null) return false;

        while (index >= buffer.size()) {
            if (!source.hasNext()) {
                release();
                return false;
            }
            buffer.add(Objects.requireNonNull(source.next(), "null element"));
        }
        return true;
    }

    private void release() {
        Iterator<? extends T> s = source;
        source = null;
        if (s instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                throw new IllegalStateException("failed to close source", e);
            }
        }
    }

    /**
     * An element and the cursor positioned after it.
     */
    public record Step<T>(T value, Cursor<T> next) {
    }

    /**
     * Immutable read position inside a {@link ReplayableSequence}.
     */
    public static final class Cursor<T> {
        private final ReplayableSequence<T> owner;
        private final int index;

        private Cursor(ReplayableSequence<T> owner, int index) {
            this.owner = owner;
            this.index = index;
        }

        public int position() {
            return index;
        }

        /**
         * An independent cursor at the same position.
         */
        public Cursor<T> fork() {
            return new Cursor<>(owner, index);
        }

        /**
         * Reads the element at this position, returning it with the advanced cursor.
         */
        public Optional<Step<T>> tryNext() {
            if (!owner.ensureBuffered(index)) return Optional.empty();
            return Optional.of(new Step<>(owner.buffer.get(index), new Cursor<>(owner, index + 1)));
        }

        public Optional<T> peek() {
            return lookahead(0);
        }

        /**
         * The element {@code offset} positions ahead, without moving.
         */
        public Optional<T> lookahead(int offset) {
            if (offset < 0) throw new IllegalArgumentException("offset must be non-negative");
            int target = index + offset;
            return owner.ensureBuffered(target) ? Optional.of(owner.buffer.get(target)) : Optional.empty();
        }

        /**
         * Iterates from this position forward; this cursor itself does not move.
         */
        public Iterable<T> iterable() {
            return () -> new Iterator<T>() {
                private Cursor<T> at = Cursor.this;

                @Override
                public boolean hasNext() {
                    return at.owner.ensureBuffered(at.index);
                }

                @Override
                public T next() {
                    Step<T> step = at.tryNext().orElseThrow(NoSuchElementException::new);
                    at = step.next();
                    return step.value();
                }
            };
        }

        public Stream<T> stream() {
            return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterable().iterator(), Spliterator.ORDERED), false);
        }

        /**
         * Fixed-size chunks from this position; the last chunk may be smaller.
         */
        public Iterable<List<T>> batch(int size) {
            if (size <= 0) throw new IllegalArgumentException("size must be positive");
            return () -> new Iterator<List<T>>() {
                private final Iterator<T> source = iterable().iterator();

                @Override
                public boolean hasNext() {
                    return source.hasNext();
                }

                @Override
                public List<T> next() {
                    if (!source.hasNext()) throw new NoSuchElementException();
                    List<T> chunk = new ArrayList<>(size);
                    while (chunk.size() < size && source.hasNext()) {
                        chunk.add(source.next());
                    }
                    return List.copyOf(chunk);
                }
            };
        }
    }
}
