package io.replayflow.core.sync;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Sliding and striding windows over an {@link Iterable}.
 *
 * <pre>{@code
 * for (Window<Integer> w : Windows.windows(List.of(1, 2, 3, 4, 5), 3, 2, true, false)) {
 *     // [1, 2, 3], [3, 4, 5], [5] (partial)
 * }
 * }</pre>
 */
public final class Windows {
    private Windows() {
    }

    public static <T> Iterable<Window<T>> windows(Iterable<? extends T> source, int size) {
        return windows(source, size, 1, false, false);
    }

    public static <T> Iterable<Window<T>> windows(Iterable<? extends T> source, int size, int stride) {
        return windows(source, size, stride, false, false);
    }

    /**
     * Windows of {@code size} elements, each starting {@code stride} elements after the previous.
     * When {@code stride} exceeds {@code size} the elements between two windows are skipped, so
     * over {@code 1..6} with size 2 and stride 3 the windows are {@code [1, 2]} and {@code [4, 5]}.
     * Elements must not be {@code null}; a {@code null} element fails iteration with a
     * {@link NullPointerException}.
     *
     * @param includePartial yield a trailing window shorter than {@code size}
     * @param reuseBuffer reuse one backing array for every full window; callers must copy
     *                    ({@link Window#toList()}) what they keep
     */
    public static <T> Iterable<Window<T>> windows(Iterable<? extends T> source, int size, int stride,
                                                  boolean includePartial, boolean reuseBuffer) {
        Objects.requireNonNull(source, "source");
        if (size <= 0) throw new IllegalArgumentException("size must be positive");
        if (stride <= 0) throw new IllegalArgumentException("stride must be positive");
        return () -> new WindowIterator<>(source.iterator(), size, stride, includePartial, reuseBuffer);
    }

    private static final class WindowIterator<T> implements Iterator<Window<T>> {
        private final Iterator<? extends T> source;
        private final int size;
        private final int stride;
        private final boolean includePartial;
        private final Object[] shared;
        private final ArrayDeque<T> queue;
        private boolean primed;
        private boolean done;
        private Window<T> next;

        private WindowIterator(Iterator<? extends T> source, int size, int stride, boolean includePartial, boolean reuseBuffer) {
            this.source = source;
            this.size = size;
            this.stride = stride;
            this.includePartial = includePartial;
            this.shared = reuseBuffer ? new Object[size] : null;
            this.queue = new ArrayDeque<>(size);
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) {
                next = compute();
            }
            return next != null;
        }

        @Override
        public Window<T> next() {
            if (!hasNext()) throw new NoSuchElementException();
            Window<T> w = next;
            next = null;
            return w;
        }

        private Window<T> compute() {
            if (primed) {
                for (int i = 0; i < stride && !queue.isEmpty(); i++) {
                    queue.poll();
                }
                if (stride > size) {
                    skip(stride - size);
                }
            }
            primed = true;
            fill();
            if (queue.size() == size) {
                return window(false);
            }
            done = true;
            if (includePartial && !queue.isEmpty()) {
                return window(true);
            }
            return null;
        }

        private void fill() {
            while (queue.size() < size && source.hasNext()) {
                queue.add(Objects.requireNonNull(source.next(), "null element"));
            }
        }

        private void skip(int n) {
            for (int i = 0; i < n && source.hasNext(); i++) {
                source.next();
            }
        }

        private Window<T> window(boolean partial) {
            if (shared != null && !partial) {
                queue.toArray(shared);
                return new Window<>(shared, size, false, true);
            }
            return new Window<>(queue.toArray(), queue.size(), partial, false);
        }
    }

    /**
     * A full window, or a trailing partial one.
     */
    public static final class Window<T> implements Iterable<T> {
        private final Object[] buffer;
        private final int count;
        private final boolean partial;
        private final boolean reused;

        Window(Object[] buffer, int count, boolean partial, boolean reused) {
            this.buffer = buffer;
            this.count = count;
            this.partial = partial;
            this.reused = reused;
        }

        public int size() {
            return count;
        }

        @SuppressWarnings("unchecked")
        public T get(int index) {
            Objects.checkIndex(index, count);
            return (T) buffer[index];
        }

        public boolean isPartial() {
            return partial;
        }

        /**
         * True when the backing array is shared with later windows.
         */
        public boolean isBufferReused() {
            return reused;
        }

        /**
         * Copies the window; safe to keep even when the buffer is reused.
         */
        @SuppressWarnings("unchecked")
        public List<T> toList() {
            List<Object> copy = List.of(Arrays.copyOf(buffer, count));
            return (List<T>) (List<?>) copy;
        }

        @Override
        public Iterator<T> iterator() {
            return toList().iterator();
        }

        @Override
        public String toString() {
            return (partial ? "Window(partial)" : "Window") + Arrays.toString(Arrays.copyOf(buffer, count));
        }
    }
}
