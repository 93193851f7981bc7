package io.replayflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Thread-safe replay buffer over a single-pass {@link Upstream}.
 *
 * <p>The upstream is advanced at most once per element, no matter how many readers ask for it.
 * Every element is appended to an in-memory log and served by index to any number of concurrent
 * readers, so all readers observe the same values in the same order, followed by the same
 * completion or the same failure.
 *
 * <p>Reading is a two-step protocol:
 * <pre>{@code
 * buffer.tryGet(i).thenApply(available -> available ? buffer.get(i) : null);
 * }</pre>
 *
 * <p>A reader asking for an index past the tail registers a waiter. The reader that finds the
 * buffer {@link State#IDLE idle} is elected producer and advances the upstream outside the lock;
 * everyone else waits. Publishing the result (append, completion or failure) and detaching the
 * wait list happen in one critical section; the detached waiters are woken after the lock is
 * released. A woken reader resumes on {@link ReplayOptions#executor()}, re-checks its own index
 * and, if it is still ahead of the tail, waits for the next round. If the executor rejects the
 * resumption, that reader's future fails with the {@link RejectedExecutionException}.
 *
 * <p>Cancelling (or timing out) the future returned by {@link #tryGet(int)} only unwinds that
 * reader. The producer, the log and the other waiters are unaffected.
 *
 * <p>The log grows for the lifetime of the buffer; there is no eviction.
 *
 * @param <T> element type
 */
public final class ReplayBuffer<T> {

    private static final Logger log = LoggerFactory.getLogger(ReplayBuffer.class);

    /**
     * Lifecycle of the buffer. {@link #COMPLETE} and {@link #FAILED} are terminal.
     */
    public enum State {
        /** No advance in flight; the next waiter to arrive becomes the producer. */
        IDLE,
        /** A producer is advancing the upstream. */
        PRODUCING,
        /** The upstream is exhausted and disposed. */
        COMPLETE,
        /** The upstream failed and is disposed; the failure is replayed to readers past the tail. */
        FAILED
    }

    private enum Signal {
        PROCEED,
        EXHAUSTED
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Supplier<? extends Upstream<T>> opener;
    private final Executor executor;

    // guarded by lock
    private final ArrayList<T> elements;
    private final List<Waiter> waiters = new ArrayList<>();
    private State state = State.IDLE;
    private Throwable failure;

    // published copy of elements.size() for the lock-free fast path
    private volatile int size;

    // only touched by the elected producer; handed over through the lock
    private Upstream<T> source;

    ReplayBuffer(Supplier<? extends Upstream<T>> opener, ReplayOptions options) {
        this.opener = Objects.requireNonNull(opener, "opener");
        Objects.requireNonNull(options, "options");
        this.executor = options.executor();
        this.elements = new ArrayList<>(options.initialCapacity());
    }

    /**
     * Creates a buffer owning {@code source}. The buffer disposes it once it completes or fails.
     */
    public static <T> ReplayBuffer<T> over(Upstream<T> source) {
        return over(source, ReplayOptions.defaults());
    }

    public static <T> ReplayBuffer<T> over(Upstream<T> source, ReplayOptions options) {
        Objects.requireNonNull(source, "source");
        return new ReplayBuffer<>(() -> source, options);
    }

    /**
     * Waits until {@code index} is buffered.
     *
     * @param index zero-based element index
     * @return future completing with {@code true} when {@link #get(int)} will succeed for
     *         {@code index}, {@code false} when the upstream ended before it, or exceptionally with
     *         the upstream failure. Negative indices complete with {@code false}.
     */
    public CompletableFuture<Boolean> tryGet(int index) {
        if (index < 0) return CompletableFuture.completedFuture(false);
        if (index < size) return CompletableFuture.completedFuture(true);

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        AtomicReference<Waiter> current = new AtomicReference<>();
        result.whenComplete((ignored, error) -> {
            Waiter w = current.get();
            if (result.isCancelled() && w != null) {
                w.cancel();
            }
        });
        await(index, result, current);
        return result;
    }

    /**
     * Returns a buffered element without suspending.
     *
     * @throws ReplayFlowException.ElementNotBuffered if {@code index} was never confirmed by {@link #tryGet(int)}
     * @throws ReplayFlowException.UpstreamFailed wrapping a checked upstream failure when
     *         {@code index} lies past the point of failure; unchecked failures are rethrown as-is
     */
    public T get(int index) {
        lock.lock();
        try {
            if (index >= 0 && index < elements.size()) {
                return elements.get(index);
            }
            if (failure != null) {
                if (failure instanceof RuntimeException re) throw re;
                if (failure instanceof Error err) throw err;
                throw new ReplayFlowException.UpstreamFailed(failure);
            }
            throw new ReplayFlowException.ElementNotBuffered(index, elements.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of buffered elements.
     */
    public int size() {
        return size;
    }

    public State state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isComplete() {
        State s = state();
        return s == State.COMPLETE || s == State.FAILED;
    }

    /**
     * The captured upstream failure, if the buffer failed.
     */
    public Optional<Throwable> failure() {
        lock.lock();
        try {
            return Optional.ofNullable(failure);
        } finally {
            lock.unlock();
        }
    }

    int pendingWaiters() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    private void await(int index, CompletableFuture<Boolean> result, AtomicReference<Waiter> current) {
        while (!result.isDone()) {
            Waiter waiter;
            boolean producer;
            lock.lock();
            try {
                if (index < elements.size()) {
                    result.complete(true);
                    return;
                }
                if (state == State.FAILED) {
                    result.completeExceptionally(failure);
                    return;
                }
                if (state == State.COMPLETE) {
                    result.complete(false);
                    return;
                }
                waiter = new Waiter(index);
                waiters.add(waiter);
                producer = state == State.IDLE;
                if (producer) {
                    state = State.PRODUCING;
                }
            } finally {
                lock.unlock();
            }

            current.set(waiter);
            if (result.isCancelled()) {
                waiter.cancel();
            }
            if (producer) {
                produce();
            }

            CompletableFuture<Signal> signal = waiter.signal;
            if (!signal.isDone()) {
                signal.whenComplete((s, error) -> resume(index, result, current, s, error));
                return;
            }

            Signal s = null;
            Throwable error = null;
            try {
                s = signal.join();
            } catch (CancellationException | CompletionException e) {
                error = e;
            }
            if (!settle(result, s, error)) {
                return;
            }
        }
    }

    /**
     * Continues a suspended reader on the wake-up executor. A rejected hand-off fails that reader.
     */
    private void resume(int index, CompletableFuture<Boolean> result, AtomicReference<Waiter> current,
                        Signal signal, Throwable error) {
        try {
            executor.execute(() -> {
                if (settle(result, signal, error)) {
                    await(index, result, current);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
    }

    /**
     * Applies a waiter resolution to the reader's future; returns {@code true} when the reader
     * has to re-check its index.
     */
    private static boolean settle(CompletableFuture<Boolean> result, Signal signal, Throwable error) {
        if (error != null) {
            if (!(error instanceof CancellationException)) {
                result.completeExceptionally(Futures.unwrap(error));
            }
            return false;
        }
        if (signal == Signal.EXHAUSTED) {
            result.complete(false);
            return false;
        }
        return !result.isDone();
    }

    private void produce() {
        CompletableFuture<Optional<T>> step;
        try {
            if (source == null) {
                source = Objects.requireNonNull(opener.get(), "upstream");
            }
            step = Objects.requireNonNull(source.advance(), "advance() returned null");
        } catch (Throwable t) {
            step = CompletableFuture.failedFuture(t);
        }
        step.whenComplete(this::publish);
    }

    private void publish(Optional<T> next, Throwable error) {
        List<Waiter> ready;
        if (error == null && next != null && next.isPresent()) {
            lock.lock();
            try {
                elements.add(next.get());
                size = elements.size();
                state = State.IDLE;
                ready = drainWaiters();
            } finally {
                lock.unlock();
            }
            // woken readers may be elected and advance the upstream, so never under the lock
            for (Waiter w : ready) {
                w.signal.complete(Signal.PROCEED);
            }
            return;
        }

        Throwable cause = null;
        if (error != null) {
            cause = Futures.unwrap(error);
        } else if (next == null) {
            cause = new NullPointerException("advance() completed with null");
        }

        disposeSource();

        lock.lock();
        try {
            if (cause == null) {
                state = State.COMPLETE;
                log.debug("Upstream exhausted after {} elements", elements.size());
            } else {
                failure = cause;
                state = State.FAILED;
                log.debug("Upstream failed after {} elements: {}", elements.size(), cause.toString());
            }
            ready = drainWaiters();
        } finally {
            lock.unlock();
        }
        for (Waiter w : ready) {
            if (cause == null) {
                w.signal.complete(Signal.EXHAUSTED);
            } else {
                w.signal.completeExceptionally(cause);
            }
        }
    }

    private List<Waiter> drainWaiters() {
        List<Waiter> ready = new ArrayList<>(waiters);
        waiters.clear();
        return ready;
    }

    private void disposeSource() {
        Upstream<T> s = source;
        source = null;
        Disposal.quietly(s);
    }

    /**
     * One reader suspended on an index past the tail. Resolved exactly once: the first of
     * proceed, exhausted, failed or cancelled wins and later attempts are no-ops.
     */
    private static final class Waiter {
        private final int index;
        private final CompletableFuture<Signal> signal = new CompletableFuture<>();

        private Waiter(int index) {
            this.index = index;
        }

        void cancel() {
            signal.cancel(false);
        }

        @Override
        public String toString() {
            return "Waiter[index=" + index + ", done=" + signal.isDone() + "]";
        }
    }
}
