package io.replayflow.reactive;

import io.replayflow.core.LazySequence;
import io.replayflow.core.Upstream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Flow.Publisher} over a {@link LazySequence}.
 *
 * <p>Every subscription opens a fresh iteration, so subscribing twice to a publisher over an
 * unshared sequence runs the upstream twice. Elements are pulled only against outstanding
 * demand, one advance at a time. Cancelling the subscription disposes the iteration.
 */
public final class SequencePublisher<T> implements Flow.Publisher<T> {

    private static final Logger log = LoggerFactory.getLogger(SequencePublisher.class);

    private final LazySequence<T> sequence;

    public SequencePublisher(LazySequence<T> sequence) {
        this.sequence = Objects.requireNonNull(sequence, "sequence");
    }

    @Override
    public void subscribe(Flow.Subscriber<? super T> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        Upstream<T> upstream;
        try {
            upstream = sequence.open();
        } catch (Throwable t) {
            subscriber.onSubscribe(NoopSubscription.INSTANCE);
            subscriber.onError(t);
            return;
        }
        subscriber.onSubscribe(new Sub<>(subscriber, upstream));
    }

    private enum NoopSubscription implements Flow.Subscription {
        INSTANCE;

        @Override
        public void request(long n) {
        }

        @Override
        public void cancel() {
        }
    }

    private record Completion<T>(Optional<T> value, Throwable error) {
    }

    private static final class Sub<T> implements Flow.Subscription {
        private final Flow.Subscriber<? super T> subscriber;
        private final Upstream<T> upstream;
        private final AtomicLong requested = new AtomicLong();
        private final AtomicInteger wip = new AtomicInteger();
        private final AtomicBoolean disposed = new AtomicBoolean();

        private volatile boolean cancelled;
        private volatile Completion<T> completed;
        private volatile CompletableFuture<Optional<T>> current;

        // only touched inside drain()
        private boolean inFlight;
        private boolean done;

        Sub(Flow.Subscriber<? super T> subscriber, Upstream<T> upstream) {
            this.subscriber = subscriber;
            this.upstream = upstream;
        }

        @Override
        public void request(long n) {
            if (n <= 0) {
                cancel();
                subscriber.onError(new IllegalArgumentException("non-positive request: " + n));
                return;
            }
            requested.getAndUpdate(r -> {
                long sum = r + n;
                return sum < 0 ? Long.MAX_VALUE : sum;
            });
            drain();
        }

        @Override
        public void cancel() {
            cancelled = true;
            CompletableFuture<Optional<T>> f = current;
            if (f != null && !f.isDone()) {
                f.cancel(false);
            }
            dispose();
        }

        private void dispose() {
            if (disposed.compareAndSet(false, true)) {
                try {
                    upstream.dispose();
                } catch (Exception e) {
                    log.warn("Ignoring upstream disposal failure", e);
                }
            }
        }

        private void drain() {
            if (wip.getAndIncrement() != 0) return;
            int missed = 1;
            for (;;) {
                while (!cancelled && !done) {
                    Completion<T> c = completed;
                    if (c != null) {
                        completed = null;
                        inFlight = false;
                        Throwable error = c.error();
                        if (error == null && c.value() == null) {
                            error = new NullPointerException("advance() completed with null");
                        }
                        if (error != null) {
                            done = true;
                            dispose();
                            subscriber.onError(unwrap(error));
                            break;
                        }
                        if (c.value().isEmpty()) {
                            done = true;
                            dispose();
                            subscriber.onComplete();
                            break;
                        }
                        subscriber.onNext(c.value().get());
                        if (requested.get() != Long.MAX_VALUE) {
                            requested.decrementAndGet();
                        }
                        continue;
                    }
                    if (inFlight || requested.get() == 0) break;

                    inFlight = true;
                    CompletableFuture<Optional<T>> f;
                    try {
                        f = Objects.requireNonNull(upstream.advance(), "advance() returned null");
                    } catch (Throwable t) {
                        f = CompletableFuture.failedFuture(t);
                    }
                    current = f;
                    f.whenComplete((value, error) -> {
                        completed = new Completion<>(value, error);
                        drain();
                    });
                }
                missed = wip.addAndGet(-missed);
                if (missed == 0) break;
            }
        }

        private static Throwable unwrap(Throwable t) {
            return t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        }
    }
}
