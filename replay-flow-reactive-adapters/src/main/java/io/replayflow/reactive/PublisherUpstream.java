package io.replayflow.reactive;

import io.replayflow.core.Upstream;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * {@link Upstream} pulling from a {@link Flow.Publisher} one element at a time.
 *
 * <p>The publisher is subscribed on the first {@link #advance()}; every advance requests exactly
 * one element. {@link #dispose()} cancels the subscription.
 */
public final class PublisherUpstream<T> implements Upstream<T>, Flow.Subscriber<T> {

    private final Flow.Publisher<? extends T> publisher;

    // guarded by this
    private Flow.Subscription subscription;
    private CompletableFuture<Optional<T>> pending;
    private T early;
    private boolean finished;
    private Throwable failure;
    private boolean subscribed;
    private boolean disposed;

    public PublisherUpstream(Flow.Publisher<? extends T> publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public CompletableFuture<Optional<T>> advance() {
        CompletableFuture<Optional<T>> next = new CompletableFuture<>();
        boolean subscribe;
        Flow.Subscription s;
        synchronized (this) {
            if (disposed) {
                next.cancel(false);
                return next;
            }
            if (early != null) {
                next.complete(Optional.of(early));
                early = null;
                return next;
            }
            if (failure != null) {
                next.completeExceptionally(failure);
                return next;
            }
            if (finished) {
                next.complete(Optional.empty());
                return next;
            }
            pending = next;
            subscribe = !subscribed;
            subscribed = true;
            s = subscription;
        }
        if (subscribe) {
            publisher.subscribe(this);
        } else if (s != null) {
            s.request(1);
        }
        return next;
    }

    @Override
    public void dispose() {
        Flow.Subscription s;
        CompletableFuture<Optional<T>> p;
        synchronized (this) {
            disposed = true;
            s = subscription;
            p = pending;
            pending = null;
        }
        if (s != null) {
            s.cancel();
        }
        if (p != null) {
            p.cancel(false);
        }
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        boolean cancel;
        synchronized (this) {
            cancel = disposed || this.subscription != null;
            if (!cancel) {
                this.subscription = subscription;
            }
        }
        if (cancel) {
            subscription.cancel();
            return;
        }
        subscription.request(1);
    }

    @Override
    public void onNext(T item) {
        Objects.requireNonNull(item, "item");
        CompletableFuture<Optional<T>> p;
        synchronized (this) {
            p = pending;
            pending = null;
            if (p == null) {
                early = item;
                return;
            }
        }
        p.complete(Optional.of(item));
    }

    @Override
    public void onError(Throwable throwable) {
        Objects.requireNonNull(throwable, "throwable");
        CompletableFuture<Optional<T>> p;
        synchronized (this) {
            failure = throwable;
            p = pending;
            pending = null;
        }
        if (p != null) {
            p.completeExceptionally(throwable);
        }
    }

    @Override
    public void onComplete() {
        CompletableFuture<Optional<T>> p;
        synchronized (this) {
            finished = true;
            p = pending;
            pending = null;
        }
        if (p != null) {
            p.complete(Optional.empty());
        }
    }
}
