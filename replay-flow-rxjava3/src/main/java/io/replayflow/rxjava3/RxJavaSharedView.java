package io.replayflow.rxjava3;

import io.reactivex.rxjava3.core.Flowable;
import io.replayflow.core.SharedView;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * RxJava3 adapter over {@link SharedView}.
 */
public final class RxJavaSharedView<T> {

    private final SharedView<T> delegate;

    public RxJavaSharedView(SharedView<T> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public SharedView<T> delegate() {
        return delegate;
    }

    public Flowable<T> fork() {
        return RxJavaSequences.toFlowable(delegate.fork());
    }

    /**
     * @return two flowables, matching elements first
     */
    public List<Flowable<T>> branch(Predicate<? super T> predicate) {
        SharedView.Branches<T> branches = delegate.branch(predicate);
        return List.of(RxJavaSequences.toFlowable(branches.trueSide()), RxJavaSequences.toFlowable(branches.falseSide()));
    }
}
