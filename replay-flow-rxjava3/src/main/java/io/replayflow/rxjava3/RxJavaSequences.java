package io.replayflow.rxjava3;

import io.reactivex.rxjava3.core.Flowable;
import io.replayflow.core.LazySequence;
import io.replayflow.reactive.FlowSequences;
import org.reactivestreams.Publisher;

/**
 * RxJava3 conversions for {@link LazySequence}.
 */
public final class RxJavaSequences {
    private RxJavaSequences() {
    }

    /**
     * A cold {@link Flowable}: each subscription runs one iteration of {@code sequence}.
     */
    public static <T> Flowable<T> toFlowable(LazySequence<T> sequence) {
        return Flowable.fromPublisher(FlowSequences.toReactiveStreams(sequence));
    }

    public static <T> LazySequence<T> fromPublisher(Publisher<T> publisher) {
        return FlowSequences.fromReactiveStreams(publisher);
    }
}
