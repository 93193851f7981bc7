package io.replayflow.reactive;

import io.replayflow.core.LazySequence;
import org.reactivestreams.FlowAdapters;

import java.util.Objects;
import java.util.concurrent.Flow;

/**
 * Conversions between {@link LazySequence} and reactive publishers.
 *
 * <p>A sequence built from a publisher subscribes again on every iteration, so cold publishers
 * replay and hot publishers continue from wherever they are. Share the sequence to have forks read
 * one subscription.
 */
public final class FlowSequences {
    private FlowSequences() {}

    public static <T> Flow.Publisher<T> toPublisher(LazySequence<T> sequence) {
        return new SequencePublisher<>(sequence);
    }

    public static <T> LazySequence<T> fromPublisher(Flow.Publisher<? extends T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return LazySequence.from(() -> new PublisherUpstream<T>(publisher));
    }

    /**
     * Reactive Streams view of {@link #toPublisher(LazySequence)}, for libraries that predate
     * {@link Flow}.
     */
    public static <T> org.reactivestreams.Publisher<T> toReactiveStreams(LazySequence<T> sequence) {
        return FlowAdapters.toPublisher(toPublisher(sequence));
    }

    public static <T> LazySequence<T> fromReactiveStreams(org.reactivestreams.Publisher<T> publisher) {
        Objects.requireNonNull(publisher, "publisher");
        return fromPublisher(FlowAdapters.toFlowPublisher(publisher));
    }
}
