package io.replayflow.reactor;

import io.replayflow.core.LazySequence;
import io.replayflow.reactive.FlowSequences;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;

/**
 * Reactor conversions for {@link LazySequence}.
 */
public final class ReactorSequences {
    private ReactorSequences() {
    }

    /**
     * A cold {@link Flux}: each subscription runs one iteration of {@code sequence}.
     */
    public static <T> Flux<T> toFlux(LazySequence<T> sequence) {
        return Flux.from(FlowSequences.toReactiveStreams(sequence));
    }

    public static <T> LazySequence<T> fromPublisher(Publisher<T> publisher) {
        return FlowSequences.fromReactiveStreams(publisher);
    }
}
