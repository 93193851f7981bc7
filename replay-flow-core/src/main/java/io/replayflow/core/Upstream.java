package io.replayflow.core;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Single-pass asynchronous producer of elements.
 *
 * <p>An upstream is driven by exactly one logical consumer. The consumer calls {@link #advance()},
 * waits for the returned future to complete, and only then calls {@link #advance()} again.
 * Implementations therefore need no internal synchronization beyond what their own I/O requires.
 *
 * <p>The future returned by {@link #advance()} completes with:
 * <ul>
 *   <li>a present value: the next element (elements are never {@code null})</li>
 *   <li>{@link Optional#empty()}: the sequence is exhausted</li>
 *   <li>exceptionally: the upstream failed; no further elements follow</li>
 * </ul>
 *
 * <p>{@link #dispose()} is invoked at most once by the owner, either after exhaustion, after a
 * failure, or when the consumer abandons the sequence early.
 *
 * @param <T> element type
 * @see Upstreams
 */
public interface Upstream<T> {

    /**
     * Requests the next element.
     *
     * @return future completing with the next element, empty on exhaustion, or exceptionally
     */
    CompletableFuture<Optional<T>> advance();

    /**
     * Releases resources held by this upstream.
     *
     * @throws Exception if cleanup fails; owners treat this as advisory
     */
    void dispose() throws Exception;
}
