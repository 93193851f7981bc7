/**
 * Lazy asynchronous sequences with replayed multicast.
 *
 * <p>{@link io.replayflow.core.LazySequence} composes deferred pipelines over an
 * {@link io.replayflow.core.Upstream}. {@link io.replayflow.core.LazySequence#share()} places a
 * single iteration behind a {@link io.replayflow.core.ReplayBuffer}, and the returned
 * {@link io.replayflow.core.SharedView} forks or branches it into independent readers that never
 * re-run the upstream.
 */
package io.replayflow.core;
