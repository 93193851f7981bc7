package io.replayflow.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ReplayBufferTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void buffersElementsAndServesThemByIndex() throws Exception {
        ScriptedUpstream<String> upstream = ScriptedUpstream.of(List.of("a", "b", "c"));
        ReplayBuffer<String> buffer = ReplayBuffer.over(upstream);

        assertThat(buffer.tryGet(2).get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(buffer.size()).isEqualTo(3);
        assertThat(buffer.get(0)).isEqualTo("a");
        assertThat(buffer.get(2)).isEqualTo("c");

        // Already buffered: answered without touching the upstream
        assertThat(buffer.tryGet(1)).isCompletedWithValue(true);
        assertThat(upstream.advances).hasValue(3);
        assertThat(buffer.state()).isEqualTo(ReplayBuffer.State.IDLE);
    }

    @Test
    void opensUpstreamOnFirstRead() throws Exception {
        AtomicInteger opened = new AtomicInteger();
        ReplayBuffer<Integer> buffer = new ReplayBuffer<>(() -> {
            opened.incrementAndGet();
            return ScriptedUpstream.of(List.of(1));
        }, ReplayOptions.defaults());

        assertThat(opened).hasValue(0);
        assertThat(buffer.tryGet(0).get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(buffer.tryGet(1).get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(opened).hasValue(1);
    }

    @Test
    void completionIsIdempotent() throws Exception {
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.of(List.of(1, 2));
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream);

        assertThat(buffer.tryGet(5).get(5, TimeUnit.SECONDS)).isFalse();
        int advances = upstream.advances.get();

        for (int i = 0; i < 10; i++) {
            assertThat(buffer.tryGet(2 + i).get(5, TimeUnit.SECONDS)).isFalse();
        }
        assertThat(upstream.advances).hasValue(advances);
        assertThat(upstream.disposals).hasValue(1);
        assertThat(buffer.state()).isEqualTo(ReplayBuffer.State.COMPLETE);
        assertThat(buffer.isComplete()).isTrue();
        assertThat(buffer.failure()).isEmpty();
    }

    @Test
    void negativeIndexIsNeverAvailable() throws Exception {
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.of(List.of(1));
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream);

        assertThat(buffer.tryGet(-1).get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(upstream.advances).hasValue(0);
    }

    @Test
    void failureIsBroadcastToPendingAndLaterReaders() throws Exception {
        IllegalStateException boom = new IllegalStateException("boom");
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.failingAfter(List.of(10, 20), boom);
        CompletableFuture<Void> gate = upstream.gate(2);
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream);

        assertThat(buffer.tryGet(1).get(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Boolean> first = buffer.tryGet(2);
        CompletableFuture<Boolean> second = buffer.tryGet(3);
        assertThat(buffer.pendingWaiters()).isEqualTo(2);

        gate.complete(null);

        ExecutionException a = catchThrowableOfType(() -> first.get(5, TimeUnit.SECONDS), ExecutionException.class);
        ExecutionException b = catchThrowableOfType(() -> second.get(5, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(a.getCause()).isSameAs(boom);
        assertThat(b.getCause()).isSameAs(boom);

        // A reader arriving after the failure sees the same error
        ExecutionException late = catchThrowableOfType(() -> buffer.tryGet(7).get(5, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(late.getCause()).isSameAs(boom);

        // Elements before the failure stay readable
        assertThat(buffer.tryGet(1).get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(buffer.get(1)).isEqualTo(20);
        assertThatThrownBy(() -> buffer.get(2)).isSameAs(boom);

        assertThat(buffer.state()).isEqualTo(ReplayBuffer.State.FAILED);
        assertThat(buffer.failure()).containsSame(boom);
        assertThat(upstream.disposals).hasValue(1);
    }

    @Test
    void checkedFailureIsWrappedOnlyWhenRethrownFromGet() throws Exception {
        IOException disk = new IOException("disk");
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(ScriptedUpstream.failingAfter(List.of(), disk));

        ExecutionException ex = catchThrowableOfType(() -> buffer.tryGet(0).get(5, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(ex.getCause()).isSameAs(disk);

        assertThatThrownBy(() -> buffer.get(0))
                .isInstanceOf(ReplayFlowException.UpstreamFailed.class)
                .hasCauseReference(disk);
    }

    @Test
    void getWithoutConfirmedIndexIsContractViolation() {
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(ScriptedUpstream.of(List.of(1)));

        assertThatThrownBy(() -> buffer.get(0))
                .isInstanceOf(ReplayFlowException.ElementNotBuffered.class)
                .hasMessageContaining("0");
    }

    @Test
    void concurrentReadersOfSameIndexShareOneAdvance() throws Exception {
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.of(List.of(1, 2, 3));
        CompletableFuture<Void> gate = upstream.gate(0);
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream);

        CompletableFuture<Boolean> a = buffer.tryGet(0);
        CompletableFuture<Boolean> b = buffer.tryGet(0);
        CompletableFuture<Boolean> c = buffer.tryGet(0);

        assertThat(buffer.state()).isEqualTo(ReplayBuffer.State.PRODUCING);
        assertThat(buffer.pendingWaiters()).isEqualTo(3);
        assertThat(upstream.advances).hasValue(1);

        gate.complete(null);

        assertThat(a.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(b.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(c.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(upstream.advances).hasValue(1);
        assertThat(buffer.pendingWaiters()).isZero();
    }

    @Test
    void cancellingOneReaderLeavesOthersWaiting() throws Exception {
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.of(List.of(1, 2, 3, 4, 5));
        CompletableFuture<Void> gate = upstream.gate(2);
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream);

        assertThat(buffer.tryGet(1).get(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<Boolean> cancelled = buffer.tryGet(2);
        CompletableFuture<Boolean> survivor = buffer.tryGet(2);

        cancelled.cancel(true);

        assertThat(cancelled).isCancelled();
        assertThat(survivor).isNotDone();
        assertThat(buffer.state()).isEqualTo(ReplayBuffer.State.PRODUCING);

        gate.complete(null);

        assertThat(survivor.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(buffer.get(2)).isEqualTo(3);

        // The buffer keeps serving new readers from the start
        assertThat(buffer.tryGet(4).get(5, TimeUnit.SECONDS)).isTrue();
        List<Integer> replay = new ArrayList<>();
        for (int i = 0; i < buffer.size(); i++) {
            replay.add(buffer.get(i));
        }
        assertThat(replay).containsExactly(1, 2, 3, 4, 5);
        assertThat(upstream.produced).hasValue(5);
    }

    @Test
    void timeoutIsLocalToTheReader() throws Exception {
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.of(List.of(1));
        CompletableFuture<Void> gate = upstream.gate(0);
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream);

        CompletableFuture<Boolean> impatient = buffer.tryGet(0).orTimeout(50, TimeUnit.MILLISECONDS);
        CompletableFuture<Boolean> patient = buffer.tryGet(0);

        ExecutionException ex = catchThrowableOfType(() -> impatient.get(5, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(ex.getCause()).isInstanceOf(TimeoutException.class);
        assertThat(patient).isNotDone();

        gate.complete(null);

        assertThat(patient.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(buffer.get(0)).isEqualTo(1);
    }

    @Test
    void disposalFailureDoesNotReachReaders() throws Exception {
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.of(List.of(1))
                .failOnDispose(new IOException("close failed"));
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream);

        assertThat(buffer.tryGet(1).get(5, TimeUnit.SECONDS)).isFalse();
        assertThat(buffer.state()).isEqualTo(ReplayBuffer.State.COMPLETE);
        assertThat(upstream.disposals).hasValue(1);
    }

    @Test
    void manyReadersAdvanceUpstreamOncePerElement() throws Exception {
        List<Integer> expected = IntStream.range(0, 500).boxed().collect(Collectors.toList());
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.async(expected, executor);
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream);

        ExecutorService readerPool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<List<Integer>>> readers = new ArrayList<>();
            for (int r = 0; r < 8; r++) {
                readers.add(CompletableFuture.supplyAsync(() -> readAll(buffer), readerPool));
            }
            for (CompletableFuture<List<Integer>> reader : readers) {
                assertThat(reader.get(10, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            readerPool.shutdownNow();
        }
        // One advance per element plus the one that observed exhaustion
        assertThat(upstream.advances).hasValue(501);
        assertThat(upstream.overlapped).isFalse();
        assertThat(upstream.disposals).hasValue(1);
    }

    @Test
    void wakeUpsRunOnConfiguredExecutor() throws Exception {
        AtomicInteger tasks = new AtomicInteger();
        ReplayOptions options = ReplayOptions.builder()
                .executor(task -> {
                    tasks.incrementAndGet();
                    executor.execute(task);
                })
                .build();
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.of(List.of(1));
        CompletableFuture<Void> gate = upstream.gate(0);
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream, options);

        CompletableFuture<Boolean> pending = buffer.tryGet(0);
        gate.complete(null);

        assertThat(pending.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(tasks.get()).isPositive();
    }

    @Test
    void directWakeUpExecutorNeverAdvancesUnderTheLock() throws Exception {
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.of(List.of(1, 2));
        CompletableFuture<Void> gate = upstream.gate(0);
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream,
                ReplayOptions.builder().executor(Runnable::run).build());
        List<Boolean> lockFree = new CopyOnWriteArrayList<>();
        upstream.onAdvance(index -> lockFree.add(stateReadableFromAnotherThread(buffer)));

        CompletableFuture<Boolean> first = buffer.tryGet(0);
        CompletableFuture<Boolean> second = buffer.tryGet(1);
        // Publishing index 0 wakes the second reader inline, which then advances for index 1
        gate.complete(null);

        assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(lockFree).hasSizeGreaterThanOrEqualTo(2).containsOnly(true);
    }

    @Test
    void rejectedWakeUpFailsOnlyThatReader() throws Exception {
        ScriptedUpstream<Integer> upstream = ScriptedUpstream.of(List.of(1));
        CompletableFuture<Void> gate = upstream.gate(0);
        ReplayBuffer<Integer> buffer = ReplayBuffer.over(upstream, ReplayOptions.builder()
                .executor(task -> {
                    throw new RejectedExecutionException("shut down");
                })
                .build());

        CompletableFuture<Boolean> pending = buffer.tryGet(0);
        gate.complete(null);

        ExecutionException ex = catchThrowableOfType(() -> pending.get(5, TimeUnit.SECONDS), ExecutionException.class);
        assertThat(ex.getCause()).isInstanceOf(RejectedExecutionException.class);
        // The element was still published
        assertThat(buffer.tryGet(0)).isCompletedWithValue(true);
        assertThat(buffer.get(0)).isEqualTo(1);
    }

    private boolean stateReadableFromAnotherThread(ReplayBuffer<?> buffer) {
        try {
            CompletableFuture.supplyAsync(buffer::state, executor).get(1, TimeUnit.SECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException | ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    private static List<Integer> readAll(ReplayBuffer<Integer> buffer) {
        List<Integer> values = new ArrayList<>();
        try {
            for (int i = 0; buffer.tryGet(i).get(10, TimeUnit.SECONDS); i++) {
                values.add(buffer.get(i));
            }
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
        return values;
    }
}
