package io.replayflow.core.sync;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SharedSequenceTest {

    @Test
    void branchPartitionsElements() {
        List<Integer> pulled = new ArrayList<>();
        SharedSequence.Branches<Integer> branches = SyncSequence.from(List.of(1, 2, 3, 4, 5, 6))
                .tap(pulled::add)
                .share()
                .branch(x -> x % 2 == 0);

        assertThat(branches.trueSide()).containsExactly(2, 4, 6);
        assertThat(branches.falseSide()).containsExactly(1, 3, 5);
        assertThat(pulled).containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void interleavedForksSeeTheSameElements() {
        SharedSequence<String> shared = SyncSequence.from(List.of("a", "b", "c")).share();
        List<SyncSequence<String>> forks = shared.fork(2);

        Iterator<String> first = forks.get(0).iterator();
        Iterator<String> second = forks.get(1).iterator();

        assertThat(first.next()).isEqualTo("a");
        assertThat(second.next()).isEqualTo("a");
        assertThat(second.next()).isEqualTo("b");
        assertThat(first.next()).isEqualTo("b");
        assertThat(shared.filter(x -> !x.equals("b"))).containsExactly("a", "c");
        assertThat(shared.asSequence().first()).contains("a");
        assertThatThrownBy(() -> shared.fork(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
