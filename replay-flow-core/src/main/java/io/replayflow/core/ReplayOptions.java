package io.replayflow.core;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Tuning knobs for a {@link ReplayBuffer}.
 *
 * @param executor executor on which suspended readers are resumed
 * @param initialCapacity initial capacity of the element log
 */
public record ReplayOptions(Executor executor, int initialCapacity) {

    public static final int DEFAULT_INITIAL_CAPACITY = 64;

    private static final ReplayOptions DEFAULTS =
            new ReplayOptions(new CompletableFuture<Void>().defaultExecutor(), DEFAULT_INITIAL_CAPACITY);

    public ReplayOptions {
        Objects.requireNonNull(executor, "executor");
        if (initialCapacity <= 0) throw new IllegalArgumentException("initialCapacity must be positive");
    }

    public static ReplayOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Executor executor;
        private int initialCapacity = DEFAULT_INITIAL_CAPACITY;

        private Builder() {
        }

        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        public ReplayOptions build() {
            Executor resolved = executor;
            if (resolved == null) {
                resolved = DEFAULTS.executor();
            }
            return new ReplayOptions(resolved, initialCapacity);
        }
    }
}
