package io.replayflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for blocking upstream steps.
 *
 * <p>On a runtime with virtual threads each upstream gets a virtual-thread-per-task executor,
 * looked up reflectively so the library still targets Java 17. Older runtimes get a cached pool of
 * daemon threads named after the upstream.
 */
final class BlockingExecutors {

    private static final Logger log = LoggerFactory.getLogger(BlockingExecutors.class);

    private static final Method VIRTUAL_FACTORY = lookupVirtualFactory();

    private BlockingExecutors() {
    }

    static boolean virtualThreadsAvailable() {
        return VIRTUAL_FACTORY != null;
    }

    /**
     * A new executor owned by one upstream; the caller shuts it down when the upstream is disposed.
     */
    static ExecutorService forUpstream(String threadPrefix) {
        Objects.requireNonNull(threadPrefix, "threadPrefix");
        if (VIRTUAL_FACTORY != null) {
            try {
                return (ExecutorService) VIRTUAL_FACTORY.invoke(null);
            } catch (ReflectiveOperationException e) {
                log.debug("Virtual thread executor unavailable, using platform threads", e);
            }
        }
        return Executors.newCachedThreadPool(new DaemonThreadFactory(threadPrefix));
    }

    private static Method lookupVirtualFactory() {
        try {
            return Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger sequence = new AtomicInteger();

        private DaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
