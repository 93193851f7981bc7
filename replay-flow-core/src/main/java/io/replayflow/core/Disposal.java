package io.replayflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort disposal of upstreams. Failures are logged and never reach readers.
 */
final class Disposal {

    private static final Logger log = LoggerFactory.getLogger(Disposal.class);

    private Disposal() {
    }

    static void quietly(Upstream<?> upstream) {
        if (upstream == null) return;
        try {
            upstream.dispose();
        } catch (Exception e) {
            log.warn("Ignoring upstream disposal failure", e);
        }
    }
}
