package io.replayflow.core;

/**
 * Base class for replay flow exceptions.
 *
 * <p>Upstream failures are normally delivered to callers verbatim through the futures returned by
 * {@link ReplayBuffer#tryGet(int)} and {@link Upstream#advance()}. The subclasses here cover the
 * synchronous paths where a checked failure has to be rethrown unchecked, and caller contract
 * violations.
 */
public abstract class ReplayFlowException extends RuntimeException {

    protected ReplayFlowException(String message) {
        super(message);
    }

    protected ReplayFlowException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a captured checked upstream failure is rethrown from a non-suspending read.
     */
    public static class UpstreamFailed extends ReplayFlowException {
        public UpstreamFailed(Throwable cause) {
            super(cause.getMessage(), cause);
        }
    }

    /**
     * Raised when an element is read before a prior {@link ReplayBuffer#tryGet(int)} confirmed it.
     */
    public static class ElementNotBuffered extends ReplayFlowException {
        public ElementNotBuffered(int index, int size) {
            super("element " + index + " is not buffered yet (buffered=" + size + ")");
        }
    }
}
