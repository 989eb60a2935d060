package org.txc.appsec.client;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Caller-supplied cancellation and deadline for one or more SDK calls.
 * A cancelled or expired context makes every operation fail before it reaches the network.
 */
public final class RequestContext {

    private final Instant deadline;
    private final List<Runnable> cancelListeners = new ArrayList<>();
    private volatile boolean cancelled;

    private RequestContext(Instant deadline) {
        this.deadline = deadline;
    }

    /** A context that is never cancelled by the SDK and has no deadline. */
    public static RequestContext background() {
        return new RequestContext(null);
    }

    public static RequestContext withTimeout(Duration timeout) {
        return new RequestContext(Instant.now().plus(timeout));
    }

    public static RequestContext withDeadline(Instant deadline) {
        return new RequestContext(deadline);
    }

    /**
     * Cancels the context and aborts any exchange currently running under it.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (cancelListeners) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(cancelListeners);
            cancelListeners.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    /**
     * @return time left until the deadline, empty when there is none
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * @throws ContextCancelledException if the context was cancelled or its deadline has passed
     */
    public void ensureActive() throws ContextCancelledException {
        if (cancelled) {
            throw new ContextCancelledException("context canceled");
        }
        if (isExpired()) {
            throw new ContextCancelledException("context deadline exceeded");
        }
    }

    /**
     * Registers an action to run on {@link #cancel()}. Runs it immediately if the context is already cancelled.
     *
     * @return a handle that unregisters the action
     */
    public Registration onCancel(Runnable action) {
        synchronized (cancelListeners) {
            if (!cancelled) {
                cancelListeners.add(action);
                return () -> {
                    synchronized (cancelListeners) {
                        cancelListeners.remove(action);
                    }
                };
            }
        }
        action.run();
        return () -> { };
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
