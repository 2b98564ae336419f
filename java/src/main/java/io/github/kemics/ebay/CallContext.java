package io.github.kemics.ebay;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation signal and optional deadline governing a single API call.
 *
 * <p>
 * A context is canceled explicitly through {@link #cancel()} or implicitly once its deadline passes. Child contexts
 * created with {@link #childWithTimeout(Duration)} inherit the parent deadline (whichever is earlier wins) and are canceled
 * together with their parent. Contexts are thread-safe: one thread typically waits on the call while another cancels.
 * </p>
 */
public final class CallContext {

    private final Instant deadline;
    private final CallContext parent;
    private final CompletableFuture<Void> canceled = new CompletableFuture<>();
    private final Set<CallContext> children = ConcurrentHashMap.newKeySet();

    private CallContext(Instant deadline, CallContext parent) {
        this.deadline = deadline;
        this.parent = parent;
    }

    /**
     * @return a fresh context with no deadline that is only done once canceled.
     */
    public static CallContext background() {
        return new CallContext(null, null);
    }

    public static CallContext withDeadline(Instant deadline) {
        return new CallContext(Objects.requireNonNull(deadline, "deadline"), null);
    }

    public static CallContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return new CallContext(Instant.now().plus(timeout), null);
    }

    /**
     * Derives a child context that is canceled with this one and expires after {@code timeout} or at this context's
     * deadline, whichever comes first.
     */
    public CallContext childWithTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        Instant candidate = Instant.now().plus(timeout);
        Instant childDeadline = deadline != null && deadline.isBefore(candidate) ? deadline : candidate;
        CallContext child = new CallContext(childDeadline, this);
        // children past their deadline are dropped here; cancelled ones detach themselves
        children.removeIf(CallContext::isDone);
        children.add(child);
        if (isCanceled()) {
            child.cancel();
        }
        return child;
    }

    /**
     * Cancels this context and every child derived from it. Idempotent.
     */
    public void cancel() {
        if (!canceled.complete(null)) {
            return;
        }
        if (parent != null) {
            parent.children.remove(this);
        }
        for (CallContext child : children) {
            child.cancel();
        }
        children.clear();
    }

    public boolean isCanceled() {
        return canceled.isDone();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    /**
     * @return {@code true} once the context is canceled or past its deadline.
     */
    public boolean isDone() {
        return isCanceled() || isDeadlineExceeded();
    }

    /**
     * @return time left before the deadline, {@link Duration#ZERO} when it has passed, or {@code null} without one.
     */
    Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    int childCount() {
        return children.size();
    }

    CompletableFuture<Void> cancellation() {
        return canceled;
    }

    void throwIfDone(String operation) throws TransportException {
        if (isCanceled()) {
            throw TransportException.canceled(operation);
        }
        if (isDeadlineExceeded()) {
            throw TransportException.deadlineExceeded(operation);
        }
    }
}
