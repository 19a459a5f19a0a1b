package de.mirkosertic.searchvalidator.engine;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Point in time after which work must stop, plus a cooperative cancellation signal.
 * <p>
 * A run creates one root deadline that is shared by all workers; every case narrows it to its
 * own budget. Cancelling the root is visible through all narrowed children.
 */
public final class Deadline {

    private final long deadlineNanos;
    private final Deadline parent;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private Deadline(final long deadlineNanos, final Deadline parent) {
        this.deadlineNanos = deadlineNanos;
        this.parent = parent;
    }

    public static Deadline after(final Duration duration) {
        return new Deadline(System.nanoTime() + duration.toNanos(), null);
    }

    /**
     * A child deadline ending after {@code duration} or at this deadline, whichever comes first.
     */
    public Deadline narrow(final Duration duration) {
        final long candidate = System.nanoTime() + duration.toNanos();
        // compare as differences, nanoTime may overflow
        final long effective = candidate - deadlineNanos < 0 ? candidate : deadlineNanos;
        return new Deadline(effective, this);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }

    public boolean isExpired() {
        return remaining().isZero();
    }

    /**
     * Time left, {@link Duration#ZERO} once elapsed or cancelled.
     */
    public Duration remaining() {
        if (isCancelled()) {
            return Duration.ZERO;
        }
        final long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
    }

    /**
     * The given timeout, shortened to the remaining time if necessary.
     */
    public Duration cap(final Duration timeout) {
        final Duration remaining = remaining();
        return timeout.compareTo(remaining) <= 0 ? timeout : remaining;
    }
}
