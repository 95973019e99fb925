package com.upgradedoctor.check;

import jakarta.annotation.Nullable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one run: an optional deadline plus an explicit cancel.
 *
 * The executor consults {@link #isDone()} before each check; nothing is interrupted while a
 * check is running. Check bodies that loop over many items may call {@link #throwIfDone()}.
 * Safe to cancel from another thread.
 */
public final class ExecutionContext {

    private final Clock clock;
    @Nullable
    private final Instant deadline;
    private final AtomicBoolean canceled = new AtomicBoolean();

    private ExecutionContext(Clock clock, @Nullable Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /** A context with no deadline; done only after {@link #cancel()}. */
    public static ExecutionContext background() {
        return new ExecutionContext(Clock.systemUTC(), null);
    }

    public static ExecutionContext withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static ExecutionContext withTimeout(Duration timeout, Clock clock) {
        return new ExecutionContext(clock, clock.instant().plus(timeout));
    }

    public static ExecutionContext withDeadline(Instant deadline, Clock clock) {
        return new ExecutionContext(clock, deadline);
    }

    public void cancel() {
        canceled.set(true);
    }

    public boolean isCanceled() {
        return canceled.get();
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean isDone() {
        return isCanceled() || isDeadlineExceeded();
    }

    public @Nullable Instant getDeadline() {
        return deadline;
    }

    /**
     * @throws CheckCanceledException when the context was canceled
     * @throws CheckTimeoutException  when the deadline has passed
     */
    public void throwIfDone() {
        if (isCanceled()) {
            throw new CheckCanceledException("context canceled");
        }
        if (isDeadlineExceeded()) {
            throw new CheckTimeoutException("context deadline exceeded (deadline " + deadline + ")");
        }
    }
}
