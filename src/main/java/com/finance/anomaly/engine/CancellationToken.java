package com.finance.anomaly.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative cancellation for batch scopes. Detectors poll {@link #isCancelled()} between
 * per-address iterations and return what they have so far once it flips.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null, Clock.systemUTC());

    private final Instant deadline;
    private final Clock clock;
    private volatile boolean cancelled;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken withTimeout(Clock clock, Duration timeout) {
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public boolean isCancelled() {
        if (cancelled) return true;
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public void cancel() {
        if (this != NONE) {
            cancelled = true;
        }
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    /**
     * Milliseconds until the deadline, never negative. Long.MAX_VALUE when there is no deadline.
     */
    public long remainingMillis() {
        if (deadline == null) return Long.MAX_VALUE;
        return Math.max(0L, Duration.between(clock.instant(), deadline).toMillis());
    }
}
