package com.kinoscope.metadata.resolve.imdb;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deadline and cancel flag for one resolution run. Checked before every search and every title page fetch.
 */
public class ResolutionBudget {
    private final Clock clock;
    private final Instant deadline;
    private volatile boolean cancelled;

    public ResolutionBudget(Duration maxDuration) {
        this(maxDuration, Clock.systemUTC());
    }

    ResolutionBudget(Duration maxDuration, Clock clock) {
        this.clock = clock;
        this.deadline = maxDuration == null || maxDuration.isZero() || maxDuration.isNegative()
            ? null
            : clock.instant().plus(maxDuration);
    }

    public static ResolutionBudget unlimited() {
        return new ResolutionBudget(null);
    }

    public void cancel() {
        cancelled = true;
    }

    public void checkActive() {
        if (cancelled) {
            throw new ResolutionAbortedException("resolution_cancelled");
        }
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw new ResolutionAbortedException("resolution_deadline_exceeded");
        }
    }
}
