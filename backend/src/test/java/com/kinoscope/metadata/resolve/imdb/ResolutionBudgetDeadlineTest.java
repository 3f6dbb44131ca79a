package com.kinoscope.metadata.resolve.imdb;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolutionBudgetDeadlineTest {

    @Test
    void checkActiveAbortsOnceDeadlinePassed() {
        SteppingClock clock = new SteppingClock(Instant.parse("2024-05-01T10:00:00Z"));
        ResolutionBudget budget = new ResolutionBudget(Duration.ofSeconds(30), clock);

        clock.advance(Duration.ofSeconds(30));
        assertThatCode(budget::checkActive).doesNotThrowAnyException();

        clock.advance(Duration.ofMillis(1));
        assertThatThrownBy(budget::checkActive)
            .isInstanceOf(ResolutionAbortedException.class)
            .hasMessage("resolution_deadline_exceeded");
    }

    @Test
    void cancellationIsReportedBeforeDeadline() {
        SteppingClock clock = new SteppingClock(Instant.parse("2024-05-01T10:00:00Z"));
        ResolutionBudget budget = new ResolutionBudget(Duration.ofSeconds(30), clock);
        clock.advance(Duration.ofMinutes(1));
        budget.cancel();

        assertThatThrownBy(budget::checkActive)
            .isInstanceOf(ResolutionAbortedException.class)
            .hasMessage("resolution_cancelled");
    }

    @Test
    void zeroOrMissingDurationNeverExpires() {
        SteppingClock clock = new SteppingClock(Instant.parse("2024-05-01T10:00:00Z"));
        ResolutionBudget zero = new ResolutionBudget(Duration.ZERO, clock);
        ResolutionBudget missing = new ResolutionBudget(null, clock);

        clock.advance(Duration.ofDays(1));
        assertThatCode(zero::checkActive).doesNotThrowAnyException();
        assertThatCode(missing::checkActive).doesNotThrowAnyException();
    }

    private static final class SteppingClock extends Clock {
        private Instant now;

        private SteppingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
