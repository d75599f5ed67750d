package com.decisiontrace.tracer;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Finalization timestamps that never go backwards for one tracer, even if the
 * wall clock is stepped back.
 */
class MonotonicClock {

    private final Clock clock;
    private final AtomicReference<Instant> last = new AtomicReference<>(Instant.MIN);

    MonotonicClock(Clock clock) {
        this.clock = clock;
    }

    Instant next() {
        Instant now = clock.instant();
        return last.accumulateAndGet(now, (previous, candidate) ->
            candidate.isBefore(previous) ? previous : candidate);
    }
}
