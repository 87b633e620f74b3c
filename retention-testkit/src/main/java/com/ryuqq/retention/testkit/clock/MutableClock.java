package com.ryuqq.retention.testkit.clock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable clock for tests that allows advancing time deterministically.
 *
 * <p>Reconcilers read the current time only through an injected {@link Clock},
 * so a test can place a resource just before or just after its expiry.</p>
 *
 * @author Retention Team
 * @since 1.0.0
 */
public class MutableClock extends Clock {

    private final AtomicReference<Instant> current;
    private final ZoneId zone;

    /**
     * Creates a clock fixed at the given instant (UTC).
     *
     * @param initial the initial instant
     * @throws IllegalArgumentException if initial is null
     */
    public MutableClock(Instant initial) {
        this(initial, ZoneOffset.UTC);
    }

    private MutableClock(Instant initial, ZoneId zone) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        this.current = new AtomicReference<>(initial);
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param amount the amount to advance (may be negative to move back)
     */
    public void advance(Duration amount) {
        current.updateAndGet(instant -> instant.plus(amount));
    }

    /**
     * Sets the clock to the given instant.
     *
     * @param instant the new instant
     */
    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        current.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException("MutableClock is fixed to UTC");
    }

    @Override
    public Instant instant() {
        return current.get();
    }
}
