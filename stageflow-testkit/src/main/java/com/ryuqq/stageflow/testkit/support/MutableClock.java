package com.ryuqq.stageflow.testkit.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link Clock} whose instant only moves when a test moves it.
 *
 * <p>Lock staleness, TTL expiry and stuck-workflow cutoffs are all measured against an
 * injected clock, so tests drive them with {@link #advance(Duration)} instead of sleeping.</p>
 *
 * <pre>
 * MutableClock clock = MutableClock.startingAt(Instant.parse("2024-01-01T00:00:00Z"));
 * EntityLockManager locks = new EntityLockManager(() -&gt; kv, LockConfig.defaults(), clock);
 * clock.advance(Duration.ofMinutes(3));
 * </pre>
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> instant;
    private final ZoneId zone;

    private MutableClock(AtomicReference<Instant> instant, ZoneId zone) {
        this.instant = instant;
        this.zone = zone;
    }

    /**
     * Creates a clock fixed at the given instant (UTC).
     *
     * @param start initial instant
     * @return new clock
     */
    public static MutableClock startingAt(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        return new MutableClock(new AtomicReference<>(start), ZoneOffset.UTC);
    }

    /**
     * Creates a clock fixed at the current system time.
     *
     * @return new clock
     */
    public static MutableClock now() {
        return startingAt(Instant.now());
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to move (must not be negative)
     * @return the new instant
     */
    public Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be non-negative, but was: " + duration);
        }
        return instant.updateAndGet(current -> current.plus(duration));
    }

    public void set(Instant newInstant) {
        if (newInstant == null) {
            throw new IllegalArgumentException("newInstant cannot be null");
        }
        instant.set(newInstant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId newZone) {
        return new MutableClock(instant, newZone);
    }

    @Override
    public Instant instant() {
        return instant.get();
    }
}
