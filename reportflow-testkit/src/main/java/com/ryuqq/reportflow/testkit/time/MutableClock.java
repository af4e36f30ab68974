package com.ryuqq.reportflow.testkit.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock whose time only moves when a test advances it.
 *
 * <p>Lets delayed-visibility tests cross a 5-minute delay without sleeping.
 * Thread-safe; every view created by {@link #withZone(ZoneId)} shares the same time.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicLong epochMillis;
    private final ZoneId zone;

    public MutableClock(Instant start) {
        this(new AtomicLong(start.toEpochMilli()), ZoneOffset.UTC);
    }

    /**
     * Clock starting at 2024-01-01T00:00:00Z.
     */
    public MutableClock() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    private MutableClock(AtomicLong epochMillis, ZoneId zone) {
        this.epochMillis = epochMillis;
        this.zone = zone;
    }

    /**
     * Moves time forward.
     *
     * @param duration amount to advance (must not be negative)
     * @throws IllegalArgumentException if duration is null or negative
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative");
        }
        epochMillis.addAndGet(duration.toMillis());
    }

    public void setInstant(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        epochMillis.set(instant.toEpochMilli());
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(epochMillis, zone);
    }

    @Override
    public long millis() {
        return epochMillis.get();
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(epochMillis.get());
    }
}
