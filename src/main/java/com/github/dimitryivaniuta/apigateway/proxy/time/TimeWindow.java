package com.github.dimitryivaniuta.apigateway.proxy.time;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed, epoch-aligned time window of a given length.
 *
 * <p>Windows are half-open: {@code [start, start + length)}. Two instants fall into the same window
 * iff {@link #startOf(Instant)} returns the same value for both.
 */
public record TimeWindow(Duration length) {

    public TimeWindow {
        Objects.requireNonNull(length, "length must not be null");
        // window arithmetic is in whole millis
        if (length.toMillis() < 1) {
            throw new IllegalArgumentException("window length must be at least 1ms: " + length);
        }
    }

    public static TimeWindow of(Duration length) {
        return new TimeWindow(length);
    }

    /** floor(now / W) * W, in epoch millis precision. */
    public Instant startOf(Instant now) {
        long w = length.toMillis();
        long t = now.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(t, w) * w);
    }

    public Instant endOf(Instant now) {
        return startOf(now).plus(length);
    }

    /** Time left until the window containing {@code now} closes; always positive. */
    public Duration remaining(Instant now) {
        return Duration.between(now, endOf(now));
    }

    /** True once {@code now} is at or past {@code since + length}. */
    public boolean hasElapsed(Instant since, Instant now) {
        return !now.isBefore(since.plus(length));
    }
}
