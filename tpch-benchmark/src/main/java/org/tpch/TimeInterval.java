package org.tpch;

import java.time.Duration;
import java.util.Collection;

/**
 * Wall-clock bounds of one timed operation, in {@link System#nanoTime()} units.
 *
 * <p>All execution units run inside one JVM, so bounds taken on different
 * threads are directly comparable.
 */
public final class TimeInterval {
    private final long startNanos;
    private final long endNanos;

    public TimeInterval(long startNanos, long endNanos) {
        if (endNanos < startNanos) {
            throw new IllegalArgumentException("interval ends before it starts");
        }
        this.startNanos = startNanos;
        this.endNanos = endNanos;
    }

    public long getStartNanos() {
        return startNanos;
    }

    public long getEndNanos() {
        return endNanos;
    }

    public Duration elapsed() {
        return Duration.ofNanos(endNanos - startNanos);
    }

    /**
     * Smallest interval covering all of the given ones: earliest start to latest end.
     */
    public static TimeInterval span(Collection<TimeInterval> intervals) {
        if (intervals.isEmpty()) {
            throw new IllegalArgumentException("no intervals to span");
        }
        long start = Long.MAX_VALUE;
        long end = Long.MIN_VALUE;
        for (TimeInterval i : intervals) {
            start = Math.min(start, i.startNanos);
            end = Math.max(end, i.endNanos);
        }
        return new TimeInterval(start, end);
    }

    @Override
    public String toString() {
        return "[" + startNanos + ", " + endNanos + "]";
    }
}
