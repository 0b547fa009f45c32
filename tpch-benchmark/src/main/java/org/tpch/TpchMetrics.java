package org.tpch;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The three TPC-H composite metrics.
 *
 * <pre>
 * Power@Size      = 3600 * SF / (q1 * ... * q22 * r1 * r2)^(1/24)
 * Throughput@Size = S * 22 * 3600 * SF / Ts
 * QphH@Size       = sqrt(Power@Size * Throughput@Size)
 * </pre>
 *
 * All durations in seconds. The geometric mean is taken through logarithms so
 * long runs cannot overflow the product.
 */
public final class TpchMetrics {

    /**
     * Samples whose bounds define the throughput interval {@code Ts}: every
     * sample of the throughput phase. Throughput streams report no bounds, so
     * {@code Ts} is the refresh stream's window.
     */
    public static final Set<StreamMode> THROUGHPUT_WINDOW_MODES = EnumSet.of(StreamMode.THROUGHPUT, StreamMode.REFRESH);

    private TpchMetrics() {
    }

    /**
     * @param scaleFactor Scale factor of the database
     * @param queryTimes The 22 power-stream query durations
     * @param refreshTimes The RF1 and RF2 power-stream durations
     * @return Power@Size
     * @throws IllegalArgumentException If a duration is missing or not positive
     */
    public static double power(double scaleFactor, List<Duration> queryTimes, List<Duration> refreshTimes) {
        if (queryTimes.size() != QuerySet.QUERY_COUNT || refreshTimes.size() != 2) {
            throw new IllegalArgumentException("power metric needs 22 query and 2 refresh durations");
        }
        double logSum = 0.0;
        for (Duration d : queryTimes) {
            logSum += Math.log(positiveSeconds(d));
        }
        for (Duration d : refreshTimes) {
            logSum += Math.log(positiveSeconds(d));
        }
        double geometricMean = Math.exp(logSum / (QuerySet.QUERY_COUNT + 2));
        return 3600.0 * scaleFactor / geometricMean;
    }

    /**
     * @param scaleFactor Scale factor of the database
     * @param streams Number of throughput query streams
     * @param elapsed Throughput interval {@code Ts}
     * @return Throughput@Size
     */
    public static double throughput(double scaleFactor, int streams, Duration elapsed) {
        if (streams < 1) {
            throw new IllegalArgumentException("at least one stream is required");
        }
        return streams * QuerySet.QUERY_COUNT * 3600.0 * scaleFactor / positiveSeconds(elapsed);
    }

    public static double qphh(double power, double throughput) {
        return Math.sqrt(power * throughput);
    }

    /**
     * Computes {@code Ts}: latest end minus earliest start over the samples whose
     * mode is in {@link #THROUGHPUT_WINDOW_MODES}, ignoring null bounds.
     *
     * @throws IllegalStateException If no sample carries bounds
     */
    public static Duration throughputElapsed(Collection<TimingSample> samples) {
        Long start = null;
        Long end = null;
        for (TimingSample s : samples) {
            if (!THROUGHPUT_WINDOW_MODES.contains(s.getMode())) {
                continue;
            }
            if (s.getStart() != null) {
                start = start == null ? s.getStart() : Math.min(start, s.getStart());
            }
            if (s.getEnd() != null) {
                end = end == null ? s.getEnd() : Math.max(end, s.getEnd());
            }
        }
        if (start == null || end == null) {
            throw new IllegalStateException("no throughput-phase sample carries start/end bounds");
        }
        return Duration.ofNanos(end - start);
    }

    static double seconds(Duration d) {
        return d.toNanos() / 1e9;
    }

    private static double positiveSeconds(Duration d) {
        if (d == null) {
            throw new IllegalArgumentException("missing duration");
        }
        double s = seconds(d);
        if (s <= 0) {
            throw new IllegalArgumentException("duration must be positive: " + d);
        }
        return s;
    }
}
