package org.tpch;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The single result a query stream reports when it finishes.
 *
 * <p>{@code queryTimes} is indexed by canonical query number minus one,
 * independent of execution order. {@code start}/{@code end} are set for power
 * and refresh streams only; throughput streams leave them null. Immutable.
 */
public final class TimingSample {
    private final StreamMode mode;
    private final int streamIndex;
    private final Long start;
    private final Long end;
    private final List<Duration> queryTimes;
    private final List<Duration> refreshTimes;

    public TimingSample(StreamMode mode, int streamIndex, Long start, Long end,
                        Duration[] queryTimes, Duration[] refreshTimes) {
        if (queryTimes.length != QuerySet.QUERY_COUNT) {
            throw new IllegalArgumentException("expected " + QuerySet.QUERY_COUNT + " query times");
        }
        if (refreshTimes.length != 2) {
            throw new IllegalArgumentException("expected 2 refresh times");
        }
        this.mode = mode;
        this.streamIndex = streamIndex;
        this.start = start;
        this.end = end;
        this.queryTimes = Collections.unmodifiableList(Arrays.asList(queryTimes.clone()));
        this.refreshTimes = Collections.unmodifiableList(Arrays.asList(refreshTimes.clone()));
    }

    public StreamMode getMode() {
        return mode;
    }

    public int getStreamIndex() {
        return streamIndex;
    }

    /** Start bound in nanoTime units, or null. */
    public Long getStart() {
        return start;
    }

    /** End bound in nanoTime units, or null. */
    public Long getEnd() {
        return end;
    }

    /**
     * @return 22 entries; entry {@code k - 1} is the duration of query {@code k}, or null if it did not run
     */
    public List<Duration> getQueryTimes() {
        return queryTimes;
    }

    public Duration getQueryTime(int queryNumber) {
        QuerySet.checkQueryNumber(queryNumber);
        return queryTimes.get(queryNumber - 1);
    }

    /**
     * @return RF1 and RF2 durations, null where the stream ran no refresh pair
     */
    public List<Duration> getRefreshTimes() {
        return refreshTimes;
    }

    public String unitName() {
        return mode == StreamMode.THROUGHPUT ? mode.label() + "-" + streamIndex : mode.label();
    }

    @Override
    public String toString() {
        return "TimingSample{" + unitName() + ", start=" + start + ", end=" + end + "}";
    }
}
