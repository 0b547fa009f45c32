package org.tpch;

import org.HdrHistogram.Histogram;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes benchmark results to CSV files and the console.
 *
 * <p>Files written to the results directory:
 * <ul>
 *   <li>{@code metrics.csv}: {@code scale_factor,streams,power,throughput,qphh}</li>
 *   <li>{@code query-times.csv}: one row per stream, {@code stream,mode,q1..q22,rf1,rf2}, seconds</li>
 * </ul>
 *
 * <p>The console summary adds p50/p90/p99 query latency per stream mode, in
 * milliseconds, taken from an HdrHistogram of the recorded query durations.
 */
public class ReportWriter {
    static final String METRICS_CSV = "metrics.csv";
    static final String QUERY_TIMES_CSV = "query-times.csv";

    private static final long HIGHEST_TRACKABLE_MICROS = 3600000000000L;

    private final Path resultsDir;

    public ReportWriter(Path resultsDir) {
        this.resultsDir = resultsDir;
    }

    /**
     * Writes both CSV files, replacing earlier ones.
     */
    public void write(BenchmarkResult result) throws IOException {
        Files.createDirectories(resultsDir);

        try (BufferedWriter w = Files.newBufferedWriter(resultsDir.resolve(METRICS_CSV))) {
            w.write("scale_factor,streams,power,throughput,qphh\n");
            w.write(String.format(Locale.ROOT, "%s,%d,%.3f,%.3f,%.3f\n", result.getScaleFactor(),
                result.getStreams(), result.getPower(), result.getThroughput(), result.getQphh()));
        }

        try (BufferedWriter w = Files.newBufferedWriter(resultsDir.resolve(QUERY_TIMES_CSV))) {
            StringBuilder header = new StringBuilder("stream,mode");
            for (int q = 1; q <= QuerySet.QUERY_COUNT; q++) {
                header.append(",q").append(q);
            }
            w.write(header.append(",rf1,rf2\n").toString());
            for (TimingSample sample : allSamples(result)) {
                StringBuilder row = new StringBuilder();
                row.append(sample.getStreamIndex()).append(',').append(sample.getMode().label());
                for (Duration d : sample.getQueryTimes()) {
                    row.append(',').append(formatSeconds(d));
                }
                for (Duration d : sample.getRefreshTimes()) {
                    row.append(',').append(formatSeconds(d));
                }
                w.write(row.append('\n').toString());
            }
        }
    }

    /**
     * Prints the result block and per-mode latency percentiles.
     */
    public void printSummary(BenchmarkResult result, PrintStream out) {
        out.println("=".repeat(30));
        out.println("TPC-H Performance Benchmark Results");
        out.println();
        out.println(String.format(Locale.ROOT, "Power@Size       = %.3f", result.getPower()));
        out.println(String.format(Locale.ROOT, "Throughput@Size  = %.3f", result.getThroughput()));
        out.println(String.format(Locale.ROOT, "QphH@Size        = %.3f", result.getQphh()));
        out.println();
        out.println("Scale factor: " + result.getScaleFactor() + ", streams: " + result.getStreams());
        for (Map.Entry<StreamMode, Histogram> e : latencyByMode(result).entrySet()) {
            Histogram h = e.getValue();
            if (h.getTotalCount() == 0) {
                continue;
            }
            out.println(String.format(Locale.ROOT, "[%s] queries=%d p50=%.2fms p90=%.2fms p99=%.2fms",
                e.getKey().label(), h.getTotalCount(),
                h.getValueAtPercentile(50.0) / 1000.0,
                h.getValueAtPercentile(90.0) / 1000.0,
                h.getValueAtPercentile(99.0) / 1000.0));
        }
        out.println("=".repeat(30));
    }

    /**
     * Query latency histograms in microseconds, keyed by stream mode.
     */
    static Map<StreamMode, Histogram> latencyByMode(BenchmarkResult result) {
        Map<StreamMode, Histogram> byMode = new EnumMap<>(StreamMode.class);
        for (TimingSample sample : allSamples(result)) {
            Histogram h = byMode.computeIfAbsent(sample.getMode(), m -> new Histogram(HIGHEST_TRACKABLE_MICROS, 3));
            for (Duration d : sample.getQueryTimes()) {
                if (d != null) {
                    h.recordValue(d.toNanos() / 1000);
                }
            }
        }
        return byMode;
    }

    private static List<TimingSample> allSamples(BenchmarkResult result) {
        List<TimingSample> samples = new ArrayList<>();
        samples.add(result.getPowerSample());
        samples.addAll(result.getThroughputSamples());
        return samples;
    }

    private static String formatSeconds(Duration d) {
        return d == null ? "" : String.format(Locale.ROOT, "%.6f", d.toNanos() / 1e9);
    }
}
