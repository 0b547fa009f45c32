package org.tpch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The three TPC-H metrics of one run, the scale factor they were computed
 * under, and the samples they were computed from.
 */
public final class BenchmarkResult {
    private final double scaleFactor;
    private final int streams;
    private final double power;
    private final double throughput;
    private final double qphh;
    private final TimingSample powerSample;
    private final List<TimingSample> throughputSamples;

    public BenchmarkResult(double scaleFactor, int streams, double power, double throughput, double qphh,
                           TimingSample powerSample, List<TimingSample> throughputSamples) {
        this.scaleFactor = scaleFactor;
        this.streams = streams;
        this.power = power;
        this.throughput = throughput;
        this.qphh = qphh;
        this.powerSample = powerSample;
        this.throughputSamples = Collections.unmodifiableList(new ArrayList<>(throughputSamples));
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    public int getStreams() {
        return streams;
    }

    /** Power@Size. */
    public double getPower() {
        return power;
    }

    /** Throughput@Size. */
    public double getThroughput() {
        return throughput;
    }

    /** QphH@Size. */
    public double getQphh() {
        return qphh;
    }

    public TimingSample getPowerSample() {
        return powerSample;
    }

    public List<TimingSample> getThroughputSamples() {
        return throughputSamples;
    }

    @Override
    public String toString() {
        return String.format("BenchmarkResult{sf=%s, power=%.3f, throughput=%.3f, qphh=%.3f}",
            scaleFactor, power, throughput, qphh);
    }
}
