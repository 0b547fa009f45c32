package org.tpch;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Immutable configuration of one benchmark run.
 *
 * <p>Built from system properties by {@link #fromSystemProperties()} or
 * explicitly through {@link #builder()}, then handed to the {@link Benchmark}
 * constructor.
 *
 * <p><b>System Properties:</b>
 * <ul>
 *   <li>{@code bench.sf}: TPC-H scale factor (default: 1)</li>
 *   <li>{@code bench.streams}: number of throughput streams (default: TPC-H minimum for the scale factor)</li>
 *   <li>{@code bench.data.dir}: directory with {@code queries/} and {@code refresh/} (default: data)</li>
 *   <li>{@code bench.replicas}: replica CSV (default: replicas.csv)</li>
 *   <li>{@code bench.routes}: routing table CSV (default: routes.csv)</li>
 *   <li>{@code bench.indexes}: index assignment CSV (default: indexes.csv)</li>
 *   <li>{@code bench.unit.timeout.seconds}: per-stream timeout, 0 waits forever (default: 0)</li>
 *   <li>{@code bench.connect.timeout.ms}: session checkout timeout (default: 30000)</li>
 *   <li>{@code bench.metrics.port}: Prometheus port, 0 disables (default: 0)</li>
 *   <li>{@code bench.results.dir}: results directory (default: results)</li>
 * </ul>
 */
public final class BenchmarkConfig {
    private final double scaleFactor;
    private final int streams;
    private final Path dataDir;
    private final Path replicasFile;
    private final Path routesFile;
    private final Path indexesFile;
    private final Duration unitTimeout;
    private final long connectTimeoutMs;
    private final int metricsPort;
    private final Path resultsDir;

    private BenchmarkConfig(Builder b) {
        if (!(b.scaleFactor > 0)) {
            throw new IllegalArgumentException("scale factor must be positive: " + b.scaleFactor);
        }
        int streams = b.streams == null ? defaultQueryStreams(b.scaleFactor) : b.streams;
        if (streams < 1) {
            throw new IllegalArgumentException("at least one throughput stream is required: " + streams);
        }
        if (b.unitTimeout.isNegative()) {
            throw new IllegalArgumentException("unit timeout must not be negative");
        }
        if (b.connectTimeoutMs < 0) {
            throw new IllegalArgumentException("connect timeout must not be negative");
        }
        if (b.metricsPort < 0) {
            throw new IllegalArgumentException("metrics port must not be negative");
        }
        this.scaleFactor = b.scaleFactor;
        this.streams = streams;
        this.dataDir = b.dataDir;
        this.replicasFile = b.replicasFile;
        this.routesFile = b.routesFile;
        this.indexesFile = b.indexesFile;
        this.unitTimeout = b.unitTimeout;
        this.connectTimeoutMs = b.connectTimeoutMs;
        this.metricsPort = b.metricsPort;
        this.resultsDir = b.resultsDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BenchmarkConfig fromSystemProperties() {
        Builder b = builder()
            .scaleFactor(Double.parseDouble(System.getProperty("bench.sf", "1")))
            .dataDir(Paths.get(System.getProperty("bench.data.dir", "data")))
            .replicasFile(Paths.get(System.getProperty("bench.replicas", "replicas.csv")))
            .routesFile(Paths.get(System.getProperty("bench.routes", "routes.csv")))
            .indexesFile(Paths.get(System.getProperty("bench.indexes", "indexes.csv")))
            .unitTimeout(Duration.ofSeconds(Long.getLong("bench.unit.timeout.seconds", 0L)))
            .connectTimeoutMs(Long.getLong("bench.connect.timeout.ms", 30000L))
            .metricsPort(Integer.getInteger("bench.metrics.port", 0))
            .resultsDir(Paths.get(System.getProperty("bench.results.dir", "results")));
        Integer streams = Integer.getInteger("bench.streams");
        if (streams != null) {
            b.streams(streams);
        }
        return b.build();
    }

    /**
     * Minimum number of throughput streams TPC-H requires at a scale factor.
     */
    public static int defaultQueryStreams(double scaleFactor) {
        if (scaleFactor < 10) {
            return 2;
        } else if (scaleFactor < 30) {
            return 3;
        } else if (scaleFactor < 100) {
            return 4;
        } else if (scaleFactor < 300) {
            return 5;
        } else if (scaleFactor < 1000) {
            return 6;
        } else if (scaleFactor < 3000) {
            return 7;
        } else if (scaleFactor < 10000) {
            return 8;
        } else if (scaleFactor < 30000) {
            return 9;
        } else if (scaleFactor < 100000) {
            return 10;
        }
        return 11;
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    public int getStreams() {
        return streams;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getReplicasFile() {
        return replicasFile;
    }

    public Path getRoutesFile() {
        return routesFile;
    }

    public Path getIndexesFile() {
        return indexesFile;
    }

    /**
     * @return Per-unit timeout; {@link Duration#ZERO} means units are awaited without bound
     */
    public Duration getUnitTimeout() {
        return unitTimeout;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getMetricsPort() {
        return metricsPort;
    }

    public Path getResultsDir() {
        return resultsDir;
    }

    /**
     * Sessions needed per replica: one per throughput stream, plus the refresh
     * units and some slack.
     */
    public int poolSize() {
        return streams + 4;
    }

    public static final class Builder {
        private double scaleFactor = 1;
        private Integer streams;
        private Path dataDir = Paths.get("data");
        private Path replicasFile = Paths.get("replicas.csv");
        private Path routesFile = Paths.get("routes.csv");
        private Path indexesFile = Paths.get("indexes.csv");
        private Duration unitTimeout = Duration.ZERO;
        private long connectTimeoutMs = 30000L;
        private int metricsPort;
        private Path resultsDir = Paths.get("results");

        private Builder() {
        }

        public Builder scaleFactor(double scaleFactor) {
            this.scaleFactor = scaleFactor;
            return this;
        }

        public Builder streams(int streams) {
            this.streams = streams;
            return this;
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder replicasFile(Path replicasFile) {
            this.replicasFile = replicasFile;
            return this;
        }

        public Builder routesFile(Path routesFile) {
            this.routesFile = routesFile;
            return this;
        }

        public Builder indexesFile(Path indexesFile) {
            this.indexesFile = indexesFile;
            return this;
        }

        public Builder unitTimeout(Duration unitTimeout) {
            this.unitTimeout = unitTimeout;
            return this;
        }

        public Builder connectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder resultsDir(Path resultsDir) {
            this.resultsDir = resultsDir;
            return this;
        }

        public BenchmarkConfig build() {
            return new BenchmarkConfig(this);
        }
    }
}
