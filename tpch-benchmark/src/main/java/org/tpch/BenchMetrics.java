package org.tpch;

import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.HTTPServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.BindException;
import java.time.Duration;

/**
 * Prometheus metrics collection and HTTP server for metric exposition.
 *
 * <p>Metrics include:
 * <ul>
 *   <li>{@code tpch_query_seconds}: per-query latency, labelled by stream mode and query number</li>
 *   <li>{@code tpch_refresh_seconds}: refresh function latency across all replicas, labelled {@code rf1}/{@code rf2}</li>
 *   <li>{@code tpch_streams_total}: finished streams, labelled by mode and outcome</li>
 * </ul>
 *
 * <p>The HTTP server is optional. When the requested port is already in use,
 * the following ports are tried in turn.
 */
public class BenchMetrics {
    private static final Logger log = LoggerFactory.getLogger(BenchMetrics.class);

    static final int PORT_PROBE_RANGE = 100;

    private static final double[] BUCKETS = {0.01, 0.1, 0.5, 1, 5, 10, 30, 60, 120, 300, 600, 1800, 3600};

    public static final Histogram queryLatency = Histogram.build()
            .name("tpch_query_seconds").help("TPC-H query latency seconds")
            .labelNames("mode", "query").buckets(BUCKETS).register();
    public static final Histogram refreshLatency = Histogram.build()
            .name("tpch_refresh_seconds").help("TPC-H refresh function latency seconds")
            .labelNames("function").buckets(BUCKETS).register();
    public static final Counter streams = Counter.build()
            .name("tpch_streams_total").help("Finished query streams")
            .labelNames("mode", "outcome").register();
    private static HTTPServer server;

    public static void recordQuery(StreamMode mode, int queryNumber, Duration elapsed) {
        queryLatency.labels(mode.label(), Integer.toString(queryNumber)).observe(elapsed.toNanos() / 1e9);
    }

    public static void recordRefresh(String function, Duration elapsed) {
        refreshLatency.labels(function).observe(elapsed.toNanos() / 1e9);
    }

    public static void recordStream(StreamMode mode, boolean succeeded) {
        streams.labels(mode.label(), succeeded ? "ok" : "failed").inc();
    }

    /**
     * Starts the metrics endpoint on {@code port} or, when that port is taken,
     * on the first free port above it, trying {@value #PORT_PROBE_RANGE} ports in all.
     *
     * @return The port actually bound
     * @throws IOException If every candidate port is taken
     */
    public static synchronized int startHttpServer(int port) throws IOException {
        if (server != null) {
            return server.getPort();
        }
        BindException lastRefusal = null;
        for (int candidate = port; candidate < port + PORT_PROBE_RANGE; candidate++) {
            try {
                server = new HTTPServer(candidate);
            } catch (BindException e) {
                lastRefusal = e;
                continue;
            }
            if (candidate != port) {
                log.info("metrics port {} busy", port);
            }
            log.info("serving metrics on port {}", candidate);
            return candidate;
        }
        throw new IOException("no free metrics port in " + port + ".." + (port + PORT_PROBE_RANGE - 1), lastRefusal);
    }

    public static synchronized void stopHttpServer() {
        if (server != null) {
            server.close();
            server = null;
        }
    }
}
