package org.tpch;

import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BenchMetricsTest {

    private static double value(String name, String[] labels, String[] values) {
        Double v = CollectorRegistry.defaultRegistry.getSampleValue(name, labels, values);
        return v == null ? 0.0 : v;
    }

    @Test
    @DisplayName("query latencies are observed per mode and query number")
    void recordsQueries() {
        String[] labels = {"mode", "query"};
        String[] values = {"power", "9"};
        double before = value("tpch_query_seconds_count", labels, values);
        double sumBefore = value("tpch_query_seconds_sum", labels, values);

        BenchMetrics.recordQuery(StreamMode.POWER, 9, Duration.ofMillis(1500));

        assertEquals(before + 1, value("tpch_query_seconds_count", labels, values), 1e-9);
        assertEquals(sumBefore + 1.5, value("tpch_query_seconds_sum", labels, values), 1e-9);
    }

    @Test
    @DisplayName("finished streams are counted by outcome")
    void recordsStreams() {
        String[] labels = {"mode", "outcome"};
        String[] failed = {"refresh", "failed"};
        double before = value("tpch_streams_total", labels, failed);

        BenchMetrics.recordStream(StreamMode.REFRESH, false);

        assertEquals(before + 1, value("tpch_streams_total", labels, failed), 1e-9);
    }

    @Test
    @DisplayName("refresh functions are observed by name")
    void recordsRefresh() {
        String[] labels = {"function"};
        String[] rf2 = {"rf2"};
        double before = value("tpch_refresh_seconds_count", labels, rf2);

        BenchMetrics.recordRefresh("rf2", Duration.ofMillis(20));

        assertEquals(before + 1, value("tpch_refresh_seconds_count", labels, rf2), 1e-9);
    }

    @Test
    @DisplayName("a busy metrics port moves the endpoint to a higher one")
    void busyPortIsSkipped() throws Exception {
        try (ServerSocket busy = new ServerSocket(0)) {
            int requested = busy.getLocalPort();
            int bound = BenchMetrics.startHttpServer(requested);

            assertTrue(bound > requested && bound < requested + BenchMetrics.PORT_PROBE_RANGE, "bound " + bound);
            assertEquals(bound, BenchMetrics.startHttpServer(requested));
        } finally {
            BenchMetrics.stopHttpServer();
        }
    }
}
