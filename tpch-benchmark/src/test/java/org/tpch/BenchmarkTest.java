package org.tpch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BenchmarkTest {

    private ReplicaSet replicas;

    @AfterEach
    void closeReplicas() {
        if (replicas != null) {
            replicas.close();
        }
    }

    private static BenchmarkConfig config(int streams) {
        return BenchmarkConfig.builder().scaleFactor(0.01).streams(streams).build();
    }

    @Test
    @DisplayName("a full run on two replicas yields finite, positive metrics")
    void endToEnd() throws Exception {
        Replica first = H2Replicas.replica(0);
        Replica second = H2Replicas.replica(1);
        replicas = H2Replicas.replicaSet(first, second);
        Benchmark benchmark = new Benchmark(config(1), replicas, RoutingTable.uniform(0),
            H2Replicas.countQueries(), H2Replicas.refreshSets(2));

        benchmark.runPowerTest();
        benchmark.runThroughputTest();
        BenchmarkResult result = benchmark.getResults();

        assertTrue(result.getPower() > 0 && Double.isFinite(result.getPower()));
        assertTrue(result.getThroughput() > 0 && Double.isFinite(result.getThroughput()));
        assertTrue(result.getQphh() > 0 && Double.isFinite(result.getQphh()));
        assertEquals(Math.sqrt(result.getPower() * result.getThroughput()), result.getQphh(), 1e-6);
        assertEquals(1, result.getStreams());
        for (Replica replica : List.of(first, second)) {
            assertEquals(0, H2Replicas.count(replica, "SELECT COUNT(*) FROM ORDERS"));
            assertEquals(0, H2Replicas.count(replica, "SELECT COUNT(*) FROM LINEITEM"));
        }
    }

    @Test
    @DisplayName("the throughput test collects one sample per throughput stream plus the refresh stream")
    void sampleCounts() throws Exception {
        replicas = H2Replicas.replicaSet(H2Replicas.replica(0), H2Replicas.replica(1));
        List<Integer> alternating = new ArrayList<>();
        for (int q = 1; q <= 22; q++) {
            alternating.add(q % 2);
        }
        RoutingTable routes = new RoutingTable(alternating, Set.of(0, 1));
        Benchmark benchmark = new Benchmark(config(3), replicas, routes,
            H2Replicas.countQueries(), H2Replicas.refreshSets(4));

        benchmark.runPowerTest();
        assertEquals(StreamMode.POWER, benchmark.getPowerSample().getMode());

        benchmark.runThroughputTest();
        List<TimingSample> samples = benchmark.getThroughputSamples();
        assertEquals(4, samples.size());
        assertEquals(3, samples.stream().filter(s -> s.getMode() == StreamMode.THROUGHPUT).count());
        assertEquals(1, samples.stream().filter(s -> s.getMode() == StreamMode.REFRESH).count());
        assertEquals(3, benchmark.getRefreshStream().getRefreshPairCount());
        assertEquals(4, benchmark.getRefreshStream().getIndex());
    }

    @Test
    @DisplayName("a failing query aborts the phase with the failing unit's name")
    void failureNamesUnit() throws Exception {
        replicas = H2Replicas.replicaSet(H2Replicas.replica(0));
        QuerySet queries = H2Replicas.queries(q -> q == 5 ? "SELECT * FROM NO_SUCH_TABLE" : "SELECT 1");
        Benchmark benchmark = new Benchmark(config(1), replicas, RoutingTable.uniform(0), queries,
            H2Replicas.refreshSets(2));

        StreamFailureException e = assertThrows(StreamFailureException.class, benchmark::runPowerTest);
        assertEquals("power", e.getUnit());
        StatementException cause = assertInstanceOf(StatementException.class, e.getCause());
        assertEquals("Q5", cause.getLabel());
        assertThrows(IllegalStateException.class, benchmark::getResults);
    }

    @Test
    @DisplayName("once a phase aborts, no other stream sends another statement")
    void abortStopsSiblingStreams() throws Exception {
        Replica replica = H2Replicas.replica(0);
        replicas = H2Replicas.replicaSet(replica);
        // throughput stream 1 runs Q21 first, stream 2 runs it last
        QuerySet queries = H2Replicas.queries(q -> q == 21 ? "SELECT FAIL_WHEN_ARMED()" : "INSERT INTO HITS SELECT SPIN(20)");
        Benchmark benchmark = new Benchmark(config(2), replicas, RoutingTable.uniform(0), queries,
            H2Replicas.refreshSets(3));

        benchmark.runPowerTest();
        assertEquals(21, H2Replicas.count(replica, "SELECT COUNT(*) FROM HITS"));

        H2Replicas.arm(true);
        try {
            StreamFailureException e = assertThrows(StreamFailureException.class, benchmark::runThroughputTest);
            assertEquals("throughput-1", e.getUnit());

            // let a statement that was already in flight finish
            Thread.sleep(100);
            long atAbort = H2Replicas.count(replica, "SELECT COUNT(*) FROM HITS");
            Thread.sleep(500);
            long later = H2Replicas.count(replica, "SELECT COUNT(*) FROM HITS");

            assertEquals(atAbort, later);
            assertTrue(later <= 21 + 2, "stream 2 kept running: " + (later - 21) + " inserts");
            assertEquals(QueryStream.State.FINALIZED, benchmark.getThroughputStreams().get(1).getState());
            assertThrows(IllegalStateException.class, benchmark::getResults);
        } finally {
            H2Replicas.arm(false);
        }
    }

    @Test
    @DisplayName("a unit that outlives the timeout aborts the phase")
    void unitTimeout() throws Exception {
        replicas = H2Replicas.replicaSet(H2Replicas.replica(0));
        QuerySet queries = H2Replicas.queries(q -> q == 1 ? "SELECT PAUSE(5000)" : "SELECT 1");
        BenchmarkConfig config = BenchmarkConfig.builder().scaleFactor(1).streams(1)
            .unitTimeout(Duration.ofMillis(300)).build();
        Benchmark benchmark = new Benchmark(config, replicas, RoutingTable.uniform(0), queries,
            H2Replicas.refreshSets(2));

        long start = System.nanoTime();
        StreamTimeoutException e = assertThrows(StreamTimeoutException.class, benchmark::runPowerTest);
        assertEquals("power", e.getUnit());
        assertTrue(System.nanoTime() - start < Duration.ofSeconds(4).toNanos());
    }

    @Test
    @DisplayName("phases must run in order and results need both")
    void phaseOrder() throws Exception {
        replicas = H2Replicas.replicaSet(H2Replicas.replica(0));
        Benchmark benchmark = new Benchmark(config(1), replicas, RoutingTable.uniform(0),
            H2Replicas.countQueries(), H2Replicas.refreshSets(2));

        assertThrows(IllegalStateException.class, benchmark::getResults);
        assertThrows(IllegalStateException.class, benchmark::runThroughputTest);

        benchmark.runPowerTest();
        assertThrows(IllegalStateException.class, benchmark::getResults);
        assertThrows(IllegalStateException.class, benchmark::runPowerTest);
    }

    @Test
    @DisplayName("N streams need N + 1 refresh sets")
    void refreshSetsRequired() throws Exception {
        replicas = H2Replicas.replicaSet(H2Replicas.replica(0));
        assertThrows(IllegalArgumentException.class, () -> new Benchmark(config(2), replicas,
            RoutingTable.uniform(0), H2Replicas.countQueries(), H2Replicas.refreshSets(2)));
    }
}
