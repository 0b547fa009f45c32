package org.tpch;

import java.util.List;

/**
 * Main entry point of the TPC-H replica benchmark.
 *
 * <p>Loads the replica list, routing table, index assignments, expanded query
 * texts and refresh data, creates the indexes, runs the power test followed
 * by the throughput test, and reports Power@Size, Throughput@Size and
 * QphH@Size.
 *
 * <p>All settings are system properties; see {@link BenchmarkConfig}. Set
 * {@code bench.log.level=DEBUG} for per-query timings.
 *
 * <p>Exit status is 1 when a stream fails; the failed stream is printed.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        BenchmarkConfig config = BenchmarkConfig.fromSystemProperties();
        System.out.println("Starting TPC-H benchmark. sf=" + config.getScaleFactor()
            + " streams=" + config.getStreams() + " data=" + config.getDataDir());

        if (config.getMetricsPort() > 0) {
            BenchMetrics.startHttpServer(config.getMetricsPort());
        }

        int status = 0;
        List<Replica> replicaList = WorkloadLoader.readReplicas(config.getReplicasFile());
        try (ReplicaSet replicas = new ReplicaSet(replicaList, config.poolSize(), config.getConnectTimeoutMs())) {
            RoutingTable routes = WorkloadLoader.readRoutes(config.getRoutesFile(), WorkloadLoader.ids(replicaList));
            List<IndexSpec> indexes = WorkloadLoader.readIndexes(config.getIndexesFile());
            QuerySet queries = WorkloadLoader.readQueries(config.getDataDir().resolve("queries"));
            List<RefreshSet> refreshSets = WorkloadLoader.readRefreshSets(config.getDataDir().resolve("refresh"),
                config.getStreams() + 1);

            new IndexBuilder(replicas).createIndexes(indexes);

            Benchmark benchmark = new Benchmark(config, replicas, routes, queries, refreshSets);
            System.out.println("Running power test...");
            benchmark.runPowerTest();
            System.out.println("Running throughput test...");
            benchmark.runThroughputTest();

            BenchmarkResult result = benchmark.getResults();
            ReportWriter report = new ReportWriter(config.getResultsDir());
            report.write(result);
            report.printSummary(result, System.out);
            System.out.println("Results in '" + config.getResultsDir() + "'");
        } catch (StreamFailureException e) {
            System.err.println("Benchmark aborted, stream '" + e.getUnit() + "' failed: " + e.getMessage());
            status = 1;
        } finally {
            BenchMetrics.stopHttpServer();
        }

        if (status != 0) {
            System.exit(status);
        }
    }
}
