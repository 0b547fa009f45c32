package org.tpch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the TPC-H power and throughput tests and computes the composite metrics.
 *
 * <p>The power test runs the power stream alone. The throughput test starts the
 * N throughput streams and the refresh stream together and waits for all of
 * them. Every stream reports one {@link TimingSample} on a shared
 * multi-producer channel, which is drained only after the phase's units have
 * all terminated: exactly one sample after the power test, exactly N + 1 after
 * the throughput test.
 *
 * <p>The first unit to fail aborts its phase: the other units are cancelled and
 * a {@link StreamFailureException} naming the unit is thrown. With a non-zero
 * unit timeout, units still running when it elapses abort the phase the same
 * way. No metrics are ever computed from an incomplete sample set.
 *
 * <p>Refresh data is split into N + 1 sets: set 0 for the power stream and
 * sets 1..N for the refresh stream's repetitions.
 */
public class Benchmark {
    private static final Logger log = LoggerFactory.getLogger(Benchmark.class);

    private final BenchmarkConfig config;
    private final BlockingQueue<TimingSample> results = new LinkedBlockingQueue<>();
    private final QueryStream powerStream;
    private final List<QueryStream> throughputStreams = new ArrayList<>();
    private final QueryStream refreshStream;

    private TimingSample powerSample;
    private List<TimingSample> throughputSamples;

    /**
     * @param config Run configuration; its stream count N sizes the throughput test
     * @param replicas Pools of the replicas under test
     * @param routes Replica per canonical query
     * @param queries The 22 query texts
     * @param refreshSets At least N + 1 refresh sets
     */
    public Benchmark(BenchmarkConfig config, ReplicaSet replicas, RoutingTable routes, QuerySet queries,
                     List<RefreshSet> refreshSets) {
        this.config = config;
        int n = config.getStreams();
        if (refreshSets.size() < n + 1) {
            throw new IllegalArgumentException("need " + (n + 1) + " refresh sets for " + n
                + " streams, got " + refreshSets.size());
        }
        for (int replicaId : routes.asList()) {
            replicas.getReplica(replicaId);
        }

        this.powerStream = new QueryStream(0, StreamMode.POWER, replicas, queries, routes,
            QueryOrders.forStream(0), refreshSets.subList(0, 1), results);
        for (int i = 1; i <= n; i++) {
            throughputStreams.add(new QueryStream(i, StreamMode.THROUGHPUT, replicas, queries, routes,
                QueryOrders.forStream(i), Collections.emptyList(), results));
        }
        this.refreshStream = new QueryStream(n + 1, StreamMode.REFRESH, replicas, queries, routes,
            null, refreshSets.subList(1, n + 1), results);
    }

    /**
     * Runs the power stream with no other stream active.
     *
     * @throws StreamFailureException If the power stream fails or times out
     */
    public void runPowerTest() {
        if (powerSample != null) {
            throw new IllegalStateException("power test has already run");
        }
        log.info("starting power test...");
        List<TimingSample> samples = runPhase(Collections.singletonList(powerStream));
        powerSample = samples.get(0);
        log.info("power test finished");
    }

    /**
     * Runs all throughput streams and the refresh stream concurrently and
     * waits for every one of them.
     *
     * @throws IllegalStateException If the power test has not run yet
     * @throws StreamFailureException If any stream fails or times out
     */
    public void runThroughputTest() {
        if (powerSample == null) {
            throw new IllegalStateException("power test must run before the throughput test");
        }
        if (throughputSamples != null) {
            throw new IllegalStateException("throughput test has already run");
        }
        log.info("starting throughput test with {} streams...", throughputStreams.size());
        List<QueryStream> units = new ArrayList<>(throughputStreams);
        units.add(refreshStream);
        throughputSamples = Collections.unmodifiableList(runPhase(units));
        log.info("throughput test finished");
    }

    /**
     * Computes Power@Size, Throughput@Size and QphH@Size.
     *
     * @throws IllegalStateException If either test has not completed
     */
    public BenchmarkResult getResults() {
        if (powerSample == null || throughputSamples == null) {
            throw new IllegalStateException("results are only available after the power and throughput tests");
        }
        double sf = config.getScaleFactor();
        double power = TpchMetrics.power(sf, powerSample.getQueryTimes(), powerSample.getRefreshTimes());
        Duration elapsed = TpchMetrics.throughputElapsed(throughputSamples);
        double throughput = TpchMetrics.throughput(sf, throughputStreams.size(), elapsed);
        double qphh = TpchMetrics.qphh(power, throughput);
        return new BenchmarkResult(sf, throughputStreams.size(), power, throughput, qphh, powerSample, throughputSamples);
    }

    private List<TimingSample> runPhase(List<QueryStream> units) {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(units.size(), r -> {
            Thread t = new Thread(r, "tpch-stream-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CompletionService<Void> completion = new ExecutorCompletionService<>(executor);
        Map<Future<Void>, QueryStream> running = new IdentityHashMap<>();
        CountDownLatch startGate = new CountDownLatch(1);

        try {
            for (QueryStream unit : units) {
                Future<Void> f = completion.submit(() -> {
                    startGate.await();
                    unit.run();
                    return null;
                });
                running.put(f, unit);
            }
            startGate.countDown();
            awaitAll(completion, running);
        } catch (RuntimeException e) {
            // samples of units that finished before the abort belong to no result
            results.clear();
            throw e;
        } finally {
            executor.shutdownNow();
        }

        List<TimingSample> samples = new ArrayList<>(units.size());
        results.drainTo(samples, units.size());
        if (samples.size() != units.size()) {
            throw new IllegalStateException("expected " + units.size() + " timing samples, got " + samples.size());
        }
        return samples;
    }

    private void awaitAll(CompletionService<Void> completion, Map<Future<Void>, QueryStream> running) {
        Duration timeout = config.getUnitTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        int pending = running.size();
        try {
            while (pending > 0) {
                Future<Void> done;
                if (timeout.isZero()) {
                    done = completion.take();
                } else {
                    done = completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                    if (done == null) {
                        String unfinished = unfinishedUnits(running);
                        cancelAll(running);
                        throw new StreamTimeoutException(unfinished, timeout);
                    }
                }
                QueryStream unit = running.get(done);
                try {
                    done.get();
                } catch (ExecutionException e) {
                    cancelAll(running);
                    throw new StreamFailureException(unit.unitName(), e.getCause());
                }
                pending--;
            }
        } catch (InterruptedException e) {
            cancelAll(running);
            Thread.currentThread().interrupt();
            throw new BenchmarkException("interrupted while waiting for streams", e);
        }
    }

    private static String unfinishedUnits(Map<Future<Void>, QueryStream> running) {
        StringJoiner names = new StringJoiner(",");
        for (Map.Entry<Future<Void>, QueryStream> e : running.entrySet()) {
            if (!e.getKey().isDone()) {
                names.add(e.getValue().unitName());
            }
        }
        return names.toString();
    }

    /**
     * Interrupts every unit and cancels the statements they have in flight, so
     * no unit issues another statement once the phase is aborted.
     */
    private static void cancelAll(Map<Future<Void>, QueryStream> running) {
        for (Map.Entry<Future<Void>, QueryStream> e : running.entrySet()) {
            e.getValue().cancel();
            e.getKey().cancel(true);
        }
    }

    public QueryStream getPowerStream() {
        return powerStream;
    }

    public List<QueryStream> getThroughputStreams() {
        return Collections.unmodifiableList(throughputStreams);
    }

    public QueryStream getRefreshStream() {
        return refreshStream;
    }

    public TimingSample getPowerSample() {
        return powerSample;
    }

    public List<TimingSample> getThroughputSamples() {
        return throughputSamples;
    }
}
