package org.tpch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One TPC-H query stream.
 *
 * <p>Depending on its {@link StreamMode} the stream runs:
 * <ul>
 *   <li><b>power</b>: RF1 of refresh pair 0, the 22 queries in the stream's order, RF2 of refresh pair 0</li>
 *   <li><b>throughput</b>: the 22 queries in the stream's order</li>
 *   <li><b>refresh</b>: RF1 then RF2 for each of its refresh pairs</li>
 * </ul>
 *
 * <p>Queries run strictly one after another, each on the replica the routing
 * table names for it. A refresh function runs as one unit per replica; all of
 * them finish before the stream moves on. Every unit reports its bounds on
 * the stream's own refresh channel.
 *
 * <p>A stream runs once ({@code IDLE -> RUNNING -> FINALIZED}). On success it
 * releases its sessions and puts exactly one {@link TimingSample} on the result
 * channel. On failure it releases its sessions, puts nothing, and rethrows.
 *
 * <p>{@link #cancel()} or an interrupt stops the stream before its next
 * statement; a query already running on a replica is cancelled there. A
 * cancelled stream ends like a failed one.
 */
public class QueryStream implements Workload {
    private static final Logger log = LoggerFactory.getLogger(QueryStream.class);

    public enum State { IDLE, RUNNING, FINALIZED }

    private final int index;
    private final StreamMode mode;
    private final ReplicaSet replicas;
    private final QuerySet queries;
    private final RoutingTable routes;
    private final List<Integer> order;
    private final List<List<RefreshPair>> refreshPairs;
    private final BlockingQueue<TimingSample> results;
    private final BlockingQueue<TimeInterval> refreshTimes = new LinkedBlockingQueue<>();

    private volatile State state = State.IDLE;
    private volatile boolean cancelled;
    private final Map<Integer, ReplicaConnection> connections = new ConcurrentHashMap<>();
    private ExecutorService refreshExecutor;
    private Long startTime;
    private Long endTime;
    private final Duration[] queryTimes = new Duration[QuerySet.QUERY_COUNT];
    private final Duration[] refreshDurations = new Duration[2];

    /**
     * @param index Stream number: 0 for power, 1..N for throughput streams
     * @param mode Role of the stream
     * @param replicas Pools of the replicas under test
     * @param queries The 22 query texts
     * @param routes Replica per canonical query
     * @param order Execution order of the queries; ignored for refresh streams
     * @param refreshData One refresh set per refresh pair repetition: exactly one
     *                    for power, none for throughput, at least one for refresh
     * @param results Channel that receives this stream's timing sample
     */
    public QueryStream(int index, StreamMode mode, ReplicaSet replicas, QuerySet queries, RoutingTable routes,
                       List<Integer> order, List<RefreshSet> refreshData, BlockingQueue<TimingSample> results) {
        this.index = index;
        this.mode = mode;
        this.replicas = replicas;
        this.queries = queries;
        this.routes = routes;
        this.results = results;

        switch (mode) {
            case POWER:
                requireRefreshCount(refreshData.size() == 1, refreshData.size());
                break;
            case THROUGHPUT:
                requireRefreshCount(refreshData.isEmpty(), refreshData.size());
                break;
            case REFRESH:
                requireRefreshCount(!refreshData.isEmpty(), refreshData.size());
                break;
        }

        if (mode == StreamMode.REFRESH) {
            this.order = Collections.emptyList();
        } else {
            QueryOrders.validate(order);
            this.order = List.copyOf(order);
        }

        List<List<RefreshPair>> pairs = new ArrayList<>(refreshData.size());
        for (RefreshSet set : refreshData) {
            List<RefreshPair> perReplica = new ArrayList<>(replicas.size());
            for (Replica replica : replicas.getReplicas()) {
                perReplica.add(new RefreshPair(replicas, replica.getId(), set));
            }
            pairs.add(Collections.unmodifiableList(perReplica));
        }
        this.refreshPairs = Collections.unmodifiableList(pairs);
    }

    private void requireRefreshCount(boolean valid, int count) {
        if (!valid) {
            throw new IllegalArgumentException(mode.label() + " stream cannot run " + count + " refresh pairs");
        }
    }

    @Override
    public void run() {
        synchronized (this) {
            if (state != State.IDLE) {
                throw new IllegalStateException("stream " + unitName() + " has already run");
            }
            state = State.RUNNING;
        }
        log.debug("QS{}: starting {} stream", index, mode.label());
        try {
            switch (mode) {
                case POWER:
                    openConnections();
                    runRefreshFunction1(0);
                    runQuerySet();
                    runRefreshFunction2(0);
                    break;
                case THROUGHPUT:
                    openConnections();
                    runQuerySet();
                    break;
                case REFRESH:
                    for (int i = 0; i < refreshPairs.size(); i++) {
                        runRefreshFunction1(i);
                        runRefreshFunction2(i);
                    }
                    break;
            }
            finalise();
        } catch (RuntimeException e) {
            releaseConnections(e);
            shutdownRefreshExecutor();
            state = State.FINALIZED;
            BenchMetrics.recordStream(mode, false);
            if (cancelled) {
                log.info("QS{}: {} stream cancelled", index, mode.label());
            } else {
                log.error("QS{}: {} stream failed: {}", index, mode.label(), e.getMessage());
            }
            throw e;
        }
    }

    private void openConnections() {
        for (int replicaId : new TreeSet<>(routes.asList())) {
            connections.put(replicaId, replicas.open(replicaId));
        }
    }

    private void runQuerySet() {
        for (int queryNumber : order) {
            int replicaId = routes.replicaFor(queryNumber);
            ReplicaConnection conn = connections.get(replicaId);
            String sql = queries.get(queryNumber);
            String label = "Q" + queryNumber;
            checkCancelled();

            long tic = System.nanoTime();
            long rows = conn.executeQuery(label, sql);
            long toc = System.nanoTime();

            Duration elapsed = Duration.ofNanos(toc - tic);
            queryTimes[queryNumber - 1] = elapsed;
            BenchMetrics.recordQuery(mode, queryNumber, elapsed);
            log.debug("QS{}:Q{} : {}s ({} rows on replica {})", index, queryNumber, seconds(elapsed), rows, replicaId);
        }
    }

    private void runRefreshFunction1(int iteration) {
        checkCancelled();
        log.debug("starting refresh function #1 in query stream {}:I{}", index, iteration);
        List<Workload> units = new ArrayList<>();
        for (RefreshPair pair : refreshPairs.get(iteration)) {
            units.add(pair.refreshFunction1(refreshTimes));
        }
        TimeInterval span = runOnAllReplicas(units);
        if (startTime == null) {
            startTime = span.getStartNanos();
        }
        refreshDurations[0] = span.elapsed();
        BenchMetrics.recordRefresh("rf1", span.elapsed());
        log.debug("QS{}:I{}:RF1 : {}s", index, iteration, seconds(span.elapsed()));
    }

    private void runRefreshFunction2(int iteration) {
        checkCancelled();
        log.debug("starting refresh function #2 in query stream {}:I{}", index, iteration);
        List<Workload> units = new ArrayList<>();
        for (RefreshPair pair : refreshPairs.get(iteration)) {
            units.add(pair.refreshFunction2(refreshTimes));
        }
        TimeInterval span = runOnAllReplicas(units);
        endTime = span.getEndNanos();
        refreshDurations[1] = span.elapsed();
        BenchMetrics.recordRefresh("rf2", span.elapsed());
        log.debug("QS{}:I{}:RF2 : {}s", index, iteration, seconds(span.elapsed()));
    }

    /**
     * Starts one unit per replica, waits for all of them and drains exactly one
     * interval per unit from the refresh channel.
     */
    private TimeInterval runOnAllReplicas(List<Workload> units) {
        ExecutorService executor = refreshExecutor();
        List<Future<?>> futures = new ArrayList<>(units.size());
        for (Workload unit : units) {
            futures.add(executor.submit(unit));
        }
        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new BenchmarkException("refresh unit of stream " + unitName() + " failed", cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new BenchmarkException("stream " + unitName() + " interrupted during refresh", e);
        }

        List<TimeInterval> times = new ArrayList<>(units.size());
        refreshTimes.drainTo(times, units.size());
        if (times.size() != units.size()) {
            throw new IllegalStateException("expected " + units.size() + " refresh timings, got " + times.size());
        }
        return TimeInterval.span(times);
    }

    private ExecutorService refreshExecutor() {
        if (refreshExecutor == null) {
            AtomicInteger n = new AtomicInteger();
            refreshExecutor = Executors.newFixedThreadPool(replicas.size(), r -> {
                Thread t = new Thread(r, "QS" + index + "-refresh-" + n.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        return refreshExecutor;
    }

    private static void cancelAll(List<Future<?>> futures) {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }

    /**
     * Stops the stream from another thread. The stream then fails at its next
     * step and reports no sample.
     */
    public void cancel() {
        cancelled = true;
        for (ReplicaConnection conn : connections.values()) {
            conn.cancel();
        }
    }

    private void checkCancelled() {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new BenchmarkException("stream " + unitName() + " was cancelled");
        }
    }

    private void finalise() {
        checkCancelled();
        releaseConnections(null);
        shutdownRefreshExecutor();
        TimingSample sample = new TimingSample(mode, index, startTime, endTime,
            mode == StreamMode.REFRESH ? new Duration[QuerySet.QUERY_COUNT] : queryTimes,
            refreshDurations);
        state = State.FINALIZED;
        BenchMetrics.recordStream(mode, true);
        results.add(sample);
        log.debug("QS{}: {} stream finished", index, mode.label());
    }

    private void releaseConnections(Throwable failure) {
        for (ReplicaConnection conn : connections.values()) {
            if (conn.isClosed()) {
                continue;
            }
            try {
                conn.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    throw e;
                }
                failure.addSuppressed(e);
            }
        }
        connections.clear();
    }

    private void shutdownRefreshExecutor() {
        if (refreshExecutor != null) {
            refreshExecutor.shutdownNow();
            refreshExecutor = null;
        }
    }

    private static String seconds(Duration d) {
        return String.format("%.2f", d.toNanos() / 1e9);
    }

    public int getIndex() {
        return index;
    }

    public StreamMode getMode() {
        return mode;
    }

    public State getState() {
        return state;
    }

    public List<Integer> getOrder() {
        return order;
    }

    public int getRefreshPairCount() {
        return refreshPairs.size();
    }

    /**
     * Name used in logs and failures: {@code power}, {@code throughput-<n>} or {@code refresh}.
     */
    public String unitName() {
        return mode == StreamMode.THROUGHPUT ? mode.label() + "-" + index : mode.label();
    }
}
