package org.tpch;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection pool manager for the replicas under test, one HikariCP pool per replica.
 *
 * <p>Pools are created on first use and never connect eagerly, so an unreachable
 * replica fails the execution unit that opens it instead of the whole startup.
 *
 * <p>Pool configuration:
 * <ul>
 *   <li>Maximum pool size: stream count + 4</li>
 *   <li>Minimum idle: half of maximum pool size (minimum 2)</li>
 *   <li>Database-specific properties from {@link DatabaseAdapter}</li>
 * </ul>
 */
public class ReplicaSet implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReplicaSet.class);

    private final Map<Integer, Replica> replicas = new LinkedHashMap<>();
    private final Map<Integer, HikariDataSource> pools = new HashMap<>();
    private final int poolSize;
    private final long connectTimeoutMs;
    private boolean closed;

    /**
     * @param replicas Replicas in configuration order; ids must be unique
     * @param poolSize Maximum number of sessions per replica
     * @param connectTimeoutMs How long {@link #open} waits for a session before failing
     */
    public ReplicaSet(List<Replica> replicas, int poolSize, long connectTimeoutMs) {
        if (replicas.isEmpty()) {
            throw new IllegalArgumentException("at least one replica is required");
        }
        for (Replica replica : replicas) {
            if (this.replicas.putIfAbsent(replica.getId(), replica) != null) {
                throw new IllegalArgumentException("duplicate replica id " + replica.getId());
            }
        }
        this.poolSize = poolSize;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    /**
     * Opens a new session to a replica.
     *
     * @param replicaId Id of the target replica
     * @return A handle owned by the caller, to be closed by the caller
     * @throws ReplicaConnectionException If the replica is unreachable or rejects the credentials
     */
    public ReplicaConnection open(int replicaId) {
        HikariDataSource ds = pool(replicaId);
        try {
            Connection c = ds.getConnection();
            return new ReplicaConnection(replicaId, c);
        } catch (SQLException e) {
            throw new ReplicaConnectionException(replicaId, e);
        }
    }

    /**
     * Looks up or creates the pool under the lock {@link #close()} holds, so no
     * pool is created once the set is closed.
     */
    private synchronized HikariDataSource pool(int replicaId) {
        if (closed) {
            throw new IllegalStateException("replica set is closed");
        }
        return pools.computeIfAbsent(replicaId, this::createPool);
    }

    private HikariDataSource createPool(int replicaId) {
        Replica replica = getReplica(replicaId);
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("replica-" + replicaId);
        cfg.setJdbcUrl(replica.getJdbcUrl());
        cfg.setUsername(replica.getUser());
        cfg.setPassword(replica.getPassword());
        cfg.setMaximumPoolSize(poolSize);
        cfg.setMinimumIdle(Math.min(poolSize, Math.max(2, poolSize / 2)));
        cfg.setConnectionTimeout(connectTimeoutMs);
        cfg.setInitializationFailTimeout(-1);

        new DatabaseAdapter(replica.getType()).configureConnectionProperties(cfg);

        try {
            HikariDataSource ds = new HikariDataSource(cfg);
            log.debug("created pool for {} (max {})", replica, poolSize);
            return ds;
        } catch (RuntimeException e) {
            throw new ReplicaConnectionException(replicaId, e);
        }
    }

    /**
     * @throws IllegalArgumentException If no replica has the given id
     */
    public Replica getReplica(int replicaId) {
        Replica replica = replicas.get(replicaId);
        if (replica == null) {
            throw new IllegalArgumentException("unknown replica id " + replicaId);
        }
        return replica;
    }

    public boolean contains(int replicaId) {
        return replicas.containsKey(replicaId);
    }

    public List<Replica> getReplicas() {
        return Collections.unmodifiableList(new ArrayList<>(replicas.values()));
    }

    public int size() {
        return replicas.size();
    }

    /**
     * Closes every pool that was created. Sessions still checked out are evicted.
     */
    @Override
    public synchronized void close() {
        closed = true;
        for (HikariDataSource ds : pools.values()) {
            ds.close();
        }
        pools.clear();
    }
}
