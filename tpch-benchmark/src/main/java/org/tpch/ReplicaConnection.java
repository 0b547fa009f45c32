package org.tpch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * A single live session to one replica.
 *
 * <p>Owned by exactly one execution unit and never shared. {@link #close()}
 * hands the session back to the replica's pool exactly once; any later call
 * raises {@link ConnectionClosedException}.
 *
 * <p>{@link #cancel()} is the one call allowed from another thread: it aborts
 * the statement in flight and makes every later query fail.
 */
public class ReplicaConnection implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReplicaConnection.class);

    static final String QUERY_CANCELED_STATE = "57014";

    private final int replicaId;
    private Connection connection;
    private volatile Statement current;
    private volatile boolean cancelled;

    ReplicaConnection(int replicaId, Connection connection) {
        this.replicaId = replicaId;
        this.connection = connection;
    }

    public int getReplicaId() {
        return replicaId;
    }

    /**
     * Executes one benchmark query and reads every result it produces.
     *
     * <p>Multi-statement texts (TPC-H Q15 creates and drops a view around its
     * select) are walked to the end so the whole query is inside the caller's
     * timing.
     *
     * @param label Step label used in failures, e.g. {@code Q15}
     * @param sql Query text
     * @return Number of rows read across all result sets
     * @throws StatementException If the replica rejects the statement
     */
    public long executeQuery(String label, String sql) {
        Connection c = jdbc();
        long rows = 0;
        try (Statement s = c.createStatement()) {
            current = s;
            if (cancelled) {
                throw new SQLException("statement cancelled before execution", QUERY_CANCELED_STATE);
            }
            boolean isResultSet = s.execute(sql);
            while (true) {
                if (isResultSet) {
                    try (ResultSet rs = s.getResultSet()) {
                        while (rs.next()) {
                            rows++;
                        }
                    }
                } else if (s.getUpdateCount() == -1) {
                    break;
                }
                isResultSet = s.getMoreResults();
            }
        } catch (SQLException e) {
            throw new StatementException(label, replicaId, e);
        } finally {
            current = null;
        }
        return rows;
    }

    /**
     * Aborts the query running on this session, if any, and refuses further
     * queries. Safe to call from any thread, any number of times.
     */
    public void cancel() {
        cancelled = true;
        Statement s = current;
        if (s == null) {
            return;
        }
        try {
            s.cancel();
        } catch (SQLException e) {
            log.warn("replica {}: could not cancel running statement: {}", replicaId, e.getMessage());
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Executes a statement that returns no rows.
     *
     * @throws StatementException If the replica rejects the statement
     */
    public void executeUpdate(String label, String sql) {
        try (Statement s = jdbc().createStatement()) {
            s.executeUpdate(sql);
        } catch (SQLException e) {
            throw new StatementException(label, replicaId, e);
        }
    }

    public PreparedStatement prepare(String sql) throws SQLException {
        return jdbc().prepareStatement(sql);
    }

    public void begin() throws SQLException {
        jdbc().setAutoCommit(false);
    }

    public void commit() throws SQLException {
        Connection c = jdbc();
        c.commit();
        c.setAutoCommit(true);
    }

    /**
     * Rolls back an open transaction, attaching any rollback failure to the
     * original cause.
     */
    void rollbackQuietly(Throwable cause) {
        try {
            if (connection != null && !connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    public boolean isClosed() {
        return connection == null;
    }

    /**
     * Releases the session.
     *
     * @throws ConnectionClosedException If the handle was already released
     */
    @Override
    public void close() {
        Connection c = jdbc();
        connection = null;
        try {
            c.close();
        } catch (SQLException e) {
            throw new ReplicaConnectionException(replicaId, e);
        }
    }

    private Connection jdbc() {
        if (connection == null) {
            throw new ConnectionClosedException(replicaId);
        }
        return connection;
    }
}
