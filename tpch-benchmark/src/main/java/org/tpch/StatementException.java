package org.tpch;

import java.sql.SQLException;

/**
 * A statement was rejected by a replica.
 *
 * <p>The label identifies the benchmark step that issued it ({@code Q7},
 * {@code RF1}, {@code RF2}, {@code INDEX}).
 */
public class StatementException extends BenchmarkException {
    private final String label;
    private final int replicaId;
    private final String sqlState;

    public StatementException(String label, int replicaId, SQLException cause) {
        super(label + " failed on replica " + replicaId + " [" + cause.getSQLState() + "]: " + cause.getMessage(), cause);
        this.label = label;
        this.replicaId = replicaId;
        this.sqlState = cause.getSQLState();
    }

    public String getLabel() {
        return label;
    }

    public int getReplicaId() {
        return replicaId;
    }

    public String getSqlState() {
        return sqlState;
    }
}
