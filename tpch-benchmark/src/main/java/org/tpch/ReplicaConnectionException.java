package org.tpch;

/**
 * A replica could not be reached or rejected the configured credentials.
 */
public class ReplicaConnectionException extends BenchmarkException {
    private final int replicaId;

    public ReplicaConnectionException(int replicaId, Throwable cause) {
        super("cannot connect to replica " + replicaId + ": " + cause.getMessage(), cause);
        this.replicaId = replicaId;
    }

    public int getReplicaId() {
        return replicaId;
    }
}
