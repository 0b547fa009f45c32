package org.tpch;

/**
 * Raised when a {@link ReplicaConnection} is used after it was released.
 */
public class ConnectionClosedException extends IllegalStateException {

    public ConnectionClosedException(int replicaId) {
        super("connection to replica " + replicaId + " has already been closed");
    }
}
