package org.tpch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Creates the per-replica secondary indexes before the power test.
 *
 * <p>Indexes are named {@code idx_1}, {@code idx_2}, ... in the order they are
 * given, across all replicas. Not part of any timed region.
 */
public class IndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private final ReplicaSet replicas;

    public IndexBuilder(ReplicaSet replicas) {
        this.replicas = replicas;
    }

    /**
     * @param indexes Index assignments, in creation order
     * @return Number of indexes created
     * @throws StatementException If a replica rejects an index
     */
    public int createIndexes(List<IndexSpec> indexes) {
        for (IndexSpec index : indexes) {
            replicas.getReplica(index.getReplicaId());
        }
        log.info("creating indexes!");
        int created = 0;
        for (Replica replica : replicas.getReplicas()) {
            DatabaseAdapter adapter = new DatabaseAdapter(replica.getType());
            ReplicaConnection conn = null;
            try {
                for (int i = 0; i < indexes.size(); i++) {
                    IndexSpec index = indexes.get(i);
                    if (index.getReplicaId() != replica.getId()) {
                        continue;
                    }
                    if (conn == null) {
                        conn = replicas.open(replica.getId());
                    }
                    String sql = adapter.createIndexSql("idx_" + (i + 1), index.getTable(), index.getColumns());
                    conn.executeUpdate("INDEX", sql);
                    log.debug("replica {}: {}", replica.getId(), sql);
                    created++;
                }
            } finally {
                if (conn != null) {
                    conn.close();
                }
            }
        }
        log.info("created {} indexes", created);
        return created;
    }
}
