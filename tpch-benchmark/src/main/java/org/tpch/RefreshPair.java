package org.tpch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

/**
 * The two refresh functions of TPC-H applied to a single replica.
 *
 * <p><b>RF1</b> inserts every new order followed by its line items, in the
 * generator's order, inside one transaction. <b>RF2</b> deletes the listed
 * order keys, line items before orders for every key, inside one transaction.
 * Both commits are inside the timed region.
 *
 * <p>All statement text and row splitting is done at construction so the timed
 * regions only bind and execute. RF2 has delete-if-exists semantics: a key
 * without rows is not an error.
 *
 * <p>A pair is stateless across invocations; each run opens and releases its
 * own session.
 */
public class RefreshPair {
    private static final Logger log = LoggerFactory.getLogger(RefreshPair.class);

    private final ReplicaSet replicas;
    private final int replicaId;
    private final List<InsertRow> inserts;
    private final List<RefreshDelete> deletes;

    /**
     * @param replicas Pools of the replicas under test
     * @param replicaId Replica this pair writes to
     * @param data Refresh data of this pair
     */
    public RefreshPair(ReplicaSet replicas, int replicaId, RefreshSet data) {
        this.replicas = replicas;
        this.replicaId = replicas.getReplica(replicaId).getId();
        this.inserts = planInserts(data.getInserts());
        this.deletes = planDeletes(data.getDeleteKeys());
    }

    /**
     * Expands the RF2 key list into its delete steps: for every key, the
     * {@code LINEITEM} rows first and then the {@code ORDERS} row, so foreign
     * keys checked immediately are never violated.
     */
    public static List<RefreshDelete> planDeletes(List<Long> orderKeys) {
        List<RefreshDelete> plan = new ArrayList<>(orderKeys.size() * 2);
        for (long key : orderKeys) {
            plan.add(new RefreshDelete(RefreshDelete.Table.LINEITEM, key));
            plan.add(new RefreshDelete(RefreshDelete.Table.ORDERS, key));
        }
        return Collections.unmodifiableList(plan);
    }

    private static List<InsertRow> planInserts(List<NewOrder> orders) {
        List<InsertRow> plan = new ArrayList<>();
        for (NewOrder order : orders) {
            plan.add(new InsertRow("ORDERS", NewOrder.fields(order.getOrderRow())));
            for (String lineItem : order.getLineItemRows()) {
                plan.add(new InsertRow("LINEITEM", NewOrder.fields(lineItem)));
            }
        }
        return Collections.unmodifiableList(plan);
    }

    public int getReplicaId() {
        return replicaId;
    }

    public List<RefreshDelete> getDeletes() {
        return deletes;
    }

    /**
     * Runs RF1 against this pair's replica.
     *
     * @return Bounds from just before the first insert to just after the commit
     * @throws ReplicaConnectionException If the replica cannot be reached
     * @throws StatementException If any insert or the commit is rejected
     */
    public TimeInterval runInsert() {
        ReplicaConnection conn = replicas.open(replicaId);
        Map<String, PreparedStatement> statements = new HashMap<>();
        try {
            for (InsertRow row : inserts) {
                String sql = row.sql();
                if (!statements.containsKey(sql)) {
                    statements.put(sql, conn.prepare(sql));
                }
            }
            conn.begin();

            long start = System.nanoTime();
            for (InsertRow row : inserts) {
                PreparedStatement ps = statements.get(row.sql());
                for (int i = 0; i < row.fields.size(); i++) {
                    ps.setString(i + 1, row.fields.get(i));
                }
                ps.executeUpdate();
            }
            conn.commit();
            long end = System.nanoTime();

            log.debug("replica {}: RF1 inserted {} rows", replicaId, inserts.size());
            return new TimeInterval(start, end);
        } catch (SQLException e) {
            StatementException failure = new StatementException("RF1", replicaId, e);
            conn.rollbackQuietly(failure);
            throw failure;
        } finally {
            closeAll(statements.values());
            conn.close();
        }
    }

    /**
     * Runs RF2 against this pair's replica.
     *
     * @return Bounds from just before the first delete to just after the commit
     * @throws ReplicaConnectionException If the replica cannot be reached
     * @throws StatementException If any delete or the commit is rejected
     */
    public TimeInterval runDelete() {
        ReplicaConnection conn = replicas.open(replicaId);
        Map<RefreshDelete.Table, PreparedStatement> statements = new HashMap<>();
        try {
            for (RefreshDelete.Table table : RefreshDelete.Table.values()) {
                statements.put(table, conn.prepare(table.deleteSql()));
            }
            conn.begin();

            int absent = 0;
            long start = System.nanoTime();
            for (RefreshDelete delete : deletes) {
                PreparedStatement ps = statements.get(delete.getTable());
                ps.setLong(1, delete.getOrderKey());
                int removed = ps.executeUpdate();
                if (removed == 0 && delete.getTable() == RefreshDelete.Table.ORDERS) {
                    absent++;
                }
            }
            conn.commit();
            long end = System.nanoTime();

            if (absent > 0) {
                log.debug("replica {}: RF2 found no order for {} of {} keys", replicaId, absent, deletes.size() / 2);
            }
            return new TimeInterval(start, end);
        } catch (SQLException e) {
            StatementException failure = new StatementException("RF2", replicaId, e);
            conn.rollbackQuietly(failure);
            throw failure;
        } finally {
            closeAll(statements.values());
            conn.close();
        }
    }

    /**
     * RF1 as an execution unit that reports its bounds onto {@code results}.
     */
    public Workload refreshFunction1(BlockingQueue<TimeInterval> results) {
        return () -> results.add(runInsert());
    }

    /**
     * RF2 as an execution unit that reports its bounds onto {@code results}.
     */
    public Workload refreshFunction2(BlockingQueue<TimeInterval> results) {
        return () -> results.add(runDelete());
    }

    private void closeAll(Iterable<PreparedStatement> statements) {
        for (PreparedStatement ps : statements) {
            try {
                ps.close();
            } catch (SQLException e) {
                log.warn("replica {}: failed to close statement: {}", replicaId, e.getMessage());
            }
        }
    }

    private static final class InsertRow {
        private final String sql;
        private final List<String> fields;

        InsertRow(String table, List<String> fields) {
            StringBuilder sb = new StringBuilder("INSERT INTO ").append(table).append(" VALUES (");
            for (int i = 0; i < fields.size(); i++) {
                sb.append(i == 0 ? "?" : ",?");
            }
            this.sql = sb.append(')').toString();
            this.fields = fields;
        }

        String sql() {
            return sql;
        }
    }
}
