package org.tpch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A secondary index assigned to one replica.
 *
 * <p>The table is derived from the column prefix, following the TPC-H naming
 * scheme ({@code l_} LINEITEM, {@code ps_} PARTSUPP, ...).
 */
public final class IndexSpec {
    private static final Map<String, String> TABLES_BY_PREFIX = new HashMap<>();

    static {
        TABLES_BY_PREFIX.put("l", "LINEITEM");
        TABLES_BY_PREFIX.put("p", "PART");
        TABLES_BY_PREFIX.put("ps", "PARTSUPP");
        TABLES_BY_PREFIX.put("o", "ORDERS");
        TABLES_BY_PREFIX.put("c", "CUSTOMER");
        TABLES_BY_PREFIX.put("n", "NATION");
        TABLES_BY_PREFIX.put("r", "REGION");
        TABLES_BY_PREFIX.put("s", "SUPPLIER");
    }

    private final int replicaId;
    private final String table;
    private final List<String> columns;

    public IndexSpec(int replicaId, String table, List<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("an index needs at least one column");
        }
        this.replicaId = replicaId;
        this.table = table;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    /**
     * Builds an index on the table that owns the first column.
     */
    public static IndexSpec onColumns(int replicaId, List<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("an index needs at least one column");
        }
        return new IndexSpec(replicaId, tableForColumn(columns.get(0)), columns);
    }

    /**
     * @param column Column name, e.g. {@code ps_suppkey}
     * @return Owning table, e.g. {@code PARTSUPP}
     */
    public static String tableForColumn(String column) {
        String prefix = column.trim().toLowerCase().split("_", 2)[0];
        String table = TABLES_BY_PREFIX.get(prefix);
        if (table == null) {
            throw new IllegalArgumentException("no TPC-H table for column " + column);
        }
        return table;
    }

    public int getReplicaId() {
        return replicaId;
    }

    public String getTable() {
        return table;
    }

    public List<String> getColumns() {
        return columns;
    }
}
