package org.tpch;

/**
 * One precomputed RF2 delete: remove every row of {@code table} whose order key
 * equals {@code orderKey}.
 *
 * <p>Kept structured until execution, where the key is bound as a statement
 * parameter.
 */
public final class RefreshDelete {

    public enum Table {
        LINEITEM("LINEITEM", "L_ORDERKEY"),
        ORDERS("ORDERS", "O_ORDERKEY");

        private final String tableName;
        private final String keyColumn;

        Table(String tableName, String keyColumn) {
            this.tableName = tableName;
            this.keyColumn = keyColumn;
        }

        public String getTableName() {
            return tableName;
        }

        public String deleteSql() {
            return "DELETE FROM " + tableName + " WHERE " + keyColumn + " = ?";
        }
    }

    private final Table table;
    private final long orderKey;

    public RefreshDelete(Table table, long orderKey) {
        this.table = table;
        this.orderKey = orderKey;
    }

    public Table getTable() {
        return table;
    }

    public long getOrderKey() {
        return orderKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RefreshDelete)) return false;
        RefreshDelete other = (RefreshDelete) o;
        return table == other.table && orderKey == other.orderKey;
    }

    @Override
    public int hashCode() {
        return 31 * table.hashCode() + Long.hashCode(orderKey);
    }

    @Override
    public String toString() {
        return table.getTableName() + "#" + orderKey;
    }
}
