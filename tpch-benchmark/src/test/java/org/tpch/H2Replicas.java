package org.tpch;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * H2 in-memory replicas carrying the ORDERS and LINEITEM tables of TPC-H.
 */
public final class H2Replicas {
    private static final AtomicInteger DB_COUNTER = new AtomicInteger();

    static final String ORDERS_DDL = "CREATE TABLE ORDERS ("
        + "O_ORDERKEY BIGINT NOT NULL PRIMARY KEY, O_CUSTKEY INTEGER NOT NULL, O_ORDERSTATUS CHAR(1) NOT NULL, "
        + "O_TOTALPRICE DECIMAL(15,2) NOT NULL, O_ORDERDATE DATE NOT NULL, O_ORDERPRIORITY CHAR(15) NOT NULL, "
        + "O_CLERK CHAR(15) NOT NULL, O_SHIPPRIORITY INTEGER NOT NULL, O_COMMENT VARCHAR(79) NOT NULL)";

    static final String LINEITEM_DDL = "CREATE TABLE LINEITEM ("
        + "L_ORDERKEY BIGINT NOT NULL, L_PARTKEY INTEGER NOT NULL, L_SUPPKEY INTEGER NOT NULL, "
        + "L_LINENUMBER INTEGER NOT NULL, L_QUANTITY DECIMAL(15,2) NOT NULL, L_EXTENDEDPRICE DECIMAL(15,2) NOT NULL, "
        + "L_DISCOUNT DECIMAL(15,2) NOT NULL, L_TAX DECIMAL(15,2) NOT NULL, L_RETURNFLAG CHAR(1) NOT NULL, "
        + "L_LINESTATUS CHAR(1) NOT NULL, L_SHIPDATE DATE NOT NULL, L_COMMITDATE DATE NOT NULL, "
        + "L_RECEIPTDATE DATE NOT NULL, L_SHIPINSTRUCT CHAR(25) NOT NULL, L_SHIPMODE CHAR(10) NOT NULL, "
        + "L_COMMENT VARCHAR(44) NOT NULL, "
        + "PRIMARY KEY (L_ORDERKEY, L_LINENUMBER), "
        + "FOREIGN KEY (L_ORDERKEY) REFERENCES ORDERS (O_ORDERKEY))";

    private H2Replicas() {
    }

    /**
     * A fresh, empty in-memory replica with the refresh tables, a {@code HITS}
     * table and the {@code PAUSE}, {@code SPIN} and {@code FAIL_WHEN_ARMED} functions.
     */
    static Replica replica(int id) throws SQLException {
        String url = "jdbc:h2:mem:tpch-" + DB_COUNTER.incrementAndGet() + ";DB_CLOSE_DELAY=-1";
        Replica replica = Replica.fromJdbcUrl(id, url, "sa", "");
        execute(replica,
            ORDERS_DDL,
            LINEITEM_DDL,
            "CREATE TABLE HITS (Q INTEGER NOT NULL)",
            "CREATE ALIAS PAUSE FOR 'org.tpch.H2Replicas.pause'",
            "CREATE ALIAS SPIN FOR 'org.tpch.H2Replicas.spin'",
            "CREATE ALIAS FAIL_WHEN_ARMED FOR 'org.tpch.H2Replicas.failWhenArmed'");
        return replica;
    }

    static ReplicaSet replicaSet(Replica... replicas) {
        List<Replica> list = new ArrayList<>();
        Collections.addAll(list, replicas);
        return new ReplicaSet(list, 8, 5000);
    }

    /**
     * Called from SQL as {@code PAUSE(ms)}.
     */
    public static int pause(int millis) throws InterruptedException {
        Thread.sleep(millis);
        return millis;
    }

    /**
     * Called from SQL as {@code SPIN(ms)}. Busy-waits and ignores interrupts,
     * like a driver blocked on the network.
     */
    public static int spin(int millis) {
        long end = System.nanoTime() + millis * 1_000_000L;
        while (System.nanoTime() < end) {
            Thread.onSpinWait();
        }
        return millis;
    }

    private static volatile boolean armed;

    static void arm(boolean value) {
        armed = value;
    }

    /**
     * Called from SQL as {@code FAIL_WHEN_ARMED()}; fails while {@link #arm} is set.
     */
    public static int failWhenArmed() throws SQLException {
        if (armed) {
            throw new SQLException("armed failure");
        }
        return 0;
    }

    static void execute(Replica replica, String... statements) throws SQLException {
        try (Connection c = DriverManager.getConnection(replica.getJdbcUrl(), replica.getUser(), replica.getPassword());
             Statement s = c.createStatement()) {
            for (String sql : statements) {
                s.execute(sql);
            }
        }
    }

    static long count(Replica replica, String sql) throws SQLException {
        try (Connection c = DriverManager.getConnection(replica.getJdbcUrl(), replica.getUser(), replica.getPassword());
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    static List<Integer> hits(Replica replica) throws SQLException {
        List<Integer> hits = new ArrayList<>();
        try (Connection c = DriverManager.getConnection(replica.getJdbcUrl(), replica.getUser(), replica.getPassword());
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT Q FROM HITS ORDER BY Q")) {
            while (rs.next()) {
                hits.add(rs.getInt(1));
            }
        }
        return hits;
    }

    /**
     * 22 cheap read queries.
     */
    static QuerySet countQueries() {
        return new QuerySet(Collections.nCopies(QuerySet.QUERY_COUNT, "SELECT COUNT(*) FROM ORDERS"));
    }

    static QuerySet queries(QueryText text) {
        List<String> queries = new ArrayList<>();
        for (int q = 1; q <= QuerySet.QUERY_COUNT; q++) {
            queries.add(text.forQuery(q));
        }
        return new QuerySet(queries);
    }

    interface QueryText {
        String forQuery(int queryNumber);
    }

    static String orderRow(long key) {
        return key + "|39136|O|252004.18|1996-01-10|2-HIGH|Clerk#000000470|0|ly special requests |";
    }

    static String lineItemRow(long key, int lineNumber) {
        return key + "|182052|9607|" + lineNumber + "|12|13608.60|0.07|0.03|N|O|1996-05-07|1996-03-13|1996-06-03|"
            + "TAKE BACK RETURN|FOB|ss pinto beans wake against th|";
    }

    /**
     * One new order with two line items, and a delete of that same order.
     */
    static RefreshSet refreshSet(long key) {
        NewOrder order = new NewOrder(orderRow(key), List.of(lineItemRow(key, 1), lineItemRow(key, 2)));
        return new RefreshSet(List.of(order), List.of(key));
    }

    static List<RefreshSet> refreshSets(int count) {
        List<RefreshSet> sets = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            sets.add(refreshSet(1_000_000L + i));
        }
        return sets;
    }
}
