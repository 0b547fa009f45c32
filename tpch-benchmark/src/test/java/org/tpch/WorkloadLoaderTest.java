package org.tpch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkloadLoaderTest {

    @TempDir
    Path dir;

    private Path write(String name, String... lines) throws IOException {
        return Files.write(dir.resolve(name), List.of(lines));
    }

    @Test
    @DisplayName("replica rows become JDBC URLs for their dialect")
    void readReplicas() throws IOException {
        Path file = write("replicas.csv",
            "# id,host,port,dbname,user,password[,type]",
            "0,db0,5432,tpch,bench,secret",
            "",
            "1,db1,3306,tpch,bench,secret,mysql");

        List<Replica> replicas = WorkloadLoader.readReplicas(file);

        assertEquals(2, replicas.size());
        assertEquals("jdbc:postgresql://db0:5432/tpch", replicas.get(0).getJdbcUrl());
        assertEquals(DatabaseType.POSTGRESQL, replicas.get(0).getType());
        assertEquals("jdbc:mysql://db1:3306/tpch", replicas.get(1).getJdbcUrl());
        assertEquals("secret", replicas.get(1).getPassword());
        assertEquals(Set.of(0, 1), WorkloadLoader.ids(replicas));
    }

    @Test
    @DisplayName("malformed replica files are rejected")
    void rejectsBadReplicas() throws IOException {
        assertThrows(IllegalArgumentException.class,
            () -> WorkloadLoader.readReplicas(write("short.csv", "0,db0,5432,tpch")));
        assertThrows(IllegalArgumentException.class,
            () -> WorkloadLoader.readReplicas(write("empty.csv", "# nothing")));
        assertThrows(IllegalArgumentException.class,
            () -> WorkloadLoader.readReplicas(write("dialect.csv", "0,db0,1,tpch,u,p,oracle")));
    }

    @Test
    @DisplayName("the routing line maps queries 1..22 in order")
    void readRoutes() throws IOException {
        Path file = write("routes.csv", "0,1,0,1,0,1,0,1,0,1,0,1,0,1,0,1,0,1,0,1,1,1");

        RoutingTable routes = WorkloadLoader.readRoutes(file, Set.of(0, 1));

        assertEquals(0, routes.replicaFor(1));
        assertEquals(1, routes.replicaFor(2));
        assertEquals(1, routes.replicaFor(21));
        assertThrows(IllegalArgumentException.class, () -> WorkloadLoader.readRoutes(file, Set.of(0)));
    }

    @Test
    @DisplayName("index rows resolve their table from the column prefix")
    void readIndexes() throws IOException {
        Path file = write("indexes.csv", "0,l_shipdate", "1,ps_partkey,ps_suppkey", "1,o_orderdate");

        List<IndexSpec> indexes = WorkloadLoader.readIndexes(file);

        assertEquals(3, indexes.size());
        assertEquals("LINEITEM", indexes.get(0).getTable());
        assertEquals("PARTSUPP", indexes.get(1).getTable());
        assertEquals(List.of("ps_partkey", "ps_suppkey"), indexes.get(1).getColumns());
        assertEquals(1, indexes.get(2).getReplicaId());
        assertTrue(WorkloadLoader.readIndexes(dir.resolve("missing.csv")).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> IndexSpec.tableForColumn("x_unknown"));
    }

    @Test
    @DisplayName("queries are read from 1.sql through 22.sql")
    void readQueries() throws IOException {
        for (int q = 1; q <= 22; q++) {
            write(q + ".sql", "-- query " + q, "select " + q + ";", "");
        }

        QuerySet queries = WorkloadLoader.readQueries(dir);

        assertEquals("-- query 7\nselect 7;", queries.get(7));
        Files.delete(dir.resolve("13.sql"));
        assertThrows(IOException.class, () -> WorkloadLoader.readQueries(dir));
    }

    @Test
    @DisplayName("line items are grouped under their order, in file order")
    void readRefreshSets() throws IOException {
        write("orders.tbl.u1", H2Replicas.orderRow(7), H2Replicas.orderRow(3));
        write("lineitem.tbl.u1", H2Replicas.lineItemRow(7, 1), H2Replicas.lineItemRow(3, 1),
            H2Replicas.lineItemRow(7, 2));
        write("delete.1", "5|", "9|");

        List<RefreshSet> sets = WorkloadLoader.readRefreshSets(dir, 1);

        assertEquals(1, sets.size());
        RefreshSet set = sets.get(0);
        assertEquals(2, set.getInserts().size());
        assertEquals(7L, set.getInserts().get(0).getOrderKey());
        assertEquals(2, set.getInserts().get(0).getLineItemRows().size());
        assertEquals(3L, set.getInserts().get(1).getOrderKey());
        assertEquals(List.of(5L, 9L), set.getDeleteKeys());
        assertEquals(9, NewOrder.fields(set.getInserts().get(0).getOrderRow()).size());
        assertEquals(16, NewOrder.fields(set.getInserts().get(0).getLineItemRows().get(0)).size());
    }

    @Test
    @DisplayName("line items of unknown orders and duplicate orders are rejected")
    void rejectsInconsistentRefreshData() throws IOException {
        Path orders = write("orders", H2Replicas.orderRow(7));
        Path strayItem = write("lineitem", H2Replicas.lineItemRow(8, 1));
        Path deletes = write("delete", "1|");
        assertThrows(IllegalArgumentException.class,
            () -> WorkloadLoader.readRefreshSet(orders, strayItem, deletes));

        Path duplicate = write("orders.dup", H2Replicas.orderRow(7), H2Replicas.orderRow(7));
        Path noItems = write("lineitem.empty");
        assertThrows(IllegalArgumentException.class,
            () -> WorkloadLoader.readRefreshSet(duplicate, noItems, deletes));
    }
}
