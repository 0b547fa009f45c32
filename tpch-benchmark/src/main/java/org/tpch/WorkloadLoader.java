package org.tpch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the benchmark inputs produced ahead of the run: replica list, routing
 * table, index assignments, expanded query texts and refresh data.
 *
 * <p>Refresh set {@code i} (1-based) consists of {@code orders.tbl.u<i>},
 * {@code lineitem.tbl.u<i>} and {@code delete.<i>} in the refresh directory.
 * Blank lines and lines starting with {@code #} are skipped in every CSV file.
 */
public final class WorkloadLoader {
    private static final Logger log = LoggerFactory.getLogger(WorkloadLoader.class);

    private WorkloadLoader() {
    }

    /**
     * Reads {@code id,host,port,dbname,user,password[,type]} rows.
     */
    public static List<Replica> readReplicas(Path file) throws IOException {
        List<Replica> replicas = new ArrayList<>();
        for (String line : csvLines(file)) {
            String[] f = line.split(",", -1);
            if (f.length < 6 || f.length > 7) {
                throw new IllegalArgumentException(file + ": expected 6 or 7 fields: " + line);
            }
            DatabaseType type = DatabaseType.fromName(f.length == 7 ? f[6] : null);
            replicas.add(new Replica(Integer.parseInt(f[0].trim()), f[1].trim(), Integer.parseInt(f[2].trim()),
                f[3].trim(), f[4].trim(), f[5].trim(), type));
        }
        if (replicas.isEmpty()) {
            throw new IllegalArgumentException(file + ": no replicas defined");
        }
        return replicas;
    }

    /**
     * Reads the routing table: one line of 22 comma-separated replica ids.
     */
    public static RoutingTable readRoutes(Path file, Set<Integer> replicaIds) throws IOException {
        List<String> lines = csvLines(file);
        if (lines.isEmpty()) {
            throw new IllegalArgumentException(file + ": routing table is empty");
        }
        List<Integer> routes = new ArrayList<>();
        for (String r : lines.get(0).split(",")) {
            routes.add(Integer.parseInt(r.trim()));
        }
        return new RoutingTable(routes, replicaIds);
    }

    /**
     * Reads {@code replicaId,column[,column...]} rows. A missing file means no indexes.
     */
    public static List<IndexSpec> readIndexes(Path file) throws IOException {
        if (!Files.exists(file)) {
            log.info("no index configuration at {}", file);
            return Collections.emptyList();
        }
        List<IndexSpec> indexes = new ArrayList<>();
        for (String line : csvLines(file)) {
            String[] f = line.split(",");
            if (f.length < 2) {
                throw new IllegalArgumentException(file + ": expected a replica id and at least one column: " + line);
            }
            List<String> columns = new ArrayList<>();
            for (String c : Arrays.copyOfRange(f, 1, f.length)) {
                columns.add(c.trim());
            }
            indexes.add(IndexSpec.onColumns(Integer.parseInt(f[0].trim()), columns));
        }
        return indexes;
    }

    /**
     * Reads {@code 1.sql} .. {@code 22.sql} from a directory.
     */
    public static QuerySet readQueries(Path dir) throws IOException {
        log.info("reading queries");
        List<String> queries = new ArrayList<>(QuerySet.QUERY_COUNT);
        for (int q = 1; q <= QuerySet.QUERY_COUNT; q++) {
            queries.add(Files.readString(dir.resolve(q + ".sql"), StandardCharsets.UTF_8).strip());
        }
        return new QuerySet(queries);
    }

    /**
     * Reads refresh sets {@code 1..count}.
     */
    public static List<RefreshSet> readRefreshSets(Path dir, int count) throws IOException {
        log.info("loading data for {} refresh pairs", count);
        List<RefreshSet> sets = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            sets.add(readRefreshSet(dir.resolve("orders.tbl.u" + i), dir.resolve("lineitem.tbl.u" + i),
                dir.resolve("delete." + i)));
        }
        return sets;
    }

    /**
     * Groups line items under their order, keeping the order file's sequence.
     */
    public static RefreshSet readRefreshSet(Path ordersFile, Path lineItemsFile, Path deleteFile) throws IOException {
        Map<Long, String> orders = new LinkedHashMap<>();
        Map<Long, List<String>> lineItems = new LinkedHashMap<>();
        for (String row : dataLines(ordersFile)) {
            long key = NewOrder.orderKeyOf(row);
            if (orders.putIfAbsent(key, row) != null) {
                throw new IllegalArgumentException(ordersFile + ": duplicate order key " + key);
            }
            lineItems.put(key, new ArrayList<>());
        }
        for (String row : dataLines(lineItemsFile)) {
            long key = NewOrder.orderKeyOf(row);
            List<String> items = lineItems.get(key);
            if (items == null) {
                throw new IllegalArgumentException(lineItemsFile + ": line item for unknown order " + key);
            }
            items.add(row);
        }

        List<NewOrder> inserts = new ArrayList<>(orders.size());
        for (Map.Entry<Long, String> e : orders.entrySet()) {
            inserts.add(new NewOrder(e.getValue(), lineItems.get(e.getKey())));
        }

        List<Long> deletes = new ArrayList<>();
        for (String row : dataLines(deleteFile)) {
            deletes.add(NewOrder.orderKeyOf(row));
        }
        return new RefreshSet(inserts, deletes);
    }

    private static List<String> csvLines(Path file) throws IOException {
        List<String> lines = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private static List<String> dataLines(Path file) throws IOException {
        List<String> lines = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        return lines;
    }

    static Set<Integer> ids(List<Replica> replicas) {
        Set<Integer> ids = new HashSet<>();
        for (Replica r : replicas) {
            ids.add(r.getId());
        }
        return ids;
    }
}
