package org.tpch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Maps each canonical query number to the replica that executes it.
 *
 * <p>Position {@code i} holds the replica for query {@code i + 1}. The table
 * always has exactly {@value QuerySet#QUERY_COUNT} entries, each naming a known replica.
 */
public final class RoutingTable {
    private final int[] routes;

    /**
     * @param routes Replica id per canonical query, in query order
     * @param replicaIds Ids of the configured replicas
     * @throws IllegalArgumentException If the length is wrong or an id is unknown
     */
    public RoutingTable(List<Integer> routes, Set<Integer> replicaIds) {
        if (routes.size() != QuerySet.QUERY_COUNT) {
            throw new IllegalArgumentException("routing table must have " + QuerySet.QUERY_COUNT
                + " entries, got " + routes.size());
        }
        this.routes = new int[QuerySet.QUERY_COUNT];
        for (int i = 0; i < routes.size(); i++) {
            Integer replica = routes.get(i);
            if (replica == null || !replicaIds.contains(replica)) {
                throw new IllegalArgumentException("query " + (i + 1) + " routed to unknown replica " + replica);
            }
            this.routes[i] = replica;
        }
    }

    /**
     * Routes every query to the same replica.
     */
    public static RoutingTable uniform(int replicaId) {
        return new RoutingTable(Collections.nCopies(QuerySet.QUERY_COUNT, replicaId), Set.of(replicaId));
    }

    /**
     * @param queryNumber Canonical query number, 1..22
     * @return Id of the replica that executes the query
     */
    public int replicaFor(int queryNumber) {
        QuerySet.checkQueryNumber(queryNumber);
        return routes[queryNumber - 1];
    }

    public List<Integer> asList() {
        List<Integer> list = new ArrayList<>(routes.length);
        for (int r : routes) {
            list.add(r);
        }
        return Collections.unmodifiableList(list);
    }
}
