package org.tpch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The 22 benchmark query texts, indexed by canonical query number.
 *
 * <p>Texts are fully expanded before the run; substitution parameters are
 * resolved outside the timed region (TPC-H clause 2.5.3.1).
 */
public final class QuerySet {
    public static final int QUERY_COUNT = 22;

    private final List<String> queries;

    /**
     * @param queries Query texts for queries 1..22, in canonical order
     */
    public QuerySet(List<String> queries) {
        if (queries.size() != QUERY_COUNT) {
            throw new IllegalArgumentException("expected " + QUERY_COUNT + " queries, got " + queries.size());
        }
        for (int i = 0; i < queries.size(); i++) {
            String q = queries.get(i);
            if (q == null || q.isBlank()) {
                throw new IllegalArgumentException("query " + (i + 1) + " is empty");
            }
        }
        this.queries = Collections.unmodifiableList(new ArrayList<>(queries));
    }

    public String get(int queryNumber) {
        checkQueryNumber(queryNumber);
        return queries.get(queryNumber - 1);
    }

    static void checkQueryNumber(int queryNumber) {
        if (queryNumber < 1 || queryNumber > QUERY_COUNT) {
            throw new IllegalArgumentException("query number out of range: " + queryNumber);
        }
    }
}
