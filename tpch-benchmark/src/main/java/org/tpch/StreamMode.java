package org.tpch;

/**
 * Role of a query stream within the benchmark.
 */
public enum StreamMode {
    /** One stream, refresh pair 0 around the 22 queries, run alone. */
    POWER,
    /** Queries only; refresh work is carried by the refresh stream. */
    THROUGHPUT,
    /** Refresh pairs only, one repetition per throughput stream. */
    REFRESH;

    public String label() {
        return name().toLowerCase();
    }
}
