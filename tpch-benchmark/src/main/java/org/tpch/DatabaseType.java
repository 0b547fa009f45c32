package org.tpch;

/**
 * Enumeration of the database systems a replica can run.
 *
 * <p>Used to pick the JDBC URL scheme and the dialect-specific pool properties
 * applied by {@link DatabaseAdapter}.
 */
public enum DatabaseType {
    MYSQL,
    POSTGRESQL,
    OTHER;

    /**
     * Determines the database type from a JDBC URL.
     *
     * @param url The JDBC connection URL
     * @return The detected {@code DatabaseType}, {@code OTHER} for any driver
     *         without dedicated tuning (or a null URL)
     */
    public static DatabaseType fromUrl(String url) {
        if (url == null) return OTHER;
        url = url.toLowerCase();
        if (url.startsWith("jdbc:postgresql:")) {
            return POSTGRESQL;
        }
        if (url.startsWith("jdbc:mysql:")) {
            return MYSQL;
        }
        return OTHER;
    }

    /**
     * Parses the dialect column of the replica file.
     *
     * @param name {@code postgresql}, {@code postgres} or {@code mysql}; blank means PostgreSQL
     * @return The matching type
     * @throws IllegalArgumentException for any other value
     */
    public static DatabaseType fromName(String name) {
        if (name == null || name.isBlank()) return POSTGRESQL;
        switch (name.trim().toLowerCase()) {
            case "postgresql":
            case "postgres":
                return POSTGRESQL;
            case "mysql":
                return MYSQL;
            default:
                throw new IllegalArgumentException("unsupported database type: " + name);
        }
    }
}
