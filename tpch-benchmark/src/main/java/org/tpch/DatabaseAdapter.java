package org.tpch;

import com.zaxxer.hikari.HikariConfig;

/**
 * Database adapter to handle dialect differences between MySQL and PostgreSQL replicas.
 *
 * <p>This class abstracts away differences in:
 * <ul>
 *   <li>JDBC URL layout</li>
 *   <li>Connection pool properties (statement caching, batch rewriting, multi-statement
 *       query texts, parameter typing)</li>
 * </ul>
 *
 * <p>Refresh function rows arrive as text fields. PostgreSQL is told to send
 * string parameters untyped ({@code stringtype=unspecified}) so the server
 * coerces them to the column type; MySQL coerces on its own.
 */
public class DatabaseAdapter {
    private final DatabaseType dbType;

    public DatabaseAdapter(DatabaseType dbType) {
        this.dbType = dbType;
    }

    public static DatabaseAdapter fromUrl(String url) {
        return new DatabaseAdapter(DatabaseType.fromUrl(url));
    }

    /**
     * Builds the JDBC URL for a host/port/database triple.
     *
     * @param host Replica host name
     * @param port Replica port
     * @param dbname Database name
     * @return JDBC URL in the scheme of this adapter's database type
     * @throws IllegalStateException for {@code OTHER}, which has no known scheme
     */
    public String jdbcUrl(String host, int port, String dbname) {
        switch (dbType) {
            case POSTGRESQL:
                return "jdbc:postgresql://" + host + ":" + port + "/" + dbname;
            case MYSQL:
                return "jdbc:mysql://" + host + ":" + port + "/" + dbname;
            default:
                throw new IllegalStateException("no URL scheme for " + dbType);
        }
    }

    /**
     * Configures HikariCP connection pool properties based on the database type.
     *
     * <p>MySQL: prepared statement caching, server-side prepared statements,
     * batch rewriting and multi-statement texts (Q15 creates and drops a view).
     * PostgreSQL: prepared statement caching and untyped string
     * parameters.
     *
     * @param config The HikariCP configuration to modify
     */
    public void configureConnectionProperties(HikariConfig config) {
        switch (dbType) {
            case MYSQL:
                config.addDataSourceProperty("cachePrepStmts", "true");
                config.addDataSourceProperty("prepStmtCacheSize", "250");
                config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
                config.addDataSourceProperty("rewriteBatchedStatements", "true");
                config.addDataSourceProperty("useServerPrepStmts", "true");
                config.addDataSourceProperty("allowMultiQueries", "true");
                break;
            case POSTGRESQL:
                config.addDataSourceProperty("preparedStatementCacheQueries", "250");
                config.addDataSourceProperty("preparedStatementCacheSizeMiB", "5");
                config.addDataSourceProperty("stringtype", "unspecified");
                break;
            default:
                break;
        }
    }

    /**
     * Generates the DDL for one secondary index. Both dialects accept the same
     * {@code CREATE INDEX} form.
     *
     * @param name Index name
     * @param table Table the index is created on
     * @param columns Indexed columns, in key order
     * @return {@code CREATE INDEX} statement
     */
    public String createIndexSql(String name, String table, Iterable<String> columns) {
        return "CREATE INDEX " + name + " ON " + table + " (" + String.join(",", columns) + ")";
    }

    public DatabaseType getType() {
        return dbType;
    }
}
