package org.tpch;

import java.util.Objects;

/**
 * Immutable identity and connection parameters of one database replica.
 *
 * <p>Replicas are created once at startup and never change afterwards. The
 * JDBC URL is derived from host, port and database name for the configured
 * {@link DatabaseType}, or supplied directly via {@link #fromJdbcUrl}.
 */
public final class Replica {
    private final int id;
    private final String host;
    private final int port;
    private final String dbname;
    private final String user;
    private final String password;
    private final String jdbcUrl;

    public Replica(int id, String host, int port, String dbname, String user, String password) {
        this(id, host, port, dbname, user, password, DatabaseType.POSTGRESQL);
    }

    public Replica(int id, String host, int port, String dbname, String user, String password, DatabaseType type) {
        this(id, host, port, dbname, user, password, new DatabaseAdapter(type).jdbcUrl(host, port, dbname));
    }

    private Replica(int id, String host, int port, String dbname, String user, String password, String jdbcUrl) {
        if (id < 0) {
            throw new IllegalArgumentException("replica id must be non-negative: " + id);
        }
        this.id = id;
        this.host = host;
        this.port = port;
        this.dbname = dbname;
        this.user = Objects.requireNonNull(user, "user");
        this.password = password == null ? "" : password;
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    }

    /**
     * Creates a replica reached through an explicit JDBC URL.
     */
    public static Replica fromJdbcUrl(int id, String jdbcUrl, String user, String password) {
        return new Replica(id, null, -1, null, user, password, jdbcUrl);
    }

    public int getId() {
        return id;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDbname() {
        return dbname;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public DatabaseType getType() {
        return DatabaseType.fromUrl(jdbcUrl);
    }

    @Override
    public String toString() {
        return "Replica{id=" + id + ", url=" + jdbcUrl + ", user=" + user + "}";
    }
}
