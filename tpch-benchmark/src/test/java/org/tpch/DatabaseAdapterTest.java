package org.tpch;

import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseAdapterTest {

    @Test
    @DisplayName("dialects are detected from URLs and replica file names")
    void detectsDialect() {
        assertEquals(DatabaseType.POSTGRESQL, DatabaseType.fromUrl("jdbc:postgresql://h:5432/tpch"));
        assertEquals(DatabaseType.MYSQL, DatabaseType.fromUrl("JDBC:MYSQL://h:3306/tpch"));
        assertEquals(DatabaseType.OTHER, DatabaseType.fromUrl("jdbc:h2:mem:x"));
        assertEquals(DatabaseType.POSTGRESQL, DatabaseType.fromName(""));
        assertEquals(DatabaseType.POSTGRESQL, DatabaseType.fromName("Postgres"));
        assertEquals(DatabaseType.MYSQL, DatabaseType.fromName("mysql"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseType.fromName("db2"));
    }

    @Test
    @DisplayName("PostgreSQL sessions send refresh values as untyped strings")
    void postgresProperties() {
        HikariConfig config = new HikariConfig();
        new DatabaseAdapter(DatabaseType.POSTGRESQL).configureConnectionProperties(config);
        assertEquals("unspecified", config.getDataSourceProperties().getProperty("stringtype"));

        HikariConfig other = new HikariConfig();
        new DatabaseAdapter(DatabaseType.OTHER).configureConnectionProperties(other);
        assertTrue(other.getDataSourceProperties().isEmpty());
    }

    @Test
    @DisplayName("MySQL sessions accept multi-statement query texts")
    void mysqlProperties() {
        HikariConfig config = new HikariConfig();
        new DatabaseAdapter(DatabaseType.MYSQL).configureConnectionProperties(config);
        assertEquals("true", config.getDataSourceProperties().getProperty("allowMultiQueries"));
        assertEquals("true", config.getDataSourceProperties().getProperty("cachePrepStmts"));
    }

    @Test
    @DisplayName("index DDL is shared and URLs follow the dialect")
    void ddlAndUrls() {
        DatabaseAdapter mysql = new DatabaseAdapter(DatabaseType.MYSQL);
        assertEquals("CREATE INDEX idx_4 ON LINEITEM (l_shipdate,l_discount)",
            mysql.createIndexSql("idx_4", "LINEITEM", List.of("l_shipdate", "l_discount")));
        assertEquals("jdbc:mysql://db:3306/tpch", mysql.jdbcUrl("db", 3306, "tpch"));
        assertThrows(IllegalStateException.class, () -> new DatabaseAdapter(DatabaseType.OTHER).jdbcUrl("h", 1, "d"));
    }
}
