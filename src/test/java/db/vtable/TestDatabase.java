package db.vtable;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import db.vtable.config.VTableConfig;

/**
 * Throwaway SQLite databases for tests, one file per test directory.
 */
public final class TestDatabase {
    private TestDatabase() {}

    public static Path file(Path dir) {
        return dir.resolve("test.db");
    }

    public static Connection open(Path dir) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + file(dir));
    }

    public static VTableConfig config(Path dir) {
        return new VTableConfig(file(dir), "product", null, "test", 50, "_cents");
    }

    public static VersionedTable table(Path dir) {
        return VersionedTable.open(config(dir));
    }

    public static void exec(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }

    public static long count(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    public static String string(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }
}
