package db.vtable.catalog;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the live physical schema of a table. Nothing is cached: each call reflects
 * whatever the given connection currently sees, including uncommitted changes made
 * earlier in the same transaction.
 */
public class SchemaIntrospector {
    private static final String TABLE_INFO = "PRAGMA table_info(%s)";
    private static final String CREATE_SQL =
        "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ? COLLATE NOCASE";

    /** Columns in declaration order; empty if the table does not exist. */
    public List<ColumnDescriptor> listColumns(Connection conn, Identifier table) throws SQLException {
        List<ColumnDescriptor> columns = new ArrayList<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(String.format(TABLE_INFO, table.quoted()))) {
            while (rs.next()) {
                String dflt = rs.getString("dflt_value");
                columns.add(new ColumnDescriptor(
                    rs.getInt("cid"),
                    Identifier.of(rs.getString("name")),
                    ColumnType.fromDeclared(rs.getString("type")),
                    rs.getInt("notnull") == 0,
                    Optional.ofNullable(dflt),
                    rs.getInt("pk") > 0));
            }
        }
        return columns;
    }

    public TableSchema readSchema(Connection conn, Identifier table) throws SQLException {
        return new TableSchema(table, listColumns(conn, table));
    }

    /** Stored CREATE TABLE text, for display only. */
    public Optional<String> getDefinitionStatement(Connection conn, Identifier table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(CREATE_SQL)) {
            ps.setString(1, table.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    public boolean tableExists(Connection conn, Identifier table) throws SQLException {
        return getDefinitionStatement(conn, table).isPresent();
    }
}
