package db.vtable.schema;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.vtable.ErrorCode;
import db.vtable.MigrationException;
import db.vtable.catalog.ColumnDescriptor;
import db.vtable.catalog.ColumnType;
import db.vtable.catalog.Identifier;
import db.vtable.catalog.TableSchema;
import db.vtable.storage.Transactions;

/**
 * Replaces a table's physical layout for changes SQLite cannot express with ALTER TABLE.
 * Flow, all inside one transaction (or savepoint when the caller already holds one):
 *  1) drop leftovers and create {@code <table>__shadow} with the target columns
 *  2) bulk copy the columns present in both layouts, matched by name
 *  3) carry the AUTOINCREMENT high-water mark so record ids are never reused
 *  4) drop the original and rename the shadow into its place
 * Any failure rolls everything back and surfaces {@link ErrorCode#MIGRATION_FAILURE}.
 */
public class TableRebuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(TableRebuilder.class);

    static final String SHADOW_SUFFIX = "__shadow";

    private final RebuildListener listener;

    public TableRebuilder() {
        this(RebuildListener.NONE);
    }

    public TableRebuilder(RebuildListener listener) {
        this.listener = listener;
    }

    public void rebuild(Connection conn, TableSchema current, List<ColumnDescriptor> target) {
        Identifier table = current.name();
        long keys = target.stream().filter(ColumnDescriptor::primaryKey).count();
        if (keys != 1) {
            throw new MigrationException(ErrorCode.MIGRATION_FAILURE,
                "Table '" + table + "' must keep exactly one primary-key column, target has " + keys);
        }
        Identifier shadow = Identifier.of(table.name() + SHADOW_SUFFIX);
        List<Identifier> common = intersection(current.columns(), target);

        try {
            Transactions.inTransaction(conn, () -> {
                listener.beforeStep(RebuildStep.CREATE_SHADOW, table);
                execute(conn, "DROP TABLE IF EXISTS " + shadow.quoted());
                execute(conn, createTableSql(shadow, target));

                listener.beforeStep(RebuildStep.COPY_ROWS, table);
                if (!common.isEmpty()) {
                    String cols = common.stream().map(Identifier::quoted).collect(Collectors.joining(", "));
                    execute(conn, "INSERT INTO " + shadow.quoted() + " (" + cols + ") SELECT " + cols
                        + " FROM " + table.quoted());
                }
                carrySequence(conn, table, shadow);

                listener.beforeStep(RebuildStep.SWAP, table);
                execute(conn, "DROP TABLE " + table.quoted());
                execute(conn, "ALTER TABLE " + shadow.quoted() + " RENAME TO " + table.quoted());
                return null;
            });
        } catch (SQLException | RuntimeException e) {
            LOGGER.error("Rebuild of table '{}' failed, original left untouched: {}", table, e.getMessage());
            throw new MigrationException(ErrorCode.MIGRATION_FAILURE,
                "Rebuild of table '" + table + "' failed: " + e.getMessage(), e);
        }
        LOGGER.info("Rebuilt table '{}' ({} -> {} columns, {} copied)",
            table, current.columns().size(), target.size(), common.size());
    }

    static String createTableSql(Identifier table, List<ColumnDescriptor> columns) {
        List<String> defs = new ArrayList<>();
        for (ColumnDescriptor c : columns) {
            StringBuilder def = new StringBuilder(c.name().quoted()).append(' ').append(c.type().sqlName());
            if (c.primaryKey()) {
                def.append(" PRIMARY KEY");
                if (c.type() == ColumnType.INTEGER) def.append(" AUTOINCREMENT");
            } else if (!c.nullable()) {
                def.append(" NOT NULL");
            }
            c.defaultValue().ifPresent(d -> def.append(" DEFAULT ").append(d));
            defs.add(def.toString());
        }
        return "CREATE TABLE " + table.quoted() + " (" + String.join(", ", defs) + ")";
    }

    // By name, not position; keeps target order.
    private static List<Identifier> intersection(List<ColumnDescriptor> old, List<ColumnDescriptor> target) {
        List<Identifier> out = new ArrayList<>();
        for (ColumnDescriptor t : target) {
            if (old.stream().anyMatch(o -> o.name().equals(t.name()))) out.add(t.name());
        }
        return out;
    }

    private static void carrySequence(Connection conn, Identifier table, Identifier shadow) throws SQLException {
        if (!hasSequenceTable(conn)) return;
        try (PreparedStatement del = conn.prepareStatement("DELETE FROM sqlite_sequence WHERE name = ?")) {
            del.setString(1, shadow.name());
            del.executeUpdate();
        }
        try (PreparedStatement ins = conn.prepareStatement(
                "INSERT INTO sqlite_sequence (name, seq) SELECT ?, seq FROM sqlite_sequence WHERE name = ?")) {
            ins.setString(1, shadow.name());
            ins.setString(2, table.name());
            ins.executeUpdate();
        }
    }

    private static boolean hasSequenceTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = 'sqlite_sequence'")) {
            return rs.next();
        }
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }
}
