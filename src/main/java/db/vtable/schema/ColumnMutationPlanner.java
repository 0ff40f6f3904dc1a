package db.vtable.schema;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.vtable.ErrorCode;
import db.vtable.MigrationException;
import db.vtable.catalog.ColumnDescriptor;
import db.vtable.catalog.ColumnType;
import db.vtable.catalog.Identifier;
import db.vtable.catalog.SchemaIntrospector;
import db.vtable.catalog.TableSchema;
import db.vtable.storage.Transactions;

/**
 * Decides how a requested schema change is applied.
 * Strategy:
 *  1. Adding a column is additive: a single ALTER TABLE ADD COLUMN, existing rows untouched.
 *  2. Dropping, renaming or retyping a column needs a new physical layout: {@link TableRebuilder}.
 *  3. Raw statements bypass planning entirely.
 */
public class ColumnMutationPlanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ColumnMutationPlanner.class);

    static final String DEFAULT_KEY = "id";

    private final SchemaIntrospector introspector;
    private final TableRebuilder rebuilder;

    public ColumnMutationPlanner(SchemaIntrospector introspector, TableRebuilder rebuilder) {
        this.introspector = introspector;
        this.rebuilder = rebuilder;
    }

    /** Creates the table with only its primary key if it does not exist yet. */
    public void ensureTable(Connection conn, Identifier table) throws SQLException {
        if (introspector.tableExists(conn, table)) return;
        execute(conn, "CREATE TABLE " + table.quoted() + " (\"" + DEFAULT_KEY + "\" INTEGER PRIMARY KEY AUTOINCREMENT)");
        LOGGER.info("Created table '{}' with default schema", table);
    }

    public void addColumn(Connection conn, Identifier table, Identifier name, String type, String defaultValue)
            throws SQLException {
        addColumn(conn, table, name, ColumnType.parse(type), defaultValue);
    }

    public void addColumn(Connection conn, Identifier table, Identifier name, ColumnType type, String defaultValue)
            throws SQLException {
        TableSchema schema = introspector.readSchema(conn, table);
        if (schema.find(name).isPresent()) {
            throw new MigrationException(ErrorCode.COLUMN_EXISTS,
                "Column '" + name + "' already exists in table '" + table + "'");
        }
        Optional<String> literal = SqlLiterals.render(type, defaultValue);
        StringBuilder sql = new StringBuilder("ALTER TABLE ").append(table.quoted())
            .append(" ADD COLUMN ").append(name.quoted()).append(' ').append(type.sqlName());
        literal.ifPresent(l -> sql.append(" DEFAULT ").append(l));
        execute(conn, sql.toString());
        LOGGER.info("Added column '{}' {} to '{}'{}", name, type, table,
            literal.map(l -> " default " + l).orElse(""));
    }

    public void dropColumn(Connection conn, Identifier table, Identifier name) throws SQLException {
        TableSchema schema = introspector.readSchema(conn, table);
        ColumnDescriptor victim = mutableColumn(schema, name);
        List<ColumnDescriptor> target = new ArrayList<>();
        for (ColumnDescriptor c : schema.columns()) {
            if (c != victim) target.add(c.withOrdinal(target.size()));
        }
        rebuilder.rebuild(conn, schema, target);
        LOGGER.info("Dropped column '{}' from '{}'", name, table);
    }

    /**
     * Renames and/or retypes a column. The new default replaces the old one; a null or
     * empty default removes it. A retyped column keeps its nullability; a renamed one
     * starts empty and so becomes nullable.
     */
    public void modifyColumn(Connection conn, Identifier table, Identifier oldName, Identifier newName,
                             String newType, String newDefault) throws SQLException {
        ColumnType type = ColumnType.parse(newType);
        TableSchema schema = introspector.readSchema(conn, table);
        ColumnDescriptor original = mutableColumn(schema, oldName);
        if (!newName.equals(oldName) && schema.find(newName).isPresent()) {
            throw new MigrationException(ErrorCode.COLUMN_EXISTS,
                "Cannot rename '" + oldName + "' to '" + newName + "': column already exists");
        }
        Optional<String> literal = SqlLiterals.render(type, newDefault);
        ColumnDescriptor replacement = original.redefined(newName, type, literal);
        if (!newName.equals(oldName)) {
            // Values are not carried across a rename, so existing rows would violate NOT NULL.
            replacement = new ColumnDescriptor(replacement.ordinal(), replacement.name(), replacement.type(),
                true, replacement.defaultValue(), false);
        }
        List<ColumnDescriptor> target = new ArrayList<>();
        for (ColumnDescriptor c : schema.columns()) {
            target.add(c == original ? replacement : c);
        }
        rebuilder.rebuild(conn, schema, target);
        LOGGER.info("Modified column '{}' -> '{}' {} in '{}'", oldName, newName, type, table);
    }

    /**
     * Executes operator-issued SQL as-is. Nothing here protects schema/ledger consistency,
     * so every call is logged with its actor.
     */
    public void runRawStatement(Connection conn, Identifier table, String sql, String actor) throws SQLException {
        if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql must not be blank");
        LOGGER.warn("Raw statement on '{}' by '{}': {}", table, actor, sql);
        Transactions.inTransaction(conn, () -> {
            execute(conn, sql);
            return null;
        });
    }

    private static ColumnDescriptor mutableColumn(TableSchema schema, Identifier name) {
        ColumnDescriptor c = schema.find(name).orElseThrow(() -> new MigrationException(ErrorCode.COLUMN_NOT_FOUND,
            "Column '" + name + "' not found in table '" + schema.name() + "'"));
        if (c.primaryKey()) {
            throw new MigrationException(ErrorCode.PRIMARY_KEY_IMMUTABLE,
                "Primary key column '" + c.name() + "' cannot be dropped or modified");
        }
        return c;
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }
}
