package db.vtable.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.vtable.AccessException;
import db.vtable.ErrorCode;
import db.vtable.catalog.ColumnDescriptor;
import db.vtable.catalog.Identifier;
import db.vtable.catalog.SchemaIntrospector;
import db.vtable.catalog.TableSchema;
import db.vtable.ledger.FieldDiff;
import db.vtable.ledger.VersionEntry;
import db.vtable.ledger.VersioningLedger;

/**
 * Generic CRUD over a table whose columns are read from the database on every call.
 * Writes diff the canonical string form of old and new values and hand the differences
 * to the {@link VersioningLedger}. Deletes are not versioned.
 */
public class RecordAccessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecordAccessor.class);

    private final SchemaIntrospector introspector;
    private final VersioningLedger ledger;
    private final List<FieldTransform> transforms;

    public RecordAccessor(SchemaIntrospector introspector, VersioningLedger ledger, List<FieldTransform> transforms) {
        this.introspector = introspector;
        this.ledger = ledger;
        this.transforms = List.copyOf(transforms);
    }

    /**
     * Inserts a row. Columns missing from {@code values}: NOT NULL without a default get a
     * zero value (0 for INTEGER, "" for TEXT, null otherwise), columns with a default are
     * left to it, the rest are null. Every supplied field is versioned with no old value.
     *
     * @return the new record id
     */
    public long create(Connection conn, Identifier table, Map<String, ?> values, String actor) throws SQLException {
        TableSchema schema = introspector.readSchema(conn, table);
        ColumnDescriptor key = primaryKey(schema);
        Map<ColumnDescriptor, Object> supplied = resolve(schema, values);

        List<ColumnDescriptor> cols = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (ColumnDescriptor c : schema.columns()) {
            if (c.primaryKey()) continue;
            if (supplied.containsKey(c)) {
                cols.add(c);
                params.add(supplied.get(c));
            } else if (!c.nullable() && c.defaultValue().isEmpty()) {
                cols.add(c);
                params.add(ValueCodec.zeroValue(c.type()));
            }
        }

        String sql;
        if (cols.isEmpty()) {
            sql = "INSERT INTO " + table.quoted() + " DEFAULT VALUES";
        } else {
            String names = cols.stream().map(c -> c.name().quoted()).collect(Collectors.joining(", "));
            String marks = cols.stream().map(c -> "?").collect(Collectors.joining(", "));
            sql = "INSERT INTO " + table.quoted() + " (" + names + ") VALUES (" + marks + ")";
        }
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            ps.executeUpdate();
        }
        long id = lastInsertId(conn);

        List<FieldDiff> diffs = new ArrayList<>();
        for (Map.Entry<ColumnDescriptor, Object> e : supplied.entrySet()) {
            diffs.add(new FieldDiff(e.getKey().name().name(), null, ValueCodec.canonical(e.getValue())));
        }
        ledger.record(conn, id, diffs, actor);
        LOGGER.debug("Created record {} in '{}' (key {})", id, table, key.name());
        return id;
    }

    public Record get(Connection conn, Identifier table, long id) throws SQLException {
        TableSchema schema = introspector.readSchema(conn, table);
        return find(conn, schema, id).orElseThrow(() -> notFound(table, id));
    }

    public boolean exists(Connection conn, TableSchema schema, long id) throws SQLException {
        return find(conn, schema, id).isPresent();
    }

    /** Newest first. */
    public List<Record> list(Connection conn, Identifier table, int limit) throws SQLException {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive, got " + limit);
        TableSchema schema = introspector.readSchema(conn, table);
        String sql = "SELECT * FROM " + table.quoted() + " ORDER BY " + primaryKey(schema).name().quoted()
            + " DESC LIMIT ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, limit);
            return readAll(ps, schema);
        }
    }

    /** The listed records that exist, in id order. */
    public List<Record> getAll(Connection conn, Identifier table, Collection<Long> ids) throws SQLException {
        if (ids.isEmpty()) return List.of();
        TableSchema schema = introspector.readSchema(conn, table);
        String key = primaryKey(schema).name().quoted();
        String marks = ids.stream().map(i -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT * FROM " + table.quoted() + " WHERE " + key + " IN (" + marks + ") ORDER BY " + key;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, new ArrayList<>(ids));
            return readAll(ps, schema);
        }
    }

    /**
     * Applies {@code values} in one UPDATE and versions each field whose canonical form
     * changed.
     *
     * @return the ledger entries appended, possibly none
     */
    public List<VersionEntry> update(Connection conn, Identifier table, long id, Map<String, ?> values, String actor)
            throws SQLException {
        TableSchema schema = introspector.readSchema(conn, table);
        Record current = find(conn, schema, id).orElseThrow(() -> notFound(table, id));
        Map<ColumnDescriptor, Object> supplied = resolve(schema, values);
        if (supplied.isEmpty()) return List.of();

        List<FieldDiff> diffs = new ArrayList<>();
        for (Map.Entry<ColumnDescriptor, Object> e : supplied.entrySet()) {
            String field = e.getKey().name().name();
            String before = current.canonical(field);
            String after = ValueCodec.canonical(e.getValue());
            if (!ValueCodec.sameValue(e.getKey().type(), before, after)) diffs.add(new FieldDiff(field, before, after));
        }
        writeFields(conn, schema, id, supplied);
        List<VersionEntry> logged = ledger.record(conn, id, diffs, actor);
        LOGGER.debug("Updated record {} in '{}': {} field(s) supplied, {} changed", id, table, supplied.size(), diffs.size());
        return logged;
    }

    /**
     * Sets one column to a value in ledger (stored) form: type coercion applies, field
     * transforms do not. Nothing is versioned here.
     *
     * @return the canonical value the field held before
     */
    public String applyStored(Connection conn, TableSchema schema, long id, ColumnDescriptor column, String stored)
            throws SQLException {
        Record current = find(conn, schema, id).orElseThrow(() -> notFound(schema.name(), id));
        String before = current.canonical(column.name().name());
        Map<ColumnDescriptor, Object> one = new LinkedHashMap<>();
        one.put(column, ValueCodec.coerce(column, stored));
        writeFields(conn, schema, id, one);
        return before;
    }

    public void delete(Connection conn, Identifier table, long id) throws SQLException {
        TableSchema schema = introspector.readSchema(conn, table);
        String sql = "DELETE FROM " + table.quoted() + " WHERE " + primaryKey(schema).name().quoted() + " = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            if (ps.executeUpdate() == 0) throw notFound(table, id);
        }
        LOGGER.debug("Deleted record {} from '{}'", id, table);
    }

    /** Field transform for the column, if any convention claims it. */
    public Optional<FieldTransform> transformFor(ColumnDescriptor column) {
        return transforms.stream().filter(t -> t.appliesTo(column)).findFirst();
    }

    public List<FieldTransform> transforms() { return transforms; }

    private Optional<Record> find(Connection conn, TableSchema schema, long id) throws SQLException {
        String sql = "SELECT * FROM " + schema.name().quoted() + " WHERE " + primaryKey(schema).name().quoted() + " = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            List<Record> rows = readAll(ps, schema);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    private List<Record> readAll(PreparedStatement ps, TableSchema schema) throws SQLException {
        String key = primaryKey(schema).name().name();
        List<Record> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            ResultSetMetaData md = rs.getMetaData();
            while (rs.next()) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (ColumnDescriptor c : schema.columns()) values.put(c.name().name(), null);
                for (int i = 1; i <= md.getColumnCount(); i++) {
                    String label = md.getColumnLabel(i);
                    Optional<ColumnDescriptor> c = schema.find(label);
                    if (c.isPresent()) values.put(c.get().name().name(), ValueCodec.read(rs, i));
                }
                Object id = values.get(key);
                out.add(new Record(schema, ((Number) id).longValue(), values, transforms));
            }
        }
        return out;
    }

    private void writeFields(Connection conn, TableSchema schema, long id, Map<ColumnDescriptor, Object> fields)
            throws SQLException {
        String set = fields.keySet().stream().map(c -> c.name().quoted() + " = ?").collect(Collectors.joining(", "));
        String sql = "UPDATE " + schema.name().quoted() + " SET " + set + " WHERE "
            + primaryKey(schema).name().quoted() + " = ?";
        List<Object> params = new ArrayList<>(fields.values());
        params.add(id);
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            if (ps.executeUpdate() == 0) throw notFound(schema.name(), id);
        }
    }

    // Maps caller keys to columns (aliases included), applies transforms, then coercion.
    private Map<ColumnDescriptor, Object> resolve(TableSchema schema, Map<String, ?> values) {
        Map<ColumnDescriptor, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : values.entrySet()) {
            ColumnDescriptor c = lookup(schema, e.getKey());
            if (c.primaryKey()) {
                throw new AccessException(ErrorCode.PRIMARY_KEY_IMMUTABLE,
                    "Primary key column '" + c.name() + "' cannot be written");
            }
            Object v = e.getValue();
            Optional<FieldTransform> t = transformFor(c);
            if (t.isPresent()) v = t.get().toStored(c, v);
            out.put(c, ValueCodec.coerce(c, v));
        }
        return out;
    }

    private ColumnDescriptor lookup(TableSchema schema, String key) {
        Optional<ColumnDescriptor> direct = schema.find(key);
        if (direct.isPresent()) return direct.get();
        for (ColumnDescriptor c : schema.columns()) {
            Optional<FieldTransform> t = transformFor(c);
            if (t.isPresent() && t.get().alias(c).filter(a -> a.equalsIgnoreCase(key)).isPresent()) return c;
        }
        throw new AccessException(ErrorCode.COLUMN_NOT_FOUND,
            "Column '" + key + "' not found in table '" + schema.name() + "'");
    }

    private static ColumnDescriptor primaryKey(TableSchema schema) {
        return schema.primaryKey().orElseThrow(() -> new AccessException(ErrorCode.COLUMN_NOT_FOUND,
            "Table '" + schema.name() + "' has no primary key"));
    }

    private static void bind(PreparedStatement ps, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static long lastInsertId(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT last_insert_rowid()");
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static AccessException notFound(Identifier table, long id) {
        return new AccessException(ErrorCode.RECORD_NOT_FOUND, "Record " + id + " not found in table '" + table + "'");
    }
}
