package db.vtable.ledger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.vtable.catalog.Identifier;

/**
 * Append-only store of field-level change events. Rows are only ever inserted; there is
 * no update or delete path. The physical layout
 * {@code (id, record_id, field_name, old_value, new_value, changed_at, changed_by)}
 * is read by external reporting tools and must not change.
 */
public class VersioningLedger {
    private static final Logger LOGGER = LoggerFactory.getLogger(VersioningLedger.class);

    // Fixed width so changed_at sorts lexically in time order.
    private static final DateTimeFormatter CHANGED_AT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private static final String COLUMNS = "id, record_id, field_name, old_value, new_value, changed_at, changed_by";

    private final Identifier table;
    private final Clock clock;

    public VersioningLedger(Identifier table, Clock clock) {
        this.table = table;
        this.clock = clock;
    }

    public Identifier table() { return table; }

    public void ensureTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS " + table.quoted() + " ("
                + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                + "record_id INTEGER NOT NULL, "
                + "field_name TEXT NOT NULL, "
                + "old_value TEXT, "
                + "new_value TEXT, "
                + "changed_at TEXT NOT NULL, "
                + "changed_by TEXT)");
            st.execute("CREATE INDEX IF NOT EXISTS " + Identifier.of(table.name() + "_record_idx").quoted()
                + " ON " + table.quoted() + " (record_id)");
        }
    }

    /**
     * Appends one entry per diff, all sharing one timestamp. Empty input is a no-op.
     *
     * @return the appended entries in id order
     */
    public List<VersionEntry> record(Connection conn, long recordId, List<FieldDiff> diffs, String actor)
            throws SQLException {
        if (diffs == null || diffs.isEmpty()) return List.of();
        Instant now = clock.instant();
        String changedAt = CHANGED_AT.format(now);
        String sql = "INSERT INTO " + table.quoted()
            + " (record_id, field_name, old_value, new_value, changed_at, changed_by) VALUES (?,?,?,?,?,?)";
        List<VersionEntry> out = new ArrayList<>(diffs.size());
        try (PreparedStatement ps = conn.prepareStatement(sql);
             PreparedStatement lastId = conn.prepareStatement("SELECT last_insert_rowid()")) {
            for (FieldDiff d : diffs) {
                ps.setLong(1, recordId);
                ps.setString(2, d.field());
                ps.setString(3, d.oldValue());
                ps.setString(4, d.newValue());
                ps.setString(5, changedAt);
                ps.setString(6, actor);
                ps.executeUpdate();
                long id;
                try (ResultSet rs = lastId.executeQuery()) {
                    rs.next();
                    id = rs.getLong(1);
                }
                out.add(new VersionEntry(id, recordId, d.field(), Optional.ofNullable(d.oldValue()),
                    Optional.ofNullable(d.newValue()), parseInstant(changedAt), actor));
            }
        }
        LOGGER.debug("Recorded {} change(s) for record {} by '{}'", out.size(), recordId, actor);
        return out;
    }

    /**
     * Entries filtered by record when given, ordered by {@code sortField} (ties by id in the
     * same direction), truncated to {@code limit}.
     *
     * @throws IllegalArgumentException if {@code limit} is not positive
     */
    public List<VersionEntry> list(Connection conn, OptionalLong recordId, int limit,
                                   VersionSortField sortField, SortOrder order) throws SQLException {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive, got " + limit);
        String dir = order == SortOrder.ASC ? "ASC" : "DESC";
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ").append(table.quoted());
        if (recordId.isPresent()) sql.append(" WHERE record_id = ?");
        sql.append(" ORDER BY ").append(sortField.column()).append(' ').append(dir);
        if (sortField != VersionSortField.ID) sql.append(", id ").append(dir);
        sql.append(" LIMIT ?");
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int p = 1;
            if (recordId.isPresent()) ps.setLong(p++, recordId.getAsLong());
            ps.setInt(p, limit);
            List<VersionEntry> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(map(rs));
            }
            return out;
        }
    }

    public Optional<VersionEntry> getById(Connection conn, long id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + COLUMNS + " FROM " + table.quoted() + " WHERE id = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private static VersionEntry map(ResultSet rs) throws SQLException {
        return new VersionEntry(
            rs.getLong("id"),
            rs.getLong("record_id"),
            rs.getString("field_name"),
            Optional.ofNullable(rs.getString("old_value")),
            Optional.ofNullable(rs.getString("new_value")),
            parseInstant(rs.getString("changed_at")),
            rs.getString("changed_by"));
    }

    // Also accepts rows written with a shorter fraction, e.g. by older tooling.
    private static Instant parseInstant(String text) {
        if (text == null) return null;
        return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
    }
}
