package db.vtable.ledger;

import java.util.Arrays;
import java.util.Locale;

/**
 * Columns a version listing may be ordered by. Only the ledger's own attributes are
 * allowed, and the SQL column text comes from here, never from the caller.
 */
public enum VersionSortField {
    ID("id"),
    RECORD_ID("record_id"),
    FIELD_NAME("field_name"),
    OLD_VALUE("old_value"),
    NEW_VALUE("new_value"),
    CHANGED_AT("changed_at"),
    CHANGED_BY("changed_by");

    private final String column;

    VersionSortField(String column) {
        this.column = column;
    }

    public String column() { return column; }

    /** Accepts either the enum name or the column name, case-insensitive. */
    public static VersionSortField parse(String raw) {
        if (raw != null) {
            String t = raw.trim();
            for (VersionSortField f : values()) {
                if (f.name().equalsIgnoreCase(t) || f.column.equalsIgnoreCase(t)) return f;
            }
        }
        throw new IllegalArgumentException("Unknown version sort field: " + raw
            + " (expected one of " + Arrays.toString(values()).toLowerCase(Locale.ROOT) + ")");
    }
}
