package db.vtable.catalog;

import java.util.Locale;

import db.vtable.ErrorCode;
import db.vtable.MigrationException;

/**
 * Canonical column kinds. Declared SQLite types are folded onto these by affinity.
 */
public enum ColumnType {
    INTEGER,
    REAL,
    TEXT,
    BLOB;

    public String sqlName() { return name(); }

    /**
     * Parses one of the four canonical names (case-insensitive).
     *
     * @throws MigrationException with {@link ErrorCode#TYPE_INVALID} for anything else
     */
    public static ColumnType parse(String raw) {
        if (raw != null) {
            String t = raw.trim().toUpperCase(Locale.ROOT);
            for (ColumnType type : values()) {
                if (type.name().equals(t)) return type;
            }
        }
        throw new MigrationException(ErrorCode.TYPE_INVALID,
            "Unsupported column type '" + raw + "' (expected INTEGER, REAL, TEXT or BLOB)");
    }

    /**
     * Maps a declared type as reported by {@code PRAGMA table_info} using SQLite's
     * affinity rules. NUMERIC affinity has no canonical counterpart and maps to REAL;
     * such a column may still hand back integral values as integers ({@code 5} for
     * {@code 5.0}), so REAL values are diffed numerically.
     */
    public static ColumnType fromDeclared(String declared) {
        String t = declared == null ? "" : declared.toUpperCase(Locale.ROOT);
        if (t.contains("INT")) return INTEGER;
        if (t.contains("CHAR") || t.contains("CLOB") || t.contains("TEXT")) return TEXT;
        if (t.isBlank() || t.contains("BLOB")) return BLOB;
        return REAL;
    }
}
