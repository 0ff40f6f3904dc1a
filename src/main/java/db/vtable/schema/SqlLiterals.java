package db.vtable.schema;

import java.util.Optional;

import db.vtable.ErrorCode;
import db.vtable.MigrationException;
import db.vtable.catalog.ColumnType;

/**
 * Renders column defaults as SQL literals. DDL cannot take bound parameters, so this is
 * the one place a user-supplied value becomes statement text: numbers are re-printed from
 * their parsed form and everything else is single-quoted with quotes doubled.
 */
final class SqlLiterals {
    private SqlLiterals() {}

    /** Empty or null input means "no default", as in the schema designer form. */
    static Optional<String> render(ColumnType type, String raw) {
        if (raw == null || raw.isEmpty()) return Optional.empty();
        String trimmed = raw.trim();
        try {
            return switch (type) {
                case INTEGER -> Optional.of(Long.toString(Long.parseLong(trimmed)));
                case REAL -> {
                    double d = Double.parseDouble(trimmed);
                    if (Double.isNaN(d) || Double.isInfinite(d)) throw new NumberFormatException(trimmed);
                    yield Optional.of(Double.toString(d));
                }
                default -> Optional.of("'" + raw.replace("'", "''") + "'");
            };
        } catch (NumberFormatException e) {
            throw new MigrationException(ErrorCode.TYPE_COERCION_ERROR,
                "Default '" + raw + "' is not a valid " + type + " literal", e);
        }
    }
}
