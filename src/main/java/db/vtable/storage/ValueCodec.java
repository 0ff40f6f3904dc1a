package db.vtable.storage;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HexFormat;
import java.util.Objects;

import db.vtable.AccessException;
import db.vtable.ErrorCode;
import db.vtable.catalog.ColumnDescriptor;
import db.vtable.catalog.ColumnType;

/**
 * Type coercion for values headed into a column, and the canonical string form used for
 * diffing and ledger storage. {@code null} stays {@code null} in both directions, so
 * "no value" never collapses into the empty string.
 */
public final class ValueCodec {
    private static final HexFormat HEX = HexFormat.of();

    private ValueCodec() {}

    public static String canonical(Object value) {
        if (value == null) return null;
        if (value instanceof byte[] bytes) return HEX.formatHex(bytes);
        if (value instanceof Integer i) return Long.toString(i);
        if (value instanceof Float f) return Double.toString(f);
        return value.toString();
    }

    /**
     * Converts a caller-supplied value into what gets bound for {@code column}.
     * INTEGER accepts integral numbers or text that parses as a long; REAL accepts any
     * number or numeric text; TEXT and BLOB accept anything.
     *
     * @throws AccessException with {@link ErrorCode#TYPE_COERCION_ERROR} on bad numeric input
     */
    public static Object coerce(ColumnDescriptor column, Object value) {
        if (value == null) return null;
        ColumnType type = column.type();
        switch (type) {
            case INTEGER -> {
                if (value instanceof Long || value instanceof Integer || value instanceof Short) {
                    return ((Number) value).longValue();
                }
                if (value instanceof Number n) {
                    try {
                        return new BigDecimal(n.toString()).longValueExact();
                    } catch (ArithmeticException | NumberFormatException e) {
                        throw coercionError(column, value);
                    }
                }
                try {
                    return Long.parseLong(value.toString().trim());
                } catch (NumberFormatException e) {
                    throw coercionError(column, value);
                }
            }
            case REAL -> {
                if (value instanceof Number n) return n.doubleValue();
                try {
                    double d = Double.parseDouble(value.toString().trim());
                    if (Double.isNaN(d) || Double.isInfinite(d)) throw coercionError(column, value);
                    return d;
                } catch (NumberFormatException e) {
                    throw coercionError(column, value);
                }
            }
            case BLOB -> {
                return value instanceof byte[] ? value : canonical(value);
            }
            default -> {
                return canonical(value);
            }
        }
    }

    /**
     * Equality used for change detection. REAL values compare numerically, since a column
     * with NUMERIC affinity hands back {@code 5} for a stored {@code 5.0}.
     */
    public static boolean sameValue(ColumnType type, String before, String after) {
        if (before == null || after == null || type != ColumnType.REAL) return Objects.equals(before, after);
        try {
            return new BigDecimal(before).compareTo(new BigDecimal(after)) == 0;
        } catch (NumberFormatException e) {
            return before.equals(after);
        }
    }

    /** Reads column {@code index} normalizing driver types to Long/Double/String/byte[]. */
    public static Object read(ResultSet rs, int index) throws SQLException {
        Object v = rs.getObject(index);
        if (v instanceof Integer i) return i.longValue();
        if (v instanceof Short s) return s.longValue();
        if (v instanceof Float f) return f.doubleValue();
        return v;
    }

    static Object zeroValue(ColumnType type) {
        return switch (type) {
            case INTEGER -> 0L;
            case TEXT -> "";
            default -> null;
        };
    }

    private static AccessException coercionError(ColumnDescriptor column, Object value) {
        return new AccessException(ErrorCode.TYPE_COERCION_ERROR,
            "Value '" + value + "' is not valid for " + column.type() + " column '" + column.name() + "'");
    }
}
