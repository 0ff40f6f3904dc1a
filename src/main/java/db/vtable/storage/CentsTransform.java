package db.vtable.storage;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Optional;

import db.vtable.AccessException;
import db.vtable.ErrorCode;
import db.vtable.catalog.ColumnDescriptor;

/**
 * Monetary convention: a column named {@code <prefix>_cents} stores an integer number of
 * cents, accepts decimal input such as {@code "12.50"} and displays as a two-decimal string.
 * The bare prefix ({@code price} for {@code price_cents}) is accepted as an alias.
 */
public class CentsTransform implements FieldTransform {
    public static final String DEFAULT_SUFFIX = "_cents";

    private final String suffix;

    public CentsTransform() {
        this(DEFAULT_SUFFIX);
    }

    public CentsTransform(String suffix) {
        if (suffix == null || suffix.isEmpty()) throw new IllegalArgumentException("suffix must not be empty");
        this.suffix = suffix.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean appliesTo(ColumnDescriptor column) {
        String n = column.name().name().toLowerCase(Locale.ROOT);
        return n.endsWith(suffix) && n.length() > suffix.length();
    }

    /** Decimal amount to cents, rounded half-even. */
    @Override
    public Object toStored(ColumnDescriptor column, Object input) {
        if (input == null) return null;
        BigDecimal amount;
        try {
            amount = input instanceof Number n ? new BigDecimal(n.toString()) : new BigDecimal(input.toString().trim());
            return amount.movePointRight(2).setScale(0, RoundingMode.HALF_EVEN).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new AccessException(ErrorCode.TYPE_COERCION_ERROR,
                "Invalid monetary amount '" + input + "' for column '" + column.name() + "'", e);
        }
    }

    @Override
    public String toDisplay(Object stored) {
        if (stored == null) return null;
        long cents;
        if (stored instanceof Number n) {
            cents = n.longValue();
        } else {
            try {
                cents = Long.parseLong(stored.toString().trim());
            } catch (NumberFormatException e) {
                return stored.toString();
            }
        }
        return BigDecimal.valueOf(cents, 2).toPlainString();
    }

    @Override
    public Optional<String> alias(ColumnDescriptor column) {
        String n = column.name().name();
        return Optional.of(n.substring(0, n.length() - suffix.length()));
    }
}
