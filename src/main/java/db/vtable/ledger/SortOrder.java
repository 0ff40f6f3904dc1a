package db.vtable.ledger;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("order must not be null");
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
