package db.vtable.catalog;

import java.util.Locale;
import java.util.regex.Pattern;

import db.vtable.ErrorCode;
import db.vtable.VersionedTableException;

/**
 * A table or column name that is safe to place in generated SQL text.
 * Comparison is case-insensitive, matching how SQLite resolves names.
 */
public final class Identifier {
    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_]+");

    private final String name;

    private Identifier(String name) {
        this.name = name;
    }

    /**
     * Wraps a name that is already known to be safe (read back from the database, or a
     * constant). User-supplied text goes through {@link IdentifierSanitizer#sanitize(String)}.
     *
     * @throws VersionedTableException with {@link ErrorCode#IDENTIFIER_INVALID} if the name
     *         contains anything outside {@code [A-Za-z0-9_]}
     */
    public static Identifier of(String name) {
        if (name == null || !SAFE.matcher(name).matches()) {
            throw new VersionedTableException(ErrorCode.IDENTIFIER_INVALID,
                "Unsanitized identifier: " + name);
        }
        return new Identifier(name);
    }

    public String name() { return name; }

    /** Double-quoted form for statement text. */
    public String quoted() { return "\"" + name + "\""; }

    public boolean matches(String other) {
        return other != null && name.equalsIgnoreCase(other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier other)) return false;
        return name.equalsIgnoreCase(other.name);
    }

    @Override
    public int hashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() { return name; }
}
