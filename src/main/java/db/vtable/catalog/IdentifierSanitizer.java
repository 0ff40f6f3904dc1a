package db.vtable.catalog;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The only path by which user-supplied names become {@link Identifier}s.
 */
public final class IdentifierSanitizer {
    private static final Pattern UNSAFE = Pattern.compile("[^0-9A-Za-z_]");

    private IdentifierSanitizer() {}

    /**
     * Replaces every character outside {@code [A-Za-z0-9_]} with {@code _}.
     * An empty input yields {@code _}.
     */
    public static Identifier sanitize(String raw) {
        Objects.requireNonNull(raw, "raw");
        String cleaned = UNSAFE.matcher(raw).replaceAll("_");
        if (cleaned.isEmpty()) cleaned = "_";
        return Identifier.of(cleaned);
    }
}
