package db.vtable.ledger;

import java.time.Instant;
import java.util.Optional;

/**
 * Immutable ledger row. {@code id} is assigned by the ledger and strictly increasing.
 */
public record VersionEntry(long id,
                           long recordId,
                           String fieldName,
                           Optional<String> oldValue,
                           Optional<String> newValue,
                           Instant timestamp,
                           String actor) {
}
