package db.vtable.ledger;

import java.util.Objects;

// One field-level change in canonical string form; either side may be null ("no value").
public record FieldDiff(String field, String oldValue, String newValue) {

    public FieldDiff {
        Objects.requireNonNull(field, "field");
    }
}
