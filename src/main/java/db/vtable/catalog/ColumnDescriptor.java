package db.vtable.catalog;

import java.util.Objects;
import java.util.Optional;

// Schema metadata for one column. defaultValue holds the SQL literal text exactly as the
// database reports it (e.g. 'abc' or 0) so it can be re-emitted verbatim on rebuild.
public record ColumnDescriptor(int ordinal,
                               Identifier name,
                               ColumnType type,
                               boolean nullable,
                               Optional<String> defaultValue,
                               boolean primaryKey) {

    public ColumnDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(defaultValue, "defaultValue");
    }

    public ColumnDescriptor withOrdinal(int newOrdinal) {
        return new ColumnDescriptor(newOrdinal, name, type, nullable, defaultValue, primaryKey);
    }

    public ColumnDescriptor redefined(Identifier newName, ColumnType newType, Optional<String> newDefault) {
        return new ColumnDescriptor(ordinal, newName, newType, nullable, newDefault, primaryKey);
    }
}
