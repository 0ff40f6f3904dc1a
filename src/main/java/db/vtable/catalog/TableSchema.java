package db.vtable.catalog;

import java.util.List;
import java.util.Optional;

// Ordered column set of one table, as read at a single point in time.
public record TableSchema(Identifier name, List<ColumnDescriptor> columns) {

    public TableSchema {
        columns = List.copyOf(columns);
    }

    public Optional<ColumnDescriptor> find(String columnName) {
        for (ColumnDescriptor c : columns) {
            if (c.name().matches(columnName)) return Optional.of(c);
        }
        return Optional.empty();
    }

    public Optional<ColumnDescriptor> find(Identifier columnName) {
        return find(columnName.name());
    }

    public boolean hasColumn(String columnName) {
        return find(columnName).isPresent();
    }

    public Optional<ColumnDescriptor> primaryKey() {
        return columns.stream().filter(ColumnDescriptor::primaryKey).findFirst();
    }

    public List<Identifier> columnNames() {
        return columns.stream().map(ColumnDescriptor::name).toList();
    }
}
