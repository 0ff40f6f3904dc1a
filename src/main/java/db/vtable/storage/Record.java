package db.vtable.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import db.vtable.AccessException;
import db.vtable.ErrorCode;
import db.vtable.catalog.ColumnDescriptor;
import db.vtable.catalog.TableSchema;

/**
 * One row read under a specific schema: column name to value, in schema order.
 * Values are Long, Double, String, byte[] or null. Not meant to outlive the call that
 * produced it, since the schema may change in between.
 */
public class Record {
    private final TableSchema schema;
    private final long id;
    private final Map<String, Object> values;
    private final List<FieldTransform> transforms;

    public Record(TableSchema schema, long id, Map<String, Object> values, List<FieldTransform> transforms) {
        this.schema = schema;
        this.id = id;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.transforms = List.copyOf(transforms);
    }

    public long id() { return id; }

    public TableSchema schema() { return schema; }

    public Map<String, Object> getValues() { return values; }

    List<FieldTransform> transforms() { return transforms; }

    /** Stored value; {@code column} is matched case-insensitively. */
    public Object get(String column) {
        return values.get(column(column).name().name());
    }

    public String canonical(String column) {
        return ValueCodec.canonical(get(column));
    }

    /** Value as shown to people, e.g. {@code "12.50"} for a cents column holding 1250. */
    public String display(String column) {
        ColumnDescriptor c = column(column);
        Object v = values.get(c.name().name());
        for (FieldTransform t : transforms) {
            if (t.appliesTo(c)) return t.toDisplay(v);
        }
        return ValueCodec.canonical(v);
    }

    private ColumnDescriptor column(String column) {
        return schema.find(column).orElseThrow(() -> new AccessException(ErrorCode.COLUMN_NOT_FOUND,
            "Column '" + column + "' not found in table '" + schema.name() + "'"));
    }

    @Override
    public String toString() {
        return "Record#" + id + values;
    }
}
