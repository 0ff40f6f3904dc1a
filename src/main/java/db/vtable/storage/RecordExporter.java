package db.vtable.storage;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import db.vtable.catalog.ColumnDescriptor;

/**
 * JSON view of records. Transformed columns are exported under their alias with the
 * display value, so a {@code price_cents} of 1250 becomes {@code "price": 12.50}.
 */
public class RecordExporter {
    private final Gson gson = new GsonBuilder()
        .disableHtmlEscaping()
        .serializeNulls()
        .setPrettyPrinting()
        .create();

    public String toJson(List<Record> records) {
        List<Map<String, Object>> rows = records.stream().map(this::toMap).toList();
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("records", rows);
        return gson.toJson(root);
    }

    Map<String, Object> toMap(Record record) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (ColumnDescriptor c : record.schema().columns()) {
            String name = c.name().name();
            Object v = record.get(name);
            Optional<FieldTransform> t = transformFor(record, c);
            if (t.isPresent()) {
                String shown = t.get().toDisplay(v);
                out.put(t.get().alias(c).orElse(name), shown == null ? null : toNumber(shown));
            } else {
                out.put(name, v instanceof byte[] ? ValueCodec.canonical(v) : v);
            }
        }
        return out;
    }

    private static Optional<FieldTransform> transformFor(Record record, ColumnDescriptor c) {
        return record.transforms().stream().filter(t -> t.appliesTo(c)).findFirst();
    }

    private static Object toNumber(String shown) {
        try {
            return new BigDecimal(shown);
        } catch (NumberFormatException e) {
            return shown;
        }
    }
}
