package db.vtable.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.vtable.AccessException;
import db.vtable.ErrorCode;
import db.vtable.TestDatabase;
import db.vtable.catalog.Identifier;
import db.vtable.catalog.SchemaIntrospector;
import db.vtable.ledger.SortOrder;
import db.vtable.ledger.VersionEntry;
import db.vtable.ledger.VersionSortField;
import db.vtable.ledger.VersioningLedger;

public class RecordAccessorTest {

    @TempDir
    Path dir;

    private final Identifier product = Identifier.of("product");
    private Connection conn;
    private VersioningLedger ledger;
    private RecordAccessor records;

    @BeforeEach
    void setUp() throws Exception {
        conn = TestDatabase.open(dir);
        TestDatabase.exec(conn, "CREATE TABLE product (id INTEGER PRIMARY KEY AUTOINCREMENT, "
            + "name TEXT NOT NULL, stock INTEGER NOT NULL, weight REAL, category TEXT DEFAULT 'misc', "
            + "description TEXT, price_cents INTEGER)");
        ledger = new VersioningLedger(Identifier.of("product_field_versions"),
            Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));
        ledger.ensureTable(conn);
        records = new RecordAccessor(new SchemaIntrospector(), ledger, List.of(new CentsTransform()));
    }

    @AfterEach
    void tearDown() throws Exception {
        conn.close();
    }

    @Test
    void missingFieldsGetZeroValuesOrDefaults() throws Exception {
        long id = records.create(conn, product, Map.of(), "create");

        Record r = records.get(conn, product, id);
        assertEquals("", r.get("name"));
        assertEquals(0L, r.get("stock"));
        assertNull(r.get("weight"));
        assertEquals("misc", r.get("category"));
        assertNull(r.get("description"));
        assertTrue(versions(id).isEmpty());
    }

    @Test
    void createVersionsEverySuppliedField() throws Exception {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "Mug");
        values.put("stock", "3");
        values.put("description", null);
        long id = records.create(conn, product, values, "create");

        List<VersionEntry> entries = versions(id);
        assertEquals(List.of("name", "stock", "description"), entries.stream().map(VersionEntry::fieldName).toList());
        for (VersionEntry e : entries) {
            assertEquals(Optional.empty(), e.oldValue());
            assertEquals("create", e.actor());
        }
        assertEquals(Optional.of("3"), entries.get(1).newValue());
        assertEquals(Optional.empty(), entries.get(2).newValue());
        assertEquals(3L, records.get(conn, product, id).get("stock"));
    }

    @Test
    void updateLogsExactlyTheChangedFields() throws Exception {
        long id = records.create(conn, product, Map.of("name", "Mug", "stock", 3), "create");
        int before = versions(id).size();

        Map<String, Object> edit = new LinkedHashMap<>();
        edit.put("name", "Mug");
        edit.put("stock", "5");
        edit.put("description", "Blue");
        List<VersionEntry> logged = records.update(conn, product, id, edit, "edit");

        assertEquals(2, logged.size());
        assertEquals("stock", logged.get(0).fieldName());
        assertEquals(Optional.of("3"), logged.get(0).oldValue());
        assertEquals(Optional.of("5"), logged.get(0).newValue());
        assertEquals("description", logged.get(1).fieldName());
        assertEquals(Optional.empty(), logged.get(1).oldValue());
        assertEquals(Optional.of("Blue"), logged.get(1).newValue());
        assertEquals(before + 2, versions(id).size());

        Record r = records.get(conn, product, id);
        assertEquals(5L, r.get("stock"));
        assertEquals("Blue", r.get("description"));
    }

    @Test
    void emptyStringAndNullAreDifferentValues() throws Exception {
        long id = records.create(conn, product, Map.of("name", "Mug"), "create");

        List<VersionEntry> logged = records.update(conn, product, id, Map.of("description", ""), "edit");
        assertEquals(1, logged.size());
        assertEquals(Optional.empty(), logged.get(0).oldValue());
        assertEquals(Optional.of(""), logged.get(0).newValue());

        Map<String, Object> clear = new HashMap<>();
        clear.put("description", null);
        logged = records.update(conn, product, id, clear, "edit");
        assertEquals(Optional.of(""), logged.get(0).oldValue());
        assertEquals(Optional.empty(), logged.get(0).newValue());
    }

    @Test
    void unchangedUpdateLogsNothing() throws Exception {
        long id = records.create(conn, product, Map.of("name", "Mug", "weight", 1.5), "create");
        assertTrue(records.update(conn, product, id, Map.of("weight", "1.5", "name", "Mug"), "edit").isEmpty());
    }

    @Test
    void numericAffinityDoesNotProduceSpuriousChanges() throws Exception {
        TestDatabase.exec(conn, "ALTER TABLE product ADD COLUMN ratio NUMERIC");
        long id = records.create(conn, product, Map.of("name", "Mug", "ratio", "5"), "create");
        assertEquals(5L, records.get(conn, product, id).get("ratio"));

        assertTrue(records.update(conn, product, id, Map.of("ratio", "5.0"), "edit").isEmpty());
        assertEquals(1, records.update(conn, product, id, Map.of("ratio", "5.5"), "edit").size());
    }

    @Test
    void badNumericInputIsRejectedBeforeWriting() throws Exception {
        long id = records.create(conn, product, Map.of("name", "Mug", "stock", 3), "create");
        int before = versions(id).size();

        AccessException ex = assertThrows(AccessException.class,
            () -> records.update(conn, product, id, Map.of("name", "Cup", "stock", "lots"), "edit"));
        assertEquals(ErrorCode.TYPE_COERCION_ERROR, ex.code());
        assertEquals("Mug", records.get(conn, product, id).get("name"));
        assertEquals(before, versions(id).size());

        AccessException real = assertThrows(AccessException.class,
            () -> records.create(conn, product, Map.of("weight", "heavy"), "create"));
        assertEquals(ErrorCode.TYPE_COERCION_ERROR, real.code());
    }

    @Test
    void unknownColumnsAndTheKeyCannotBeWritten() throws Exception {
        long id = records.create(conn, product, Map.of("name", "Mug"), "create");

        AccessException unknown = assertThrows(AccessException.class,
            () -> records.update(conn, product, id, Map.of("colour", "red"), "edit"));
        assertEquals(ErrorCode.COLUMN_NOT_FOUND, unknown.code());

        AccessException key = assertThrows(AccessException.class,
            () -> records.update(conn, product, id, Map.of("id", 99), "edit"));
        assertEquals(ErrorCode.PRIMARY_KEY_IMMUTABLE, key.code());
    }

    @Test
    void missingRecordIsReported() {
        AccessException get = assertThrows(AccessException.class, () -> records.get(conn, product, 42));
        assertEquals(ErrorCode.RECORD_NOT_FOUND, get.code());
        AccessException update = assertThrows(AccessException.class,
            () -> records.update(conn, product, 42, Map.of("name", "x"), "edit"));
        assertEquals(ErrorCode.RECORD_NOT_FOUND, update.code());
    }

    @Test
    void deleteIsNotVersioned() throws Exception {
        long id = records.create(conn, product, Map.of("name", "Mug"), "create");
        int before = versions(id).size();

        records.delete(conn, product, id);

        assertThrows(AccessException.class, () -> records.get(conn, product, id));
        assertEquals(before, versions(id).size());
        AccessException again = assertThrows(AccessException.class, () -> records.delete(conn, product, id));
        assertEquals(ErrorCode.RECORD_NOT_FOUND, again.code());
    }

    @Test
    void monetaryAliasIsStoredAsCents() throws Exception {
        long id = records.create(conn, product, Map.of("name", "Mug", "price", "12.50"), "create");

        Record r = records.get(conn, product, id);
        assertEquals(1250L, r.get("price_cents"));
        assertEquals("12.50", r.display("price_cents"));
        assertEquals(Optional.of("1250"), versions(id).stream()
            .filter(e -> e.fieldName().equals("price_cents")).findFirst().orElseThrow().newValue());

        records.update(conn, product, id, Map.of("price_cents", "12.504"), "edit");
        assertEquals(1250L, records.get(conn, product, id).get("price_cents"));
    }

    @Test
    void listsNewestFirstAndFetchesById() throws Exception {
        long a = records.create(conn, product, Map.of("name", "A"), "create");
        long b = records.create(conn, product, Map.of("name", "B"), "create");
        long c = records.create(conn, product, Map.of("name", "C"), "create");

        assertEquals(List.of(c, b), records.list(conn, product, 2).stream().map(Record::id).toList());
        assertEquals(List.of(a, c), records.getAll(conn, product, List.of(c, a, 999L)).stream().map(Record::id).toList());
        assertThrows(IllegalArgumentException.class, () -> records.list(conn, product, 0));
    }

    private List<VersionEntry> versions(long recordId) throws Exception {
        return ledger.list(conn, OptionalLong.of(recordId), 1000, VersionSortField.ID, SortOrder.ASC);
    }
}
