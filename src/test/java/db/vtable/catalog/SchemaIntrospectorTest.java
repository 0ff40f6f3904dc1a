package db.vtable.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.vtable.TestDatabase;

public class SchemaIntrospectorTest {

    @TempDir
    Path dir;

    private final SchemaIntrospector introspector = new SchemaIntrospector();

    @Test
    void readsColumnsInDeclarationOrder() throws Exception {
        try (Connection conn = TestDatabase.open(dir)) {
            TestDatabase.exec(conn, "CREATE TABLE product (id INTEGER PRIMARY KEY AUTOINCREMENT, "
                + "name VARCHAR(120) NOT NULL DEFAULT 'unnamed', price FLOAT, photo BLOB)");
            List<ColumnDescriptor> cols = introspector.listColumns(conn, Identifier.of("product"));

            assertEquals(4, cols.size());
            ColumnDescriptor id = cols.get(0);
            assertEquals("id", id.name().name());
            assertTrue(id.primaryKey());
            assertEquals(ColumnType.INTEGER, id.type());

            ColumnDescriptor name = cols.get(1);
            assertEquals(1, name.ordinal());
            assertEquals(ColumnType.TEXT, name.type());
            assertFalse(name.nullable());
            assertEquals(Optional.of("'unnamed'"), name.defaultValue());
            assertFalse(name.primaryKey());

            assertEquals(ColumnType.REAL, cols.get(2).type());
            assertTrue(cols.get(2).nullable());
            assertEquals(Optional.empty(), cols.get(2).defaultValue());
            assertEquals(ColumnType.BLOB, cols.get(3).type());
        }
    }

    @Test
    void reflectsChangesWithoutCaching() throws Exception {
        try (Connection conn = TestDatabase.open(dir)) {
            Identifier table = Identifier.of("product");
            TestDatabase.exec(conn, "CREATE TABLE product (id INTEGER PRIMARY KEY)");
            assertEquals(1, introspector.listColumns(conn, table).size());
            TestDatabase.exec(conn, "ALTER TABLE product ADD COLUMN stock INTEGER");
            assertEquals(2, introspector.listColumns(conn, table).size());
            assertTrue(introspector.readSchema(conn, table).hasColumn("STOCK"));
        }
    }

    @Test
    void definitionStatementIsTheStoredText() throws Exception {
        try (Connection conn = TestDatabase.open(dir)) {
            Identifier table = Identifier.of("product");
            assertTrue(introspector.getDefinitionStatement(conn, table).isEmpty());
            assertFalse(introspector.tableExists(conn, table));
            assertTrue(introspector.listColumns(conn, table).isEmpty());

            TestDatabase.exec(conn, "CREATE TABLE product (id INTEGER PRIMARY KEY, name TEXT)");
            assertEquals("CREATE TABLE product (id INTEGER PRIMARY KEY, name TEXT)",
                introspector.getDefinitionStatement(conn, table).orElseThrow());
            assertTrue(introspector.tableExists(conn, table));
        }
    }
}
