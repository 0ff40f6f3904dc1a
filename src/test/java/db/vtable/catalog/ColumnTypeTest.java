package db.vtable.catalog;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import db.vtable.ErrorCode;
import db.vtable.MigrationException;

public class ColumnTypeTest {

    @Test
    void parsesCanonicalNamesIgnoringCase() {
        assertEquals(ColumnType.INTEGER, ColumnType.parse("integer"));
        assertEquals(ColumnType.REAL, ColumnType.parse(" Real "));
        assertEquals(ColumnType.TEXT, ColumnType.parse("TEXT"));
        assertEquals(ColumnType.BLOB, ColumnType.parse("blob"));
    }

    @Test
    void rejectsAnythingElse() {
        MigrationException ex = assertThrows(MigrationException.class, () -> ColumnType.parse("VARCHAR"));
        assertEquals(ErrorCode.TYPE_INVALID, ex.code());
        assertThrows(MigrationException.class, () -> ColumnType.parse(null));
        assertThrows(MigrationException.class, () -> ColumnType.parse("INTEGER; DROP TABLE x"));
    }

    @Test
    void declaredTypesFoldByAffinity() {
        assertEquals(ColumnType.INTEGER, ColumnType.fromDeclared("BIGINT"));
        assertEquals(ColumnType.TEXT, ColumnType.fromDeclared("VARCHAR(120)"));
        assertEquals(ColumnType.TEXT, ColumnType.fromDeclared("clob"));
        assertEquals(ColumnType.REAL, ColumnType.fromDeclared("FLOAT"));
        assertEquals(ColumnType.REAL, ColumnType.fromDeclared("NUMERIC"));
        assertEquals(ColumnType.BLOB, ColumnType.fromDeclared(""));
        assertEquals(ColumnType.BLOB, ColumnType.fromDeclared(null));
    }
}
