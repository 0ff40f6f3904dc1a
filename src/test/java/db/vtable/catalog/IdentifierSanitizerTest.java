package db.vtable.catalog;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import db.vtable.ErrorCode;
import db.vtable.VersionedTableException;

public class IdentifierSanitizerTest {

    @Test
    void safeNamesPassThrough() {
        assertEquals("price_cents", IdentifierSanitizer.sanitize("price_cents").name());
        assertEquals("Col9", IdentifierSanitizer.sanitize("Col9").name());
    }

    @Test
    void everyUnsafeCharacterBecomesUnderscore() {
        assertEquals("unit_price__EUR_", IdentifierSanitizer.sanitize("unit price (EUR)").name());
        assertEquals("name___DROP_TABLE_product___", IdentifierSanitizer.sanitize("name\"; DROP TABLE product;--").name());
        assertEquals("_x_", IdentifierSanitizer.sanitize(" x ").name());
        assertEquals("caf_", IdentifierSanitizer.sanitize("café").name());
    }

    @Test
    void emptyInputStillYieldsAName() {
        assertEquals("_", IdentifierSanitizer.sanitize("").name());
    }

    @Test
    void quotedFormIsDoubleQuoted() {
        assertEquals("\"stock\"", IdentifierSanitizer.sanitize("stock").quoted());
    }

    @Test
    void unsanitizedNamesAreRejectedAtTheBoundary() {
        VersionedTableException ex = assertThrows(VersionedTableException.class, () -> Identifier.of("bad name"));
        assertEquals(ErrorCode.IDENTIFIER_INVALID, ex.code());
        assertThrows(VersionedTableException.class, () -> Identifier.of(""));
        assertThrows(VersionedTableException.class, () -> Identifier.of(null));
    }

    @Test
    void identifiersCompareCaseInsensitively() {
        assertEquals(Identifier.of("Price"), Identifier.of("price"));
        assertEquals(Identifier.of("Price").hashCode(), Identifier.of("PRICE").hashCode());
        assertTrue(Identifier.of("stock").matches("STOCK"));
    }
}
