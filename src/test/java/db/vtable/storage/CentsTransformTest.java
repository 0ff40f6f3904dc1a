package db.vtable.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import db.vtable.AccessException;
import db.vtable.ErrorCode;
import db.vtable.catalog.ColumnDescriptor;
import db.vtable.catalog.ColumnType;
import db.vtable.catalog.Identifier;

public class CentsTransformTest {

    private final CentsTransform cents = new CentsTransform();
    private final ColumnDescriptor price = column("price_cents");

    @Test
    void appliesOnlyToSuffixedColumns() {
        assertTrue(cents.appliesTo(price));
        assertTrue(cents.appliesTo(column("Shipping_CENTS")));
        assertFalse(cents.appliesTo(column("price")));
        assertFalse(cents.appliesTo(column("_cents")));
        assertFalse(cents.appliesTo(column("centsless")));
    }

    @Test
    void decimalInputBecomesWholeCents() {
        assertEquals(1250L, cents.toStored(price, "12.50"));
        assertEquals(1250L, cents.toStored(price, " 12.5 "));
        assertEquals(1200L, cents.toStored(price, 12));
        assertEquals(1250L, cents.toStored(price, "12.504"));
        assertEquals(1252L, cents.toStored(price, "12.515"));
        assertEquals(1250L, cents.toStored(price, "12.505"));
        assertNull(cents.toStored(price, null));
    }

    @Test
    void nonNumericInputIsACoercionError() {
        AccessException ex = assertThrows(AccessException.class, () -> cents.toStored(price, "twelve"));
        assertEquals(ErrorCode.TYPE_COERCION_ERROR, ex.code());
    }

    @Test
    void displaysTwoDecimals() {
        assertEquals("12.50", cents.toDisplay(1250L));
        assertEquals("0.05", cents.toDisplay(5L));
        assertEquals("-3.00", cents.toDisplay(-300L));
        assertEquals("12.50", cents.toDisplay("1250"));
        assertNull(cents.toDisplay(null));
    }

    @Test
    void aliasIsTheBareName() {
        assertEquals(Optional.of("price"), cents.alias(price));
        assertEquals(Optional.of("unit_price"), new CentsTransform("_CENTS").alias(column("unit_price_cents")));
    }

    private static ColumnDescriptor column(String name) {
        return new ColumnDescriptor(1, Identifier.of(name), ColumnType.INTEGER, true, Optional.empty(), false);
    }
}
