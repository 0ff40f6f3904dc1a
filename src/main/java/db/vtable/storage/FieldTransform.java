package db.vtable.storage;

import java.util.Optional;

import db.vtable.catalog.ColumnDescriptor;

/**
 * Value transform selected by column naming convention. Runs above the generic type
 * coercion: on write it turns caller input into the stored form, on read it renders the
 * stored form for display.
 */
public interface FieldTransform {

    boolean appliesTo(ColumnDescriptor column);

    Object toStored(ColumnDescriptor column, Object input);

    String toDisplay(Object stored);

    /** Alternative input/export name for the column, if the convention defines one. */
    default Optional<String> alias(ColumnDescriptor column) {
        return Optional.empty();
    }
}
