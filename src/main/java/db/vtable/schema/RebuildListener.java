package db.vtable.schema;

import db.vtable.catalog.Identifier;

/**
 * Called before each rebuild step. Throwing aborts the rebuild; the table is left as it was.
 */
@FunctionalInterface
public interface RebuildListener {
    RebuildListener NONE = (step, table) -> { };

    void beforeStep(RebuildStep step, Identifier table);
}
