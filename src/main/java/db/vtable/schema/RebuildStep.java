package db.vtable.schema;

/**
 * Observable phases of a table rebuild, in execution order.
 */
public enum RebuildStep {
    CREATE_SHADOW,
    COPY_ROWS,
    SWAP
}
