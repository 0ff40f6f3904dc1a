package db.vtable;

/**
 * Failure categories surfaced by schema, record and ledger operations.
 */
public enum ErrorCode {
    /** A name reached SQL construction without going through the sanitizer. */
    IDENTIFIER_INVALID,
    COLUMN_NOT_FOUND,
    COLUMN_EXISTS,
    PRIMARY_KEY_IMMUTABLE,
    TYPE_INVALID,
    TYPE_COERCION_ERROR,
    /** A rebuild step failed; the live table was left exactly as it was. */
    MIGRATION_FAILURE,
    RECORD_NOT_FOUND,
    VERSION_NOT_FOUND,
    FIELD_NO_LONGER_EXISTS,
    STORAGE_FAILURE
}
