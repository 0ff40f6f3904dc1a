package db.vtable;

/**
 * Raised by schema operations (add/drop/modify column, rebuild, raw statements).
 */
public class MigrationException extends VersionedTableException {

    public MigrationException(ErrorCode code, String message) {
        super(code, message);
    }

    public MigrationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
