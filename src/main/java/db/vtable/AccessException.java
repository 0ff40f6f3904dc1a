package db.vtable;

/**
 * Raised by record reads/writes and ledger lookups.
 */
public class AccessException extends VersionedTableException {

    public AccessException(ErrorCode code, String message) {
        super(code, message);
    }

    public AccessException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
