package db.vtable;

/**
 * Base of the unchecked failures thrown by this library. Every instance carries an
 * {@link ErrorCode} so callers can branch on the category without parsing messages.
 */
public class VersionedTableException extends RuntimeException {
    private final ErrorCode code;

    public VersionedTableException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public VersionedTableException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() { return code; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
