package db.vtable.ledger;

/**
 * Requested -> Validated -> Applied -> Logged, or Requested -> Rejected.
 * LOGGED and REJECTED are terminal.
 */
public enum RollbackState {
    REQUESTED,
    VALIDATED,
    APPLIED,
    LOGGED,
    REJECTED;

    public boolean isTerminal() {
        return this == LOGGED || this == REJECTED;
    }
}
