package db.vtable.ledger;

import java.util.Optional;

import db.vtable.ErrorCode;

// Terminal outcome of a rollback: the inversion entry when LOGGED, the reason when REJECTED.
public record RollbackResult(long versionId,
                             RollbackState state,
                             Optional<VersionEntry> logged,
                             Optional<ErrorCode> rejection,
                             String message) {

    public static RollbackResult logged(long versionId, VersionEntry entry) {
        return new RollbackResult(versionId, RollbackState.LOGGED, Optional.of(entry), Optional.empty(),
            "Rolled back " + entry.fieldName() + " to " + entry.newValue().orElse("NULL"));
    }

    public static RollbackResult rejected(long versionId, ErrorCode reason, String message) {
        return new RollbackResult(versionId, RollbackState.REJECTED, Optional.empty(), Optional.of(reason), message);
    }

    public boolean isApplied() {
        return state == RollbackState.LOGGED;
    }
}
