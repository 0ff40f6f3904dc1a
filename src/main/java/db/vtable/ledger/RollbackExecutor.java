package db.vtable.ledger;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.vtable.AccessException;
import db.vtable.ErrorCode;
import db.vtable.catalog.ColumnDescriptor;
import db.vtable.catalog.Identifier;
import db.vtable.catalog.SchemaIntrospector;
import db.vtable.catalog.TableSchema;
import db.vtable.storage.RecordAccessor;
import db.vtable.storage.ValueCodec;

/**
 * Restores a ledger entry's old value onto the live record and logs the inversion as a
 * new forward entry, so the ledger stays append-only and every rollback can itself be
 * rolled back. All validation happens before anything is written; a rejected request
 * mutates nothing.
 */
public class RollbackExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(RollbackExecutor.class);

    private final SchemaIntrospector introspector;
    private final RecordAccessor records;
    private final VersioningLedger ledger;

    public RollbackExecutor(SchemaIntrospector introspector, RecordAccessor records, VersioningLedger ledger) {
        this.introspector = introspector;
        this.records = records;
        this.ledger = ledger;
    }

    public RollbackResult rollback(Connection conn, Identifier table, long versionId, String actor) throws SQLException {
        transition(versionId, RollbackState.REQUESTED);

        Optional<VersionEntry> found = ledger.getById(conn, versionId);
        if (found.isEmpty()) {
            return reject(versionId, ErrorCode.VERSION_NOT_FOUND, "Version " + versionId + " not found");
        }
        VersionEntry entry = found.get();
        TableSchema schema = introspector.readSchema(conn, table);
        Optional<ColumnDescriptor> column = schema.find(entry.fieldName());
        if (column.isEmpty()) {
            return reject(versionId, ErrorCode.FIELD_NO_LONGER_EXISTS,
                "Field '" + entry.fieldName() + "' no longer exists in table '" + table + "'");
        }
        if (column.get().primaryKey()) {
            return reject(versionId, ErrorCode.PRIMARY_KEY_IMMUTABLE,
                "Field '" + entry.fieldName() + "' is the primary key");
        }
        if (!records.exists(conn, schema, entry.recordId())) {
            return reject(versionId, ErrorCode.RECORD_NOT_FOUND,
                "Record " + entry.recordId() + " no longer exists");
        }
        String target = entry.oldValue().orElse(null);
        if (target == null && !column.get().nullable()) {
            return reject(versionId, ErrorCode.TYPE_COERCION_ERROR,
                "Field '" + entry.fieldName() + "' is NOT NULL and cannot be rolled back to NULL");
        }
        try {
            ValueCodec.coerce(column.get(), target);
        } catch (AccessException e) {
            return reject(versionId, e.code(), e.getMessage());
        }
        transition(versionId, RollbackState.VALIDATED);

        String before = records.applyStored(conn, schema, entry.recordId(), column.get(), target);
        transition(versionId, RollbackState.APPLIED);

        List<VersionEntry> logged = ledger.record(conn, entry.recordId(),
            List.of(new FieldDiff(column.get().name().name(), before, target)), actor);
        transition(versionId, RollbackState.LOGGED);
        LOGGER.info("Rolled back version {} ({}#{} -> {}) as version {}",
            versionId, entry.fieldName(), entry.recordId(), target, logged.get(0).id());
        return RollbackResult.logged(versionId, logged.get(0));
    }

    private static RollbackResult reject(long versionId, ErrorCode reason, String message) {
        transition(versionId, RollbackState.REJECTED);
        LOGGER.info("Rollback of version {} rejected: {} ({})", versionId, reason, message);
        return RollbackResult.rejected(versionId, reason, message);
    }

    private static void transition(long versionId, RollbackState state) {
        LOGGER.debug("Rollback of version {} -> {}", versionId, state);
    }
}
