package db.vtable;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.vtable.catalog.ColumnDescriptor;
import db.vtable.catalog.ColumnType;
import db.vtable.catalog.Identifier;
import db.vtable.catalog.IdentifierSanitizer;
import db.vtable.catalog.SchemaIntrospector;
import db.vtable.config.VTableConfig;
import db.vtable.ledger.RollbackExecutor;
import db.vtable.ledger.RollbackResult;
import db.vtable.ledger.SortOrder;
import db.vtable.ledger.VersionEntry;
import db.vtable.ledger.VersionSortField;
import db.vtable.ledger.VersioningLedger;
import db.vtable.schema.ColumnMutationPlanner;
import db.vtable.schema.TableRebuilder;
import db.vtable.storage.CentsTransform;
import db.vtable.storage.Record;
import db.vtable.storage.RecordAccessor;
import db.vtable.storage.RecordExporter;
import db.vtable.storage.Transactions;

/**
 * Operation set for one runtime-evolvable table and its change ledger.
 *
 * <p>Each call runs as one transaction on the table's connection and either commits in
 * full or leaves no trace. There is a single logical writer per table: all calls are
 * serialized on one lock, which also confines the JDBC connection to one thread at a time.
 * Names supplied here pass through {@link IdentifierSanitizer}; values are always bound.
 */
public class VersionedTable implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(VersionedTable.class);

    private final Connection connection;
    private final Identifier table;
    private final String defaultActor;
    private final ReentrantLock lock = new ReentrantLock();

    private final SchemaIntrospector introspector = new SchemaIntrospector();
    private final ColumnMutationPlanner planner;
    private final VersioningLedger ledger;
    private final RecordAccessor records;
    private final RollbackExecutor rollbacks;
    private final RecordExporter exporter = new RecordExporter();

    public static VersionedTable open(VTableConfig config) {
        String url = "jdbc:sqlite:" + config.databasePath;
        Connection conn;
        try {
            conn = DriverManager.getConnection(url);
        } catch (SQLException e) {
            throw new VersionedTableException(ErrorCode.STORAGE_FAILURE, "Cannot open " + url, e);
        }
        try {
            VersionedTable vt = new VersionedTable(conn, config, new TableRebuilder(), Clock.systemUTC());
            LOGGER.info("Opened {} for table '{}'", url, vt.table());
            return vt;
        } catch (RuntimeException e) {
            try {
                conn.close();
            } catch (SQLException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Takes ownership of {@code connection} and creates the table (primary key only) and
     * its ledger if they do not exist yet.
     */
    public VersionedTable(Connection connection, VTableConfig config, TableRebuilder rebuilder, Clock clock) {
        this.connection = connection;
        this.table = IdentifierSanitizer.sanitize(config.tableName);
        this.defaultActor = config.defaultActor;
        this.planner = new ColumnMutationPlanner(introspector, rebuilder);
        this.ledger = new VersioningLedger(IdentifierSanitizer.sanitize(config.ledgerTableName), clock);
        this.records = new RecordAccessor(introspector, ledger, List.of(new CentsTransform(config.monetarySuffix)));
        this.rollbacks = new RollbackExecutor(introspector, records, ledger);
        read("initialize", () -> Transactions.inTransaction(connection, () -> {
            planner.ensureTable(connection, table);
            ledger.ensureTable(connection);
            return null;
        }));
    }

    public Identifier table() { return table; }

    // ----- schema -----

    public List<ColumnDescriptor> listColumns() {
        return read("listColumns", () -> introspector.listColumns(connection, table));
    }

    public Optional<String> getDefinitionStatement() {
        return read("getDefinitionStatement", () -> introspector.getDefinitionStatement(connection, table));
    }

    public void addColumn(String name, String type, String defaultValue) {
        Identifier column = IdentifierSanitizer.sanitize(name);
        migrate("addColumn", () -> {
            planner.addColumn(connection, table, column, type, defaultValue);
            return null;
        });
    }

    public void addColumn(String name, ColumnType type, String defaultValue) {
        addColumn(name, type.sqlName(), defaultValue);
    }

    public void dropColumn(String name) {
        Identifier column = IdentifierSanitizer.sanitize(name);
        migrate("dropColumn", () -> {
            planner.dropColumn(connection, table, column);
            return null;
        });
    }

    public void modifyColumn(String oldName, String newName, String newType, String newDefault) {
        Identifier from = IdentifierSanitizer.sanitize(oldName);
        Identifier to = IdentifierSanitizer.sanitize(newName == null || newName.isBlank() ? oldName : newName);
        migrate("modifyColumn", () -> {
            planner.modifyColumn(connection, table, from, to, newType, newDefault);
            return null;
        });
    }

    /** Privileged: executes {@code sql} verbatim. */
    public void runRawStatement(String sql, String actor) {
        migrate("runRawStatement", () -> {
            planner.runRawStatement(connection, table, sql, actorOr(actor));
            return null;
        });
    }

    // ----- records -----

    public long createRecord(Map<String, ?> values, String actor) {
        return write("createRecord", () -> records.create(connection, table, values, actorOr(actor)));
    }

    public Record getRecord(long id) {
        return read("getRecord", () -> records.get(connection, table, id));
    }

    public List<VersionEntry> updateRecord(long id, Map<String, ?> values, String actor) {
        return write("updateRecord", () -> records.update(connection, table, id, values, actorOr(actor)));
    }

    public void deleteRecord(long id) {
        write("deleteRecord", () -> {
            records.delete(connection, table, id);
            return null;
        });
    }

    public List<Record> listRecords(int limit) {
        return read("listRecords", () -> records.list(connection, table, limit));
    }

    public List<Record> getRecords(Collection<Long> ids) {
        return read("getRecords", () -> records.getAll(connection, table, ids));
    }

    public String exportRecordsJson(int limit) {
        return exporter.toJson(listRecords(limit));
    }

    // ----- ledger -----

    public List<VersionEntry> listVersions(OptionalLong recordId, int limit, VersionSortField sortField, SortOrder order) {
        return read("listVersions", () -> ledger.list(connection, recordId, limit, sortField, order));
    }

    public Optional<VersionEntry> getVersion(long id) {
        return read("getVersion", () -> ledger.getById(connection, id));
    }

    public RollbackResult rollback(long versionId, String actor) {
        return write("rollback", () -> rollbacks.rollback(connection, table, versionId, actorOr(actor)));
    }

    @Override
    public void close() {
        lock.lock();
        try {
            connection.close();
        } catch (SQLException e) {
            throw new VersionedTableException(ErrorCode.STORAGE_FAILURE, "Failed closing connection", e);
        } finally {
            lock.unlock();
        }
    }

    private String actorOr(String actor) {
        return actor == null || actor.isBlank() ? defaultActor : actor;
    }

    private <T> T write(String op, Transactions.SqlWork<T> work) {
        return read(op, () -> Transactions.inTransaction(connection, work));
    }

    private <T> T migrate(String op, Transactions.SqlWork<T> work) {
        lock.lock();
        try {
            return Transactions.inTransaction(connection, work);
        } catch (SQLException e) {
            throw new MigrationException(ErrorCode.MIGRATION_FAILURE, op + " failed on '" + table + "': " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(String op, Transactions.SqlWork<T> work) {
        lock.lock();
        try {
            return work.run();
        } catch (SQLException e) {
            throw new VersionedTableException(ErrorCode.STORAGE_FAILURE, op + " failed on '" + table + "': " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }
}
