package db.vtable.storage;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;

/**
 * Runs a unit of work atomically on one connection. In auto-commit mode a transaction is
 * opened and committed; inside an existing transaction a savepoint is used instead, so a
 * failing inner unit is undone without touching the outer one.
 */
public final class Transactions {
    private Transactions() {}

    @FunctionalInterface
    public interface SqlWork<T> {
        T run() throws SQLException;
    }

    public static <T> T inTransaction(Connection conn, SqlWork<T> work) throws SQLException {
        if (conn.getAutoCommit()) {
            conn.setAutoCommit(false);
            try {
                T result = work.run();
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, null, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
        Savepoint sp = conn.setSavepoint();
        try {
            T result = work.run();
            conn.releaseSavepoint(sp);
            return result;
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(conn, sp, e);
            throw e;
        }
    }

    // A failed rollback is attached to the original failure rather than replacing it.
    private static void rollbackQuietly(Connection conn, Savepoint sp, Exception failure) {
        try {
            if (sp == null) {
                conn.rollback();
            } else {
                conn.rollback(sp);
                conn.releaseSavepoint(sp);
            }
        } catch (SQLException rollbackFailure) {
            failure.addSuppressed(rollbackFailure);
        }
    }
}
