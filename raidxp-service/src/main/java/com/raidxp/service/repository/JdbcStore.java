package com.raidxp.service.repository;

import com.raidxp.api.exceptions.StoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handle to the durable progression store.
 *
 * <p>Opened once and passed to every component that reads or writes. Writes run
 * through {@link #inTransaction}, which commits on success and rolls back on any
 * failure; reads run through {@link #read} on an auto-commit connection. Either
 * way a {@link SQLException} surfaces as {@link StoreException}.
 */
public class JdbcStore {

    private static final Logger logger = Logger.getLogger(JdbcStore.class.getName());

    private static final Map<String, String> SQL = SqlLoader.loadQueries("sql/queries.sql");
    private static final String SCHEMA_RESOURCE = "sql/schema.sql";

    /**
     * A unit of JDBC work against a borrowed connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    private final DataSource dataSource;

    public JdbcStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Creates tables and indexes that do not exist yet.
     */
    public void initializeSchema() {
        List<String> statements = SqlLoader.loadStatements(SCHEMA_RESOURCE);
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            logger.info("Progression store schema initialized (" + statements.size() + " statements)");
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to initialize progression store schema", e);
            throw new StoreException("Failed to initialize schema", e);
        }
    }

    /**
     * Runs {@code work} in one transaction.
     *
     * @param operation short description used in the failure message
     * @throws StoreException if the work or the commit fails; the transaction is rolled back
     */
    public <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to " + operation, e);
        }
    }

    /**
     * Runs read-only {@code work} on an auto-commit connection.
     */
    public <T> T read(String operation, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            return work.execute(conn);
        } catch (SQLException e) {
            throw new StoreException("Failed to " + operation, e);
        }
    }

    static String sql(String name) {
        String sql = SQL.get(name);
        if (sql == null) {
            throw new IllegalStateException("Unknown query: " + name);
        }
        return sql;
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            logger.log(Level.WARNING, "Rollback failed", e);
        }
    }
}
