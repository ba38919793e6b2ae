package os.db.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;

/**
 * The one connection all advisory lock traffic of a {@link DbLock} goes through. Advisory locks are
 * scoped to it: when it ends, the database drops every lock it held.
 */
class Session implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final Connection connection;
    private final int validationTimeoutSeconds;
    private boolean closed;
    private boolean broken;

    private Session(Connection connection, int validationTimeoutSeconds) {
        this.connection = connection;
        this.validationTimeoutSeconds = validationTimeoutSeconds;
    }

    static Session open(ConnectionTarget target) {
        Connection connection;
        try {
            connection = DriverManager.getConnection(target.jdbcUrl(), target.connectionProperties());
        } catch (SQLException e) {
            throw new ConnectionException(String.format("Unable to connect to %s", target), e);
        }
        return validated(connection, target.validationTimeoutSeconds(), target.toString());
    }

    static Session open(DataSource dataSource, int validationTimeoutSeconds) {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new ConnectionException("Unable to obtain a connection from the data source", e);
        }
        return validated(connection, validationTimeoutSeconds, "data source");
    }

    private static Session validated(Connection connection, int validationTimeoutSeconds, String description) {
        try {
            if (!connection.isValid(validationTimeoutSeconds)) {
                throw closeAfterFailure(connection, new ConnectionException(String.format("Connection to %s is not valid", description)));
            }
            // session level locks must not hang on an open transaction
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw closeAfterFailure(connection, new ConnectionException(String.format("Unable to validate connection to %s", description), e));
        }
        log.debug("Session opened to {}", description);
        return new Session(connection, validationTimeoutSeconds);
    }

    <T> T execute(SessionCall<T> call) {
        if (closed) {
            throw new ConnectionException("Session is closed");
        }
        if (broken) {
            throw new ConnectionException("Session is broken, locks it held are gone");
        }

        try {
            return call.apply(connection);
        } catch (SQLException e) {
            if (isConnectionFailure(e)) {
                broken = true;
                log.warn("Session connection lost: {}", e.getMessage());
                throw new ConnectionException("Session connection lost", e);
            }
            throw new SessionException(String.format("Advisory lock request failed: %s", e.getMessage()), e);
        }
    }

    boolean isUsable() {
        return !closed && !broken;
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
        } catch (SQLException e) {
            throw new ConnectionException("Unable to close session", e);
        }
        log.debug("Session closed");
    }

    private boolean isConnectionFailure(SQLException e) {
        if (e instanceof SQLNonTransientConnectionException) {
            return true;
        }
        String sqlState = e.getSQLState();
        if (sqlState != null && sqlState.startsWith("08")) {
            return true;
        }
        try {
            return !connection.isValid(validationTimeoutSeconds);
        } catch (SQLException validationFailure) {
            e.addSuppressed(validationFailure);
            return true;
        }
    }

    private static ConnectionException closeAfterFailure(Connection connection, ConnectionException failure) {
        try {
            connection.close();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
        return failure;
    }

    interface SessionCall<T> {
        T apply(Connection connection) throws SQLException;
    }
}
