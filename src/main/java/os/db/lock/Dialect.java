package os.db.lock;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;

/**
 * The two advisory lock calls of a database, plus the statement that drops every lock of the session.
 */
public enum Dialect {

    POSTGRES("postgresql", 5432,
            "SELECT pg_try_advisory_lock(?)",
            "SELECT pg_advisory_unlock(?)",
            "SELECT pg_advisory_unlock_all()") {

        @Override
        Object lockKey(long lockId) {
            return lockId;
        }

        @Override
        boolean granted(ResultSet rs) throws SQLException {
            boolean granted = rs.getBoolean(1);
            return granted && !rs.wasNull();
        }
    },

    /**
     * MySQL and MariaDB user level locks.
     *
     * <p>User level lock names are global to the server, so the name is the current schema, a slash and the
     * decimal lock id. That keeps ids of applications on different schemas apart, like the per database keys
     * of PostgreSQL. MySQL limits lock names to 64 characters, which leaves 43 for the schema name.</p>
     *
     * <p>{@code RELEASE_ALL_LOCKS()} exists on MySQL 5.7.5 and MariaDB 10.5 onwards. On older MariaDB closing a
     * {@link DbLock} that still holds locks reports a {@link SessionException}; the locks are released anyway
     * when the connection is closed.</p>
     */
    MYSQL("mysql", 3306,
            "SELECT GET_LOCK(CONCAT(COALESCE(DATABASE(), ''), '/', ?), 0)",
            "SELECT RELEASE_LOCK(CONCAT(COALESCE(DATABASE(), ''), '/', ?))",
            "SELECT RELEASE_ALL_LOCKS()") {

        @Override
        Object lockKey(long lockId) {
            return Long.toString(lockId);
        }

        // GET_LOCK and RELEASE_LOCK answer 1, 0 or NULL
        @Override
        boolean granted(ResultSet rs) throws SQLException {
            int result = rs.getInt(1);
            return result == 1 && !rs.wasNull();
        }
    };

    private final String jdbcScheme;
    private final int defaultPort;
    private final String tryLockSql;
    private final String unlockSql;
    private final String unlockAllSql;

    Dialect(String jdbcScheme, int defaultPort, String tryLockSql, String unlockSql, String unlockAllSql) {
        this.jdbcScheme = jdbcScheme;
        this.defaultPort = defaultPort;
        this.tryLockSql = tryLockSql;
        this.unlockSql = unlockSql;
        this.unlockAllSql = unlockAllSql;
    }

    abstract Object lockKey(long lockId);

    abstract boolean granted(ResultSet rs) throws SQLException;

    boolean released(ResultSet rs) throws SQLException {
        return granted(rs);
    }

    String tryLockSql() {
        return tryLockSql;
    }

    String unlockSql() {
        return unlockSql;
    }

    String unlockAllSql() {
        return unlockAllSql;
    }

    int defaultPort() {
        return defaultPort;
    }

    String jdbcUrl(String host, int port, String database) {
        return String.format("jdbc:%s://%s:%d/%s", jdbcScheme, host, port, database);
    }

    /**
     * @return the dialect for the given {@code DatabaseMetaData#getDatabaseProductName()}, or null if the
     * product has no advisory locks known to this library
     */
    static Dialect detect(String databaseProductName) {
        if (databaseProductName == null) {
            return null;
        }
        String product = databaseProductName.toLowerCase(Locale.ROOT);
        if (product.contains("postgres")) {
            return POSTGRES;
        }
        if (product.contains("mysql") || product.contains("mariadb")) {
            return MYSQL;
        }
        return null;
    }

    static Dialect forVendor(String vendor) {
        switch (vendor.trim().toLowerCase(Locale.ROOT)) {
            case "postgres":
            case "postgresql":
                return POSTGRES;
            case "mysql":
            case "mariadb":
                return MYSQL;
            default:
                throw new IllegalArgumentException(String.format("Unknown vendor '%s'", vendor));
        }
    }
}
