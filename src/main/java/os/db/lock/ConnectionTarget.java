package os.db.lock;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Where the session of a {@link DbLock} connects to.
 *
 * <p>Either built from parts, in which case the {@link Dialect} is known up front, or from an explicit
 * JDBC URL, in which case the dialect is detected once the session is open.</p>
 */
public final class ConnectionTarget {

    public static final int DEFAULT_VALIDATION_TIMEOUT_SECONDS = 5;

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final Dialect dialect;
    private final int validationTimeoutSeconds;
    private final Properties driverProperties;

    private ConnectionTarget(String jdbcUrl, String user, String password, Dialect dialect, int validationTimeoutSeconds,
                             Properties driverProperties) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        this.user = user;
        this.password = password;
        this.dialect = dialect;
        this.driverProperties = driverProperties;
        if (validationTimeoutSeconds < 0) {
            throw new IllegalArgumentException("validationTimeoutSeconds must be >= 0");
        }
        this.validationTimeoutSeconds = validationTimeoutSeconds;
    }

    public static ConnectionTarget of(Dialect dialect, String host, int port, String database, String user, String password) {
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(database, "database");
        return new ConnectionTarget(dialect.jdbcUrl(host, port, database), user, password, dialect,
                DEFAULT_VALIDATION_TIMEOUT_SECONDS, new Properties());
    }

    public static ConnectionTarget ofUrl(String jdbcUrl, String user, String password) {
        return new ConnectionTarget(jdbcUrl, user, password, null, DEFAULT_VALIDATION_TIMEOUT_SECONDS, new Properties());
    }

    /**
     * Parses either a JDBC URL or a {@code key=value;key=value} connection string such as
     * {@code Host=db1;Port=5432;Database=app;Username=app;Password=secret}.
     *
     * <p>Recognized keys, case insensitive: Host (or Server), Port, Database, Username (or User, User Id),
     * Password and Vendor ({@code postgres}, the default, or {@code mysql}). Any other key is handed to the
     * JDBC driver as a connection property, verbatim, so it has to be a property the driver knows, for example
     * {@code sslmode=require} for PostgreSQL. Values may be quoted with {@code '} or {@code "} to contain
     * {@code ;}, a doubled quote inside a quoted value stands for the quote itself.</p>
     */
    public static ConnectionTarget parse(String connectionString) {
        Objects.requireNonNull(connectionString, "connectionString");
        String trimmed = connectionString.trim();
        if (trimmed.regionMatches(true, 0, "jdbc:", 0, 5)) {
            return ofUrl(trimmed, null, null);
        }

        Map<String, String> values = new LinkedHashMap<>();
        Properties driverProperties = new Properties();
        for (Map.Entry<String, String> entry : split(trimmed).entrySet()) {
            String key = canonicalKey(entry.getKey());
            if (key == null) {
                driverProperties.setProperty(entry.getKey(), entry.getValue());
            } else {
                values.put(key, entry.getValue());
            }
        }

        ConnectionTarget target = fromValues(values);
        return new ConnectionTarget(target.jdbcUrl, target.user, target.password, target.dialect,
                target.validationTimeoutSeconds, driverProperties);
    }

    /**
     * Reads {@code <prefix>.url}, {@code .host}, {@code .port}, {@code .database}, {@code .user},
     * {@code .password} and {@code .vendor}. An url wins over the individual parts.
     */
    public static ConnectionTarget fromProperties(Properties properties, String prefix) {
        String url = properties.getProperty(prefix + ".url");
        String user = properties.getProperty(prefix + ".user");
        String password = properties.getProperty(prefix + ".password");
        if (url != null) {
            return ofUrl(url.trim(), user, password);
        }

        Map<String, String> values = new LinkedHashMap<>();
        for (String key : new String[]{"host", "port", "database", "user", "password", "vendor"}) {
            String value = properties.getProperty(prefix + "." + key);
            if (value != null) {
                values.put(key, value.trim());
            }
        }
        return fromValues(values);
    }

    public ConnectionTarget withValidationTimeout(int seconds) {
        return new ConnectionTarget(jdbcUrl, user, password, dialect, seconds, driverProperties);
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    public String user() {
        return user;
    }

    public String password() {
        return password;
    }

    /**
     * @return the dialect or null when it has to be detected from the database
     */
    public Dialect dialect() {
        return dialect;
    }

    public int validationTimeoutSeconds() {
        return validationTimeoutSeconds;
    }

    /**
     * @return the connection properties for the driver, including user and password when set
     */
    public Properties connectionProperties() {
        Properties properties = new Properties();
        properties.putAll(driverProperties);
        if (user != null) {
            properties.setProperty("user", user);
        }
        if (password != null) {
            properties.setProperty("password", password);
        }
        return properties;
    }

    @Override
    public String toString() {
        return "ConnectionTarget{" +
                "jdbcUrl='" + jdbcUrl + '\'' +
                ", user='" + user + '\'' +
                ", password=" + (password == null ? "null" : "****") +
                ", driverProperties=" + driverProperties.stringPropertyNames() +
                '}';
    }

    private static ConnectionTarget fromValues(Map<String, String> values) {
        String host = values.get("host");
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Connection string has no host");
        }
        String database = values.get("database");
        if (database == null || database.isEmpty()) {
            throw new IllegalArgumentException("Connection string has no database");
        }

        Dialect dialect = values.containsKey("vendor") ? Dialect.forVendor(values.get("vendor")) : Dialect.POSTGRES;
        int port = dialect.defaultPort();
        if (values.containsKey("port")) {
            try {
                port = Integer.parseInt(values.get("port"));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(String.format("Invalid port '%s'", values.get("port")), e);
            }
        }

        return of(dialect, host, port, database, values.get("user"), values.get("password"));
    }

    private static String canonicalKey(String key) {
        String normalized = key.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        switch (normalized) {
            case "host":
            case "server":
                return "host";
            case "port":
                return "port";
            case "database":
                return "database";
            case "username":
            case "user":
            case "userid":
                return "user";
            case "password":
                return "password";
            case "vendor":
                return "vendor";
            default:
                return null;
        }
    }

    private static Map<String, String> split(String connectionString) {
        Map<String, String> entries = new LinkedHashMap<>();
        int length = connectionString.length();
        int position = 0;

        while (position < length) {
            int separator = connectionString.indexOf('=', position);
            int end = connectionString.indexOf(';', position);
            if (end == position || connectionString.substring(position, end < 0 ? length : end).isBlank()) {
                position = end < 0 ? length : end + 1;
                continue;
            }
            if (separator < 0 || (end >= 0 && end < separator) || connectionString.substring(position, separator).isBlank()) {
                String entry = connectionString.substring(position, end < 0 ? length : end);
                throw new IllegalArgumentException(String.format("Malformed connection string entry '%s'", entry.trim()));
            }
            String key = connectionString.substring(position, separator).trim();

            position = separator + 1;
            while (position < length && connectionString.charAt(position) == ' ') {
                position++;
            }

            StringBuilder value = new StringBuilder();
            char first = position < length ? connectionString.charAt(position) : ';';
            if (first == '\'' || first == '"') {
                position++;
                boolean closed = false;
                while (position < length) {
                    char c = connectionString.charAt(position++);
                    if (c != first) {
                        value.append(c);
                    } else if (position < length && connectionString.charAt(position) == first) {
                        value.append(c);
                        position++;
                    } else {
                        closed = true;
                        break;
                    }
                }
                if (!closed) {
                    throw new IllegalArgumentException(String.format("Unterminated quoted value for '%s'", key));
                }
                end = connectionString.indexOf(';', position);
                String rest = connectionString.substring(position, end < 0 ? length : end);
                if (!rest.isBlank()) {
                    throw new IllegalArgumentException(String.format("Unexpected '%s' after quoted value for '%s'", rest.trim(), key));
                }
            } else {
                end = connectionString.indexOf(';', position);
                value.append(connectionString, position, end < 0 ? length : end);
            }

            String text = value.toString();
            entries.put(key, first == '\'' || first == '"' ? text : text.trim());
            position = end < 0 ? length : end + 1;
        }
        return entries;
    }
}
