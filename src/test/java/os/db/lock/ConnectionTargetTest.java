package os.db.lock;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConnectionTargetTest {

    @Test
    void parse_a_key_value_connection_string() {
        ConnectionTarget target = ConnectionTarget.parse("Host=db1;Port=6543;Database=app;Username=locker;Password=secret");

        assertEquals("jdbc:postgresql://db1:6543/app", target.jdbcUrl());
        assertEquals("locker", target.user());
        assertEquals("secret", target.password());
        assertSame(Dialect.POSTGRES, target.dialect());
    }

    @Test
    void use_the_default_port_of_the_vendor() {
        assertEquals("jdbc:postgresql://db1:5432/app", ConnectionTarget.parse("Server=db1;Database=app").jdbcUrl());

        ConnectionTarget mysql = ConnectionTarget.parse("host=db2; database=app; vendor=MySQL; User Id=locker");
        assertEquals("jdbc:mysql://db2:3306/app", mysql.jdbcUrl());
        assertEquals("locker", mysql.user());
        assertSame(Dialect.MYSQL, mysql.dialect());
    }

    @Test
    void ignore_empty_entries_and_surrounding_blanks() {
        ConnectionTarget target = ConnectionTarget.parse(" Host = db1 ;; Database = app ; ");

        assertEquals("jdbc:postgresql://db1:5432/app", target.jdbcUrl());
        assertNull(target.user());
    }

    @Test
    void take_a_jdbc_url_as_is() {
        ConnectionTarget target = ConnectionTarget.parse("jdbc:postgresql://db1/app?user=locker");

        assertEquals("jdbc:postgresql://db1/app?user=locker", target.jdbcUrl());
        assertNull(target.dialect());
        assertNull(target.user());
    }

    @Test
    void pass_unknown_keys_to_the_driver() {
        ConnectionTarget target = ConnectionTarget.parse("Host=db1;Database=app;sslmode=require;Pooling=true;Username=locker");

        Properties properties = target.connectionProperties();
        assertEquals("require", properties.getProperty("sslmode"));
        assertEquals("true", properties.getProperty("Pooling"));
        assertEquals("locker", properties.getProperty("user"));
        assertNull(properties.getProperty("password"));
        assertEquals("jdbc:postgresql://db1:5432/app", target.jdbcUrl());
    }

    @Test
    void keep_separators_inside_quoted_values() {
        ConnectionTarget target = ConnectionTarget.parse("Host=db1;Password='a;b''c';Database=\"app\" ;Username=locker");

        assertEquals("a;b'c", target.password());
        assertEquals("jdbc:postgresql://db1:5432/app", target.jdbcUrl());
        assertEquals("a;b'c", target.connectionProperties().getProperty("password"));
        assertFalse(target.toString().contains("a;b"));
    }

    @Test
    void reject_broken_quoting() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionTarget.parse("Host=db1;Database=app;Password='open"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionTarget.parse("Host=db1;Database=app;Password='a'b"));
    }

    @Test
    void reject_incomplete_connection_strings() {
        assertThrows(IllegalArgumentException.class, () -> ConnectionTarget.parse("Database=app"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionTarget.parse("Host=db1"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionTarget.parse("Host=db1;Database=app;Port=x"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionTarget.parse("Host=db1;=app"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionTarget.parse("Host=db1;Database"));
        assertThrows(IllegalArgumentException.class, () -> ConnectionTarget.parse("Host=db1;Database=app;Vendor=oracle"));
    }

    @Test
    void read_the_target_from_properties() {
        Properties properties = new Properties();
        properties.setProperty("lock.db.host", "db1");
        properties.setProperty("lock.db.database", "app");
        properties.setProperty("lock.db.user", "locker");
        properties.setProperty("lock.db.password", "secret");
        properties.setProperty("lock.db.vendor", "mariadb");

        ConnectionTarget target = ConnectionTarget.fromProperties(properties, "lock.db");

        assertEquals("jdbc:mysql://db1:3306/app", target.jdbcUrl());
        assertEquals("locker", target.user());
        assertEquals("secret", target.password());
    }

    @Test
    void prefer_the_url_property() {
        Properties properties = new Properties();
        properties.setProperty("lock.db.url", "jdbc:h2:mem:other");
        properties.setProperty("lock.db.host", "ignored");
        properties.setProperty("lock.db.user", "sa");

        ConnectionTarget target = ConnectionTarget.fromProperties(properties, "lock.db");

        assertEquals("jdbc:h2:mem:other", target.jdbcUrl());
        assertEquals("sa", target.user());
        assertNull(target.dialect());
    }

    @Test
    void never_print_the_password() {
        ConnectionTarget target = ConnectionTarget.parse("Host=db1;Database=app;Username=locker;Password=secret");

        assertFalse(target.toString().contains("secret"));
        assertTrue(target.toString().contains("locker"));
    }

    @Test
    void validate_the_validation_timeout() {
        ConnectionTarget target = ConnectionTarget.parse("Host=db1;Database=app");

        assertEquals(ConnectionTarget.DEFAULT_VALIDATION_TIMEOUT_SECONDS, target.validationTimeoutSeconds());
        assertEquals(1, target.withValidationTimeout(1).validationTimeoutSeconds());
        assertEquals(target.jdbcUrl(), target.withValidationTimeout(1).jdbcUrl());
        assertThrows(IllegalArgumentException.class, () -> target.withValidationTimeout(-1));
    }
}
