package de.t14d3.bobbin.test;

import de.t14d3.bobbin.connection.ConnectionConfig;
import de.t14d3.bobbin.connection.ConnectionRegistry;
import de.t14d3.bobbin.connection.DatabaseConnection;
import de.t14d3.bobbin.connection.JdbcConnection;
import de.t14d3.bobbin.core.EntityManager;
import de.t14d3.bobbin.exceptions.NoDefaultConnectionException;
import de.t14d3.bobbin.exceptions.OrmException;
import de.t14d3.bobbin.exceptions.UnknownConnectionException;
import de.t14d3.bobbin.query.Dialect;
import de.t14d3.bobbin.test.entities.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionRegistryTest {
    private ConnectionRegistry registry;
    private DatabaseConnection first;
    private DatabaseConnection second;

    @BeforeEach
    void setup() {
        registry = new ConnectionRegistry();
        first = JdbcConnection.open(TestSchema.url("registry_a"));
        second = JdbcConnection.open(TestSchema.url("registry_b"));
    }

    @AfterEach
    void teardown() {
        first.close();
        second.close();
    }

    @Test
    void testFirstRegistrationBecomesDefault() {
        registry.register("a", first);
        registry.register("b", second);

        assertEquals("a", registry.getDefaultName());
        assertSame(first, registry.getDefault());
        assertSame(second, registry.resolve("b"));
        assertEquals("b", second.getName(), "Registering names the connection");
        assertEquals(Set.of("a", "b"), registry.names());
    }

    @Test
    void testSetDefaultName() {
        registry.register("a", first);
        registry.register("b", second);
        registry.setDefaultName("b");

        assertSame(second, registry.getDefault());
        assertSame(second, registry.connection(null));
        assertSame(first, registry.connection("a"));
    }

    @Test
    void testSetDefaultNameRequiresRegisteredConnection() {
        registry.register("a", first);
        UnknownConnectionException ex = assertThrows(UnknownConnectionException.class,
                () -> registry.setDefaultName("missing"));
        assertEquals("missing", ex.getConnectionName());
        assertEquals("a", registry.getDefaultName());
    }

    @Test
    void testResolveUnknownName() {
        registry.register("a", first);
        assertThrows(UnknownConnectionException.class, () -> registry.resolve("b"));
        assertFalse(registry.has("b"));
    }

    @Test
    void testEmptyRegistryHasNoDefault() {
        assertThrows(NoDefaultConnectionException.class, registry::getDefault);
        assertThrows(NoDefaultConnectionException.class, () -> registry.connection(null));
    }

    @Test
    void testClearDropsEverything() {
        registry.register("a", first);
        registry.clear();

        assertThrows(UnknownConnectionException.class, () -> registry.resolve("a"));
        assertThrows(NoDefaultConnectionException.class, registry::getDefault);
        assertNull(registry.getDefaultName());

        // the next registration is the new default
        registry.register("b", second);
        assertEquals("b", registry.getDefaultName());
    }

    @Test
    void testEmptyNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("", first));
    }

    @Test
    void testModelConnectionOverride() {
        registry.register("a", first);
        registry.register("b", second);
        EntityManager em = new EntityManager(registry);

        User user = em.make(User.class);
        assertSame(first, user.getConnection());

        user.setConnection("b");
        assertSame(second, user.getConnection());

        user.setConnection("reporting");
        assertThrows(UnknownConnectionException.class, user::getConnection);
    }

    @Test
    void testConfigureFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("bobbin.connections.main.url", TestSchema.url("config_main"));
        properties.setProperty("bobbin.connections.audit.url", TestSchema.url("config_audit"));
        properties.setProperty("bobbin.default", "main");

        ConnectionRegistry configured = new ConnectionRegistry();
        ConnectionConfig.configure(configured, properties);
        try {
            assertEquals(Set.of("audit", "main"), configured.names());
            assertEquals("main", configured.getDefaultName());
            assertEquals(Dialect.H2, configured.getDefault().getQueryGrammar().getDialect());
        } finally {
            configured.close();
        }
    }

    @Test
    void testLoadFromClasspathResource() {
        ConnectionRegistry loaded = ConnectionConfig.load("bobbin-test.properties");
        try {
            assertTrue(loaded.has("primary"));
            assertTrue(loaded.has("secondary"));
            // no bobbin.default key: the first name in order is the default
            assertEquals("primary", loaded.getDefaultName());
        } finally {
            loaded.close();
        }
    }

    @Test
    void testMissingConfigurationResource() {
        assertThrows(de.t14d3.bobbin.exceptions.OrmException.class,
                () -> ConnectionConfig.load("does-not-exist.properties"));
    }

    @Test
    void testFailedConfigurationClosesOpenedConnections() {
        // INIT only runs when the in-memory database is first created
        String url = "jdbc:h2:mem:config_leak;INIT=CREATE TABLE IF NOT EXISTS marker(id INT)";
        Properties properties = new Properties();
        properties.setProperty("bobbin.connections.main.url", url);
        properties.setProperty("bobbin.default", "missing");

        assertThrows(UnknownConnectionException.class, () -> ConnectionConfig.fromProperties(properties));

        // Once its last connection closed, the database is gone and so is the table
        DatabaseConnection reopened = JdbcConnection.open("jdbc:h2:mem:config_leak");
        try {
            assertThrows(OrmException.class, () -> reopened.select("SELECT * FROM marker", List.of()));
        } finally {
            reopened.close();
        }
    }
}
