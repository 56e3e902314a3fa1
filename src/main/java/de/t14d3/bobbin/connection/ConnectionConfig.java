package de.t14d3.bobbin.connection;

import de.t14d3.bobbin.exceptions.OrmException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Populates a {@link ConnectionRegistry} from properties.
 * <p>
 * Recognized keys:
 * <pre>
 * bobbin.connections.&lt;name&gt;.url = jdbc:...
 * bobbin.default = &lt;name&gt;
 * </pre>
 * Connections are registered in name order; without {@code bobbin.default} the first
 * one registered is the default.
 */
public final class ConnectionConfig {
    public static final String PREFIX = "bobbin.connections.";
    public static final String DEFAULT_KEY = "bobbin.default";

    private ConnectionConfig() {
    }

    /**
     * Load a properties file from the classpath and register its connections into a new registry.
     */
    public static ConnectionRegistry load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = ConnectionConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new OrmException("Connection configuration not found on classpath: " + resource);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new OrmException("Failed to read connection configuration " + resource, e);
        }
        return fromProperties(properties);
    }

    /**
     * Register the connections of the given properties into a new registry. If any
     * connection fails to open, those already opened are closed again.
     */
    public static ConnectionRegistry fromProperties(Properties properties) {
        ConnectionRegistry registry = new ConnectionRegistry();
        try {
            configure(registry, properties);
        } catch (RuntimeException e) {
            registry.close();
            throw e;
        }
        return registry;
    }

    public static void configure(ConnectionRegistry registry, Properties properties) {
        TreeSet<String> names = new TreeSet<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(PREFIX) && key.endsWith(".url")) {
                names.add(key.substring(PREFIX.length(), key.length() - ".url".length()));
            }
        }
        for (String name : names) {
            registry.register(name, JdbcConnection.open(properties.getProperty(PREFIX + name + ".url")));
        }
        String defaultName = properties.getProperty(DEFAULT_KEY);
        if (defaultName != null && !defaultName.isBlank()) {
            registry.setDefaultName(defaultName.trim());
        }
    }
}
