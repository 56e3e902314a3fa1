package de.t14d3.bobbin.connection;

import de.t14d3.bobbin.exceptions.NoDefaultConnectionException;
import de.t14d3.bobbin.exceptions.UnknownConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named database connections with one default.
 * <p>
 * The first connection registered into an empty registry becomes the default.
 * Models resolve their connection here: their own connection name if they carry one,
 * the default otherwise.
 * <p>
 * Not thread-safe. A registry is populated at startup and then read; concurrent
 * registration must be guarded by the caller.
 */
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, DatabaseConnection> connections = new LinkedHashMap<>();
    private String defaultName;

    /**
     * Register a connection under a name, replacing any connection registered under the same name.
     */
    public void register(String name, DatabaseConnection connection) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Connection name must not be empty");
        }
        if (connections.isEmpty()) {
            defaultName = name;
        }
        connection.setName(name);
        connections.put(name, connection);
        log.info("Registered database connection [{}]{}", name, name.equals(defaultName) ? " (default)" : "");
    }

    /**
     * The connection registered under {@code name}.
     *
     * @throws UnknownConnectionException if no such connection is registered
     */
    public DatabaseConnection resolve(String name) {
        DatabaseConnection connection = connections.get(name);
        if (connection == null) {
            throw new UnknownConnectionException(name);
        }
        return connection;
    }

    /**
     * The default connection.
     *
     * @throws NoDefaultConnectionException if no connection is registered
     */
    public DatabaseConnection getDefault() {
        if (connections.isEmpty() || defaultName == null) {
            throw new NoDefaultConnectionException();
        }
        return resolve(defaultName);
    }

    /**
     * The named connection, or the default one when {@code name} is null or empty.
     */
    public DatabaseConnection connection(String name) {
        return name == null || name.isEmpty() ? getDefault() : resolve(name);
    }

    /**
     * Make a registered connection the default.
     *
     * @throws UnknownConnectionException if {@code name} is not registered
     */
    public void setDefaultName(String name) {
        if (!connections.containsKey(name)) {
            throw new UnknownConnectionException(name);
        }
        defaultName = name;
    }

    public String getDefaultName() {
        return defaultName;
    }

    public boolean has(String name) {
        return connections.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(connections.keySet());
    }

    /**
     * Drop every registration and the default marker. Connections are not closed.
     */
    public void clear() {
        connections.clear();
        defaultName = null;
    }

    /**
     * Close every registered connection, then clear the registry.
     */
    public void close() {
        List<DatabaseConnection> open = new ArrayList<>(connections.values());
        clear();
        for (DatabaseConnection connection : open) {
            connection.close();
        }
    }
}
