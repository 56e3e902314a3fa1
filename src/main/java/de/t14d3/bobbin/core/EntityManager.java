package de.t14d3.bobbin.core;

import de.t14d3.bobbin.connection.ConnectionRegistry;
import de.t14d3.bobbin.connection.JdbcConnection;
import de.t14d3.bobbin.mapping.ModelMetadata;
import de.t14d3.bobbin.mapping.ModelScanner;
import de.t14d3.bobbin.model.Builder;
import de.t14d3.bobbin.model.Model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The main entry point for working with models of a type rather than an instance:
 * creating, finding and querying them.
 * <p>
 * Holds the {@link ConnectionRegistry} that every model it creates or loads is bound to.
 */
public class EntityManager {
    public static final String DEFAULT_CONNECTION = "default";

    private final ConnectionRegistry connections;

    public EntityManager(ConnectionRegistry connections) {
        this.connections = connections;
    }

    /**
     * Create a new EntityManager with a single default connection for the given URL.
     */
    public static EntityManager create(String jdbcUrl) {
        ConnectionRegistry registry = new ConnectionRegistry();
        registry.register(DEFAULT_CONNECTION, JdbcConnection.open(jdbcUrl));
        return new EntityManager(registry);
    }

    public ConnectionRegistry getConnections() {
        return connections;
    }

    /**
     * A new, unsaved model bound to this manager's connections.
     */
    public <T extends Model> T make(Class<T> type) {
        return make(type, Map.of());
    }

    public <T extends Model> T make(Class<T> type, Map<String, ?> attributes) {
        T model = type.cast(ModelMetadata.of(type).newInstance());
        model.setConnectionRegistry(connections);
        model.fill(attributes);
        return model;
    }

    /**
     * Bind a model constructed elsewhere to this manager's connections.
     */
    public <T extends Model> T attach(T model) {
        model.setConnectionRegistry(connections);
        return model;
    }

    /**
     * Save a new model with the given attributes and return it.
     */
    public <T extends Model> T create(Class<T> type, Map<String, ?> attributes) {
        T model = make(type, attributes);
        model.save();
        return model;
    }

    /**
     * Find a model by its primary key, or {@code null}.
     */
    public <T extends Model> T find(Class<T> type, Object id, String... columns) {
        return query(type).find(id, columns);
    }

    public <T extends Model> List<T> all(Class<T> type, String... columns) {
        return query(type).get(columns);
    }

    /**
     * A new query for a model type.
     */
    public <T extends Model> Builder<T> query(Class<T> type) {
        return Model.queryFor(make(type));
    }

    /**
     * Begin querying a model type with eager loading.
     */
    public <T extends Model> Builder<T> with(Class<T> type, String... relations) {
        return query(type).with(relations);
    }

    /**
     * Preload metadata for every model type in a package.
     */
    public Set<Class<? extends Model>> scan(String basePackage) {
        return ModelScanner.scan(basePackage);
    }

    /**
     * Close every registered connection.
     */
    public void close() {
        connections.close();
    }
}
