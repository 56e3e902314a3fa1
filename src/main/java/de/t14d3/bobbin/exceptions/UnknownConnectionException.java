package de.t14d3.bobbin.exceptions;

/**
 * Thrown when a connection name is not registered with the connection registry.
 */
public class UnknownConnectionException extends OrmException {
    private final String connectionName;

    public UnknownConnectionException(String connectionName) {
        super("Database connection [" + connectionName + "] is not registered");
        this.connectionName = connectionName;
    }

    public String getConnectionName() {
        return connectionName;
    }
}
