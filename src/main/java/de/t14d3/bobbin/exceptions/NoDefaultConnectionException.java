package de.t14d3.bobbin.exceptions;

/**
 * Thrown when the default connection is requested but no connection has been registered.
 */
public class NoDefaultConnectionException extends OrmException {
    public NoDefaultConnectionException() {
        super("No database connection has been registered");
    }
}
