package de.t14d3.bobbin.exceptions;

/**
 * Thrown when a model type cannot be instantiated, typically because it is abstract
 * or lacks a parameterless constructor.
 */
public class InvalidRelatedTypeException extends OrmException {
    private final Class<?> type;

    public InvalidRelatedTypeException(Class<?> type, Throwable cause) {
        super("Cannot instantiate model " + type.getName(), cause);
        this.type = type;
    }

    public InvalidRelatedTypeException(Class<?> type, String reason) {
        super("Cannot instantiate model " + type.getName() + ": " + reason);
        this.type = type;
    }

    public Class<?> getType() {
        return type;
    }
}
