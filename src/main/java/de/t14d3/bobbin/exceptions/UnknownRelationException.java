package de.t14d3.bobbin.exceptions;

/**
 * Thrown when a relationship is requested by name and the model declares no such relationship method.
 */
public class UnknownRelationException extends OrmException {
    private final Class<?> modelClass;
    private final String relationName;

    public UnknownRelationException(Class<?> modelClass, String relationName) {
        super("Call to undefined relationship [" + relationName + "] on model [" + modelClass.getName() + "]");
        this.modelClass = modelClass;
        this.relationName = relationName;
    }

    public Class<?> getModelClass() {
        return modelClass;
    }

    public String getRelationName() {
        return relationName;
    }
}
