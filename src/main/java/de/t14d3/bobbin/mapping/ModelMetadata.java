package de.t14d3.bobbin.mapping;

import de.t14d3.bobbin.annotations.Accessor;
import de.t14d3.bobbin.annotations.Mutator;
import de.t14d3.bobbin.annotations.Table;
import de.t14d3.bobbin.exceptions.InvalidRelatedTypeException;
import de.t14d3.bobbin.exceptions.OrmException;
import de.t14d3.bobbin.exceptions.UnknownRelationException;
import de.t14d3.bobbin.model.Model;
import de.t14d3.bobbin.model.relations.Relation;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds per-type information about a model class: its table and key, and the
 * accessor, mutator and relationship methods it declares. Built once per class using
 * reflection and cached.
 */
public class ModelMetadata {
    private static final Map<Class<?>, ModelMetadata> METADATA_CACHE = new ConcurrentHashMap<>();

    private final Class<? extends Model> modelClass;
    private final String tableName;
    private final String keyName;
    private final String connectionName;
    private final boolean timestamps;
    private final Map<String, Method> accessors = new HashMap<>();
    private final Map<String, Method> mutators = new HashMap<>();
    private final Map<String, Method> relations = new HashMap<>();

    private ModelMetadata(Class<? extends Model> modelClass) {
        this.modelClass = modelClass;

        Table table = modelClass.getAnnotation(Table.class);
        if (table != null) {
            this.tableName = table.name().isEmpty() ? NamingConventions.tableName(modelClass) : table.name();
            this.keyName = table.primaryKey();
            this.connectionName = table.connection().isEmpty() ? null : table.connection();
            this.timestamps = table.timestamps();
        } else {
            this.tableName = NamingConventions.tableName(modelClass);
            this.keyName = "id";
            this.connectionName = null;
            this.timestamps = true;
        }

        // Walk from the concrete class up so that overriding declarations win
        for (Class<?> cls = modelClass; cls != null && cls != Model.class; cls = cls.getSuperclass()) {
            for (Method method : cls.getDeclaredMethods()) {
                if (method.isAnnotationPresent(Accessor.class)) {
                    String attribute = hookAttribute(method, method.getAnnotation(Accessor.class).value(), "get");
                    accessors.putIfAbsent(attribute, method);
                }
                if (method.isAnnotationPresent(Mutator.class)) {
                    String attribute = hookAttribute(method, method.getAnnotation(Mutator.class).value(), "set");
                    mutators.putIfAbsent(attribute, method);
                }
            }
        }

        for (Method method : modelClass.getMethods()) {
            if (method.getParameterCount() == 0
                    && !Modifier.isStatic(method.getModifiers())
                    && Relation.class.isAssignableFrom(method.getReturnType())
                    && method.getDeclaringClass() != Model.class) {
                method.setAccessible(true);
                relations.putIfAbsent(method.getName(), method);
            }
        }
    }

    /**
     * Get or create metadata for the given model class.
     */
    public static ModelMetadata of(Class<? extends Model> modelClass) {
        return METADATA_CACHE.computeIfAbsent(modelClass, cls -> new ModelMetadata(modelClass));
    }

    private String hookAttribute(Method method, String declared, String prefix) {
        if (method.getParameterCount() != 1) {
            throw new IllegalArgumentException("Attribute hook " + modelClass.getName() + "#" + method.getName()
                    + " must take exactly one parameter");
        }
        method.setAccessible(true);
        if (!declared.isEmpty()) {
            return declared;
        }
        String name = method.getName();
        if (name.startsWith(prefix) && name.length() > prefix.length()) {
            name = name.substring(prefix.length());
        }
        return NamingConventions.snakeCase(name);
    }

    public Class<? extends Model> getModelClass() {
        return modelClass;
    }

    public String getTableName() {
        return tableName;
    }

    public String getKeyName() {
        return keyName;
    }

    /**
     * The connection configured for this type, or {@code null} for the registry default.
     */
    public String getConnectionName() {
        return connectionName;
    }

    public boolean usesTimestamps() {
        return timestamps;
    }

    public boolean hasAccessor(String attribute) {
        return accessors.containsKey(attribute);
    }

    public boolean hasMutator(String attribute) {
        return mutators.containsKey(attribute);
    }

    public Set<String> getRelationNames() {
        return Collections.unmodifiableSet(relations.keySet());
    }

    /**
     * Run the accessor registered for an attribute.
     */
    public Object applyAccessor(Model model, String attribute, Object raw) {
        return invoke(accessors.get(attribute), model, raw);
    }

    /**
     * Run the mutator registered for an attribute.
     */
    public Object applyMutator(Model model, String attribute, Object value) {
        return invoke(mutators.get(attribute), model, value);
    }

    /**
     * Invoke the relationship method with the given name.
     *
     * @throws UnknownRelationException if the model declares no such relationship
     */
    public Relation<?> relation(Model model, String name) {
        Method method = relations.get(name);
        if (method == null) {
            throw new UnknownRelationException(modelClass, name);
        }
        return (Relation<?>) invoke(method, model);
    }

    private static Object invoke(Method method, Object target, Object... args) {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new OrmException("Method " + method.getName() + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new OrmException("Cannot access method " + method.getName(), e);
        }
    }

    /**
     * Creates a new, empty instance of the model.
     *
     * @throws InvalidRelatedTypeException if the class is abstract or has no parameterless constructor
     */
    public Model newInstance() {
        if (Modifier.isAbstract(modelClass.getModifiers())) {
            throw new InvalidRelatedTypeException(modelClass, "type is abstract");
        }
        Constructor<? extends Model> constructor;
        try {
            constructor = modelClass.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new InvalidRelatedTypeException(modelClass, "no parameterless constructor");
        }

        try {
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            throw new InvalidRelatedTypeException(modelClass, e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new InvalidRelatedTypeException(modelClass, e);
        }
    }
}
