package de.t14d3.bobbin.model;

import de.t14d3.bobbin.connection.ConnectionRegistry;
import de.t14d3.bobbin.connection.DatabaseConnection;
import de.t14d3.bobbin.exceptions.OrmException;
import de.t14d3.bobbin.mapping.ModelMetadata;
import de.t14d3.bobbin.mapping.NamingConventions;
import de.t14d3.bobbin.mapping.TypeMapper;
import de.t14d3.bobbin.model.relations.BelongsTo;
import de.t14d3.bobbin.model.relations.BelongsToMany;
import de.t14d3.bobbin.model.relations.HasMany;
import de.t14d3.bobbin.model.relations.HasOne;
import de.t14d3.bobbin.model.relations.Relation;
import de.t14d3.bobbin.query.QueryBuilder;

import java.lang.invoke.MethodType;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base type of every persistent model.
 * <p>
 * A model is a schema-less attribute map bound to one row of its table. Columns are
 * whatever keys are set; accessors and mutators declared with
 * {@link de.t14d3.bobbin.annotations.Accessor} and {@link de.t14d3.bobbin.annotations.Mutator}
 * intercept reads and writes of single attributes. Relationships are declared as public
 * no-argument methods returning a {@link Relation}:
 *
 * <pre>
 * public class User extends Model {
 *     public HasMany&lt;Post&gt; posts() {
 *         return hasMany(Post.class);
 *     }
 * }
 * </pre>
 *
 * Subclasses need a parameterless constructor so that query results can be hydrated.
 * Instances are bound to a {@link ConnectionRegistry}, normally by creating them through
 * {@link de.t14d3.bobbin.core.EntityManager}; models hydrated from queries or reached through
 * relationships inherit the registry of the model they came from.
 */
public abstract class Model {
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    private final ModelMetadata metadata;
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final Map<String, Object> relations = new LinkedHashMap<>();
    private Map<String, Object> pivot = Collections.emptyMap();
    private String table;
    private String connection;
    private boolean exists;
    private ConnectionRegistry registry;

    protected Model() {
        this.metadata = ModelMetadata.of(getClass());
        this.table = metadata.getTableName();
        this.connection = metadata.getConnectionName();
    }

    /**
     * Fill the model with attributes, running mutators.
     */
    public Model fill(Map<String, ?> attributes) {
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            setAttribute(entry.getKey(), entry.getValue());
        }
        return this;
    }

    /**
     * Create a new instance of this model's type, sharing its registry and connection.
     */
    public Model newInstance(Map<String, ?> attributes) {
        Model model = metadata.newInstance();
        model.registry = registry;
        model.connection = connection;
        model.table = table;
        model.fill(attributes);
        return model;
    }

    public Model newInstance() {
        return newInstance(Map.of());
    }

    /**
     * Create an existing instance from a row returned by a query. Hooks are bypassed.
     */
    public Model newFromBuilder(Map<String, Object> row) {
        Model model = newInstance();
        model.setRawAttributes(row);
        model.exists = true;
        return model;
    }

    // ---------------------------------------------------------------------
    // Attributes
    // ---------------------------------------------------------------------

    /**
     * Get an attribute, passing the stored value through its accessor when one is registered.
     */
    public Object getAttribute(String key) {
        Object value = attributes.get(key);
        if (metadata.hasAccessor(key)) {
            return metadata.applyAccessor(this, key, value);
        }
        return value;
    }

    /**
     * Get an attribute converted to the given type.
     */
    @SuppressWarnings("unchecked")
    public <V> V getAttribute(String key, Class<V> type) {
        // int.class cannot cast its own boxed values
        Class<V> boxed = (Class<V>) MethodType.methodType(type).wrap().returnType();
        return boxed.cast(TypeMapper.convertToJavaType(getAttribute(key), type));
    }

    /**
     * Set an attribute, storing the result of its mutator when one is registered.
     */
    public void setAttribute(String key, Object value) {
        if (metadata.hasMutator(key)) {
            attributes.put(key, metadata.applyMutator(this, key, value));
            return;
        }
        attributes.put(key, value);
    }

    /**
     * Whether the attribute is present, even if its value is {@code null}.
     */
    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public void removeAttribute(String key) {
        attributes.remove(key);
    }

    /**
     * All raw attribute values, unmodifiable.
     */
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Replace every attribute without running mutators.
     */
    public void setRawAttributes(Map<String, Object> attributes) {
        this.attributes.clear();
        this.attributes.putAll(attributes);
    }

    // ---------------------------------------------------------------------
    // Identity & table
    // ---------------------------------------------------------------------

    public Object getKey() {
        return getAttribute(getKeyName());
    }

    public String getKeyName() {
        return metadata.getKeyName();
    }

    public String getQualifiedKeyName() {
        return getTable() + "." + getKeyName();
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    /**
     * The default foreign key other tables use to reference this model's type.
     */
    public String getForeignKey() {
        return NamingConventions.foreignKey(getClass());
    }

    /**
     * The join table for a many-to-many relationship with the given type.
     */
    public String joiningTable(Class<? extends Model> related) {
        return NamingConventions.joiningTable(getClass(), related);
    }

    public boolean exists() {
        return exists;
    }

    public void setExists(boolean exists) {
        this.exists = exists;
    }

    // ---------------------------------------------------------------------
    // Connection & queries
    // ---------------------------------------------------------------------

    public ConnectionRegistry getConnectionRegistry() {
        return registry;
    }

    public Model setConnectionRegistry(ConnectionRegistry registry) {
        this.registry = registry;
        return this;
    }

    /**
     * The connection override of this model, or {@code null} when it uses the default.
     */
    public String getConnectionName() {
        return connection;
    }

    public void setConnection(String name) {
        this.connection = name;
    }

    /**
     * The connection backing this model: its own connection if set, the registry default otherwise.
     */
    public DatabaseConnection getConnection() {
        if (registry == null) {
            throw new OrmException("Model " + getClass().getName()
                    + " is not bound to a connection registry; create it through an EntityManager");
        }
        return registry.connection(connection);
    }

    /**
     * A new query against this model's table whose results are hydrated into this model's type.
     */
    public Builder<? extends Model> newQuery() {
        return queryFor(this);
    }

    /**
     * A new query against a model's table, typed by the model.
     */
    public static <M extends Model> Builder<M> queryFor(M model) {
        DatabaseConnection conn = model.getConnection();
        QueryBuilder query = new QueryBuilder(conn, conn.getQueryGrammar(), conn.getPostProcessor());
        return new Builder<M>(query).setModel(model);
    }

    // ---------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------

    /**
     * Insert or update the model's row.
     * <p>
     * A new model is inserted with all of its attributes; the generated key is stored
     * under the key name and the model is marked as existing. An existing model is
     * updated by primary key.
     */
    public boolean save() {
        Builder<Model> query = queryFor(this);

        if (usesTimestamps()) {
            updateTimestamps();
        }

        if (exists) {
            query.where(getKeyName(), "=", getKey());
            query.update(attributes);
        } else {
            Map<String, Object> values = new LinkedHashMap<>(attributes);
            if (values.get(getKeyName()) == null) {
                values.remove(getKeyName());
            }
            Object id = query.insertGetId(values);
            if (id != null) {
                attributes.put(getKeyName(), id);
            }
            exists = true;
        }
        return true;
    }

    /**
     * Delete the model's row. Returns {@code false} when the model was never persisted.
     */
    public boolean delete() {
        if (!exists) {
            return false;
        }
        Builder<Model> query = queryFor(this);
        query.where(getKeyName(), "=", getKey());
        query.delete();
        exists = false;
        return true;
    }

    protected boolean usesTimestamps() {
        return metadata.usesTimestamps();
    }

    /**
     * Touch {@code updated_at}, and {@code created_at} with the same instant on a new model.
     */
    protected void updateTimestamps() {
        LocalDateTime now = freshTimestamp();
        setAttribute(UPDATED_AT, now);
        if (!exists) {
            setAttribute(CREATED_AT, now);
        }
    }

    protected LocalDateTime freshTimestamp() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
    }

    // ---------------------------------------------------------------------
    // Relationship definitions
    // ---------------------------------------------------------------------

    /**
     * Define a one-to-one relationship keyed by this model's default foreign key.
     */
    protected <T extends Model> HasOne<T> hasOne(Class<T> related) {
        return hasOne(related, getForeignKey());
    }

    protected <T extends Model> HasOne<T> hasOne(Class<T> related, String foreignKey) {
        T instance = newRelatedInstance(related);
        return new HasOne<>(queryFor(instance), this, foreignKey);
    }

    /**
     * Define a one-to-many relationship keyed by this model's default foreign key.
     */
    protected <T extends Model> HasMany<T> hasMany(Class<T> related) {
        return hasMany(related, getForeignKey());
    }

    protected <T extends Model> HasMany<T> hasMany(Class<T> related, String foreignKey) {
        T instance = newRelatedInstance(related);
        return new HasMany<>(queryFor(instance), this, foreignKey);
    }

    /**
     * Define an inverse one-to-one or one-to-many relationship whose foreign key, held by
     * this model, is the related type's default foreign key.
     */
    protected <T extends Model> BelongsTo<T> belongsTo(Class<T> related) {
        return belongsTo(related, NamingConventions.foreignKey(related));
    }

    /**
     * Define an inverse one-to-one or one-to-many relationship. The foreign key is the
     * column of this model that references the related model, e.g. {@code owner_id}.
     */
    protected <T extends Model> BelongsTo<T> belongsTo(Class<T> related, String foreignKey) {
        T instance = newRelatedInstance(related);
        return new BelongsTo<>(queryFor(instance), this, foreignKey);
    }

    protected <T extends Model> BelongsToMany<T> belongsToMany(Class<T> related) {
        return belongsToMany(related, null, null, null);
    }

    protected <T extends Model> BelongsToMany<T> belongsToMany(Class<T> related, String table) {
        return belongsToMany(related, table, null, null);
    }

    /**
     * Define a many-to-many relationship through a join table. Null arguments fall back to
     * the conventions: the join table of both types, this type's foreign key and the
     * related type's foreign key.
     */
    protected <T extends Model> BelongsToMany<T> belongsToMany(Class<T> related, String table,
                                                               String foreignKey, String otherKey) {
        T instance = newRelatedInstance(related);

        String joinTable = table != null ? table : joiningTable(related);
        String fk = foreignKey != null ? foreignKey : getForeignKey();
        String ok = otherKey != null ? otherKey : instance.getForeignKey();

        return new BelongsToMany<>(queryFor(instance), this, joinTable, fk, ok);
    }

    private <T extends Model> T newRelatedInstance(Class<T> related) {
        if (related == null) {
            throw new IllegalArgumentException("Related model type must not be null");
        }
        T instance = related.cast(ModelMetadata.of(related).newInstance());
        Model model = instance;
        model.registry = registry;
        if (model.connection == null) {
            model.connection = connection;
        }
        return instance;
    }

    // ---------------------------------------------------------------------
    // Loaded relationships
    // ---------------------------------------------------------------------

    /**
     * Invoke the relationship method with the given name.
     *
     * @throws de.t14d3.bobbin.exceptions.UnknownRelationException if there is no such method
     */
    public Relation<?> relation(String name) {
        return metadata.relation(this, name);
    }

    /**
     * The loaded value of a relationship, loading it on first access.
     */
    public Object getRelationValue(String name) {
        if (!relations.containsKey(name)) {
            relations.put(name, relation(name).getResults());
        }
        return relations.get(name);
    }

    /**
     * Eager load relationships onto this model.
     */
    public Model load(String... names) {
        Builder<Model> query = queryFor(this);
        query.with(names).eagerLoadRelations(List.of(this));
        return this;
    }

    public Object getRelation(String name) {
        return relations.get(name);
    }

    public void setRelation(String name, Object value) {
        relations.put(name, value);
    }

    public boolean relationLoaded(String name) {
        return relations.containsKey(name);
    }

    public Map<String, Object> getRelations() {
        return Collections.unmodifiableMap(relations);
    }

    /**
     * Join table columns of a model loaded through a many-to-many relationship.
     */
    public Map<String, Object> getPivot() {
        return pivot;
    }

    public void setPivot(Map<String, Object> pivot) {
        this.pivot = Collections.unmodifiableMap(new LinkedHashMap<>(pivot));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + attributes;
    }
}
