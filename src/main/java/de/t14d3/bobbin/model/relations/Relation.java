package de.t14d3.bobbin.model.relations;

import de.t14d3.bobbin.mapping.TypeMapper;
import de.t14d3.bobbin.model.Builder;
import de.t14d3.bobbin.model.Model;
import de.t14d3.bobbin.query.QueryBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * A relationship between an owning model and a related model type.
 * <p>
 * A relation is a deferred query on the related type, already constrained to the rows
 * that belong to its owner, and at the same time the strategy used to eager load the
 * relationship for a whole batch of owners:
 * {@link #addEagerConstraints}, {@link #initRelation} and {@link #match}.
 *
 * @param <T> the related model type
 */
public abstract class Relation<T extends Model> {
    private static final ThreadLocal<Boolean> CONSTRAINTS = ThreadLocal.withInitial(() -> Boolean.TRUE);

    protected final Builder<T> query;
    protected final Model parent;
    protected final T related;
    private QueryBuilder constraints;

    protected Relation(Builder<T> query, Model parent) {
        this.query = query;
        this.parent = parent;
        this.related = query.getModel();
    }

    /**
     * Build relations without their owner constraint, as needed when the owner is a batch
     * of models rather than a single instance.
     */
    public static <R> R noConstraints(Supplier<R> callback) {
        boolean previous = CONSTRAINTS.get();
        CONSTRAINTS.set(Boolean.FALSE);
        try {
            return callback.get();
        } finally {
            CONSTRAINTS.set(previous);
        }
    }

    protected static boolean constraintsEnabled() {
        return CONSTRAINTS.get();
    }

    /**
     * Constrain the query to the rows related to the owning model.
     */
    public abstract void addConstraints();

    /**
     * Constrain the query to the rows related to any of the given owners.
     */
    public abstract void addEagerConstraints(List<? extends Model> models);

    /**
     * Give every owner the empty value of this relationship.
     */
    public abstract void initRelation(List<? extends Model> models, String relation);

    /**
     * Distribute eagerly loaded results onto their owners.
     */
    public abstract void match(List<? extends Model> models, List<T> results, String relation);

    /**
     * The value of the relationship for the owning model.
     */
    public abstract Object getResults();

    /**
     * Run the eager query for a batch of owners.
     */
    public List<T> getEager() {
        return get();
    }

    public List<T> get(String... columns) {
        return query.get(columns);
    }

    public T first(String... columns) {
        query.take(1);
        List<T> results = get(columns);
        return results.isEmpty() ? null : results.get(0);
    }

    public T find(Object id, String... columns) {
        query.where(related.getQualifiedKeyName(), "=", id);
        return first(columns);
    }

    public Relation<T> where(String column, String operator, Object value) {
        constraints().where(column, operator, value);
        return this;
    }

    public Relation<T> where(String column, Object value) {
        constraints().where(column, value);
        return this;
    }

    public Relation<T> orWhere(String column, String operator, Object value) {
        constraints().orWhere(column, operator, value);
        return this;
    }

    public Relation<T> whereIn(String column, Collection<?> values) {
        constraints().whereIn(column, values);
        return this;
    }

    /**
     * The group holding caller constraints. It is joined to the owner constraint with
     * {@code AND}, so an {@code orWhere} never reaches rows of another owner.
     */
    private QueryBuilder constraints() {
        if (constraints == null) {
            constraints = query.getQuery().newQuery();
            query.getQuery().whereNested(constraints);
        }
        return constraints;
    }

    public Relation<T> orderBy(String column, String direction) {
        query.orderBy(column, direction);
        return this;
    }

    public Relation<T> with(String... relations) {
        query.with(relations);
        return this;
    }

    public String toSql() {
        return query.toSql();
    }

    public Builder<T> getQuery() {
        return query;
    }

    public QueryBuilder getBaseQuery() {
        return query.getQuery();
    }

    public Model getParent() {
        return parent;
    }

    public T getRelated() {
        return related;
    }

    /**
     * The distinct, non-null values of an attribute across the given models.
     */
    protected List<Object> getKeys(List<? extends Model> models, String key) {
        Map<Object, Object> keys = new LinkedHashMap<>();
        for (Model model : models) {
            Object value = model.getAttributes().get(key);
            if (value != null) {
                keys.putIfAbsent(TypeMapper.normalizeKey(value), value);
            }
        }
        return new ArrayList<>(keys.values());
    }

    /**
     * Dictionary key under which a key value is matched, so that keys read from columns of
     * different integral types compare equal.
     */
    protected static Object dictionaryKey(Object value) {
        return TypeMapper.normalizeKey(value);
    }
}
