package de.t14d3.bobbin.model;

import de.t14d3.bobbin.model.relations.Relation;
import de.t14d3.bobbin.query.QueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Model level query: a {@link QueryBuilder} whose rows are hydrated into instances of
 * one model type, plus the relationships to eager load onto them.
 *
 * @param <T> the model type results are hydrated into
 */
public class Builder<T extends Model> {
    private static final Logger log = LoggerFactory.getLogger(Builder.class);
    private static final Consumer<Relation<?>> NO_CONSTRAINTS = relation -> { };

    private final QueryBuilder query;
    private T model;
    private final Map<String, Consumer<Relation<?>>> eagerLoad = new LinkedHashMap<>();

    public Builder(QueryBuilder query) {
        this.query = query;
    }

    /**
     * Bind the hydration target. The query is pointed at the model's table.
     */
    public Builder<T> setModel(T model) {
        this.model = model;
        query.from(model.getTable());
        return this;
    }

    public T getModel() {
        return model;
    }

    public QueryBuilder getQuery() {
        return query;
    }

    // ---------------------------------------------------------------------
    // Constraints
    // ---------------------------------------------------------------------

    public Builder<T> where(String column, String operator, Object value) {
        query.where(column, operator, value);
        return this;
    }

    public Builder<T> where(String column, Object value) {
        query.where(column, value);
        return this;
    }

    public Builder<T> orWhere(String column, String operator, Object value) {
        query.orWhere(column, operator, value);
        return this;
    }

    public Builder<T> whereIn(String column, Collection<?> values) {
        query.whereIn(column, values);
        return this;
    }

    public Builder<T> whereNull(String column) {
        query.whereNull(column);
        return this;
    }

    public Builder<T> orderBy(String column, String direction) {
        query.orderBy(column, direction);
        return this;
    }

    public Builder<T> take(int value) {
        query.take(value);
        return this;
    }

    public Builder<T> skip(int value) {
        query.skip(value);
        return this;
    }

    // ---------------------------------------------------------------------
    // Retrieval
    // ---------------------------------------------------------------------

    /**
     * Find a model by its primary key, or {@code null}.
     */
    public T find(Object id, String... columns) {
        query.where(model.getQualifiedKeyName(), "=", id);
        return first(columns);
    }

    public T first(String... columns) {
        List<T> models = take(1).get(columns);
        return models.isEmpty() ? null : models.get(0);
    }

    /**
     * Execute the query, hydrate the rows and eager load the requested relationships.
     */
    public List<T> get(String... columns) {
        List<T> models = getModels(columns);
        if (!models.isEmpty()) {
            eagerLoadRelations(models);
        }
        return models;
    }

    /**
     * Execute the query and hydrate the rows without eager loading.
     */
    @SuppressWarnings("unchecked")
    public List<T> getModels(String... columns) {
        List<Map<String, Object>> rows = query.get(columns);
        List<T> models = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            models.add((T) model.newFromBuilder(row));
        }
        return models;
    }

    // ---------------------------------------------------------------------
    // Eager loading
    // ---------------------------------------------------------------------

    /**
     * Request relationships to be loaded with the results. Dotted names load nested
     * relationships: {@code posts.comments} loads the posts and their comments.
     */
    public Builder<T> with(String... relations) {
        for (String name : relations) {
            with(name, NO_CONSTRAINTS);
        }
        return this;
    }

    /**
     * Request a relationship with an additional constraint on its eager query.
     */
    public Builder<T> with(String relation, Consumer<Relation<?>> constraints) {
        String progress = null;
        // Every parent segment of a nested name is loaded as well
        for (String segment : relation.split("\\.")) {
            progress = progress == null ? segment : progress + "." + segment;
            if (!progress.equals(relation)) {
                eagerLoad.putIfAbsent(progress, NO_CONSTRAINTS);
            }
        }
        eagerLoad.put(relation, constraints);
        return this;
    }

    public Builder<T> with(Map<String, Consumer<Relation<?>>> relations) {
        for (Map.Entry<String, Consumer<Relation<?>>> entry : relations.entrySet()) {
            with(entry.getKey(), entry.getValue());
        }
        return this;
    }

    public Map<String, Consumer<Relation<?>>> getEagerLoads() {
        return Collections.unmodifiableMap(eagerLoad);
    }

    /**
     * Load every requested top level relationship onto the given models.
     */
    public List<T> eagerLoadRelations(List<T> models) {
        for (Map.Entry<String, Consumer<Relation<?>>> entry : eagerLoad.entrySet()) {
            if (!entry.getKey().contains(".")) {
                loadRelation(models, entry.getKey(), entry.getValue());
            }
        }
        return models;
    }

    /**
     * One query for the whole batch: constrain the relation to the keys of all models,
     * then distribute the results back onto their owners.
     */
    protected void loadRelation(List<T> models, String name, Consumer<Relation<?>> constraints) {
        Relation<?> relation = getRelation(name);
        log.debug("Eager loading [{}] for {} {} model(s)", name, models.size(), model.getClass().getSimpleName());

        relation.addEagerConstraints(models);
        constraints.accept(relation);
        relation.initRelation(models, name);
        matchEager(relation, models, name);
    }

    private <R extends Model> void matchEager(Relation<R> relation, List<T> models, String name) {
        relation.match(models, relation.getEager(), name);
    }

    /**
     * The unconstrained relation for a name, with its nested eager loads applied.
     */
    public Relation<?> getRelation(String name) {
        Relation<?> relation = Relation.noConstraints(() -> model.newInstance().relation(name));

        Map<String, Consumer<Relation<?>>> nested = nestedRelations(name);
        if (!nested.isEmpty()) {
            relation.getQuery().with(nested);
        }
        return relation;
    }

    private Map<String, Consumer<Relation<?>>> nestedRelations(String relation) {
        Map<String, Consumer<Relation<?>>> nested = new LinkedHashMap<>();
        String prefix = relation + ".";
        for (Map.Entry<String, Consumer<Relation<?>>> entry : eagerLoad.entrySet()) {
            if (entry.getKey().startsWith(prefix)) {
                nested.put(entry.getKey().substring(prefix.length()), entry.getValue());
            }
        }
        return nested;
    }

    // ---------------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------------

    public Object insertGetId(Map<String, Object> values) {
        return query.insertGetId(values);
    }

    public int update(Map<String, Object> values) {
        return query.update(values);
    }

    public int delete() {
        return query.delete();
    }

    public String toSql() {
        return query.toSql();
    }
}
