package de.t14d3.bobbin.model.relations;

import de.t14d3.bobbin.model.Builder;
import de.t14d3.bobbin.model.Model;
import de.t14d3.bobbin.query.QueryBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Many-to-many relationship through a join table holding one foreign key to each side.
 * <p>
 * Related models are loaded with an inner join on the join table. The join table's
 * two key columns are selected along with the related row and exposed through
 * {@link Model#getPivot()}.
 */
public class BelongsToMany<T extends Model> extends Relation<T> {
    static final String PIVOT_PREFIX = "pivot_";

    protected final String table;
    protected final String foreignKey;
    protected final String otherKey;

    public BelongsToMany(Builder<T> query, Model parent, String table, String foreignKey, String otherKey) {
        super(query, parent);
        this.table = table;
        this.foreignKey = foreignKey;
        this.otherKey = otherKey;

        // The join is needed for eager queries too; only the owner constraint is optional
        setJoin();
        if (constraintsEnabled()) {
            addConstraints();
        }
    }

    @Override
    public List<T> getResults() {
        return get();
    }

    @Override
    public void addConstraints() {
        query.where(table + "." + foreignKey, "=", parent.getKey());
    }

    protected void setJoin() {
        query.getQuery().join(table, related.getQualifiedKeyName(), "=", table + "." + otherKey);
    }

    /**
     * Select the related columns plus the join table keys, then move the join table
     * values from the attributes into each model's pivot.
     */
    @Override
    public List<T> get(String... columns) {
        List<String> select = new ArrayList<>();
        if (columns.length == 0) {
            select.add(related.getTable() + ".*");
        } else {
            select.addAll(Arrays.asList(columns));
        }
        select.add(table + "." + foreignKey + " as " + PIVOT_PREFIX + foreignKey);
        select.add(table + "." + otherKey + " as " + PIVOT_PREFIX + otherKey);

        List<T> models = query.get(select.toArray(new String[0]));
        hydratePivotRelation(models);
        return models;
    }

    protected void hydratePivotRelation(List<T> models) {
        for (T model : models) {
            Map<String, Object> attributes = new LinkedHashMap<>(model.getAttributes());
            Map<String, Object> pivot = new LinkedHashMap<>();
            Iterator<Map.Entry<String, Object>> it = attributes.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Object> entry = it.next();
                if (entry.getKey().startsWith(PIVOT_PREFIX)) {
                    pivot.put(entry.getKey().substring(PIVOT_PREFIX.length()), entry.getValue());
                    it.remove();
                }
            }
            model.setRawAttributes(attributes);
            model.setPivot(pivot);
        }
    }

    @Override
    public void addEagerConstraints(List<? extends Model> models) {
        query.whereIn(table + "." + foreignKey, getKeys(models, parent.getKeyName()));
    }

    @Override
    public void initRelation(List<? extends Model> models, String relation) {
        for (Model model : models) {
            model.setRelation(relation, new ArrayList<T>());
        }
    }

    @Override
    public void match(List<? extends Model> models, List<T> results, String relation) {
        Map<Object, List<T>> dictionary = new LinkedHashMap<>();
        for (T result : results) {
            Object key = result.getPivot().get(foreignKey);
            if (key != null) {
                dictionary.computeIfAbsent(dictionaryKey(key), k -> new ArrayList<>()).add(result);
            }
        }

        for (Model model : models) {
            List<T> matches = dictionary.get(dictionaryKey(model.getAttributes().get(model.getKeyName())));
            if (matches != null) {
                model.setRelation(relation, new ArrayList<>(matches));
            }
        }
    }

    /**
     * Insert a join table row linking the owner to the related model with the given key.
     */
    public void attach(Object id) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(foreignKey, parent.getKey());
        record.put(otherKey, id);
        newPivotQuery().insert(record);
    }

    /**
     * Delete join table rows of the owner; all of them when no keys are given.
     *
     * @return the number of join rows removed
     */
    public int detach(Object... ids) {
        QueryBuilder pivot = newPivotQuery().where(foreignKey, "=", parent.getKey());
        if (ids.length > 0) {
            pivot.whereIn(otherKey, Arrays.asList(ids));
        }
        return pivot.delete();
    }

    protected QueryBuilder newPivotQuery() {
        return query.getQuery().newQuery().from(table);
    }

    public String getTable() {
        return table;
    }

    public String getForeignKey() {
        return foreignKey;
    }

    public String getOtherKey() {
        return otherKey;
    }
}
