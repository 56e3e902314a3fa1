package de.t14d3.bobbin.model.relations;

import de.t14d3.bobbin.model.Builder;
import de.t14d3.bobbin.model.Model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relationships where the related table holds a foreign key to the owner's primary key.
 */
public abstract class HasOneOrMany<T extends Model> extends Relation<T> {
    protected final String foreignKey;

    protected HasOneOrMany(Builder<T> query, Model parent, String foreignKey) {
        super(query, parent);
        this.foreignKey = foreignKey;

        if (constraintsEnabled()) {
            addConstraints();
        }
    }

    @Override
    public void addConstraints() {
        query.where(getQualifiedForeignKey(), "=", parent.getKey());
    }

    @Override
    public void addEagerConstraints(List<? extends Model> models) {
        query.whereIn(getQualifiedForeignKey(), getKeys(models, parent.getKeyName()));
    }

    protected void matchOne(List<? extends Model> models, List<T> results, String relation) {
        Map<Object, List<T>> dictionary = buildDictionary(results);
        for (Model model : models) {
            List<T> matches = dictionary.get(dictionaryKey(model.getAttributes().get(model.getKeyName())));
            if (matches != null) {
                model.setRelation(relation, matches.get(0));
            }
        }
    }

    protected void matchMany(List<? extends Model> models, List<T> results, String relation) {
        Map<Object, List<T>> dictionary = buildDictionary(results);
        for (Model model : models) {
            List<T> matches = dictionary.get(dictionaryKey(model.getAttributes().get(model.getKeyName())));
            if (matches != null) {
                model.setRelation(relation, new ArrayList<>(matches));
            }
        }
    }

    /**
     * Group results by the value of their foreign key.
     */
    private Map<Object, List<T>> buildDictionary(List<T> results) {
        Map<Object, List<T>> dictionary = new LinkedHashMap<>();
        for (T result : results) {
            Object key = result.getAttributes().get(foreignKey);
            if (key != null) {
                dictionary.computeIfAbsent(dictionaryKey(key), k -> new ArrayList<>()).add(result);
            }
        }
        return dictionary;
    }

    /**
     * Point a related model at the owner and save it.
     */
    public T save(T model) {
        model.setAttribute(foreignKey, parent.getKey());
        model.save();
        return model;
    }

    /**
     * Create and save a related model pointing at the owner.
     */
    @SuppressWarnings("unchecked")
    public T create(Map<String, ?> attributes) {
        T instance = (T) related.newInstance(attributes);
        return save(instance);
    }

    public String getForeignKey() {
        return foreignKey;
    }

    public String getQualifiedForeignKey() {
        return related.getTable() + "." + foreignKey;
    }
}
