package de.t14d3.bobbin.model.relations;

import de.t14d3.bobbin.model.Builder;
import de.t14d3.bobbin.model.Model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inverse of a one-to-one or one-to-many relationship: the owning model holds a
 * foreign key referencing the related model's primary key.
 */
public class BelongsTo<T extends Model> extends Relation<T> {
    protected final String foreignKey;

    public BelongsTo(Builder<T> query, Model parent, String foreignKey) {
        super(query, parent);
        this.foreignKey = foreignKey;

        if (constraintsEnabled()) {
            addConstraints();
        }
    }

    @Override
    public T getResults() {
        return first();
    }

    @Override
    public void addConstraints() {
        query.where(related.getQualifiedKeyName(), "=", parent.getAttribute(foreignKey));
    }

    @Override
    public void addEagerConstraints(List<? extends Model> models) {
        query.whereIn(related.getQualifiedKeyName(), getKeys(models, foreignKey));
    }

    @Override
    public void initRelation(List<? extends Model> models, String relation) {
        for (Model model : models) {
            model.setRelation(relation, null);
        }
    }

    @Override
    public void match(List<? extends Model> models, List<T> results, String relation) {
        Map<Object, T> dictionary = new HashMap<>();
        for (T result : results) {
            dictionary.putIfAbsent(dictionaryKey(result.getAttributes().get(related.getKeyName())), result);
        }

        for (Model model : models) {
            Object key = model.getAttributes().get(foreignKey);
            if (key != null && dictionary.containsKey(dictionaryKey(key))) {
                model.setRelation(relation, dictionary.get(dictionaryKey(key)));
            }
        }
    }

    /**
     * Point the owning model at the given related model. The owner is not saved.
     */
    public Model associate(T model) {
        parent.setAttribute(foreignKey, model.getKey());
        return parent;
    }

    /**
     * Clear the owning model's foreign key. The owner is not saved.
     */
    public Model dissociate() {
        parent.setAttribute(foreignKey, null);
        return parent;
    }

    public String getForeignKey() {
        return foreignKey;
    }
}
