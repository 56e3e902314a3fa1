package de.t14d3.bobbin.model.relations;

import de.t14d3.bobbin.model.Builder;
import de.t14d3.bobbin.model.Model;

import java.util.List;

/**
 * One-to-one relationship: at most one related row carries the owner's key.
 */
public class HasOne<T extends Model> extends HasOneOrMany<T> {

    public HasOne(Builder<T> query, Model parent, String foreignKey) {
        super(query, parent, foreignKey);
    }

    @Override
    public T getResults() {
        return first();
    }

    @Override
    public void initRelation(List<? extends Model> models, String relation) {
        for (Model model : models) {
            model.setRelation(relation, null);
        }
    }

    @Override
    public void match(List<? extends Model> models, List<T> results, String relation) {
        matchOne(models, results, relation);
    }
}
