package de.t14d3.bobbin.model.relations;

import de.t14d3.bobbin.model.Builder;
import de.t14d3.bobbin.model.Model;

import java.util.ArrayList;
import java.util.List;

/**
 * One-to-many relationship: any number of related rows carry the owner's key.
 */
public class HasMany<T extends Model> extends HasOneOrMany<T> {

    public HasMany(Builder<T> query, Model parent, String foreignKey) {
        super(query, parent, foreignKey);
    }

    @Override
    public List<T> getResults() {
        return get();
    }

    @Override
    public void initRelation(List<? extends Model> models, String relation) {
        for (Model model : models) {
            model.setRelation(relation, new ArrayList<T>());
        }
    }

    @Override
    public void match(List<? extends Model> models, List<T> results, String relation) {
        matchMany(models, results, relation);
    }
}
