package de.t14d3.bobbin.test.entities;

import de.t14d3.bobbin.annotations.Table;
import de.t14d3.bobbin.model.Model;
import de.t14d3.bobbin.model.relations.BelongsTo;

@Table(name = "profiles", timestamps = false)
public class Profile extends Model {

    public BelongsTo<User> user() {
        return belongsTo(User.class);
    }
}
