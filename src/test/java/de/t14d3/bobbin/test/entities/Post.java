package de.t14d3.bobbin.test.entities;

import de.t14d3.bobbin.annotations.Table;
import de.t14d3.bobbin.model.Model;
import de.t14d3.bobbin.model.relations.BelongsTo;
import de.t14d3.bobbin.model.relations.HasMany;

@Table(name = "posts")
public class Post extends Model {

    public BelongsTo<User> author() {
        return belongsTo(User.class, "user_id");
    }

    public HasMany<Comment> comments() {
        return hasMany(Comment.class);
    }
}
