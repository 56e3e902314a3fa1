package de.t14d3.bobbin.test;

import de.t14d3.bobbin.core.EntityManager;
import de.t14d3.bobbin.exceptions.InvalidRelatedTypeException;
import de.t14d3.bobbin.exceptions.UnknownRelationException;
import de.t14d3.bobbin.model.Model;
import de.t14d3.bobbin.model.relations.BelongsTo;
import de.t14d3.bobbin.model.relations.BelongsToMany;
import de.t14d3.bobbin.model.relations.HasMany;
import de.t14d3.bobbin.model.relations.HasOne;
import de.t14d3.bobbin.query.WhereClause;
import de.t14d3.bobbin.test.entities.Comment;
import de.t14d3.bobbin.test.entities.Post;
import de.t14d3.bobbin.test.entities.Profile;
import de.t14d3.bobbin.test.entities.Role;
import de.t14d3.bobbin.test.entities.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RelationshipTest {
    private EntityManager em;

    abstract static class Attachment extends Model {
    }

    static class Ticket extends Model {
        public HasMany<Attachment> attachments() {
            return hasMany(Attachment.class);
        }
    }

    @BeforeEach
    void setup() {
        em = EntityManager.create(TestSchema.url("relationship_test"));
        TestSchema.create(em.getConnections().getDefault());
    }

    @AfterEach
    void teardown() {
        if (em != null) {
            em.close();
        }
    }

    @Test
    void testHasManyIsConstrainedToOwner() {
        User user = em.create(User.class, Map.of("name", "alice"));
        HasMany<Post> posts = user.posts();

        List<WhereClause> wheres = posts.getBaseQuery().getWheres();
        assertEquals(1, wheres.size(), "Exactly one owner constraint");
        assertEquals("posts.user_id", wheres.get(0).column());
        assertEquals("=", wheres.get(0).operator());
        assertEquals(user.getKey(), wheres.get(0).value());
        assertEquals("posts", posts.getBaseQuery().getTable());
        assertEquals("user_id", posts.getForeignKey());
    }

    @Test
    void testHasManyResults() {
        User alice = em.create(User.class, Map.of("name", "alice"));
        User bob = em.create(User.class, Map.of("name", "bob"));
        alice.posts().create(Map.of("title", "first"));
        alice.posts().create(Map.of("title", "second"));
        bob.posts().create(Map.of("title", "other"));

        List<Post> posts = alice.posts().orderBy("title", "asc").get();
        assertEquals(2, posts.size());
        assertEquals("first", posts.get(0).getAttribute("title"));
        assertEquals(alice.getKey(), posts.get(0).getAttribute("user_id", Long.class));
        assertSame(em.getConnections(), posts.get(0).getConnectionRegistry());

        assertEquals(1, alice.posts().where("title", "second").get().size());
        assertTrue(em.create(User.class, Map.of("name", "carol")).posts().get().isEmpty());
    }

    @Test
    void testHasOne() {
        User user = em.create(User.class, Map.of("name", "alice"));
        assertNull(user.profile().getResults());

        HasOne<Profile> profile = user.profile();
        Profile saved = profile.create(Map.of("bio", "hi"));
        assertTrue(saved.exists());
        assertEquals(user.getKey(), saved.getAttribute("user_id"));

        Profile loaded = user.profile().getResults();
        assertEquals("hi", loaded.getAttribute("bio"));
    }

    @Test
    void testBelongsTo() {
        User user = em.create(User.class, Map.of("name", "alice"));
        Post post = user.posts().create(Map.of("title", "hello"));

        BelongsTo<User> author = post.author();
        assertEquals("user_id", author.getForeignKey());
        User loaded = author.getResults();
        assertNotNull(loaded);
        assertEquals("alice", loaded.getAttribute("name"));

        Post orphan = em.create(Post.class, Map.of("title", "nobody"));
        assertNull(orphan.author().getResults());
    }

    @Test
    void testBelongsToDefaultForeignKey() {
        Profile profile = em.make(Profile.class);
        assertEquals("user_id", profile.user().getForeignKey());

        Comment comment = em.make(Comment.class);
        assertEquals("post_id", comment.post().getForeignKey());
    }

    @Test
    void testAssociateAndDissociate() {
        User user = em.create(User.class, Map.of("name", "alice"));
        Post post = em.create(Post.class, Map.of("title", "hello"));

        post.author().associate(user);
        assertEquals(user.getKey(), post.getAttribute("user_id"));
        post.save();
        assertEquals("alice", em.find(Post.class, post.getKey()).author().getResults().getAttribute("name"));

        post.author().dissociate();
        assertTrue(post.hasAttribute("user_id"));
        assertNull(post.getAttribute("user_id"));
    }

    @Test
    void testBelongsToManyWithPivot() {
        User user = em.create(User.class, Map.of("name", "alice"));
        Role admin = em.create(Role.class, Map.of("name", "admin"));
        Role editor = em.create(Role.class, Map.of("name", "editor"));
        em.create(Role.class, Map.of("name", "viewer"));

        BelongsToMany<Role> roles = user.roles();
        assertEquals("role_user", roles.getTable());
        assertEquals("user_id", roles.getForeignKey());
        assertEquals("role_id", roles.getOtherKey());

        roles.attach(admin.getKey());
        roles.attach(editor.getKey());

        List<Role> loaded = user.roles().orderBy("roles.name", "asc").get();
        assertEquals(2, loaded.size());
        Role first = loaded.get(0);
        assertEquals("admin", first.getAttribute("name"));
        assertFalse(first.hasAttribute("pivot_user_id"), "Join columns are moved out of the attributes");
        assertEquals(user.getKey(), first.getPivot().get("user_id"));
        assertEquals(admin.getKey(), first.getPivot().get("role_id"));

        List<User> users = admin.users().get();
        assertEquals(1, users.size());
        assertEquals("alice", users.get(0).getAttribute("name"));
    }

    @Test
    void testDetach() {
        User user = em.create(User.class, Map.of("name", "alice"));
        Role admin = em.create(Role.class, Map.of("name", "admin"));
        Role editor = em.create(Role.class, Map.of("name", "editor"));
        user.roles().attach(admin.getKey());
        user.roles().attach(editor.getKey());

        assertEquals(1, user.roles().detach(admin.getKey()));
        assertEquals(List.of("editor"), user.roles().get().stream().map(r -> r.getAttribute("name")).toList());

        assertEquals(1, user.roles().detach());
        assertTrue(user.roles().get().isEmpty());
    }

    @Test
    void testRelationValueIsCached() {
        User user = em.create(User.class, Map.of("name", "alice"));
        user.posts().create(Map.of("title", "hello"));

        assertFalse(user.relationLoaded("posts"));
        Object first = user.getRelationValue("posts");
        assertTrue(user.relationLoaded("posts"));
        assertEquals(1, ((List<?>) first).size());

        user.posts().create(Map.of("title", "again"));
        assertSame(first, user.getRelationValue("posts"), "A loaded relation is not queried again");
    }

    @Test
    void testRelationFind() {
        User user = em.create(User.class, Map.of("name", "alice"));
        Post post = user.posts().create(Map.of("title", "mine"));
        Post foreign = em.create(Post.class, Map.of("title", "not mine"));

        assertNotNull(user.posts().find(post.getKey()));
        assertNull(user.posts().find(foreign.getKey()));
    }

    @Test
    void testUnknownRelation() {
        User user = em.create(User.class, Map.of("name", "alice"));
        UnknownRelationException ex = assertThrows(UnknownRelationException.class, () -> user.relation("friends"));
        assertEquals("friends", ex.getRelationName());
        assertTrue(ex.getMessage().contains("friends"));
        assertThrows(UnknownRelationException.class, () -> user.getRelationValue("friends"));
    }

    @Test
    void testAbstractRelatedType() {
        Ticket ticket = em.make(Ticket.class);
        assertThrows(InvalidRelatedTypeException.class, ticket::attachments);
    }

    @Test
    void testOrWhereStaysWithinOwner() {
        User alice = em.create(User.class, Map.of("name", "alice"));
        User bob = em.create(User.class, Map.of("name", "bob"));
        alice.posts().create(Map.of("title", "a1"));
        bob.posts().create(Map.of("title", "b1"));

        HasMany<Post> posts = alice.posts();
        posts.where("title", "a1").orWhere("title", "=", "b1");
        assertTrue(posts.toSql().contains("\"posts\".\"user_id\" = ? AND (\"title\" = ? OR \"title\" = ?)"),
                posts.toSql());

        List<Post> found = posts.get();
        assertEquals(1, found.size(), "Bob's post must not leak into Alice's posts");
        assertEquals("a1", found.get(0).getAttribute("title"));
        assertEquals(alice.getKey(), found.get(0).getAttribute("user_id", Long.class));
    }
}
