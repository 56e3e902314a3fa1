package de.t14d3.bobbin.test;

import de.t14d3.bobbin.connection.ConnectionRegistry;
import de.t14d3.bobbin.connection.JdbcConnection;
import de.t14d3.bobbin.core.EntityManager;
import de.t14d3.bobbin.exceptions.UnknownRelationException;
import de.t14d3.bobbin.model.Builder;
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
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Eager loading issues one query per relationship for a whole batch of owners.
 */
public class EagerLoadingTest {
    private EntityManager em;
    private RecordingConnection recorder;

    private User alice;
    private User bob;
    private User carol;

    @BeforeEach
    void setup() {
        recorder = new RecordingConnection(JdbcConnection.open(TestSchema.url("eager_loading_test")));
        ConnectionRegistry registry = new ConnectionRegistry();
        registry.register("default", recorder);
        em = new EntityManager(registry);
        TestSchema.create(recorder);

        alice = em.create(User.class, Map.of("name", "alice"));
        bob = em.create(User.class, Map.of("name", "bob"));
        carol = em.create(User.class, Map.of("name", "carol"));
    }

    @AfterEach
    void teardown() {
        if (em != null) {
            em.close();
        }
    }

    @SuppressWarnings("unchecked")
    private static <R> List<R> many(Object value) {
        return (List<R>) value;
    }

    @Test
    void testHasManyUsesOneQueryForAllOwners() {
        alice.posts().create(Map.of("title", "a1"));
        alice.posts().create(Map.of("title", "a2"));
        bob.posts().create(Map.of("title", "b1"));
        recorder.reset();

        List<User> users = em.with(User.class, "posts").orderBy("name", "asc").get();

        assertEquals(2, recorder.getSelects().size(), "One query for the owners, one for the relation");
        assertTrue(recorder.getSelects().get(1).contains("\"posts\".\"user_id\" IN (?, ?, ?)"),
                recorder.getSelects().get(1));
        assertEquals(List.of(alice.getKey(), bob.getKey(), carol.getKey()), recorder.getSelectBindings().get(1));

        assertEquals(2, many(users.get(0).getRelation("posts")).size());
        assertEquals(1, many(users.get(1).getRelation("posts")).size());
        assertTrue(users.get(2).relationLoaded("posts"));
        assertEquals(List.of(), users.get(2).getRelation("posts"), "Owners without matches get an empty list");
    }

    @Test
    void testNoRelationQueryWhenOwnersAreEmpty() {
        recorder.reset();
        List<User> users = em.with(User.class, "posts").where("name", "nobody").get();

        assertTrue(users.isEmpty());
        assertEquals(1, recorder.getSelects().size());
    }

    @Test
    void testNestedRelations() {
        Post a1 = alice.posts().create(Map.of("title", "a1"));
        Post a2 = alice.posts().create(Map.of("title", "a2"));
        a1.comments().create(Map.of("body", "nice"));
        a1.comments().create(Map.of("body", "great"));
        recorder.reset();

        Builder<User> query = em.with(User.class, "posts.comments");
        assertEquals(Set.of("posts", "posts.comments"), query.getEagerLoads().keySet());

        List<User> users = query.where("name", "alice").get();
        assertEquals(3, recorder.getSelects().size(), "Owners, posts and comments");

        List<Post> posts = many(users.get(0).getRelation("posts"));
        assertEquals(2, posts.size());
        for (Post post : posts) {
            List<Comment> comments = many(post.getRelation("comments"));
            if (post.getKey().equals(a1.getKey())) {
                assertEquals(2, comments.size());
            } else {
                assertEquals(a2.getKey(), post.getKey());
                assertTrue(comments.isEmpty());
            }
        }
    }

    @Test
    void testConstrainedEagerLoad() {
        alice.posts().create(Map.of("title", "apple"));
        alice.posts().create(Map.of("title", "banana"));
        recorder.reset();

        List<User> users = em.query(User.class)
                .with("posts", relation -> relation.where("title", "like", "a%"))
                .where("name", "alice")
                .get();

        List<Post> posts = many(users.get(0).getRelation("posts"));
        assertEquals(1, posts.size());
        assertEquals("apple", posts.get(0).getAttribute("title"));
        assertTrue(recorder.getSelectBindings().get(1).contains("a%"));
    }

    @Test
    void testBelongsToEagerLoadUsesDistinctForeignKeys() {
        alice.posts().create(Map.of("title", "a1"));
        alice.posts().create(Map.of("title", "a2"));
        bob.posts().create(Map.of("title", "b1"));
        em.create(Post.class, Map.of("title", "orphan"));
        recorder.reset();

        List<Post> posts = em.with(Post.class, "author").orderBy("id", "asc").get();

        assertEquals(2, recorder.getSelects().size());
        assertEquals(2, recorder.getSelectBindings().get(1).size(), "Each author key is queried once");

        assertEquals("alice", ((User) posts.get(0).getRelation("author")).getAttribute("name"));
        assertEquals("alice", ((User) posts.get(1).getRelation("author")).getAttribute("name"));
        assertEquals("bob", ((User) posts.get(2).getRelation("author")).getAttribute("name"));
        assertTrue(posts.get(3).relationLoaded("author"));
        assertNull(posts.get(3).getRelation("author"));
    }

    @Test
    void testHasOneEagerLoad() {
        bob.profile().create(Map.of("bio", "bob's bio"));
        recorder.reset();

        List<User> users = em.with(User.class, "profile").orderBy("name", "asc").get();

        assertEquals(2, recorder.getSelects().size());
        assertNull(users.get(0).getRelation("profile"));
        assertEquals("bob's bio", ((Profile) users.get(1).getRelation("profile")).getAttribute("bio"));
        assertTrue(users.get(2).relationLoaded("profile"));
    }

    @Test
    void testBelongsToManyEagerLoad() {
        Role admin = em.create(Role.class, Map.of("name", "admin"));
        Role editor = em.create(Role.class, Map.of("name", "editor"));
        alice.roles().attach(admin.getKey());
        alice.roles().attach(editor.getKey());
        bob.roles().attach(editor.getKey());
        recorder.reset();

        List<User> users = em.with(User.class, "roles").orderBy("name", "asc").get();

        assertEquals(2, recorder.getSelects().size());
        assertTrue(recorder.getSelects().get(1).contains("INNER JOIN \"role_user\""));

        List<Role> aliceRoles = many(users.get(0).getRelation("roles"));
        assertEquals(2, aliceRoles.size());
        assertEquals(alice.getKey(), aliceRoles.get(0).getPivot().get("user_id"));

        List<Role> bobRoles = many(users.get(1).getRelation("roles"));
        assertEquals(1, bobRoles.size());
        assertEquals("editor", bobRoles.get(0).getAttribute("name"));

        assertEquals(List.of(), users.get(2).getRelation("roles"));
    }

    @Test
    void testLoadOnSingleModel() {
        alice.posts().create(Map.of("title", "a1"));
        User fresh = em.find(User.class, alice.getKey());
        assertFalse(fresh.relationLoaded("posts"));

        fresh.load("posts", "profile");
        assertEquals(1, many(fresh.getRelation("posts")).size());
        assertTrue(fresh.relationLoaded("profile"));
        assertNull(fresh.getRelation("profile"));
    }

    @Test
    void testUnknownEagerRelation() {
        Builder<User> query = em.with(User.class, "followers");
        assertThrows(UnknownRelationException.class, query::get);
    }
}
