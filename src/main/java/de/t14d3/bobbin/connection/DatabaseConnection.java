package de.t14d3.bobbin.connection;

import de.t14d3.bobbin.query.Grammar;
import de.t14d3.bobbin.query.Processor;
import de.t14d3.bobbin.query.QueryBuilder;

import java.util.List;
import java.util.Map;

/**
 * A handle to one database. Supplies the grammar and post processor used to build
 * queries against it and executes the compiled statements.
 * <p>
 * Failures are reported as {@link de.t14d3.bobbin.exceptions.OrmException}.
 */
public interface DatabaseConnection extends AutoCloseable {

    /**
     * The name this connection was registered under, if any.
     */
    String getName();

    void setName(String name);

    Grammar getQueryGrammar();

    Processor getPostProcessor();

    /**
     * Run a select statement and return its rows keyed by column label.
     */
    List<Map<String, Object>> select(String sql, List<Object> bindings);

    boolean insert(String sql, List<Object> bindings);

    /**
     * Run an insert statement and return the generated key of the new row, or {@code null}.
     */
    Object insertGetId(String sql, List<Object> bindings);

    int update(String sql, List<Object> bindings);

    int delete(String sql, List<Object> bindings);

    /**
     * Run an arbitrary statement, such as DDL.
     */
    void statement(String sql, List<Object> bindings);

    /**
     * Begin a fluent query against a table of this connection.
     */
    default QueryBuilder table(String table) {
        return new QueryBuilder(this, getQueryGrammar(), getPostProcessor()).from(table);
    }

    @Override
    void close();
}
