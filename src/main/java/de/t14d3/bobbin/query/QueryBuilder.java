package de.t14d3.bobbin.query;

import de.t14d3.bobbin.connection.DatabaseConnection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fluent, table level query descriptor.
 * <p>
 * Collects the target table, selected columns, constraints, joins, ordering and paging,
 * and executes them against its connection through the connection's {@link Grammar}
 * and {@link Processor}. Rows come back as column-to-value maps.
 */
public class QueryBuilder {
    private static final Set<String> OPERATORS = Set.of(
            "=", "<", ">", "<=", ">=", "<>", "!=", "like", "not like");

    private final DatabaseConnection connection;
    private final Grammar grammar;
    private final Processor processor;

    private String table;
    private final List<String> columns = new ArrayList<>();
    private final List<JoinClause> joins = new ArrayList<>();
    private final List<WhereClause> wheres = new ArrayList<>();
    private final List<OrderClause> orders = new ArrayList<>();
    private Integer limit;
    private Integer offset;

    public QueryBuilder(DatabaseConnection connection, Grammar grammar, Processor processor) {
        this.connection = connection;
        this.grammar = grammar;
        this.processor = processor;
    }

    public QueryBuilder from(String table) {
        this.table = table;
        return this;
    }

    public QueryBuilder select(String... columns) {
        this.columns.clear();
        this.columns.addAll(Arrays.asList(columns));
        return this;
    }

    public QueryBuilder addSelect(String... columns) {
        this.columns.addAll(Arrays.asList(columns));
        return this;
    }

    public QueryBuilder join(String table, String first, String operator, String second) {
        return join("INNER", table, first, operator, second);
    }

    public QueryBuilder leftJoin(String table, String first, String operator, String second) {
        return join("LEFT", table, first, operator, second);
    }

    private QueryBuilder join(String type, String table, String first, String operator, String second) {
        joins.add(new JoinClause(type, table, first, checkOperator(operator), second));
        return this;
    }

    public QueryBuilder where(String column, String operator, Object value) {
        wheres.add(WhereClause.basic(column, checkOperator(operator), value, WhereClause.Connector.AND));
        return this;
    }

    /**
     * Shorthand for an equality constraint.
     */
    public QueryBuilder where(String column, Object value) {
        return where(column, "=", value);
    }

    public QueryBuilder orWhere(String column, String operator, Object value) {
        wheres.add(WhereClause.basic(column, checkOperator(operator), value, WhereClause.Connector.OR));
        return this;
    }

    public QueryBuilder whereIn(String column, Collection<?> values) {
        wheres.add(WhereClause.in(column, values, WhereClause.Connector.AND));
        return this;
    }

    /**
     * Add the constraints of another builder as one parenthesized group, so that its
     * {@code OR} conditions cannot widen the constraints already present here.
     */
    public QueryBuilder whereNested(QueryBuilder nested) {
        wheres.add(WhereClause.nested(nested.wheres, WhereClause.Connector.AND));
        return this;
    }

    public QueryBuilder whereNull(String column) {
        wheres.add(WhereClause.isNull(column, false, WhereClause.Connector.AND));
        return this;
    }

    public QueryBuilder whereNotNull(String column) {
        wheres.add(WhereClause.isNull(column, true, WhereClause.Connector.AND));
        return this;
    }

    public QueryBuilder orderBy(String column, String direction) {
        String normalized = direction.toLowerCase(Locale.ROOT);
        if (!normalized.equals("asc") && !normalized.equals("desc")) {
            throw new IllegalArgumentException("Order direction must be 'asc' or 'desc', got: " + direction);
        }
        orders.add(new OrderClause(column, normalized));
        return this;
    }

    public QueryBuilder orderBy(String column) {
        return orderBy(column, "asc");
    }

    public QueryBuilder limit(int limit) {
        this.limit = limit >= 0 ? limit : null;
        return this;
    }

    public QueryBuilder take(int value) {
        return limit(value);
    }

    public QueryBuilder offset(int offset) {
        this.offset = offset > 0 ? offset : null;
        return this;
    }

    public QueryBuilder skip(int value) {
        return offset(value);
    }

    /**
     * Execute the query and return all rows. Requested columns replace any earlier selection.
     */
    public List<Map<String, Object>> get(String... columns) {
        if (columns.length > 0) {
            select(columns);
        }
        Query compiled = grammar.compileSelect(this);
        List<Map<String, Object>> rows = connection.select(compiled.getSql(), compiled.getParameters());
        return processor.processSelect(this, rows);
    }

    /**
     * Execute the query for a single row, or {@code null} when nothing matches.
     */
    public Map<String, Object> first(String... columns) {
        List<Map<String, Object>> rows = take(1).get(columns);
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Find a row by its {@code id} column.
     */
    public Map<String, Object> find(Object id, String... columns) {
        return where("id", "=", id).first(columns);
    }

    public boolean insert(Map<String, Object> values) {
        Query compiled = grammar.compileInsert(this, values);
        return connection.insert(compiled.getSql(), compiled.getParameters());
    }

    /**
     * Insert a row and return the identifier the database generated for it.
     */
    public Object insertGetId(Map<String, Object> values) {
        Query compiled = grammar.compileInsert(this, values);
        return processor.processInsertGetId(this, compiled.getSql(), compiled.getParameters());
    }

    /**
     * Update every row matching the constraints and return the affected row count.
     */
    public int update(Map<String, Object> values) {
        Query compiled = grammar.compileUpdate(this, values);
        return connection.update(compiled.getSql(), compiled.getParameters());
    }

    public int delete() {
        Query compiled = grammar.compileDelete(this);
        return connection.delete(compiled.getSql(), compiled.getParameters());
    }

    /**
     * A fresh builder on the same connection, with no table or constraints.
     */
    public QueryBuilder newQuery() {
        return new QueryBuilder(connection, grammar, processor);
    }

    public String toSql() {
        return grammar.compileSelect(this).getSql();
    }

    public List<Object> getBindings() {
        return grammar.compileSelect(this).getParameters();
    }

    private static String checkOperator(String operator) {
        if (operator == null || !OPERATORS.contains(operator.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Illegal operator: " + operator);
        }
        return operator.toLowerCase(Locale.ROOT);
    }

    public DatabaseConnection getConnection() {
        return connection;
    }

    public Grammar getGrammar() {
        return grammar;
    }

    public Processor getProcessor() {
        return processor;
    }

    public String getTable() {
        return table;
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public List<JoinClause> getJoins() {
        return Collections.unmodifiableList(joins);
    }

    public List<WhereClause> getWheres() {
        return Collections.unmodifiableList(wheres);
    }

    public List<OrderClause> getOrders() {
        return Collections.unmodifiableList(orders);
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }
}
