package de.t14d3.bobbin.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compiles {@link QueryBuilder} state into dialect specific SQL text and ordered bindings.
 */
public class Grammar {
    private final Dialect dialect;

    public Grammar(Dialect dialect) {
        this.dialect = dialect;
    }

    public Dialect getDialect() {
        return dialect;
    }

    /**
     * Quote a column reference for this dialect.
     */
    public String wrap(String value) {
        return Query.wrap(dialect, value);
    }

    public Query compileSelect(QueryBuilder query) {
        List<String> columns = query.getColumns().isEmpty() ? List.of("*") : query.getColumns();
        Query.SelectBuilder select = Query.select(dialect, columns.toArray(new String[0]))
                .from(requireTable(query));

        for (JoinClause join : query.getJoins()) {
            select.join(join.type(), join.table(), join.first(), join.operator(), join.second());
        }

        List<Object> bindings = new ArrayList<>();
        String where = compileWheres(query.getWheres(), bindings);
        if (!where.isEmpty()) {
            select.where(where, bindings.toArray());
        }

        for (OrderClause order : query.getOrders()) {
            select.orderBy(order.column(), order.direction());
        }

        return select.limit(query.getLimit()).offset(query.getOffset()).build();
    }

    public Query compileInsert(QueryBuilder query, Map<String, Object> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot insert an empty set of values into " + query.getTable());
        }
        return Query.insertInto(dialect, requireTable(query))
                .columns(values.keySet().toArray(new String[0]))
                .values(values.values().toArray())
                .build();
    }

    public Query compileUpdate(QueryBuilder query, Map<String, Object> values) {
        Query.UpdateBuilder update = Query.update(dialect, requireTable(query));
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            update.set(entry.getKey(), entry.getValue());
        }

        List<Object> bindings = new ArrayList<>();
        String where = compileWheres(query.getWheres(), bindings);
        if (!where.isEmpty()) {
            update.where(where, bindings.toArray());
        }
        return update.build();
    }

    public Query compileDelete(QueryBuilder query) {
        Query.DeleteBuilder delete = Query.deleteFrom(dialect, requireTable(query));

        List<Object> bindings = new ArrayList<>();
        String where = compileWheres(query.getWheres(), bindings);
        if (!where.isEmpty()) {
            delete.where(where, bindings.toArray());
        }
        return delete.build();
    }

    /**
     * Render the constraint list as one condition, appending the bound values to {@code bindings}.
     */
    protected String compileWheres(List<WhereClause> wheres, List<Object> bindings) {
        StringBuilder sql = new StringBuilder();
        for (WhereClause where : wheres) {
            if (where.isEmpty()) {
                continue;
            }
            if (!sql.isEmpty()) {
                sql.append(' ').append(where.connector().name()).append(' ');
            }
            sql.append(compileWhere(where));
            bindings.addAll(where.bindings());
        }
        return sql.toString();
    }

    protected String compileWhere(WhereClause where) {
        switch (where.type()) {
            case IN:
                List<?> values = where.bindings();
                if (values.isEmpty()) {
                    // An empty IN list can never match
                    return "0 = 1";
                }
                return wrap(where.column()) + " IN ("
                        + String.join(", ", Collections.nCopies(values.size(), "?")) + ")";
            case NULL:
                return wrap(where.column()) + " IS NULL";
            case NOT_NULL:
                return wrap(where.column()) + " IS NOT NULL";
            case NESTED:
                return "(" + compileWheres(where.nestedWheres(), new ArrayList<>()) + ")";
            default:
                return wrap(where.column()) + " " + where.operator().toUpperCase(Locale.ROOT) + " ?";
        }
    }

    private String requireTable(QueryBuilder query) {
        if (query.getTable() == null) {
            throw new IllegalStateException("Query has no table; call from() first");
        }
        return query.getTable();
    }

    @Override
    public String toString() {
        return "Grammar{" + dialect + "}";
    }
}
