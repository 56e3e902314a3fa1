package de.t14d3.bobbin.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * A compiled SQL statement with its ordered parameters, plus the builders that produce it.
 * Supports multiple SQL dialects with proper identifier quoting and escaping.
 */
public class Query {
    private final Dialect dialect;
    private final StringBuilder sql;
    private final List<Object> parameters;

    private Query(Dialect dialect, StringBuilder sql, List<Object> parameters) {
        this.dialect = dialect;
        this.sql = sql;
        this.parameters = new ArrayList<>(parameters);
    }

    /**
     * Get the final SQL string.
     */
    public String getSql() {
        return sql.toString();
    }

    /**
     * Get the query parameters for prepared statement binding.
     */
    public List<Object> getParameters() {
        return new ArrayList<>(parameters);
    }

    public Dialect getDialect() {
        return dialect;
    }

    /**
     * Create a new SELECT query builder for a table.
     */
    public static SelectBuilder select(Dialect dialect, String... columns) {
        return new SelectBuilder(dialect).select(columns);
    }

    public static InsertBuilder insertInto(Dialect dialect, String table) {
        return new InsertBuilder(dialect).into(table);
    }

    public static UpdateBuilder update(Dialect dialect, String table) {
        return new UpdateBuilder(dialect).table(table);
    }

    public static DeleteBuilder deleteFrom(Dialect dialect, String table) {
        return new DeleteBuilder(dialect).from(table);
    }

    /**
     * Quote a column reference. Wildcards and function calls are left as-is,
     * qualified names ({@code table.column}, {@code table.*}) are quoted per segment and
     * {@code column as alias} quotes both sides.
     */
    public static String wrap(Dialect dialect, String value) {
        if (value == null) return "";
        String trimmed = value.trim();
        if ("*".equals(trimmed) || trimmed.contains("(")) {
            return trimmed;
        }
        int as = trimmed.toLowerCase(Locale.ROOT).indexOf(" as ");
        if (as > 0) {
            return wrap(dialect, trimmed.substring(0, as)) + " AS " + wrap(dialect, trimmed.substring(as + 4));
        }
        if (trimmed.contains(".")) {
            return Arrays.stream(trimmed.split("\\."))
                    .map(String::trim)
                    .map(segment -> "*".equals(segment) ? segment : dialect.quoteIdentifier(segment))
                    .collect(Collectors.joining("."));
        }
        return dialect.quoteIdentifier(trimmed);
    }

    // ========================================================================
    // SELECT QUERY BUILDER
    // ========================================================================

    public static class SelectBuilder {
        private final Dialect dialect;
        private final List<String> columns = new ArrayList<>();
        private String fromTable;
        private final StringBuilder joinClause = new StringBuilder();
        private final StringBuilder whereClause = new StringBuilder();
        private final List<Object> parameters = new ArrayList<>();
        private final List<String> orderBy = new ArrayList<>();
        private Integer limit;
        private Integer offset;

        public SelectBuilder(Dialect dialect) {
            this.dialect = dialect;
        }

        public SelectBuilder select(String... columns) {
            this.columns.addAll(Arrays.asList(columns));
            return this;
        }

        public SelectBuilder from(String table) {
            this.fromTable = table;
            return this;
        }

        public SelectBuilder join(String type, String table, String first, String operator, String second) {
            joinClause.append(' ').append(type).append(" JOIN ")
                    .append(dialect.quoteIdentifier(table))
                    .append(" ON ").append(wrap(dialect, first))
                    .append(' ').append(operator).append(' ')
                    .append(wrap(dialect, second));
            return this;
        }

        public SelectBuilder where(String condition, Object... params) {
            if (!whereClause.isEmpty()) {
                whereClause.append(" AND ");
            }
            whereClause.append(condition);
            if (params != null && params.length > 0) {
                parameters.addAll(Arrays.asList(params));
            }
            return this;
        }

        public SelectBuilder orderBy(String column, String direction) {
            orderBy.add(wrap(dialect, column) + " " + direction.toUpperCase(Locale.ROOT));
            return this;
        }

        public SelectBuilder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public SelectBuilder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Query build() {
            if (columns.isEmpty()) {
                throw new IllegalStateException("SELECT query must specify columns");
            }
            if (fromTable == null) {
                throw new IllegalStateException("SELECT query must specify a table");
            }

            StringBuilder sql = new StringBuilder("SELECT ");
            sql.append(columns.stream()
                    .map(column -> wrap(dialect, column))
                    .collect(Collectors.joining(", ")));
            sql.append(" FROM ").append(dialect.quoteIdentifier(fromTable));
            sql.append(joinClause);

            if (!whereClause.isEmpty()) {
                sql.append(" WHERE ").append(whereClause);
            }
            if (!orderBy.isEmpty()) {
                sql.append(" ORDER BY ").append(String.join(", ", orderBy));
            }
            if (limit != null) {
                sql.append(" LIMIT ").append(limit);
            }
            if (offset != null) {
                sql.append(" OFFSET ").append(offset);
            }

            return new Query(dialect, sql, parameters);
        }
    }

    // ========================================================================
    // INSERT QUERY BUILDER
    // ========================================================================

    public static class InsertBuilder {
        private final Dialect dialect;
        private String table;
        private final List<String> columns = new ArrayList<>();
        private final List<Object> parameters = new ArrayList<>();

        public InsertBuilder(Dialect dialect) {
            this.dialect = dialect;
        }

        public InsertBuilder into(String table) {
            this.table = table;
            return this;
        }

        public InsertBuilder columns(String... columns) {
            if (columns == null || columns.length == 0) {
                throw new IllegalArgumentException("columns must not be null or empty");
            }
            this.columns.clear();
            this.columns.addAll(Arrays.asList(columns));
            return this;
        }

        public InsertBuilder values(Object... values) {
            if (values == null) {
                throw new IllegalArgumentException("values must not be null");
            }
            if (values.length != columns.size()) {
                throw new IllegalArgumentException("Number of values must match number of columns");
            }
            parameters.addAll(Arrays.asList(values));
            return this;
        }

        public Query build() {
            if (table == null) {
                throw new IllegalStateException("INSERT query must specify a table");
            }
            if (columns.isEmpty()) {
                throw new IllegalStateException("INSERT query must specify columns");
            }
            if (parameters.size() != columns.size()) {
                throw new IllegalStateException("INSERT query must specify values");
            }

            StringBuilder sql = new StringBuilder("INSERT INTO ");
            sql.append(dialect.quoteIdentifier(table));
            sql.append(" (")
                    .append(columns.stream().map(dialect::quoteIdentifier).collect(Collectors.joining(", ")))
                    .append(") VALUES (")
                    .append(columns.stream().map(column -> "?").collect(Collectors.joining(", ")))
                    .append(")");

            return new Query(dialect, sql, parameters);
        }
    }

    // ========================================================================
    // UPDATE QUERY BUILDER
    // ========================================================================

    public static class UpdateBuilder {
        private final Dialect dialect;
        private String table;
        private final StringBuilder setClause = new StringBuilder();
        private final StringBuilder whereClause = new StringBuilder();
        private final List<Object> setParameters = new ArrayList<>();
        private final List<Object> whereParameters = new ArrayList<>();

        public UpdateBuilder(Dialect dialect) {
            this.dialect = dialect;
        }

        public UpdateBuilder table(String table) {
            this.table = table;
            return this;
        }

        public UpdateBuilder set(String column, Object value) {
            if (!setClause.isEmpty()) {
                setClause.append(", ");
            }
            setClause.append(dialect.quoteIdentifier(column)).append(" = ?");
            setParameters.add(value);
            return this;
        }

        public UpdateBuilder where(String condition, Object... params) {
            if (!whereClause.isEmpty()) {
                whereClause.append(" AND ");
            }
            whereClause.append(condition);
            if (params != null && params.length > 0) {
                whereParameters.addAll(Arrays.asList(params));
            }
            return this;
        }

        public Query build() {
            if (table == null) {
                throw new IllegalStateException("UPDATE query must specify a table");
            }
            if (setParameters.isEmpty()) {
                throw new IllegalStateException("UPDATE query must specify at least one SET clause");
            }

            StringBuilder sql = new StringBuilder("UPDATE ");
            sql.append(dialect.quoteIdentifier(table));
            sql.append(" SET ").append(setClause);

            if (!whereClause.isEmpty()) {
                sql.append(" WHERE ").append(whereClause);
            }

            List<Object> parameters = new ArrayList<>(setParameters);
            parameters.addAll(whereParameters);
            return new Query(dialect, sql, parameters);
        }
    }

    // ========================================================================
    // DELETE QUERY BUILDER
    // ========================================================================

    public static class DeleteBuilder {
        private final Dialect dialect;
        private String table;
        private final StringBuilder whereClause = new StringBuilder();
        private final List<Object> parameters = new ArrayList<>();

        public DeleteBuilder(Dialect dialect) {
            this.dialect = dialect;
        }

        public DeleteBuilder from(String table) {
            this.table = table;
            return this;
        }

        public DeleteBuilder where(String condition, Object... params) {
            if (!whereClause.isEmpty()) {
                whereClause.append(" AND ");
            }
            whereClause.append(condition);
            if (params != null && params.length > 0) {
                parameters.addAll(Arrays.asList(params));
            }
            return this;
        }

        public Query build() {
            if (table == null) {
                throw new IllegalStateException("DELETE query must specify a table");
            }

            StringBuilder sql = new StringBuilder("DELETE FROM ");
            sql.append(dialect.quoteIdentifier(table));

            if (!whereClause.isEmpty()) {
                sql.append(" WHERE ").append(whereClause);
            }

            return new Query(dialect, sql, parameters);
        }
    }
}
