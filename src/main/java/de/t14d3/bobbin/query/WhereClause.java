package de.t14d3.bobbin.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * One constraint of a query: a column, an operator and the bound value, joined to the
 * preceding constraint with {@code AND} or {@code OR}.
 */
public record WhereClause(Type type, String column, String operator, Object value, Connector connector) {

    public enum Type {
        BASIC, IN, NULL, NOT_NULL, NESTED
    }

    public enum Connector {
        AND, OR
    }

    public static WhereClause basic(String column, String operator, Object value, Connector connector) {
        return new WhereClause(Type.BASIC, column, operator, value, connector);
    }

    public static WhereClause in(String column, Collection<?> values, Connector connector) {
        return new WhereClause(Type.IN, column, "in", Collections.unmodifiableList(new ArrayList<>(values)), connector);
    }

    public static WhereClause isNull(String column, boolean not, Connector connector) {
        return new WhereClause(not ? Type.NOT_NULL : Type.NULL, column, not ? "is not" : "is", null, connector);
    }

    /**
     * A parenthesized group of constraints. The group reads the given list on every
     * compilation, so clauses added to it later are included.
     */
    public static WhereClause nested(List<WhereClause> wheres, Connector connector) {
        return new WhereClause(Type.NESTED, null, null, Collections.unmodifiableList(wheres), connector);
    }

    @SuppressWarnings("unchecked")
    public List<WhereClause> nestedWheres() {
        return type == Type.NESTED ? (List<WhereClause>) value : List.of();
    }

    /**
     * Whether this constraint compiles to nothing: an empty group.
     */
    public boolean isEmpty() {
        if (type != Type.NESTED) {
            return false;
        }
        for (WhereClause where : nestedWheres()) {
            if (!where.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * The values this constraint binds, in placeholder order.
     */
    public List<?> bindings() {
        switch (type) {
            case BASIC:
                return Collections.singletonList(value);
            case IN:
                return (List<?>) value;
            case NESTED:
                List<Object> bindings = new ArrayList<>();
                for (WhereClause where : nestedWheres()) {
                    bindings.addAll(where.bindings());
                }
                return bindings;
            default:
                return List.of();
        }
    }
}
