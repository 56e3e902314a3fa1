package de.t14d3.bobbin.query;

/**
 * A join of another table on a single column comparison.
 */
public record JoinClause(String type, String table, String first, String operator, String second) {
}
