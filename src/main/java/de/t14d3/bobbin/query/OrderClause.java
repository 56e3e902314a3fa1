package de.t14d3.bobbin.query;

public record OrderClause(String column, String direction) {
}
