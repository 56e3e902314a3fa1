package de.t14d3.bobbin.query;

import java.util.Locale;

/**
 * SQL database dialects for proper identifier quoting.
 */
public enum Dialect {
    GENERIC,
    MYSQL,
    POSTGRESQL,
    SQLITE,
    H2;

    /**
     * Quote an identifier based on the dialect. Identifier case is preserved.
     */
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.trim().isEmpty()) {
            return identifier;
        }

        switch (this) {
            case MYSQL:
                return "`" + identifier.replace("`", "``") + "`";
            case POSTGRESQL:
            case SQLITE:
            case H2:
                return "\"" + identifier.replace("\"", "\"\"") + "\"";
            default:
                // No quoting for generic
                return identifier;
        }
    }

    /**
     * Detect dialect from JDBC URL.
     */
    public static Dialect detectFromUrl(String jdbcUrl) {
        if (jdbcUrl == null) return GENERIC;

        String lowerUrl = jdbcUrl.toLowerCase(Locale.ROOT);
        if (lowerUrl.contains("mysql") || lowerUrl.contains("mariadb")) return MYSQL;
        if (lowerUrl.contains("postgresql") || lowerUrl.contains("postgres")) return POSTGRESQL;
        if (lowerUrl.contains("sqlite")) return SQLITE;
        if (lowerUrl.contains("h2")) return H2;

        return GENERIC;
    }

    /**
     * Detect dialect from the product name reported by the JDBC driver.
     */
    public static Dialect detectFromProductName(String productName) {
        if (productName == null) return GENERIC;

        String lower = productName.toLowerCase(Locale.ROOT);
        if (lower.contains("mysql") || lower.contains("mariadb")) return MYSQL;
        if (lower.contains("postgresql")) return POSTGRESQL;
        if (lower.contains("sqlite")) return SQLITE;
        if (lower.contains("h2")) return H2;

        return GENERIC;
    }
}
