package de.t14d3.bobbin.mapping;

import java.util.Arrays;
import java.util.Locale;

/**
 * Naming rules that derive table, foreign key and join table names from model type names.
 */
public final class NamingConventions {

    private NamingConventions() {
    }

    /**
     * Convert a CamelCase string to snake case.
     * <p>
     * An underscore is inserted before every uppercase letter and the result is lowercased.
     * A leading underscore produced by an initial uppercase letter is dropped, so
     * {@code UserProfile} becomes {@code user_profile}.
     */
    public static String snakeCase(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length() + 4);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    sb.append('_');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Convert a snake case string to CamelCase ({@code full_name} becomes {@code FullName}).
     */
    public static String camelCase(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (String word : value.replace('_', ' ').split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    /**
     * The simple name of a class, without package or enclosing class qualifiers.
     */
    public static String baseName(Class<?> type) {
        return baseName(type.getName());
    }

    /**
     * The trailing simple name of a qualified type name.
     */
    public static String baseName(String typeName) {
        int cut = Math.max(typeName.lastIndexOf('.'), typeName.lastIndexOf('$'));
        return cut < 0 ? typeName : typeName.substring(cut + 1);
    }

    /**
     * The default table of a model type.
     */
    public static String tableName(Class<?> type) {
        return snakeCase(baseName(type));
    }

    /**
     * The default foreign key referencing a model type ({@code BlogPost} becomes {@code blog_post_id}).
     */
    public static String foreignKey(Class<?> type) {
        return foreignKey(type.getName());
    }

    public static String foreignKey(String typeName) {
        return snakeCase(baseName(typeName)) + "_id";
    }

    /**
     * The join table of a many-to-many relationship: both snake cased base names,
     * sorted alphabetically and joined with an underscore.
     */
    public static String joiningTable(Class<?> first, Class<?> second) {
        return joiningTable(first.getName(), second.getName());
    }

    public static String joiningTable(String first, String second) {
        String[] models = {snakeCase(baseName(first)), snakeCase(baseName(second))};
        Arrays.sort(models);
        return String.join("_", models).toLowerCase(Locale.ROOT);
    }
}
