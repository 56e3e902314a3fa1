package de.t14d3.bobbin.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Configures the table a model type is stored in.
 * <p>
 * Every attribute is optional. Without this annotation the table name is the
 * snake cased simple class name, the primary key is {@code id}, the model uses
 * the registry's default connection and maintains {@code created_at} /
 * {@code updated_at} timestamps.
 *
 * @see de.t14d3.bobbin.model.Model
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Table {
    /**
     * The name of the database table.
     */
    String name() default "";

    /**
     * The primary key column.
     */
    String primaryKey() default "id";

    /**
     * The registered connection backing this model type. Empty means the default connection.
     */
    String connection() default "";

    /**
     * Whether {@code save()} maintains the {@code created_at} and {@code updated_at} columns.
     */
    boolean timestamps() default true;
}
