package de.t14d3.bobbin.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a single-argument model method as the mutator of an attribute.
 * <p>
 * The method receives the value passed to {@code setAttribute} and returns the
 * value that is actually stored. When {@link #value()} is empty, the attribute
 * name is derived from the method name: {@code setPassword} handles {@code password}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Mutator {
    /**
     * The attribute name. Derived from the method name when empty.
     */
    String value() default "";
}
