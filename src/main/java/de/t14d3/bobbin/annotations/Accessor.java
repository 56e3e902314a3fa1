package de.t14d3.bobbin.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a single-argument model method as the accessor of an attribute.
 * <p>
 * The method receives the raw stored value (or {@code null}) and returns the value
 * visible through {@code getAttribute}. When {@link #value()} is empty, the attribute
 * name is derived from the method name: {@code getFullName} handles {@code full_name}.
 *
 * <pre>
 * &#64;Accessor
 * public Object getFullName(Object raw) { ... }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Accessor {
    /**
     * The attribute name. Derived from the method name when empty.
     */
    String value() default "";
}
