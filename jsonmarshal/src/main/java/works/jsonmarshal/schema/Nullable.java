package works.jsonmarshal.schema;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a record component whose value may be {@code null},
 * which is written as JSON {@code null} and read back from either
 * {@code null} or an absent key.
 * Primitive components can't be nullable.
 */
@Retention(RUNTIME)
@Target(RECORD_COMPONENT)
public @interface Nullable {
}
