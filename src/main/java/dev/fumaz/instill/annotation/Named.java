package dev.fumaz.instill.annotation;

import java.lang.annotation.*;

/**
 * Resolves the annotated dependency by its type plus the given key.
 */
@Target({ElementType.METHOD, ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Named {
    String value();
}
