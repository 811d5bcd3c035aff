package dev.fumaz.instill.annotation;

import java.lang.annotation.*;

/**
 * Resolves the annotated dependency from the parent resolver instead of the current one.
 */
@Target({ElementType.METHOD, ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface FromParent {
}
