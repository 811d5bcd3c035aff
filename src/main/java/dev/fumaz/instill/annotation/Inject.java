package dev.fumaz.instill.annotation;

import java.lang.annotation.*;

/**
 * Marks a constructor, field, property accessor, method or parameter as an injection point.
 * <p>
 * On a property, the annotation may sit on the setter or on the getter of a property that has a setter.
 */
@Target({ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD, ElementType.PARAMETER})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Inject {
    boolean optional() default false;
}
