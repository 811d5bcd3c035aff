package dev.fumaz.instill.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Positions an injected method relative to the other injected methods of the same instance.
 * Lower values run first; methods without this annotation have order 0.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Order {

    int value() default 0;

}
