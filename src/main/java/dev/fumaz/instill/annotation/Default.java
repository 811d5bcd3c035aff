package dev.fumaz.instill.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the value used for a constructor or method parameter when nothing else supplies one.
 * The literal is converted to the parameter type: strings, primitives and their wrappers, enum constant names
 * and class names are supported.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Default {

    String value();

}
