package dev.fumaz.instill.reflection;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.beans.Introspector;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.Collectors;

public final class Reflections {

    private static final Comparator<Class<?>[]> PARAMETER_TYPES = (left, right) -> {
        int length = Math.min(left.length, right.length);

        for (int i = 0; i < length; i++) {
            int compared = left[i].getName().compareTo(right[i].getName());

            if (compared != 0) {
                return compared;
            }
        }

        return Integer.compare(left.length, right.length);
    };

    /**
     * Orders constructors by parameter count (descending), then parameter type names.
     */
    public static final Comparator<Constructor<?>> CONSTRUCTOR_ORDER = Comparator
            .comparingInt((Constructor<?> constructor) -> constructor.getParameterCount())
            .reversed()
            .thenComparing(Constructor::getParameterTypes, PARAMETER_TYPES);

    /**
     * Orders methods by name, then parameter type names.
     */
    public static final Comparator<Method> METHOD_ORDER = Comparator
            .comparing(Method::getName)
            .thenComparing(Method::getParameterTypes, PARAMETER_TYPES);

    private Reflections() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * @return the value an unset variable of the given type holds: zero for numeric primitives, {@code false},
     * {@code '\0'}, or {@code null} for reference types
     */
    public static @Nullable Object zeroValue(@NotNull Class<?> type) {
        if (!type.isPrimitive()) {
            return null;
        }

        if (type == int.class) {
            return 0;
        } else if (type == long.class) {
            return 0L;
        } else if (type == boolean.class) {
            return false;
        } else if (type == double.class) {
            return 0D;
        } else if (type == float.class) {
            return 0F;
        } else if (type == short.class) {
            return (short) 0;
        } else if (type == byte.class) {
            return (byte) 0;
        } else if (type == char.class) {
            return '\0';
        }

        // void
        return null;
    }

    public static boolean isZeroValue(@Nullable Object value, @NotNull Class<?> type) {
        return Objects.equals(value, zeroValue(type));
    }

    /**
     * Converts a textual literal to the given type.
     *
     * @throws ReflectionException if the type is unsupported or the literal is malformed
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static @Nullable Object convertLiteral(@NotNull String literal, @NotNull Class<?> type) {
        try {
            if (type == String.class || type == Object.class || type == CharSequence.class) {
                return literal;
            } else if (type == int.class || type == Integer.class) {
                return Integer.valueOf(literal.trim());
            } else if (type == long.class || type == Long.class) {
                return Long.valueOf(literal.trim());
            } else if (type == boolean.class || type == Boolean.class) {
                return parseBoolean(literal.trim());
            } else if (type == double.class || type == Double.class) {
                return Double.valueOf(literal.trim());
            } else if (type == float.class || type == Float.class) {
                return Float.valueOf(literal.trim());
            } else if (type == short.class || type == Short.class) {
                return Short.valueOf(literal.trim());
            } else if (type == byte.class || type == Byte.class) {
                return Byte.valueOf(literal.trim());
            } else if (type == char.class || type == Character.class) {
                if (literal.length() != 1) {
                    throw new IllegalArgumentException("Expected a single character but got '" + literal + "'");
                }

                return literal.charAt(0);
            } else if (type.isEnum()) {
                return Enum.valueOf((Class<? extends Enum>) type, literal.trim());
            } else if (type == Class.class) {
                return Class.forName(literal.trim());
            }
        } catch (IllegalArgumentException | ClassNotFoundException e) {
            throw new ReflectionException("Cannot convert '" + literal + "' to " + type.getName(), e);
        }

        throw new ReflectionException("Default values are not supported for type " + type.getName());
    }

    private static boolean parseBoolean(String literal) {
        if ("true".equalsIgnoreCase(literal)) {
            return true;
        } else if ("false".equalsIgnoreCase(literal)) {
            return false;
        }

        throw new IllegalArgumentException("Not a boolean: '" + literal + "'");
    }

    public static boolean isStatic(@NotNull Method method) {
        return Modifier.isStatic(method.getModifiers());
    }

    /**
     * @return whether the method follows the JavaBeans write method shape {@code void setXxx(T)}
     */
    public static boolean isSetter(@NotNull Method method) {
        String name = method.getName();

        return name.length() > 3
                && name.startsWith("set")
                && Character.isUpperCase(name.charAt(3))
                && method.getParameterCount() == 1
                && method.getReturnType() == void.class;
    }

    /**
     * @return whether the method follows the JavaBeans read method shape {@code T getXxx()} or {@code boolean isXxx()}
     */
    public static boolean isGetter(@NotNull Method method) {
        if (method.getParameterCount() != 0 || method.getReturnType() == void.class) {
            return false;
        }

        String name = method.getName();

        if (name.length() > 3 && name.startsWith("get") && Character.isUpperCase(name.charAt(3))) {
            return true;
        }

        return name.length() > 2
                && name.startsWith("is")
                && Character.isUpperCase(name.charAt(2))
                && method.getReturnType() == boolean.class;
    }

    /**
     * @return the property name of a setter or getter, e.g. {@code "logger"} for {@code setLogger}
     */
    public static @NotNull String propertyName(@NotNull Method accessor) {
        String name = accessor.getName();
        int prefix = name.startsWith("is") ? 2 : 3;

        return Introspector.decapitalize(name.substring(prefix));
    }

    /**
     * Finds the setter declared directly on {@code type} for the property read by {@code getter}.
     */
    public static @Nullable Method findDeclaredSetter(@NotNull Class<?> type, @NotNull Method getter) {
        String suffix = getter.getName().substring(getter.getName().startsWith("is") ? 2 : 3);

        try {
            Method setter = type.getDeclaredMethod("set" + suffix, getter.getReturnType());
            return isSetter(setter) && !isStatic(setter) ? setter : null;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    /**
     * @return a key identifying the method's overridable signature (name and erased parameter types)
     */
    public static @NotNull String signature(@NotNull Method method) {
        return method.getName() + Arrays.stream(method.getParameterTypes())
                .map(Class::getName)
                .collect(Collectors.joining(",", "(", ")"));
    }

    /**
     * @return whether {@code method} can be overridden by a subclass declared in {@code subclassPackage}
     */
    public static boolean isOverridableFrom(@NotNull Method method, @NotNull Package subclassPackage) {
        int modifiers = method.getModifiers();

        if (Modifier.isPrivate(modifiers) || Modifier.isStatic(modifiers)) {
            return false;
        }

        if (Modifier.isPublic(modifiers) || Modifier.isProtected(modifiers)) {
            return true;
        }

        return Objects.equals(method.getDeclaringClass().getPackage(), subclassPackage);
    }

    /**
     * @return whether {@code bridge} forwards to a method declared in {@code type} itself, as javac generates for
     * an override whose erased parameter types differ from the overridden method's. Visibility bridges, which
     * forward to an inherited method, return {@code false}.
     */
    public static boolean bridgesOverride(@NotNull Class<?> type, @NotNull Method bridge) {
        for (Method candidate : type.getDeclaredMethods()) {
            if (candidate.isBridge() || candidate.isSynthetic() || isStatic(candidate)) {
                continue;
            }

            if (candidate.getName().equals(bridge.getName())
                    && candidate.getParameterCount() == bridge.getParameterCount()) {
                return true;
            }
        }

        return false;
    }

    public static @NotNull Throwable unwrap(@NotNull InvocationTargetException exception) {
        Throwable target = exception.getTargetException();
        return target != null ? target : exception;
    }

}
