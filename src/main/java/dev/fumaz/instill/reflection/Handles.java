package dev.fumaz.instill.reflection;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.invoke.VarHandle;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates {@link MemberHandle}s and {@link InvocableHandle}s backed by {@code java.lang.invoke}, falling back to
 * core reflection when a handle cannot be obtained.
 * <p>
 * Each instance caches the private lookups it creates. The owner clears them with {@link #clear()} when it is
 * destroyed.
 */
public final class Handles {

    private static final Logger LOGGER = Logger.getLogger(Handles.class.getName());
    private static final MethodHandles.Lookup ROOT_LOOKUP = MethodHandles.lookup();

    private final ConcurrentMap<Class<?>, MethodHandles.Lookup> privateLookups = new ConcurrentHashMap<>();

    public @NotNull InvocableHandle constructor(@NotNull Constructor<?> constructor) {
        ensureAccessible(constructor);
        MethodHandle handle = null;

        try {
            MethodHandle base = unreflectConstructor(constructor);
            handle = base.asSpreader(Object[].class, constructor.getParameterCount())
                    .asType(MethodType.methodType(Object.class, Object[].class));
        } catch (IllegalAccessException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Falling back to reflection for constructor " + constructor.toGenericString(), e);
        }

        return new ConstructorInvocable(constructor, handle);
    }

    public @NotNull InvocableHandle method(@NotNull Method method) {
        if (Modifier.isStatic(method.getModifiers())) {
            throw new ReflectionException("Cannot create an instance handle for static method " + method);
        }

        ensureAccessible(method);
        MethodHandle handle = null;

        try {
            MethodHandle base = unreflect(method);
            handle = base.asSpreader(Object[].class, method.getParameterCount())
                    .asType(MethodType.methodType(Object.class, Object.class, Object[].class));
        } catch (IllegalAccessException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Falling back to reflection for method " + method.toGenericString(), e);
        }

        return new MethodInvocable(method, handle);
    }

    public @NotNull MemberHandle field(@NotNull Field field) {
        if (Modifier.isStatic(field.getModifiers())) {
            throw new ReflectionException("Cannot create an instance handle for static field " + field);
        }

        ensureAccessible(field);
        VarHandle handle = null;

        if (!Modifier.isFinal(field.getModifiers())) {
            try {
                handle = lookupFor(field.getDeclaringClass()).unreflectVarHandle(field);
            } catch (IllegalAccessException | RuntimeException e) {
                LOGGER.log(Level.WARNING, "Falling back to reflection for field " + field, e);
            }
        }

        return new FieldMember(field, handle);
    }

    /**
     * @param name   the property name
     * @param setter the property's single-argument write method
     */
    public @NotNull MemberHandle property(@NotNull String name, @NotNull Method setter) {
        if (setter.getParameterCount() != 1) {
            throw new ReflectionException("Property setter " + setter + " must take exactly one parameter");
        }

        ensureAccessible(setter);
        MethodHandle handle = null;

        try {
            handle = unreflect(setter).asType(MethodType.methodType(void.class, Object.class, Object.class));
        } catch (IllegalAccessException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Falling back to reflection for property setter " + setter, e);
        }

        return new PropertyMember(name, setter, handle);
    }

    /**
     * @return the number of classes a private lookup is cached for
     */
    public int cachedLookups() {
        return privateLookups.size();
    }

    public void clear() {
        privateLookups.clear();
    }

    private MethodHandles.Lookup lookupFor(Class<?> type) {
        return privateLookups.computeIfAbsent(type, Handles::createLookupFor);
    }

    private static MethodHandles.Lookup createLookupFor(Class<?> type) {
        try {
            return MethodHandles.privateLookupIn(type, ROOT_LOOKUP);
        } catch (IllegalAccessException | RuntimeException e) {
            return ROOT_LOOKUP;
        }
    }

    private MethodHandle unreflectConstructor(Constructor<?> constructor) throws IllegalAccessException {
        try {
            return lookupFor(constructor.getDeclaringClass()).unreflectConstructor(constructor);
        } catch (IllegalAccessException firstFailure) {
            try {
                return ROOT_LOOKUP.unreflectConstructor(constructor);
            } catch (IllegalAccessException secondFailure) {
                secondFailure.addSuppressed(firstFailure);
                throw secondFailure;
            }
        }
    }

    private MethodHandle unreflect(Method method) throws IllegalAccessException {
        try {
            return lookupFor(method.getDeclaringClass()).unreflect(method);
        } catch (IllegalAccessException firstFailure) {
            try {
                return ROOT_LOOKUP.unreflect(method);
            } catch (IllegalAccessException secondFailure) {
                secondFailure.addSuppressed(firstFailure);
                throw secondFailure;
            }
        }
    }

    private static void ensureAccessible(AccessibleObject accessibleObject) {
        try {
            accessibleObject.setAccessible(true);
        } catch (RuntimeException e) {
            throw new ReflectionException("Unable to make " + accessibleObject + " accessible", e);
        }
    }

    private static final class ConstructorInvocable implements InvocableHandle {
        private final Constructor<?> constructor;
        private final @Nullable MethodHandle handle;

        private ConstructorInvocable(Constructor<?> constructor, @Nullable MethodHandle handle) {
            this.constructor = constructor;
            this.handle = handle;
        }

        @Override
        public @NotNull String getName() {
            return constructor.getDeclaringClass().getSimpleName();
        }

        @Override
        public @NotNull Class<?> getDeclaringType() {
            return constructor.getDeclaringClass();
        }

        @Override
        public int getParameterCount() {
            return constructor.getParameterCount();
        }

        @Override
        public @Nullable Object invoke(@Nullable Object target, @NotNull Object[] arguments) throws Throwable {
            if (handle != null) {
                return handle.invoke(arguments);
            }

            try {
                return constructor.newInstance(arguments);
            } catch (InvocationTargetException e) {
                throw Reflections.unwrap(e);
            }
        }

        @Override
        public String toString() {
            return constructor.toGenericString();
        }
    }

    private static final class MethodInvocable implements InvocableHandle {
        private final Method method;
        private final @Nullable MethodHandle handle;

        private MethodInvocable(Method method, @Nullable MethodHandle handle) {
            this.method = method;
            this.handle = handle;
        }

        @Override
        public @NotNull String getName() {
            return method.getName();
        }

        @Override
        public @NotNull Class<?> getDeclaringType() {
            return method.getDeclaringClass();
        }

        @Override
        public int getParameterCount() {
            return method.getParameterCount();
        }

        @Override
        public @Nullable Object invoke(@Nullable Object target, @NotNull Object[] arguments) throws Throwable {
            if (handle != null) {
                return handle.invoke(target, arguments);
            }

            try {
                return method.invoke(target, arguments);
            } catch (InvocationTargetException e) {
                throw Reflections.unwrap(e);
            }
        }

        @Override
        public String toString() {
            return method.toGenericString();
        }
    }

    private static final class FieldMember implements MemberHandle {
        private final Field field;
        private final @Nullable VarHandle handle;

        private FieldMember(Field field, @Nullable VarHandle handle) {
            this.field = field;
            this.handle = handle;
        }

        @Override
        public @NotNull String getName() {
            return field.getName();
        }

        @Override
        public @NotNull Class<?> getType() {
            return field.getType();
        }

        @Override
        public @NotNull Class<?> getDeclaringType() {
            return field.getDeclaringClass();
        }

        @Override
        public void set(@NotNull Object target, @Nullable Object value) throws Throwable {
            if (handle != null) {
                handle.set(target, value);
                return;
            }

            field.set(target, value);
        }

        @Override
        public String toString() {
            return field.toGenericString();
        }
    }

    private static final class PropertyMember implements MemberHandle {
        private final String name;
        private final Method setter;
        private final @Nullable MethodHandle handle;

        private PropertyMember(String name, Method setter, @Nullable MethodHandle handle) {
            this.name = name;
            this.setter = setter;
            this.handle = handle;
        }

        @Override
        public @NotNull String getName() {
            return name;
        }

        @Override
        public @NotNull Class<?> getType() {
            return setter.getParameterTypes()[0];
        }

        @Override
        public @NotNull Class<?> getDeclaringType() {
            return setter.getDeclaringClass();
        }

        @Override
        public void set(@NotNull Object target, @Nullable Object value) throws Throwable {
            if (handle != null) {
                handle.invoke(target, value);
                return;
            }

            try {
                setter.invoke(target, value);
            } catch (InvocationTargetException e) {
                throw Reflections.unwrap(e);
            }
        }

        @Override
        public String toString() {
            return "property " + name + " via " + setter.toGenericString();
        }
    }
}
