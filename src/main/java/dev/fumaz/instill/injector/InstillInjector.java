package dev.fumaz.instill.injector;

import dev.fumaz.instill.exception.ResolutionException;
import dev.fumaz.instill.metadata.ConstructorDescriptor;
import dev.fumaz.instill.metadata.InjectionMetadata;
import dev.fumaz.instill.metadata.InjectionMetadataCache;
import dev.fumaz.instill.pool.ArgumentPool;
import dev.fumaz.instill.reflection.Handles;
import dev.fumaz.instill.resolver.InjectParameter;
import dev.fumaz.instill.resolver.ObjectResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

public class InstillInjector implements Injector {

    private static final Logger LOGGER = Logger.getLogger(InstillInjector.class.getName());

    private final @NotNull InjectionMetadataCache metadataCache;
    private final @NotNull ArgumentPool argumentPool;
    private final @NotNull ConstructorInjector constructorInjector;
    private final @NotNull MemberInjector fieldInjector;
    private final @NotNull MemberInjector propertyInjector;
    private final @NotNull MethodInjector methodInjector;
    private final @NotNull ConcurrentMap<Class<?>, ConstructorDescriptor> parameterlessConstructors;
    private final @NotNull Handles handles;

    public InstillInjector(@NotNull InjectorOptions options) {
        Objects.requireNonNull(options, "options");

        ParameterResolver parameterResolver = new ParameterResolver();

        this.metadataCache = new InjectionMetadataCache(options.getScanner());
        this.argumentPool = new ArgumentPool(options.getMaxPooledArity(), options.getMaxRetainedPerArity());
        this.constructorInjector = new ConstructorInjector(parameterResolver, argumentPool);
        this.fieldInjector = MemberInjector.forFields(parameterResolver);
        this.propertyInjector = MemberInjector.forProperties(parameterResolver);
        this.methodInjector = new MethodInjector(parameterResolver, argumentPool);
        this.parameterlessConstructors = new ConcurrentHashMap<>();
        this.handles = new Handles();
    }

    @Override
    public <T> @NotNull T createInstance(@NotNull Class<T> type, @NotNull ObjectResolver resolver,
                                         @Nullable List<? extends InjectParameter> overrides) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(resolver, "resolver");

        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw ResolutionException.cannotInstantiateAbstract(type);
        }

        InjectionMetadata metadata = metadataCache.getOrCreate(type);
        ConstructorDescriptor constructor = metadata.getConstructor();

        if (constructor == null) {
            constructor = getParameterlessConstructor(type);
        }

        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.log(Level.FINER, "Creating {0} via {1}", new Object[]{type.getName(), constructor});
        }

        return type.cast(constructorInjector.createInstance(constructor, resolver, overrides));
    }

    @Override
    public void injectAll(@NotNull Object instance, @NotNull Class<?> type, @NotNull ObjectResolver resolver,
                          @Nullable List<? extends InjectParameter> overrides) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(resolver, "resolver");

        if (!type.isInstance(instance)) {
            throw new IllegalArgumentException(instance.getClass().getName() + " is not an instance of "
                    + type.getName());
        }

        InjectionMetadata metadata = metadataCache.getOrCreate(type);

        fieldInjector.inject(instance, metadata.getFields(), resolver, overrides);
        propertyInjector.inject(instance, metadata.getProperties(), resolver, overrides);
        methodInjector.inject(instance, metadata.getMethods(), resolver, overrides);
    }

    @Override
    public @NotNull InjectionMetadata getInjectionMetadata(@NotNull Class<?> type) {
        return metadataCache.getOrCreate(type);
    }

    @Override
    public @NotNull InjectionMetadataCache getMetadataCache() {
        return metadataCache;
    }

    @Override
    public @NotNull ArgumentPool getArgumentPool() {
        return argumentPool;
    }

    @Override
    public void destroy() {
        metadataCache.clear();
        argumentPool.clear();
        parameterlessConstructors.clear();
        handles.clear();
    }

    private ConstructorDescriptor getParameterlessConstructor(Class<?> type) {
        ConstructorDescriptor cached = parameterlessConstructors.get(type);

        if (cached != null) {
            return cached;
        }

        Constructor<?> constructor;

        try {
            constructor = type.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw ResolutionException.noSuitableConstructor(type);
        }

        return parameterlessConstructors.computeIfAbsent(type,
                ignored -> ConstructorDescriptor.parameterless(handles.constructor(constructor)));
    }
}
