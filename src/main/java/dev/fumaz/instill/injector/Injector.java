package dev.fumaz.instill.injector;

import dev.fumaz.instill.metadata.InjectionMetadata;
import dev.fumaz.instill.metadata.InjectionMetadataCache;
import dev.fumaz.instill.pool.ArgumentPool;
import dev.fumaz.instill.resolver.InjectParameter;
import dev.fumaz.instill.resolver.ObjectResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * An {@link Injector} creates objects and injects their dependencies, looking every dependency up through the
 * {@link ObjectResolver} handed to each call.
 * <p>
 * Member injection runs fields first, then properties, then methods. A failure stops injection at the first
 * unrecoverable dependency; members injected before it keep their values.
 */
public interface Injector {

    static @NotNull Injector create() {
        return new InstillInjector(InjectorOptions.defaults());
    }

    static @NotNull Injector create(@NotNull InjectorOptions options) {
        return new InstillInjector(options);
    }

    /**
     * Selects a constructor of {@code type}, resolves its parameters and invokes it. Members are not injected.
     */
    <T> @NotNull T createInstance(@NotNull Class<T> type, @NotNull ObjectResolver resolver,
                                  @Nullable List<? extends InjectParameter> overrides);

    /**
     * Injects the fields, properties and methods that {@code type} declares into {@code instance}.
     */
    void injectAll(@NotNull Object instance, @NotNull Class<?> type, @NotNull ObjectResolver resolver,
                   @Nullable List<? extends InjectParameter> overrides);

    @NotNull InjectionMetadata getInjectionMetadata(@NotNull Class<?> type);

    @NotNull InjectionMetadataCache getMetadataCache();

    @NotNull ArgumentPool getArgumentPool();

    /**
     * Clears the metadata cache, the argument pool and the cached reflective lookups.
     */
    void destroy();

    default <T> @NotNull T createInstance(@NotNull Class<T> type, @NotNull ObjectResolver resolver) {
        return createInstance(type, resolver, Collections.emptyList());
    }

    default void injectAll(@NotNull Object instance, @NotNull Class<?> type, @NotNull ObjectResolver resolver) {
        injectAll(instance, type, resolver, Collections.emptyList());
    }

    default void inject(@NotNull Object instance, @NotNull ObjectResolver resolver) {
        inject(instance, resolver, Collections.emptyList());
    }

    default void inject(@NotNull Object instance, @NotNull ObjectResolver resolver,
                        @Nullable List<? extends InjectParameter> overrides) {
        injectAll(instance, instance.getClass(), resolver, overrides);
    }

    /**
     * Creates an instance and injects its members in one call.
     */
    default <T> @NotNull T construct(@NotNull Class<T> type, @NotNull ObjectResolver resolver,
                                     @Nullable List<? extends InjectParameter> overrides) {
        T instance = createInstance(type, resolver, overrides);
        injectAll(instance, type, resolver, overrides);
        return instance;
    }

    default <T> @NotNull T construct(@NotNull Class<T> type, @NotNull ObjectResolver resolver) {
        return construct(type, resolver, Collections.emptyList());
    }

    default boolean requiresInjection(@NotNull Class<?> type) {
        return getInjectionMetadata(type).hasInjectionPoints();
    }

}
