package dev.fumaz.instill.injector;

import dev.fumaz.instill.exception.NoParentContainerException;
import dev.fumaz.instill.exception.ServiceNotRegisteredException;
import dev.fumaz.instill.metadata.DependencyDescriptor;
import dev.fumaz.instill.reflection.Reflections;
import dev.fumaz.instill.resolver.InjectParameter;
import dev.fumaz.instill.resolver.ObjectResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the value of one dependency. Constructor parameters, method parameters, fields and properties all go
 * through the same steps, the first applicable one wins:
 * <ol>
 *     <li>an explicit {@link InjectParameter} that can supply the dependency's type and name;</li>
 *     <li>for {@code fromParent} dependencies, the parent resolver (keyed if a key is present);</li>
 *     <li>for keyed dependencies, a keyed lookup on the current resolver;</li>
 *     <li>an ordinary lookup on the current resolver;</li>
 *     <li>the declared default or the type's zero value, if the dependency is optional or has a default.</li>
 * </ol>
 * Optional and defaulted dependencies never fail on a missing registration; the lookups are attempted without
 * throwing and only required dependencies raise a {@link dev.fumaz.instill.exception.ResolutionException}.
 */
public final class ParameterResolver {

    private static final Logger LOGGER = Logger.getLogger(ParameterResolver.class.getName());

    public @Nullable Object resolveValue(@NotNull DependencyDescriptor descriptor,
                                         @NotNull ObjectResolver resolver,
                                         @Nullable List<? extends InjectParameter> overrides) {
        Class<?> type = descriptor.getType();

        if (overrides != null && !overrides.isEmpty()) {
            String name = descriptor.getName();

            for (InjectParameter override : overrides) {
                if (override.canSupply(type, name)) {
                    return override.getValue(resolver);
                }
            }
        }

        if (descriptor.isFromParent()) {
            return resolveFromParent(descriptor, resolver);
        }

        String key = descriptor.getKey();

        if (key != null) {
            if (!descriptor.allowsFallback()) {
                return resolver.resolveKeyed(type, key);
            }

            return valueOrFallback(resolver.tryResolveKeyed(type, key), descriptor);
        }

        Optional<?> resolved = resolver.tryResolve(type);

        if (resolved.isPresent()) {
            return resolved.get();
        }

        if (descriptor.allowsFallback()) {
            return fallbackValue(descriptor);
        }

        throw new ServiceNotRegisteredException(type);
    }

    private @Nullable Object resolveFromParent(DependencyDescriptor descriptor, ObjectResolver resolver) {
        Class<?> type = descriptor.getType();
        String key = descriptor.getKey();
        ObjectResolver parent = resolver.getParent();

        if (parent == null) {
            if (descriptor.allowsFallback()) {
                return fallbackValue(descriptor);
            }

            throw new NoParentContainerException(type);
        }

        if (!descriptor.allowsFallback()) {
            return key != null ? parent.resolveKeyed(type, key) : parent.resolve(type);
        }

        Optional<?> resolved = key != null ? parent.tryResolveKeyed(type, key) : parent.tryResolve(type);
        return valueOrFallback(resolved, descriptor);
    }

    private static @Nullable Object valueOrFallback(Optional<?> resolved, DependencyDescriptor descriptor) {
        return resolved.isPresent() ? resolved.get() : fallbackValue(descriptor);
    }

    /**
     * @return the declared default if present, otherwise the zero value of the dependency's type
     */
    public static @Nullable Object fallbackValue(@NotNull DependencyDescriptor descriptor) {
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.log(Level.FINER, "Falling back to the default value for {0}", descriptor);
        }

        if (descriptor.hasDefaultValue()) {
            return descriptor.getDefaultValue();
        }

        return Reflections.zeroValue(descriptor.getType());
    }
}
