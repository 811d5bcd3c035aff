package dev.fumaz.instill.injector;

import dev.fumaz.instill.exception.ProvisionException;
import dev.fumaz.instill.exception.ResolutionException;
import dev.fumaz.instill.metadata.MethodDescriptor;
import dev.fumaz.instill.metadata.ParameterDescriptor;
import dev.fumaz.instill.pool.ArgumentBuffer;
import dev.fumaz.instill.pool.ArgumentPool;
import dev.fumaz.instill.resolver.InjectParameter;
import dev.fumaz.instill.resolver.ObjectResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Invokes the injectable methods of an existing instance in the order given, which the metadata has already sorted.
 */
public final class MethodInjector {

    private static final Logger LOGGER = Logger.getLogger(MethodInjector.class.getName());

    private final @NotNull ParameterResolver parameterResolver;
    private final @NotNull ArgumentPool pool;

    public MethodInjector(@NotNull ParameterResolver parameterResolver, @NotNull ArgumentPool pool) {
        this.parameterResolver = Objects.requireNonNull(parameterResolver, "parameterResolver");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    public void inject(@Nullable Object instance,
                       @Nullable List<MethodDescriptor> methods,
                       @Nullable ObjectResolver resolver,
                       @Nullable List<? extends InjectParameter> overrides) {
        Objects.requireNonNull(instance, "instance");

        if (methods == null || methods.isEmpty()) {
            return;
        }

        Objects.requireNonNull(resolver, "resolver");

        for (MethodDescriptor method : methods) {
            invoke(instance, method, resolver, overrides);
        }
    }

    private void invoke(Object instance,
                        MethodDescriptor method,
                        ObjectResolver resolver,
                        @Nullable List<? extends InjectParameter> overrides) {
        List<ParameterDescriptor> parameters = method.getParameters();

        try (ArgumentBuffer buffer = pool.rent(parameters.size())) {
            Object[] arguments = buffer.array();

            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = parameterResolver.resolveValue(parameters.get(i), resolver, overrides);
            }

            method.getHandle().invoke(instance, arguments);
        } catch (ResolutionException e) {
            throw e;
        } catch (Error e) {
            throw e;
        } catch (Throwable throwable) {
            String message = "Failed to inject method " + method.getName() + " in " + instance.getClass().getName();
            LOGGER.log(Level.FINE, message, throwable);
            throw new ProvisionException(method.getHandle().getDeclaringType(), message, throwable);
        }
    }
}
