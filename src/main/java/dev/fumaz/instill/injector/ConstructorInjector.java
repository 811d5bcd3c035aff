package dev.fumaz.instill.injector;

import dev.fumaz.instill.exception.ProvisionException;
import dev.fumaz.instill.exception.ResolutionException;
import dev.fumaz.instill.metadata.ConstructorDescriptor;
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
 * Creates instances by resolving every constructor parameter and invoking the constructor.
 */
public final class ConstructorInjector {

    private static final Logger LOGGER = Logger.getLogger(ConstructorInjector.class.getName());

    private final @NotNull ParameterResolver parameterResolver;
    private final @NotNull ArgumentPool pool;

    public ConstructorInjector(@NotNull ParameterResolver parameterResolver, @NotNull ArgumentPool pool) {
        this.parameterResolver = Objects.requireNonNull(parameterResolver, "parameterResolver");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * @throws ResolutionException if a required parameter cannot be resolved
     * @throws ProvisionException  if the constructor itself fails
     */
    public @NotNull Object createInstance(@Nullable ConstructorDescriptor constructor,
                                          @Nullable ObjectResolver resolver,
                                          @Nullable List<? extends InjectParameter> overrides) {
        Objects.requireNonNull(constructor, "constructor");
        Objects.requireNonNull(resolver, "resolver");

        List<ParameterDescriptor> parameters = constructor.getParameters();
        Class<?> type = constructor.getDeclaringType();

        try (ArgumentBuffer buffer = pool.rent(parameters.size())) {
            Object[] arguments = buffer.array();

            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = parameterResolver.resolveValue(parameters.get(i), resolver, overrides);
            }

            Object instance = constructor.getHandle().invoke(null, arguments);

            if (instance == null) {
                throw new IllegalStateException("Constructor of " + type.getName() + " returned null");
            }

            return instance;
        } catch (ResolutionException e) {
            throw e;
        } catch (Error e) {
            throw e;
        } catch (Throwable throwable) {
            String message = "Failed to create instance of " + type.getName();
            LOGGER.log(Level.FINE, message, throwable);
            throw new ProvisionException(type, message, throwable);
        }
    }
}
