package dev.fumaz.instill.injector;

import dev.fumaz.instill.exception.ProvisionException;
import dev.fumaz.instill.exception.ResolutionException;
import dev.fumaz.instill.metadata.MemberDescriptor;
import dev.fumaz.instill.reflection.MemberHandle;
import dev.fumaz.instill.reflection.Reflections;
import dev.fumaz.instill.resolver.InjectParameter;
import dev.fumaz.instill.resolver.ObjectResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Populates the injectable fields or properties of an existing instance.
 * <p>
 * An optional member whose resolved value is the zero value of its type ({@code null}, {@code 0}, {@code false})
 * is left untouched, so an initializer or an earlier assignment survives a missing optional dependency. A
 * registration that legitimately resolves to a zero value is therefore not written either.
 */
public final class MemberInjector {

    private static final Logger LOGGER = Logger.getLogger(MemberInjector.class.getName());

    private final @NotNull ParameterResolver parameterResolver;
    private final @NotNull String kind;

    private MemberInjector(@NotNull ParameterResolver parameterResolver, @NotNull String kind) {
        this.parameterResolver = Objects.requireNonNull(parameterResolver, "parameterResolver");
        this.kind = kind;
    }

    public static @NotNull MemberInjector forFields(@NotNull ParameterResolver parameterResolver) {
        return new MemberInjector(parameterResolver, "field");
    }

    public static @NotNull MemberInjector forProperties(@NotNull ParameterResolver parameterResolver) {
        return new MemberInjector(parameterResolver, "property");
    }

    public void inject(@Nullable Object instance,
                       @Nullable List<MemberDescriptor> descriptors,
                       @Nullable ObjectResolver resolver,
                       @Nullable List<? extends InjectParameter> overrides) {
        if (descriptors == null || descriptors.isEmpty()) {
            return;
        }

        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(resolver, "resolver");

        for (MemberDescriptor descriptor : descriptors) {
            MemberHandle handle = descriptor.getHandle();

            try {
                Object value = parameterResolver.resolveValue(descriptor, resolver, overrides);

                if (descriptor.isOptional() && Reflections.isZeroValue(value, descriptor.getType())) {
                    continue;
                }

                handle.set(instance, value);
            } catch (ResolutionException e) {
                throw e;
            } catch (Error e) {
                throw e;
            } catch (Throwable throwable) {
                String message = "Failed to inject " + kind + " " + handle.getName() + " in "
                        + instance.getClass().getName();
                LOGGER.log(Level.FINE, message, throwable);
                throw new ProvisionException(handle.getDeclaringType(), message, throwable);
            }
        }
    }

    public @NotNull String getKind() {
        return kind;
    }
}
