package dev.fumaz.instill.metadata;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The facts needed to resolve one dependency, shared by constructor parameters, method parameters, fields and
 * properties.
 */
public interface DependencyDescriptor {

    @NotNull String getName();

    @NotNull Class<?> getType();

    boolean isOptional();

    /**
     * @return the discriminator for keyed resolution, or {@code null} for an ordinary lookup
     */
    @Nullable String getKey();

    boolean isFromParent();

    boolean hasDefaultValue();

    @Nullable Object getDefaultValue();

    /**
     * @return whether a missing dependency may be replaced by the default or zero value
     */
    default boolean allowsFallback() {
        return isOptional() || hasDefaultValue();
    }

}
