package dev.fumaz.instill.resolver;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A caller-supplied value that takes precedence over every other resolution strategy for a single
 * creation or injection call.
 */
public interface InjectParameter {

    /**
     * @param type the declared type of the injection point
     * @param name the parameter, field or property name
     */
    boolean canSupply(@NotNull Class<?> type, @NotNull String name);

    @Nullable Object getValue(@NotNull ObjectResolver resolver);

}
