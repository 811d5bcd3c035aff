package dev.fumaz.instill.metadata;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Describes one constructor or method parameter.
 */
public final class ParameterDescriptor implements DependencyDescriptor {

    private final String name;
    private final Class<?> type;
    private final boolean optional;
    private final @Nullable String key;
    private final boolean fromParent;
    private final boolean hasDefaultValue;
    private final @Nullable Object defaultValue;

    public ParameterDescriptor(@NotNull String name,
                               @NotNull Class<?> type,
                               boolean optional,
                               @Nullable String key,
                               boolean fromParent,
                               boolean hasDefaultValue,
                               @Nullable Object defaultValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.optional = optional;
        this.key = key;
        this.fromParent = fromParent;
        this.hasDefaultValue = hasDefaultValue;
        this.defaultValue = hasDefaultValue ? defaultValue : null;
    }

    public static @NotNull ParameterDescriptor of(@NotNull String name, @NotNull Class<?> type) {
        return new ParameterDescriptor(name, type, false, null, false, false, null);
    }

    @Override
    public @NotNull String getName() {
        return name;
    }

    @Override
    public @NotNull Class<?> getType() {
        return type;
    }

    @Override
    public boolean isOptional() {
        return optional;
    }

    @Override
    public @Nullable String getKey() {
        return key;
    }

    @Override
    public boolean isFromParent() {
        return fromParent;
    }

    @Override
    public boolean hasDefaultValue() {
        return hasDefaultValue;
    }

    @Override
    public @Nullable Object getDefaultValue() {
        return defaultValue;
    }

    @Override
    public String toString() {
        return "parameter '" + name + "' of type " + type.getName();
    }
}
