package dev.fumaz.instill.metadata;

import dev.fumaz.instill.reflection.MemberHandle;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Describes an injectable field or property. Members never carry a default value.
 */
public final class MemberDescriptor implements DependencyDescriptor {

    private final MemberHandle handle;
    private final boolean optional;
    private final @Nullable String key;
    private final boolean fromParent;

    public MemberDescriptor(@NotNull MemberHandle handle, boolean optional, @Nullable String key, boolean fromParent) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.optional = optional;
        this.key = key;
        this.fromParent = fromParent;
    }

    public @NotNull MemberHandle getHandle() {
        return handle;
    }

    @Override
    public @NotNull String getName() {
        return handle.getName();
    }

    @Override
    public @NotNull Class<?> getType() {
        return handle.getType();
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
        return false;
    }

    @Override
    public @Nullable Object getDefaultValue() {
        return null;
    }

    @Override
    public String toString() {
        return "member '" + getName() + "' of " + handle.getDeclaringType().getName();
    }
}
