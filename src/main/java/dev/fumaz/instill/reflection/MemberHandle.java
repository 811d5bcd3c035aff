package dev.fumaz.instill.reflection;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Write access to one field or property of an instance.
 */
public interface MemberHandle {

    @NotNull String getName();

    @NotNull Class<?> getType();

    @NotNull Class<?> getDeclaringType();

    void set(@NotNull Object target, @Nullable Object value) throws Throwable;

}
