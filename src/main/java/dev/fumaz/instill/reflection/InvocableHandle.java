package dev.fumaz.instill.reflection;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Invokes a constructor or method with a spread argument array.
 * The array length must equal {@link #getParameterCount()}.
 */
public interface InvocableHandle {

    @NotNull String getName();

    @NotNull Class<?> getDeclaringType();

    int getParameterCount();

    /**
     * @param target the receiver, ignored for constructors
     * @return the constructed instance, the method's return value, or {@code null} for void methods
     * @throws Throwable whatever the underlying constructor or method throws, unwrapped
     */
    @Nullable Object invoke(@Nullable Object target, @NotNull Object[] arguments) throws Throwable;

}
