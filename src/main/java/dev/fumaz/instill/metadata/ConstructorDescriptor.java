package dev.fumaz.instill.metadata;

import dev.fumaz.instill.reflection.InvocableHandle;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class ConstructorDescriptor {

    private final InvocableHandle handle;
    private final List<ParameterDescriptor> parameters;

    public ConstructorDescriptor(@NotNull InvocableHandle handle, @NotNull List<ParameterDescriptor> parameters) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.parameters = List.copyOf(parameters);

        if (this.parameters.size() != handle.getParameterCount()) {
            throw new IllegalArgumentException("Constructor of " + handle.getDeclaringType().getName() + " takes "
                    + handle.getParameterCount() + " parameters but " + this.parameters.size() + " were described");
        }
    }

    public static @NotNull ConstructorDescriptor parameterless(@NotNull InvocableHandle handle) {
        return new ConstructorDescriptor(handle, Collections.emptyList());
    }

    public @NotNull InvocableHandle getHandle() {
        return handle;
    }

    public @NotNull Class<?> getDeclaringType() {
        return handle.getDeclaringType();
    }

    public @NotNull List<ParameterDescriptor> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "constructor " + handle;
    }
}
