package dev.fumaz.instill.metadata;

import dev.fumaz.instill.reflection.InvocableHandle;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

public final class MethodDescriptor {

    private final InvocableHandle handle;
    private final int order;
    private final List<ParameterDescriptor> parameters;

    public MethodDescriptor(@NotNull InvocableHandle handle, int order, @NotNull List<ParameterDescriptor> parameters) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.order = order;
        this.parameters = List.copyOf(parameters);

        if (this.parameters.size() != handle.getParameterCount()) {
            throw new IllegalArgumentException("Method " + handle.getName() + " takes " + handle.getParameterCount()
                    + " parameters but " + this.parameters.size() + " were described");
        }
    }

    public @NotNull InvocableHandle getHandle() {
        return handle;
    }

    public @NotNull String getName() {
        return handle.getName();
    }

    public int getOrder() {
        return order;
    }

    public @NotNull List<ParameterDescriptor> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "method " + handle + " [order=" + order + "]";
    }
}
