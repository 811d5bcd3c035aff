package dev.fumaz.instill.metadata;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The immutable description of every injection point of one type.
 * <p>
 * Fields, properties and methods are listed most-derived type first. Methods are additionally sorted by
 * {@link MethodDescriptor#getOrder()}, keeping the collection order for equal values.
 */
public final class InjectionMetadata {

    private final Class<?> type;
    private final @Nullable ConstructorDescriptor constructor;
    private final List<MemberDescriptor> fields;
    private final List<MemberDescriptor> properties;
    private final List<MethodDescriptor> methods;

    public InjectionMetadata(@NotNull Class<?> type,
                             @Nullable ConstructorDescriptor constructor,
                             @NotNull List<MemberDescriptor> fields,
                             @NotNull List<MemberDescriptor> properties,
                             @NotNull List<MethodDescriptor> methods) {
        this.type = Objects.requireNonNull(type, "type");
        this.constructor = constructor;
        this.fields = List.copyOf(fields);
        this.properties = List.copyOf(properties);
        this.methods = methods.stream()
                .sorted(Comparator.comparingInt(MethodDescriptor::getOrder))
                .collect(Collectors.toUnmodifiableList());
    }

    public @NotNull Class<?> getType() {
        return type;
    }

    public @Nullable ConstructorDescriptor getConstructor() {
        return constructor;
    }

    public @NotNull List<MemberDescriptor> getFields() {
        return fields;
    }

    public @NotNull List<MemberDescriptor> getProperties() {
        return properties;
    }

    public @NotNull List<MethodDescriptor> getMethods() {
        return methods;
    }

    public boolean hasInjectionPoints() {
        return constructor != null || !fields.isEmpty() || !properties.isEmpty() || !methods.isEmpty();
    }

    @Override
    public String toString() {
        return "InjectionMetadata{" + type.getName()
                + ", constructor=" + (constructor == null ? "none" : constructor.getParameters().size() + " parameters")
                + ", fields=" + fields.size()
                + ", properties=" + properties.size()
                + ", methods=" + methods.size() + "}";
    }
}
