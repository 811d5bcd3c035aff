package dev.fumaz.instill.resolver;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Factories for the common kinds of {@link InjectParameter}.
 */
public final class InjectParameters {

    private InjectParameters() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * Supplies {@code value} to every injection point declared with exactly {@code type}.
     */
    public static @NotNull InjectParameter typed(@NotNull Class<?> type, @Nullable Object value) {
        Objects.requireNonNull(type, "type");
        return new FixedParameter((candidateType, name) -> candidateType == type, value,
                "typed(" + type.getName() + ")");
    }

    /**
     * Supplies {@code value} to every injection point with the given name.
     */
    public static @NotNull InjectParameter named(@NotNull String name, @Nullable Object value) {
        Objects.requireNonNull(name, "name");
        return new FixedParameter((type, candidateName) -> name.equals(candidateName), value,
                "named(" + name + ")");
    }

    public static @NotNull InjectParameter of(@NotNull Class<?> type, @NotNull String name, @Nullable Object value) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        return new FixedParameter((candidateType, candidateName) -> candidateType == type
                && name.equals(candidateName), value, "of(" + type.getName() + ", " + name + ")");
    }

    /**
     * Supplies a value computed from the current resolver whenever {@code matcher} accepts the injection point.
     */
    public static @NotNull InjectParameter factory(@NotNull BiPredicate<Class<?>, String> matcher,
                                                   @NotNull Function<ObjectResolver, Object> factory) {
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(factory, "factory");

        return new InjectParameter() {
            @Override
            public boolean canSupply(@NotNull Class<?> type, @NotNull String name) {
                return matcher.test(type, name);
            }

            @Override
            public @Nullable Object getValue(@NotNull ObjectResolver resolver) {
                return factory.apply(resolver);
            }
        };
    }

    private static final class FixedParameter implements InjectParameter {
        private final BiPredicate<Class<?>, String> matcher;
        private final @Nullable Object value;
        private final String description;

        private FixedParameter(BiPredicate<Class<?>, String> matcher, @Nullable Object value, String description) {
            this.matcher = matcher;
            this.value = value;
            this.description = description;
        }

        @Override
        public boolean canSupply(@NotNull Class<?> type, @NotNull String name) {
            return matcher.test(type, name);
        }

        @Override
        public @Nullable Object getValue(@NotNull ObjectResolver resolver) {
            return value;
        }

        @Override
        public String toString() {
            return "InjectParameter." + description;
        }
    }
}
