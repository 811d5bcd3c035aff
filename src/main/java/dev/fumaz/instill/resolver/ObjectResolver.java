package dev.fumaz.instill.resolver;

import dev.fumaz.instill.exception.ResolutionException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * An {@link ObjectResolver} looks up already registered dependencies for the injector.
 * It is supplied by the container; the injector never registers anything itself.
 */
public interface ObjectResolver {

    /**
     * Resolves an instance of the given type.
     *
     * @throws ResolutionException if nothing is registered for the type
     */
    <T> @NotNull T resolve(@NotNull Class<T> type);

    /**
     * Attempts to resolve an instance of the given type, never failing because nothing is registered.
     */
    <T> @NotNull Optional<T> tryResolve(@NotNull Class<T> type);

    /**
     * Resolves the instance registered for the given type under the given key.
     *
     * @throws ResolutionException if nothing is registered under the key
     */
    <T> @NotNull T resolveKeyed(@NotNull Class<T> type, @NotNull String key);

    default <T> @NotNull Optional<T> tryResolveKeyed(@NotNull Class<T> type, @NotNull String key) {
        try {
            return Optional.of(resolveKeyed(type, key));
        } catch (ResolutionException e) {
            return Optional.empty();
        }
    }

    /**
     * @return the enclosing resolver, or {@code null} for a root resolver
     */
    @Nullable ObjectResolver getParent();

}
