package dev.fumaz.instill.metadata;

import org.jetbrains.annotations.NotNull;

/**
 * Reads the injection points of a type. Implementations must be side-effect free. The
 * {@link InjectionMetadataCache} calls them at most once per type.
 */
@FunctionalInterface
public interface InjectionScanner {

    @NotNull InjectionMetadata scan(@NotNull Class<?> type);

    /**
     * Releases anything cached while scanning. Called when the owning cache is cleared.
     */
    default void reset() {
    }

}
