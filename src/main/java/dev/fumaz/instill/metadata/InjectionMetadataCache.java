package dev.fumaz.instill.metadata;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds {@link InjectionMetadata} on first request and hands out the same instance afterwards.
 * <p>
 * Construction goes through {@link ConcurrentMap#computeIfAbsent}: concurrent first requests for one type run the
 * scanner exactly once, while requests for different types do not wait on each other.
 */
public final class InjectionMetadataCache {

    private static final Logger LOGGER = Logger.getLogger(InjectionMetadataCache.class.getName());

    private final @NotNull InjectionScanner scanner;
    private final @NotNull ConcurrentMap<Class<?>, InjectionMetadata> cache;

    public InjectionMetadataCache() {
        this(new AnnotationInjectionScanner());
    }

    public InjectionMetadataCache(@NotNull InjectionScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.cache = new ConcurrentHashMap<>();
    }

    public @NotNull InjectionMetadata getOrCreate(@NotNull Class<?> type) {
        Objects.requireNonNull(type, "type");

        InjectionMetadata cached = cache.get(type);

        if (cached != null) {
            return cached;
        }

        return cache.computeIfAbsent(type, this::build);
    }

    /**
     * Looks up metadata without building it.
     */
    public @NotNull Optional<InjectionMetadata> tryGet(@NotNull Class<?> type) {
        return Optional.ofNullable(cache.get(Objects.requireNonNull(type, "type")));
    }

    public boolean remove(@NotNull Class<?> type) {
        return cache.remove(Objects.requireNonNull(type, "type")) != null;
    }

    /**
     * Drops every cached entry and resets the scanner.
     */
    public void clear() {
        cache.clear();
        scanner.reset();
    }

    public int size() {
        return cache.size();
    }

    private InjectionMetadata build(Class<?> type) {
        InjectionMetadata metadata = scanner.scan(type);

        if (metadata.getType() != type) {
            throw new IllegalStateException("Scanner returned metadata for " + metadata.getType().getName()
                    + " when asked for " + type.getName());
        }

        LOGGER.log(Level.FINE, "Built {0}", metadata);
        return metadata;
    }
}
