package dev.fumaz.instill.resolver;

import dev.fumaz.instill.exception.ServiceNotRegisteredException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolver backed by plain maps, looking only at its own registrations.
 */
public final class MapObjectResolver implements ObjectResolver {

    private final @Nullable ObjectResolver parent;
    private final Map<Class<?>, Object> instances = new HashMap<>();
    private final Map<Class<?>, Map<String, Object>> keyedInstances = new HashMap<>();
    private int keyedLookups;

    public MapObjectResolver() {
        this(null);
    }

    public MapObjectResolver(@Nullable ObjectResolver parent) {
        this.parent = parent;
    }

    public <T> MapObjectResolver register(Class<T> type, T instance) {
        instances.put(type, instance);
        return this;
    }

    public <T> MapObjectResolver registerKeyed(Class<T> type, String key, T instance) {
        keyedInstances.computeIfAbsent(type, ignored -> new HashMap<>()).put(key, instance);
        return this;
    }

    public int getKeyedLookups() {
        return keyedLookups;
    }

    @Override
    public <T> @NotNull T resolve(@NotNull Class<T> type) {
        return tryResolve(type).orElseThrow(() -> new ServiceNotRegisteredException(type));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> @NotNull Optional<T> tryResolve(@NotNull Class<T> type) {
        return Optional.ofNullable((T) instances.get(type));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> @NotNull T resolveKeyed(@NotNull Class<T> type, @NotNull String key) {
        keyedLookups++;
        Object instance = keyedInstances.getOrDefault(type, Map.of()).get(key);

        if (instance == null) {
            throw new ServiceNotRegisteredException(type, key);
        }

        return (T) instance;
    }

    @Override
    public @Nullable ObjectResolver getParent() {
        return parent;
    }
}
