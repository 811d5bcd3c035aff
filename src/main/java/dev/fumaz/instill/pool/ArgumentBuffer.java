package dev.fumaz.instill.pool;

import org.jetbrains.annotations.NotNull;

/**
 * A rented argument array. Use it with try-with-resources so the array goes back to its pool on every exit path.
 * Closing more than once has no further effect.
 */
public final class ArgumentBuffer implements AutoCloseable {

    private final ArgumentPool pool;
    private Object[] array;

    ArgumentBuffer(@NotNull ArgumentPool pool, @NotNull Object[] array) {
        this.pool = pool;
        this.array = array;
    }

    public @NotNull Object[] array() {
        Object[] current = array;

        if (current == null) {
            throw new IllegalStateException("Argument buffer has been returned to the pool");
        }

        return current;
    }

    public int size() {
        return array().length;
    }

    public void set(int index, Object value) {
        array()[index] = value;
    }

    public boolean isReleased() {
        return array == null;
    }

    @Override
    public void close() {
        Object[] current = array;

        if (current == null) {
            return;
        }

        array = null;
        pool.giveBack(current);
    }
}
