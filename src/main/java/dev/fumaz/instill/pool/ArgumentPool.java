package dev.fumaz.instill.pool;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Recycles argument arrays for constructor and method invocations.
 * <p>
 * Arrays are kept per exact length, since spread method handles reject arrays of any other size. Lengths above
 * {@code maxPooledArity} are allocated on demand and dropped on return. Each bucket retains at most
 * {@code maxRetainedPerArity} arrays.
 */
public final class ArgumentPool {

    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final int maxPooledArity;
    private final int maxRetainedPerArity;
    private final ConcurrentLinkedDeque<Object[]>[] buckets;
    private final AtomicInteger[] retained;
    private final AtomicInteger outstanding;

    @SuppressWarnings("unchecked")
    public ArgumentPool(int maxPooledArity, int maxRetainedPerArity) {
        if (maxPooledArity < 0) {
            throw new IllegalArgumentException("maxPooledArity must not be negative: " + maxPooledArity);
        }

        if (maxRetainedPerArity < 0) {
            throw new IllegalArgumentException("maxRetainedPerArity must not be negative: " + maxRetainedPerArity);
        }

        this.maxPooledArity = maxPooledArity;
        this.maxRetainedPerArity = maxRetainedPerArity;
        this.buckets = new ConcurrentLinkedDeque[maxPooledArity + 1];
        this.retained = new AtomicInteger[maxPooledArity + 1];
        this.outstanding = new AtomicInteger();

        for (int i = 0; i <= maxPooledArity; i++) {
            buckets[i] = new ConcurrentLinkedDeque<>();
            retained[i] = new AtomicInteger();
        }
    }

    /**
     * Rents an array of exactly {@code size} elements. Close the returned buffer to give the array back.
     */
    public @NotNull ArgumentBuffer rent(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }

        if (size == 0) {
            return new ArgumentBuffer(this, NO_ARGUMENTS);
        }

        Object[] array = null;

        if (size <= maxPooledArity) {
            array = buckets[size].pollLast();

            if (array != null) {
                retained[size].decrementAndGet();
            }
        }

        if (array == null) {
            array = new Object[size];
        }

        outstanding.incrementAndGet();
        return new ArgumentBuffer(this, array);
    }

    void giveBack(Object[] array) {
        int size = array.length;

        if (size == 0) {
            return;
        }

        outstanding.decrementAndGet();
        Arrays.fill(array, null);

        if (size > maxPooledArity) {
            return;
        }

        if (retained[size].incrementAndGet() > maxRetainedPerArity) {
            retained[size].decrementAndGet();
            return;
        }

        buckets[size].offerLast(array);
    }

    /**
     * @return the number of idle arrays of the given length
     */
    public int available(int size) {
        if (size <= 0 || size > maxPooledArity) {
            return 0;
        }

        return retained[size].get();
    }

    /**
     * @return the number of rented, non-empty arrays that have not been returned yet
     */
    public int outstanding() {
        return outstanding.get();
    }

    public int getMaxPooledArity() {
        return maxPooledArity;
    }

    public int getMaxRetainedPerArity() {
        return maxRetainedPerArity;
    }

    /**
     * Drops every idle array. Rented arrays are unaffected and may still be returned.
     */
    public void clear() {
        for (int i = 1; i <= maxPooledArity; i++) {
            while (buckets[i].pollLast() != null) {
                retained[i].decrementAndGet();
            }
        }
    }
}
