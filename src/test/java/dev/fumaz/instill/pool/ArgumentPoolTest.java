package dev.fumaz.instill.pool;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgumentPoolTest {

    @Test
    void rentsArraysOfExactSize() {
        ArgumentPool pool = new ArgumentPool(4, 2);

        try (ArgumentBuffer buffer = pool.rent(3)) {
            assertEquals(3, buffer.array().length);
            assertEquals(3, buffer.size());
            assertEquals(1, pool.outstanding());
        }

        assertEquals(0, pool.outstanding());
        assertEquals(1, pool.available(3));
    }

    @Test
    void reusesReturnedArraysCleared() {
        ArgumentPool pool = new ArgumentPool(4, 2);
        Object[] first;

        try (ArgumentBuffer buffer = pool.rent(2)) {
            buffer.set(0, "a");
            buffer.set(1, "b");
            first = buffer.array();
        }

        try (ArgumentBuffer buffer = pool.rent(2)) {
            assertSame(first, buffer.array());
            assertArrayEquals(new Object[2], buffer.array(), "returned arrays must not keep references");
        }
    }

    @Test
    void emptyRentalsShareOneArray() {
        ArgumentPool pool = new ArgumentPool(4, 2);

        try (ArgumentBuffer first = pool.rent(0); ArgumentBuffer second = pool.rent(0)) {
            assertSame(first.array(), second.array());
            assertEquals(0, pool.outstanding());
        }
    }

    @Test
    void oversizedArraysAreNotRetained() {
        ArgumentPool pool = new ArgumentPool(2, 4);
        Object[] first;

        try (ArgumentBuffer buffer = pool.rent(5)) {
            first = buffer.array();
        }

        try (ArgumentBuffer buffer = pool.rent(5)) {
            assertNotSame(first, buffer.array());
        }

        assertEquals(0, pool.available(5));
        assertEquals(0, pool.outstanding());
    }

    @Test
    void capsRetainedArraysPerSize() {
        ArgumentPool pool = new ArgumentPool(4, 2);
        List<ArgumentBuffer> buffers = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            buffers.add(pool.rent(1));
        }

        assertEquals(5, pool.outstanding());
        buffers.forEach(ArgumentBuffer::close);

        assertEquals(0, pool.outstanding());
        assertEquals(2, pool.available(1));
    }

    @Test
    void closeIsIdempotent() {
        ArgumentPool pool = new ArgumentPool(4, 4);
        ArgumentBuffer buffer = pool.rent(2);

        buffer.close();
        buffer.close();

        assertTrue(buffer.isReleased());
        assertEquals(0, pool.outstanding());
        assertEquals(1, pool.available(2), "a double close must not return the array twice");
        assertThrows(IllegalStateException.class, buffer::array);
    }

    @Test
    void clearDropsIdleArrays() {
        ArgumentPool pool = new ArgumentPool(4, 4);
        pool.rent(1).close();
        pool.rent(3).close();

        pool.clear();

        assertEquals(0, pool.available(1));
        assertEquals(0, pool.available(3));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ArgumentPool(-1, 1));
        assertThrows(IllegalArgumentException.class, () -> new ArgumentPool(1, -1));
        assertThrows(IllegalArgumentException.class, () -> new ArgumentPool(1, 1).rent(-1));
    }
}
