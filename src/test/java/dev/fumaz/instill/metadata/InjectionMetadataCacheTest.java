package dev.fumaz.instill.metadata;

import dev.fumaz.instill.annotation.Inject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InjectionMetadataCacheTest {

    static class Service {
        @Inject
        String name;
    }

    static class Other {
    }

    private static final class CountingScanner implements InjectionScanner {
        private final InjectionScanner delegate = new AnnotationInjectionScanner();
        private final AtomicInteger scans = new AtomicInteger();

        @Override
        public InjectionMetadata scan(Class<?> type) {
            scans.incrementAndGet();
            return delegate.scan(type);
        }
    }

    @Test
    void returnsSameMetadataOnRepeatedRequests() {
        CountingScanner scanner = new CountingScanner();
        InjectionMetadataCache cache = new InjectionMetadataCache(scanner);

        InjectionMetadata first = cache.getOrCreate(Service.class);
        InjectionMetadata second = cache.getOrCreate(Service.class);

        assertSame(first, second);
        assertEquals(1, scanner.scans.get());
        assertEquals(Service.class, first.getType());
    }

    @Test
    void concurrentFirstRequestsScanOnce() throws Exception {
        CountingScanner scanner = new CountingScanner();
        InjectionMetadataCache cache = new InjectionMetadataCache(scanner);
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<InjectionMetadata>> futures = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return cache.getOrCreate(Service.class);
                }));
            }

            start.countDown();

            InjectionMetadata expected = futures.get(0).get(10, TimeUnit.SECONDS);

            for (Future<InjectionMetadata> future : futures) {
                assertSame(expected, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, scanner.scans.get(), "metadata for one type should be built exactly once");
    }

    @Test
    void tryGetDoesNotBuild() {
        CountingScanner scanner = new CountingScanner();
        InjectionMetadataCache cache = new InjectionMetadataCache(scanner);

        assertFalse(cache.tryGet(Service.class).isPresent());
        assertEquals(0, scanner.scans.get());

        InjectionMetadata built = cache.getOrCreate(Service.class);

        assertSame(built, cache.tryGet(Service.class).orElseThrow());
    }

    @Test
    void removeAndClearForceRebuild() {
        CountingScanner scanner = new CountingScanner();
        InjectionMetadataCache cache = new InjectionMetadataCache(scanner);

        InjectionMetadata first = cache.getOrCreate(Service.class);
        cache.getOrCreate(Other.class);
        assertEquals(2, cache.size());

        assertTrue(cache.remove(Service.class));
        assertFalse(cache.remove(Service.class));
        assertNotSame(first, cache.getOrCreate(Service.class));

        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(3, scanner.scans.get());
    }

    @Test
    void rejectsMetadataForAnotherType() {
        InjectionMetadataCache cache = new InjectionMetadataCache(type -> new AnnotationInjectionScanner().scan(Other.class));

        assertThrows(IllegalStateException.class, () -> cache.getOrCreate(Service.class));
        assertEquals(0, cache.size());
    }

    @Test
    void rejectsNullType() {
        InjectionMetadataCache cache = new InjectionMetadataCache();

        assertThrows(NullPointerException.class, () -> cache.getOrCreate(null));
    }
}
