package dev.fumaz.instill.injector;

import dev.fumaz.instill.annotation.Inject;
import dev.fumaz.instill.annotation.Order;
import dev.fumaz.instill.exception.ProvisionException;
import dev.fumaz.instill.exception.ServiceNotRegisteredException;
import dev.fumaz.instill.metadata.AnnotationInjectionScanner;
import dev.fumaz.instill.metadata.MethodDescriptor;
import dev.fumaz.instill.pool.ArgumentPool;
import dev.fumaz.instill.resolver.MapObjectResolver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MethodInjectorTest {

    private final ArgumentPool pool = new ArgumentPool(4, 8);
    private final MethodInjector injector = new MethodInjector(new ParameterResolver(), pool);

    static class Clock {
    }

    static class Lifecycle {
        final List<String> calls = new ArrayList<>();

        @Inject
        @Order(5)
        void a(Clock clock) {
            calls.add("A");
        }

        @Inject
        void b() {
            calls.add("B");
        }

        @Inject
        void c(Clock clock, @Inject(optional = true) String name) {
            calls.add("C");
        }
    }

    static class Broken {
        @Inject
        void explode(Clock clock) {
            throw new IllegalArgumentException("bad clock");
        }
    }

    private static List<MethodDescriptor> methodsOf(Class<?> type) {
        return new AnnotationInjectionScanner().scan(type).getMethods();
    }

    @Test
    void invokesMethodsInOrder() {
        Lifecycle lifecycle = new Lifecycle();
        MapObjectResolver resolver = new MapObjectResolver().register(Clock.class, new Clock());

        injector.inject(lifecycle, methodsOf(Lifecycle.class), resolver, null);

        assertEquals(List.of("B", "C", "A"), lifecycle.calls);
        assertEquals(0, pool.outstanding());
    }

    @Test
    void releasesArgumentsWhenResolutionFails() {
        Lifecycle lifecycle = new Lifecycle();

        assertThrows(ServiceNotRegisteredException.class,
                () -> injector.inject(lifecycle, methodsOf(Lifecycle.class), new MapObjectResolver(), null));

        assertEquals(List.of("B"), lifecycle.calls, "methods after the failing one are not invoked");
        assertEquals(0, pool.outstanding());
        assertEquals(1, pool.available(2));
    }

    @Test
    void wrapsMethodFailures() {
        MapObjectResolver resolver = new MapObjectResolver().register(Clock.class, new Clock());

        ProvisionException exception = assertThrows(ProvisionException.class,
                () -> injector.inject(new Broken(), methodsOf(Broken.class), resolver, null));

        assertInstanceOf(IllegalArgumentException.class, exception.getCause());
        assertTrue(exception.getMessage().contains("explode"), exception.getMessage());
        assertEquals(Broken.class, exception.getServiceType());
        assertEquals(0, pool.outstanding());
        assertEquals(1, pool.available(1));
    }

    @Test
    void emptyMethodListIsNoOp() {
        assertDoesNotThrow(() -> injector.inject(new Lifecycle(), List.of(), null, null));
    }

    @Test
    void rejectsNullInstance() {
        assertThrows(NullPointerException.class, () -> injector.inject(null, List.of(), new MapObjectResolver(), null));
    }
}
