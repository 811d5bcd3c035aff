package dev.fumaz.instill.resolver;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InjectParametersTest {

    @Test
    void typedMatchesExactTypeOnly() {
        InjectParameter parameter = InjectParameters.typed(CharSequence.class, "value");

        assertTrue(parameter.canSupply(CharSequence.class, "anything"));
        assertFalse(parameter.canSupply(String.class, "anything"));
        assertEquals("value", parameter.getValue(new MapObjectResolver()));
    }

    @Test
    void namedMatchesAnyType() {
        InjectParameter parameter = InjectParameters.named("port", 8080);

        assertTrue(parameter.canSupply(int.class, "port"));
        assertTrue(parameter.canSupply(Integer.class, "port"));
        assertFalse(parameter.canSupply(int.class, "host"));
    }

    @Test
    void ofRequiresTypeAndName() {
        InjectParameter parameter = InjectParameters.of(String.class, "host", "localhost");

        assertTrue(parameter.canSupply(String.class, "host"));
        assertFalse(parameter.canSupply(String.class, "name"));
        assertFalse(parameter.canSupply(Object.class, "host"));
    }

    @Test
    void factoryComputesFromResolver() {
        MapObjectResolver resolver = new MapObjectResolver().register(String.class, "registered");
        InjectParameter parameter = InjectParameters.factory((type, name) -> name.startsWith("label"),
                current -> current.resolve(String.class) + "!");

        assertTrue(parameter.canSupply(Object.class, "labelText"));
        assertEquals("registered!", parameter.getValue(resolver));
    }

    @Test
    void nullValuesAreAllowed() {
        InjectParameter parameter = InjectParameters.named("service", null);

        assertSame(null, parameter.getValue(new MapObjectResolver()));
    }

    @Test
    void rejectsNullMatchers() {
        assertThrows(NullPointerException.class, () -> InjectParameters.typed(null, "value"));
        assertThrows(NullPointerException.class, () -> InjectParameters.named(null, "value"));
    }
}
