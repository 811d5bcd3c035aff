package dev.fumaz.instill.injector;

import dev.fumaz.instill.annotation.Inject;
import dev.fumaz.instill.annotation.Named;
import dev.fumaz.instill.exception.ProvisionException;
import dev.fumaz.instill.exception.ServiceNotRegisteredException;
import dev.fumaz.instill.metadata.AnnotationInjectionScanner;
import dev.fumaz.instill.metadata.InjectionMetadata;
import dev.fumaz.instill.resolver.InjectParameters;
import dev.fumaz.instill.resolver.MapObjectResolver;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemberInjectorTest {

    private final ParameterResolver parameterResolver = new ParameterResolver();
    private final MemberInjector fieldInjector = MemberInjector.forFields(parameterResolver);
    private final MemberInjector propertyInjector = MemberInjector.forProperties(parameterResolver);

    static class Repository {
    }

    static class Fields {
        @Inject
        Repository repository;

        @Inject(optional = true)
        String greeting = "hello";

        @Inject(optional = true)
        int retries = 3;

        @Inject(optional = true)
        @Named("cache")
        Repository cache;
    }

    static class Bean {
        private Repository repository;
        private String label = "initial";

        @Inject
        public void setRepository(Repository repository) {
            this.repository = repository;
        }

        @Inject(optional = true)
        public void setLabel(String label) {
            this.label = label;
        }
    }

    static class Failing {
        @Inject
        public void setRepository(Repository repository) {
            throw new UnsupportedOperationException("read-only");
        }
    }

    private static InjectionMetadata scan(Class<?> type) {
        return new AnnotationInjectionScanner().scan(type);
    }

    @Test
    void injectsFieldsAndKeepsInitializersForMissingOptionals() {
        Repository repository = new Repository();
        MapObjectResolver resolver = new MapObjectResolver().register(Repository.class, repository);
        Fields fields = new Fields();

        fieldInjector.inject(fields, scan(Fields.class).getFields(), resolver, null);

        assertSame(repository, fields.repository);
        assertEquals("hello", fields.greeting, "an unresolved optional field keeps its initializer");
        assertEquals(3, fields.retries);
        assertNull(fields.cache);
    }

    @Test
    void overridesReachFields() {
        MapObjectResolver resolver = new MapObjectResolver().register(Repository.class, new Repository());
        Fields fields = new Fields();

        fieldInjector.inject(fields, scan(Fields.class).getFields(), resolver,
                List.of(InjectParameters.named("greeting", "bonjour"), InjectParameters.named("retries", 5)));

        assertEquals("bonjour", fields.greeting);
        assertEquals(5, fields.retries);
    }

    @Test
    void injectsKeyedOptionalFieldWhenRegistered() {
        Repository cache = new Repository();
        MapObjectResolver resolver = new MapObjectResolver()
                .register(Repository.class, new Repository())
                .registerKeyed(Repository.class, "cache", cache);
        Fields fields = new Fields();

        fieldInjector.inject(fields, scan(Fields.class).getFields(), resolver, null);

        assertSame(cache, fields.cache);
    }

    @Test
    void requiredFieldFailureStopsInjection() {
        Fields fields = new Fields();

        assertThrows(ServiceNotRegisteredException.class,
                () -> fieldInjector.inject(fields, scan(Fields.class).getFields(), new MapObjectResolver(), null));
    }

    @Test
    void injectsProperties() {
        Repository repository = new Repository();
        MapObjectResolver resolver = new MapObjectResolver().register(Repository.class, repository);
        Bean bean = new Bean();

        propertyInjector.inject(bean, scan(Bean.class).getProperties(), resolver, null);

        assertSame(repository, bean.repository);
        assertEquals("initial", bean.label);
    }

    @Test
    void wrapsSetterFailures() {
        MapObjectResolver resolver = new MapObjectResolver().register(Repository.class, new Repository());

        ProvisionException exception = assertThrows(ProvisionException.class,
                () -> propertyInjector.inject(new Failing(), scan(Failing.class).getProperties(), resolver, null));

        assertInstanceOf(UnsupportedOperationException.class, exception.getCause());
        assertTrue(exception.getMessage().contains("property repository"), exception.getMessage());
        assertTrue(exception.getMessage().contains(Failing.class.getName()));
    }

    @Test
    void wrapsResolverFailures() {
        MapObjectResolver resolver = new MapObjectResolver().register(Repository.class, new Repository());
        Fields fields = new Fields();

        ProvisionException exception = assertThrows(ProvisionException.class,
                () -> fieldInjector.inject(fields, scan(Fields.class).getFields(), resolver,
                        List.of(InjectParameters.factory((type, name) -> name.equals("greeting"), current -> {
                            throw new IllegalStateException("factory failed");
                        }))));

        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertTrue(exception.getMessage().contains("field greeting"), exception.getMessage());
    }

    @Test
    void emptyDescriptorsAreNoOp() {
        assertDoesNotThrow(() -> fieldInjector.inject(null, Collections.emptyList(), null, null));
        assertDoesNotThrow(() -> propertyInjector.inject(null, null, null, null));
    }

    @Test
    void rejectsNullInstanceWhenThereIsWorkToDo() {
        MapObjectResolver resolver = new MapObjectResolver();

        assertThrows(NullPointerException.class,
                () -> fieldInjector.inject(null, scan(Fields.class).getFields(), resolver, null));
        assertThrows(NullPointerException.class,
                () -> fieldInjector.inject(new Fields(), scan(Fields.class).getFields(), null, null));
    }

    @Test
    void reportsKind() {
        assertEquals("field", fieldInjector.getKind());
        assertEquals("property", propertyInjector.getKind());
    }
}
