package dev.fumaz.instill.benchmark;

import dev.fumaz.instill.annotation.Inject;
import dev.fumaz.instill.annotation.Named;
import dev.fumaz.instill.exception.ServiceNotRegisteredException;
import dev.fumaz.instill.injector.Injector;
import dev.fumaz.instill.resolver.InjectParameter;
import dev.fumaz.instill.resolver.InjectParameters;
import dev.fumaz.instill.resolver.ObjectResolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class InjectorBenchmark {

    @State(Scope.Benchmark)
    public static class InjectorState {

        Injector injector;
        ObjectResolver resolver;
        List<InjectParameter> overrides;
        CompositeService existing;

        @Setup(Level.Trial)
        public void setUp() {
            injector = Injector.create();

            HeavyComputation computation = new HeavyComputation();
            resolver = new StaticResolver()
                    .register(HeavyComputation.class, computation)
                    .register(ExpensiveDependency.class, new ExpensiveDependency(computation))
                    .registerKeyed(HeavyComputation.class, "secondary", new HeavyComputation());

            overrides = List.of(InjectParameters.named("label", "benchmark"));
            existing = injector.construct(CompositeService.class, resolver);
        }
    }

    @Benchmark
    public Object createInstance(InjectorState state) {
        return state.injector.createInstance(ExpensiveDependency.class, state.resolver);
    }

    @Benchmark
    public Object constructCompositeGraph(InjectorState state) {
        return state.injector.construct(CompositeService.class, state.resolver);
    }

    @Benchmark
    public Object constructWithOverrides(InjectorState state) {
        return state.injector.construct(CompositeService.class, state.resolver, state.overrides);
    }

    @Benchmark
    public Object injectExisting(InjectorState state) {
        state.injector.injectAll(state.existing, CompositeService.class, state.resolver);
        return state.existing;
    }

    @Benchmark
    public void unresolvedDependency(InjectorState state, Blackhole blackhole) {
        try {
            blackhole.consume(state.injector.createInstance(UnresolvableService.class, state.resolver));
        } catch (RuntimeException exception) {
            blackhole.consume(exception);
        }
    }

    private static final class StaticResolver implements ObjectResolver {
        private final Map<Class<?>, Object> instances = new HashMap<>();
        private final Map<String, Object> keyed = new HashMap<>();

        <T> StaticResolver register(Class<T> type, T instance) {
            instances.put(type, instance);
            return this;
        }

        <T> StaticResolver registerKeyed(Class<T> type, String key, T instance) {
            keyed.put(type.getName() + '#' + key, instance);
            return this;
        }

        @Override
        public <T> @NotNull T resolve(@NotNull Class<T> type) {
            return tryResolve(type).orElseThrow(() -> new ServiceNotRegisteredException(type));
        }

        @Override
        public <T> @NotNull Optional<T> tryResolve(@NotNull Class<T> type) {
            return Optional.ofNullable(type.cast(instances.get(type)));
        }

        @Override
        public <T> @NotNull T resolveKeyed(@NotNull Class<T> type, @NotNull String key) {
            Object instance = keyed.get(type.getName() + '#' + key);

            if (instance == null) {
                throw new ServiceNotRegisteredException(type, key);
            }

            return type.cast(instance);
        }

        @Override
        public @Nullable ObjectResolver getParent() {
            return null;
        }
    }

    public static class CompositeService {
        private final ExpensiveDependency expensiveDependency;
        private final HeavyComputation computation;
        private final String label;

        @Inject
        HeavyComputation fieldComputation;

        private HeavyComputation secondary;

        @Inject
        public CompositeService(ExpensiveDependency expensiveDependency,
                                HeavyComputation computation,
                                @Inject(optional = true) String label) {
            this.expensiveDependency = expensiveDependency;
            this.computation = computation;
            this.label = label;
        }

        @Inject
        public void initialise(@Named("secondary") HeavyComputation secondary) {
            this.secondary = secondary;
        }

        public int aggregate() {
            return expensiveDependency.value() + computation.compute() + fieldComputation.compute()
                    + secondary.compute() + (label == null ? 0 : label.length());
        }
    }

    public static class ExpensiveDependency {
        private final HeavyComputation heavyComputation;

        @Inject
        public ExpensiveDependency(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int value() {
            return heavyComputation.compute();
        }
    }

    public static class HeavyComputation {
        public int compute() {
            int result = 0;
            for (int i = 0; i < 16; i++) {
                result = (result * 31) ^ i;
            }
            return result;
        }
    }

    public static class UnresolvableService {
        public UnresolvableService(UnboundType unboundType) {
        }
    }

    public static class UnboundType {
    }
}
