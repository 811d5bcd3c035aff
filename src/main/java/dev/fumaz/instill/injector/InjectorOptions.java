package dev.fumaz.instill.injector;

import dev.fumaz.instill.metadata.AnnotationInjectionScanner;
import dev.fumaz.instill.metadata.InjectionScanner;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Configuration object controlling how an {@link Injector} reads injection points and pools argument arrays.
 */
public final class InjectorOptions {

    public static final int DEFAULT_MAX_POOLED_ARITY = 16;
    public static final int DEFAULT_MAX_RETAINED_PER_ARITY = 64;

    private final int maxPooledArity;
    private final int maxRetainedPerArity;
    private final InjectionScanner scanner;

    private InjectorOptions(int maxPooledArity, int maxRetainedPerArity, InjectionScanner scanner) {
        this.maxPooledArity = maxPooledArity;
        this.maxRetainedPerArity = maxRetainedPerArity;
        this.scanner = scanner;
    }

    public int getMaxPooledArity() {
        return maxPooledArity;
    }

    public int getMaxRetainedPerArity() {
        return maxRetainedPerArity;
    }

    public @NotNull InjectionScanner getScanner() {
        return scanner;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InjectorOptions defaults() {
        return builder().build();
    }

    public static final class Builder {
        private int maxPooledArity = DEFAULT_MAX_POOLED_ARITY;
        private int maxRetainedPerArity = DEFAULT_MAX_RETAINED_PER_ARITY;
        private InjectionScanner scanner;

        /**
         * Argument arrays longer than this are allocated per call instead of pooled.
         */
        public Builder maxPooledArity(int maxPooledArity) {
            if (maxPooledArity < 0) {
                throw new IllegalArgumentException("maxPooledArity must not be negative: " + maxPooledArity);
            }

            this.maxPooledArity = maxPooledArity;
            return this;
        }

        public Builder maxRetainedPerArity(int maxRetainedPerArity) {
            if (maxRetainedPerArity < 0) {
                throw new IllegalArgumentException("maxRetainedPerArity must not be negative: " + maxRetainedPerArity);
            }

            this.maxRetainedPerArity = maxRetainedPerArity;
            return this;
        }

        public Builder scanner(@NotNull InjectionScanner scanner) {
            this.scanner = Objects.requireNonNull(scanner, "scanner");
            return this;
        }

        public InjectorOptions build() {
            InjectionScanner finalScanner = scanner != null ? scanner : new AnnotationInjectionScanner();
            return new InjectorOptions(maxPooledArity, maxRetainedPerArity, finalScanner);
        }
    }
}
