package dev.fumaz.instill.util;

import dev.fumaz.instill.annotation.Default;
import dev.fumaz.instill.annotation.FromParent;
import dev.fumaz.instill.annotation.Inject;
import dev.fumaz.instill.annotation.Named;
import dev.fumaz.instill.annotation.Order;
import dev.fumaz.instill.exception.ConfigurationException;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;

public final class InjectionUtils {

    private InjectionUtils() {
    }

    public static boolean isOptional(Annotation[] annotations) {
        if (annotations == null) {
            return false;
        }

        for (Annotation annotation : annotations) {
            if (annotation instanceof Inject) {
                return ((Inject) annotation).optional();
            }
        }

        return false;
    }

    public static @Nullable String resolveKey(Annotation[] annotations) {
        if (annotations == null || annotations.length == 0) {
            return null;
        }

        for (Annotation annotation : annotations) {
            if (annotation instanceof Named) {
                String key = ((Named) annotation).value();

                if (key.isEmpty()) {
                    throw new ConfigurationException("@Named requires a non-empty key");
                }

                return key;
            }
        }

        return null;
    }

    public static boolean isFromParent(Annotation[] annotations) {
        return find(annotations, FromParent.class) != null;
    }

    public static int resolveOrder(Annotation[] annotations) {
        Order order = find(annotations, Order.class);
        return order == null ? 0 : order.value();
    }

    public static @Nullable String resolveDefaultLiteral(Annotation[] annotations) {
        Default value = find(annotations, Default.class);
        return value == null ? null : value.value();
    }

    private static <A extends Annotation> @Nullable A find(Annotation[] annotations, Class<A> type) {
        if (annotations == null) {
            return null;
        }

        for (Annotation annotation : annotations) {
            if (type.isInstance(annotation)) {
                return type.cast(annotation);
            }
        }

        return null;
    }
}
