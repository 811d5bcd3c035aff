package dev.fumaz.instill.metadata;

import dev.fumaz.instill.annotation.Inject;
import dev.fumaz.instill.exception.ConfigurationException;
import dev.fumaz.instill.reflection.DeclarationOrder;
import dev.fumaz.instill.reflection.Handles;
import dev.fumaz.instill.reflection.ReflectionException;
import dev.fumaz.instill.reflection.Reflections;
import dev.fumaz.instill.util.InjectionUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds {@link InjectionMetadata} from {@link Inject}, {@link dev.fumaz.instill.annotation.Named},
 * {@link dev.fumaz.instill.annotation.FromParent}, {@link dev.fumaz.instill.annotation.Order} and
 * {@link dev.fumaz.instill.annotation.Default} annotations.
 * <p>
 * The hierarchy is walked from the given type up to, but excluding, {@link Object}. Within one class, fields and
 * methods are visited in declaration order as recorded in the class file (see {@link DeclarationOrder}). A method
 * overridden further down the hierarchy is only considered at its most-derived declaration.
 */
public class AnnotationInjectionScanner implements InjectionScanner {

    private static final Logger LOGGER = Logger.getLogger(AnnotationInjectionScanner.class.getName());

    private final @NotNull Handles handles;

    public AnnotationInjectionScanner() {
        this(new Handles());
    }

    public AnnotationInjectionScanner(@NotNull Handles handles) {
        this.handles = Objects.requireNonNull(handles, "handles");
    }

    @Override
    public @NotNull InjectionMetadata scan(@NotNull Class<?> type) {
        ConstructorDescriptor constructor = selectConstructor(type);
        List<MemberDescriptor> fields = new ArrayList<>();
        List<MemberDescriptor> properties = new ArrayList<>();
        List<MethodDescriptor> methods = new ArrayList<>();
        Map<String, Class<?>> overriding = new HashMap<>();

        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            DeclarationOrder order = DeclarationOrder.of(current);
            collectFields(current, order, fields);
            collectMethods(current, order, properties, methods, overriding);
        }

        return new InjectionMetadata(type, constructor, fields, properties, methods);
    }

    /**
     * Drops the private lookups cached while scanning.
     */
    @Override
    public void reset() {
        handles.clear();
    }

    public @NotNull Handles getHandles() {
        return handles;
    }

    protected @Nullable ConstructorDescriptor selectConstructor(@NotNull Class<?> type) {
        int modifiers = type.getModifiers();

        if (type.isInterface() || type.isPrimitive() || type.isArray() || type.isEnum()
                || Modifier.isAbstract(modifiers)) {
            return null;
        }

        Constructor<?>[] constructors = type.getDeclaredConstructors();
        Arrays.sort(constructors, Reflections.CONSTRUCTOR_ORDER);

        Constructor<?> selected = null;

        for (Constructor<?> constructor : constructors) {
            if (!constructor.isSynthetic() && constructor.isAnnotationPresent(Inject.class)) {
                selected = constructor;
                break;
            }
        }

        if (selected == null) {
            for (Constructor<?> constructor : constructors) {
                if (!constructor.isSynthetic() && Modifier.isPublic(constructor.getModifiers())) {
                    selected = constructor;
                    break;
                }
            }
        }

        if (selected == null) {
            LOGGER.log(Level.FINE, "No injectable constructor found for {0}", type.getName());
            return null;
        }

        List<ParameterDescriptor> parameters = createParameters(selected.getParameters(), type);
        return new ConstructorDescriptor(handles.constructor(selected), parameters);
    }

    private void collectFields(Class<?> current, DeclarationOrder order, List<MemberDescriptor> fields) {
        Field[] declared = current.getDeclaredFields();
        Arrays.sort(declared, order.fieldOrder());

        for (Field field : declared) {
            if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                continue;
            }

            Inject inject = field.getAnnotation(Inject.class);

            if (inject == null) {
                continue;
            }

            Annotation[] annotations = field.getAnnotations();
            fields.add(new MemberDescriptor(handles.field(field), inject.optional(),
                    InjectionUtils.resolveKey(annotations), InjectionUtils.isFromParent(annotations)));
        }
    }

    private void collectMethods(Class<?> current,
                                DeclarationOrder order,
                                List<MemberDescriptor> properties,
                                List<MethodDescriptor> methods,
                                Map<String, Class<?>> overriding) {
        Method[] declared = current.getDeclaredMethods();
        Arrays.sort(declared, order.methodOrder());

        for (Method method : declared) {
            if (Reflections.isStatic(method)) {
                continue;
            }

            if (method.isBridge()) {
                // an override bridge hides the erased declaration inherited from the superclass
                if (Reflections.bridgesOverride(current, method)) {
                    overriding.putIfAbsent(Reflections.signature(method), current);
                }

                continue;
            }

            if (method.isSynthetic()) {
                continue;
            }

            String signature = Reflections.signature(method);
            Class<?> override = overriding.get(signature);

            if (override != null && Reflections.isOverridableFrom(method, override.getPackage())) {
                continue;
            }

            if (!Modifier.isPrivate(method.getModifiers())) {
                overriding.putIfAbsent(signature, current);
            }

            Inject inject = method.getAnnotation(Inject.class);

            if (inject == null) {
                continue;
            }

            if (Reflections.isSetter(method)) {
                properties.add(createProperty(method, method, inject));
            } else if (Reflections.isGetter(method)) {
                Method setter = Reflections.findDeclaredSetter(current, method);

                if (setter == null) {
                    LOGGER.log(Level.FINE, "Skipping read-only property {0} of {1}",
                            new Object[]{Reflections.propertyName(method), current.getName()});
                    continue;
                }

                if (setter.isAnnotationPresent(Inject.class)) {
                    continue;
                }

                properties.add(createProperty(method, setter, inject));
            } else {
                Annotation[] annotations = method.getAnnotations();
                List<ParameterDescriptor> parameters = createParameters(method.getParameters(), current);
                methods.add(new MethodDescriptor(handles.method(method), InjectionUtils.resolveOrder(annotations),
                        parameters));
            }
        }
    }

    private MemberDescriptor createProperty(Method annotated, Method setter, Inject inject) {
        Annotation[] annotations = annotated.getAnnotations();
        String name = Reflections.propertyName(setter);

        return new MemberDescriptor(handles.property(name, setter), inject.optional(),
                InjectionUtils.resolveKey(annotations), InjectionUtils.isFromParent(annotations));
    }

    protected @NotNull List<ParameterDescriptor> createParameters(@NotNull Parameter[] reflectionParameters,
                                                                  @NotNull Class<?> declaringType) {
        List<ParameterDescriptor> parameters = new ArrayList<>(reflectionParameters.length);

        for (Parameter parameter : reflectionParameters) {
            Annotation[] annotations = parameter.getAnnotations();
            Class<?> parameterType = parameter.getType();
            String literal = InjectionUtils.resolveDefaultLiteral(annotations);
            boolean hasDefaultValue = literal != null;
            Object defaultValue = null;

            if (hasDefaultValue) {
                try {
                    defaultValue = Reflections.convertLiteral(literal, parameterType);
                } catch (ReflectionException e) {
                    throw new ConfigurationException("Invalid @Default on parameter " + parameter.getName()
                            + " of " + declaringType.getName(), e);
                }
            }

            boolean optional = InjectionUtils.isOptional(annotations) || hasDefaultValue;

            parameters.add(new ParameterDescriptor(parameter.getName(), parameterType, optional,
                    InjectionUtils.resolveKey(annotations), InjectionUtils.isFromParent(annotations),
                    hasDefaultValue, defaultValue));
        }

        return parameters;
    }
}
