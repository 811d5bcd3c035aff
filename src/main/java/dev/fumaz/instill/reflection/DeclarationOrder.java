package dev.fumaz.instill.reflection;

import org.jetbrains.annotations.NotNull;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The order in which a class declares its fields and methods, read from its class file.
 * <p>
 * {@link Class#getDeclaredFields()} and {@link Class#getDeclaredMethods()} return members in no particular order,
 * while javac writes them to the class file in source order. When the class file cannot be read, members are
 * ordered by name (and parameter types for methods) instead.
 */
public final class DeclarationOrder {

    private static final Logger LOGGER = Logger.getLogger(DeclarationOrder.class.getName());

    private final Map<String, Integer> fields;
    private final Map<String, Integer> methods;

    private DeclarationOrder(Map<String, Integer> fields, Map<String, Integer> methods) {
        this.fields = fields;
        this.methods = methods;
    }

    public static @NotNull DeclarationOrder of(@NotNull Class<?> type) {
        Map<String, Integer> fields = new HashMap<>();
        Map<String, Integer> methods = new HashMap<>();
        String resource = "/" + type.getName().replace('.', '/') + ".class";

        try (InputStream input = type.getResourceAsStream(resource)) {
            if (input == null) {
                LOGGER.log(Level.FINE, "No class file found for {0}, ordering members by name", type.getName());
                return new DeclarationOrder(fields, methods);
            }

            new ClassReader(input).accept(new ClassVisitor(Opcodes.ASM9) {
                @Override
                public FieldVisitor visitField(int access, String name, String descriptor, String signature,
                                               Object value) {
                    fields.putIfAbsent(name, fields.size());
                    return null;
                }

                @Override
                public MethodVisitor visitMethod(int access, String name, String descriptor, String signature,
                                                 String[] exceptions) {
                    methods.putIfAbsent(name + descriptor, methods.size());
                    return null;
                }
            }, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.FINE, "Unable to read the class file of " + type.getName() + ", ordering members by name",
                    e);
            fields.clear();
            methods.clear();
        }

        return new DeclarationOrder(fields, methods);
    }

    /**
     * Fields in declaration order. Fields missing from the class file follow, by name.
     */
    public @NotNull Comparator<Field> fieldOrder() {
        return Comparator.comparingInt((Field field) -> fields.getOrDefault(field.getName(), Integer.MAX_VALUE))
                .thenComparing(Field::getName);
    }

    /**
     * Methods in declaration order. Methods missing from the class file follow, by name and parameter types.
     */
    public @NotNull Comparator<Method> methodOrder() {
        return Comparator.comparingInt((Method method) -> methods.getOrDefault(
                        method.getName() + Type.getMethodDescriptor(method), Integer.MAX_VALUE))
                .thenComparing(Reflections.METHOD_ORDER);
    }
}
