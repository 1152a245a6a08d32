package it.polimi.ds.ruleir.analyzer.resolve;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Python-like attribute access over Java objects.
 * <p>
 * Looked up, in order: map keys, enum constants and static fields of classes, record components, public fields,
 * and public {@code getX}/{@code isX} getters. Other methods are never invoked, even when named like the attribute.
 * When nothing matches a {@code snake_case} attribute, its {@code camelCase} form is tried as well.
 */
public final class Attributes {

    private static final Logger LOGGER = LoggerFactory.getLogger(Attributes.class);
    private static final Pattern SNAKE_CASE_SEPARATOR = Pattern.compile("_([a-z0-9])");

    private Attributes() {
    }

    /**
     * @return the attribute value, or null if the object has no such attribute or it could not be read
     */
    public static @Nullable Object get(Object target, String name) {
        if (target instanceof Map<?, ?> map)
            return map.get(name);

        if (target instanceof Class<?> clazz)
            return getStatic(clazz, name);

        final Object value = getInstance(target, name);
        if (value != null)
            return value;

        final String camelCase = toCamelCase(name);
        return camelCase.equals(name) ? null : getInstance(target, camelCase);
    }

    static String toCamelCase(String snakeCase) {
        return SNAKE_CASE_SEPARATOR
                .matcher(snakeCase)
                .replaceAll(m -> m.group(1).toUpperCase(Locale.ROOT));
    }

    private static @Nullable Object getStatic(Class<?> clazz, String name) {
        if (clazz.isEnum()) {
            for (Object constant : clazz.getEnumConstants()) {
                if (((Enum<?>) constant).name().equals(name))
                    return constant;
            }
        }

        try {
            final Field field = clazz.getField(name);
            if (Modifier.isStatic(field.getModifiers()))
                return read(field, null);
        } catch (NoSuchFieldException ex) {
            LOGGER.trace("No static field {} in {}", name, clazz.getName());
        } catch (IllegalAccessException | RuntimeException ex) {
            LOGGER.debug("Failed to read static field {} of {}", name, clazz.getName(), ex);
        }
        return null;
    }

    private static @Nullable Object getInstance(Object target, String name) {
        final Class<?> clazz = target.getClass();
        try {
            if (clazz.isRecord()) {
                for (RecordComponent component : clazz.getRecordComponents()) {
                    if (component.getName().equals(name))
                        return invoke(component.getAccessor(), target);
                }
            }

            try {
                return read(clazz.getField(name), target);
            } catch (NoSuchFieldException ex) {
                LOGGER.trace("No field {} in {}", name, clazz.getName());
            }

            final String capitalized = name.isEmpty()
                    ? name
                    : name.substring(0, 1).toUpperCase(Locale.ROOT) + name.substring(1);
            for (String methodName : new String[]{ "get" + capitalized, "is" + capitalized }) {
                final Method method = findGetter(clazz, methodName);
                if (method != null)
                    return invoke(method, target);
            }
        } catch (ReflectiveOperationException | RuntimeException ex) {
            LOGGER.debug("Failed to read attribute {} of {}", name, clazz.getName(), ex);
        }
        return null;
    }

    private static @Nullable Method findGetter(Class<?> clazz, String name) {
        try {
            final Method method = clazz.getMethod(name);
            return method.getReturnType() != void.class && !Modifier.isStatic(method.getModifiers())
                    ? method
                    : null;
        } catch (NoSuchMethodException ex) {
            return null;
        }
    }

    private static @Nullable Object read(Field field, @Nullable Object target) throws IllegalAccessException {
        field.trySetAccessible();
        return field.get(target);
    }

    private static @Nullable Object invoke(Method method, Object target) throws ReflectiveOperationException {
        method.trySetAccessible();
        return method.invoke(target);
    }
}
