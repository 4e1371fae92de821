package org.Aayush.hashbox.core.attribute;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reflective extractor for a named attribute.
 *
 * <p>Accessors are resolved once per concrete class and cached. Safe to share between threads.</p>
 */
final class NamedAttributeExtractor<T> implements AttributeExtractor<T> {

    private final String name;
    private final String capitalized;
    private final ConcurrentHashMap<Class<?>, Accessor> accessorsByClass = new ConcurrentHashMap<>();

    NamedAttributeExtractor(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("attribute name must be non-blank");
        }
        this.name = name;
        this.capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    @Override
    public Object extract(T object) {
        if (object == null) {
            return MISSING;
        }
        if (object instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) object;
            if (!map.containsKey(name)) {
                return MISSING;
            }
            return map.get(name);
        }
        Accessor accessor = accessorsByClass.computeIfAbsent(object.getClass(), this::resolve);
        return accessor.read(object);
    }

    String name() {
        return name;
    }

    private Accessor resolve(Class<?> type) {
        for (String candidate : new String[]{name, "get" + capitalized, "is" + capitalized}) {
            Method method = findNoArgMethod(type, candidate);
            if (method != null) {
                method.trySetAccessible();
                return target -> invoke(method, target);
            }
        }
        Field field = findInstanceField(type, name);
        if (field != null) {
            field.trySetAccessible();
            return target -> readField(field, target);
        }
        return target -> MISSING;
    }

    private static Method findNoArgMethod(Class<?> type, String methodName) {
        try {
            Method method = type.getMethod(methodName);
            if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class) {
                return null;
            }
            return method;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }

    private static Field findInstanceField(Class<?> type, String fieldName) {
        try {
            Field field = type.getField(fieldName);
            return Modifier.isStatic(field.getModifiers()) ? null : field;
        } catch (NoSuchFieldException e) {
            return null;
        }
    }

    private Object invoke(Method method, Object target) {
        try {
            return method.invoke(target);
        } catch (IllegalAccessException e) {
            throw new AttributeExtractionException("Accessor " + method + " is not accessible", e);
        } catch (InvocationTargetException e) {
            throw new AttributeExtractionException(
                    "Accessor " + method + " failed while reading '" + name + "'", e.getCause());
        }
    }

    private static Object readField(Field field, Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException e) {
            throw new AttributeExtractionException("Field " + field + " is not accessible", e);
        }
    }

    @FunctionalInterface
    private interface Accessor {
        Object read(Object target);
    }
}
