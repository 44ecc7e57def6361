package com.codeprint.runtime;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.codeprint.code.AttributeResolver;
import com.codeprint.code.ResolutionFailureException;

/**
 * Attribute lookup over script values and plain Java objects.
 *
 * Script values answer through {@link HasAttributes}. On a {@link Class} the lookup tries a
 * public static field, then a public static method, then a public nested class. On any other
 * object it tries a public instance field, then a public method. Methods resolve to their
 * {@link Method}; overloads are ordered by parameter count, then signature, and the first wins.
 * Linkage and class initialisation errors surface as {@link ResolutionFailureException}.
 */
public final class DefaultAttributeResolver implements AttributeResolver {

    public static final DefaultAttributeResolver INSTANCE = new DefaultAttributeResolver();

    private static final Comparator<Method> OVERLOAD_ORDER =
            Comparator.comparingInt(Method::getParameterCount).thenComparing(Method::toGenericString);

    @Override
    public Object getAttribute(Object target, String name) {
        if (name == null) throw new ResolutionFailureException("attribute name is null");
        if (target == null) {
            throw new ResolutionFailureException("null has no attribute '" + name + "'");
        }
        if (target instanceof HasAttributes) {
            return ((HasAttributes) target).getAttribute(name);
        }
        try {
            if (target instanceof Class) {
                return staticAttribute((Class<?>) target, name);
            }
            return instanceAttribute(target, name);
        } catch (LinkageError e) {
            // reading a static field initialises its class; a failing initialiser lands here
            throw new ResolutionFailureException("cannot resolve '" + name + "' on "
                    + describe(target) + ": " + e, e);
        }
    }

    private static String describe(Object target) {
        return (target instanceof Class) ? ((Class<?>) target).getName() : target.getClass().getName();
    }

    private Object staticAttribute(Class<?> type, String name) {
        Field field = publicField(type, name);
        if (field != null && Modifier.isStatic(field.getModifiers())) {
            return read(field, null);
        }

        Method method = firstMethod(type, name, true);
        if (method != null) return method;

        for (Class<?> nested : type.getClasses()) {
            if (nested.getSimpleName().equals(name)) return nested;
        }

        throw new ResolutionFailureException("type " + type.getName() + " has no static attribute '" + name + "'");
    }

    private Object instanceAttribute(Object target, String name) {
        Class<?> type = target.getClass();

        Field field = publicField(type, name);
        if (field != null && !Modifier.isStatic(field.getModifiers())) {
            return read(field, target);
        }

        Method method = firstMethod(type, name, false);
        if (method != null) return method;

        throw new ResolutionFailureException("'" + type.getName() + "' object has no attribute '" + name + "'");
    }

    private static Field publicField(Class<?> type, String name) {
        try {
            return type.getField(name);
        } catch (NoSuchFieldException e) {
            return null;
        }
    }

    private static Method firstMethod(Class<?> type, String name, boolean statics) {
        List<Method> candidates = new ArrayList<>();
        for (Method m : type.getMethods()) {
            if (!m.getName().equals(name)) continue;
            if (statics && !Modifier.isStatic(m.getModifiers())) continue;
            candidates.add(m);
        }
        if (candidates.isEmpty()) return null;
        candidates.sort(OVERLOAD_ORDER);
        return candidates.get(0);
    }

    private static Object read(Field field, Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException | RuntimeException e) {
            throw new ResolutionFailureException("cannot read " + field.getDeclaringClass().getName()
                    + "." + field.getName() + ": " + e.getMessage(), e);
        }
    }
}
