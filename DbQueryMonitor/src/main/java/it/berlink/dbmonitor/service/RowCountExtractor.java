package it.berlink.dbmonitor.service;

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collection;

/**
 * Best-effort row count of a query result.
 *
 * Checked in order: a {@code getRowCount()}/{@code rowCount()} accessor,
 * a {@code length()}/{@code getLength()} accessor or array length,
 * and finally the size of a collection result. Anything else yields {@code null}.
 */
@Slf4j
final class RowCountExtractor {

    private static final String[] ROW_COUNT_ACCESSORS = {"getRowCount", "rowCount"};
    private static final String[] LENGTH_ACCESSORS = {"getLength", "length"};

    private RowCountExtractor() {
    }

    static Integer extract(Object result) {
        if (result == null || result instanceof CharSequence) {
            return null;
        }

        try {
            Integer count = invokeNumberAccessor(result, ROW_COUNT_ACCESSORS);
            if (count != null) {
                return count;
            }
            if (result.getClass().isArray()) {
                return Array.getLength(result);
            }
            count = invokeNumberAccessor(result, LENGTH_ACCESSORS);
            if (count != null) {
                return count;
            }
            if (result instanceof Collection<?> collection) {
                return collection.size();
            }
        } catch (RuntimeException | ReflectiveOperationException e) {
            log.trace("Unable to extract row count from {}: {}", result.getClass().getName(), e.getMessage());
        }
        return null;
    }

    private static Integer invokeNumberAccessor(Object target, String[] names) throws ReflectiveOperationException {
        for (String name : names) {
            Method method = findAccessor(target.getClass(), name);
            if (method == null) {
                continue;
            }
            Object value = method.invoke(target);
            if (value instanceof Number number) {
                return number.intValue();
            }
        }
        return null;
    }

    private static Method findAccessor(Class<?> type, String name) {
        for (Method method : type.getMethods()) {
            if (method.getName().equals(name)
                    && method.getParameterCount() == 0
                    && !Modifier.isStatic(method.getModifiers())
                    && Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
                return method;
            }
        }
        return null;
    }
}
