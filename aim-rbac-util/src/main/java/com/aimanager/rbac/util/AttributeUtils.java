package com.aimanager.rbac.util;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lenient readers for loosely typed attribute maps (resource attributes, token claims,
 * source descriptors). None of these methods throw on a wrong value type.
 */
public final class AttributeUtils {

    private AttributeUtils() {
    }

    /**
     * @return the value as a string, or null when absent or null
     */
    public static String getString(Map<String, ?> attrs, String key) {
        if (attrs == null) {
            return null;
        }
        Object value = attrs.get(key);
        return value == null ? null : value.toString();
    }

    public static String getString(Map<String, ?> attrs, String key, String defaultValue) {
        String value = getString(attrs, key);
        return StringUtils.isBlank(value) ? defaultValue : value;
    }

    /**
     * Reads an integer from a number or a numeric string. Fractional or out of range values
     * are not rounded.
     *
     * @return empty when the value is present but is not exactly an integer
     */
    public static Optional<Integer> getInteger(Map<String, ?> attrs, String key, int defaultValue) {
        if (attrs == null || attrs.get(key) == null) {
            return Optional.of(defaultValue);
        }
        String text = attrs.get(key).toString().trim();
        try {
            return Optional.of(new BigDecimal(text).intValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            ExceptionLoggingUtils.logIgnoredException(e, "AttributeUtils.getInteger(" + key + ")");
            return Optional.empty();
        }
    }

    /**
     * Reads a boolean flag. Absent or null gives {@code defaultValue}; strings are parsed
     * case-insensitively.
     */
    public static boolean getBoolean(Map<String, ?> attrs, String key, boolean defaultValue) {
        if (attrs == null || attrs.get(key) == null) {
            return defaultValue;
        }
        Object value = attrs.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * Reads a list of strings from a collection, an array or a single value.
     */
    public static List<String> getStringList(Map<String, ?> attrs, String key) {
        if (attrs == null || attrs.get(key) == null) {
            return Collections.emptyList();
        }
        Object value = attrs.get(key);
        List<String> out = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object o : (Collection<?>) value) {
                if (o != null) {
                    out.add(o.toString());
                }
            }
        } else if (value instanceof Object[]) {
            for (Object o : (Object[]) value) {
                if (o != null) {
                    out.add(o.toString());
                }
            }
        } else {
            out.add(value.toString());
        }
        return out;
    }

    /**
     * Equality of two identifiers where a blank value on either side never matches.
     */
    public static boolean sameNonBlank(String left, String right) {
        return StringUtils.isNotBlank(left) && StringUtils.isNotBlank(right) && Objects.equals(left, right);
    }
}
