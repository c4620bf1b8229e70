package com.aimanager.rbac.context;

import jakarta.json.JsonArray;
import jakarta.json.JsonNumber;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Converts token claim values, which may arrive as JSON-P values, to plain Java values.
 */
final class ClaimValues {

    private ClaimValues() {
    }

    static Object toJava(Object value) {
        if (value == null || value == JsonValue.NULL) {
            return null;
        }
        if (value instanceof JsonString) {
            return ((JsonString) value).getString();
        }
        if (value instanceof JsonNumber) {
            return ((JsonNumber) value).numberValue();
        }
        if (value == JsonValue.TRUE) {
            return Boolean.TRUE;
        }
        if (value == JsonValue.FALSE) {
            return Boolean.FALSE;
        }
        if (value instanceof JsonArray) {
            List<Object> out = new ArrayList<>();
            for (JsonValue v : (JsonArray) value) {
                out.add(toJava(v));
            }
            return out;
        }
        if (value instanceof Collection && !(value instanceof List)) {
            return new ArrayList<>((Collection<?>) value);
        }
        return value;
    }
}
