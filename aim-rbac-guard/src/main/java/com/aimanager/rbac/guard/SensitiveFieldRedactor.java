package com.aimanager.rbac.guard;

import com.aimanager.rbac.model.Role;
import com.aimanager.rbac.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Replaces the values of personal or compensation fields in response payloads for roles
 * below {@link Role#LEADERSHIP}. A key is sensitive when its lowercase form contains one of
 * {@link #DEFAULT_SENSITIVE_FIELDS}. Nested objects, and objects inside lists, are handled to
 * a depth of {@value #MAX_DEPTH}; deeper content is returned as is. Inputs are never modified.
 */
@ApplicationScoped
public class SensitiveFieldRedactor {

    public static final String REDACTED = "[REDACTED]";
    public static final int MAX_DEPTH = 10;
    public static final List<String> DEFAULT_SENSITIVE_FIELDS = List.of(
        "salary", "compensation", "ssn", "social_security", "bank_account",
        "personal_email", "home_address", "phone_number");

    private final List<String> sensitiveFields;

    public SensitiveFieldRedactor() {
        this(DEFAULT_SENSITIVE_FIELDS);
    }

    public SensitiveFieldRedactor(List<String> sensitiveFields) {
        this.sensitiveFields = List.copyOf(sensitiveFields);
    }

    public boolean appliesTo(Role role) {
        return role == null || role.isBelow(Role.LEADERSHIP);
    }

    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String lower = key.toLowerCase(Locale.ROOT);
        for (String field : sensitiveFields) {
            if (lower.contains(field)) {
                return true;
            }
        }
        return false;
    }

    public Map<String, Object> redact(Role role, Map<String, ?> data) {
        if (data == null) {
            return null;
        }
        if (!appliesTo(role)) {
            return new LinkedHashMap<>(data);
        }
        return redactMap(data, 0);
    }

    public JsonNode redact(Role role, JsonNode data) {
        if (data == null) {
            return null;
        }
        if (!appliesTo(role)) {
            return data.deepCopy();
        }
        return redactNode(data, 0);
    }

    /**
     * Redacts any response object by rendering it as a Jackson tree first, so field names are
     * matched by their wire names.
     */
    public JsonNode redactPayload(Role role, Object payload) {
        if (payload == null) {
            return null;
        }
        return redact(role, JsonUtils.instance().toTree(payload));
    }

    private Map<String, Object> redactMap(Map<?, ?> data, int depth) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : data.entrySet()) {
            String key = String.valueOf(e.getKey());
            Object value = e.getValue();
            if (depth > MAX_DEPTH) {
                out.put(key, value);
            } else if (isSensitive(key)) {
                out.put(key, REDACTED);
            } else if (value instanceof Map) {
                out.put(key, redactMap((Map<?, ?>) value, depth + 1));
            } else if (value instanceof Collection) {
                List<Object> items = new ArrayList<>();
                for (Object item : (Collection<?>) value) {
                    items.add(item instanceof Map ? redactMap((Map<?, ?>) item, depth + 1) : item);
                }
                out.put(key, items);
            } else {
                out.put(key, value);
            }
        }
        return out;
    }

    private JsonNode redactNode(JsonNode node, int depth) {
        if (!node.isObject() || depth > MAX_DEPTH) {
            return node.deepCopy();
        }
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            JsonNode value = e.getValue();
            if (isSensitive(e.getKey())) {
                out.put(e.getKey(), REDACTED);
            } else if (value.isObject()) {
                out.set(e.getKey(), redactNode(value, depth + 1));
            } else if (value.isArray()) {
                ArrayNode items = JsonNodeFactory.instance.arrayNode();
                for (JsonNode item : value) {
                    items.add(item.isObject() ? redactNode(item, depth + 1) : item.deepCopy());
                }
                out.set(e.getKey(), items);
            } else {
                out.set(e.getKey(), value.deepCopy());
            }
        }
        return out;
    }
}
