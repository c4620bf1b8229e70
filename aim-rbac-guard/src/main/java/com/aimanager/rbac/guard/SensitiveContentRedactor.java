package com.aimanager.rbac.guard;

import com.aimanager.rbac.model.Role;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rewrites money figures attached to sensitive business terms in free text. Applied for
 * roles below {@link Role#MANAGER}. The replacement tokens do not match the patterns, so
 * redacting twice gives the same text as redacting once.
 */
public final class SensitiveContentRedactor {

    private static final Map<Pattern, String> PATTERNS = ImmutableMap.of(
        Pattern.compile("salary[:\\s]+\\$[\\d,]+", Pattern.CASE_INSENSITIVE), "[SALARY REDACTED]",
        Pattern.compile("compensation[:\\s]+\\$[\\d,]+", Pattern.CASE_INSENSITIVE), "[COMPENSATION REDACTED]",
        Pattern.compile("revenue[:\\s]+\\$[\\d,]+[BMK]?", Pattern.CASE_INSENSITIVE), "[REVENUE REDACTED]",
        Pattern.compile("budget[:\\s]+\\$[\\d,]+[BMK]?", Pattern.CASE_INSENSITIVE), "[BUDGET REDACTED]");

    private SensitiveContentRedactor() {
    }

    public static boolean appliesTo(Role role) {
        return role == null || role.isBelow(Role.MANAGER);
    }

    public static String redact(Role role, String text) {
        if (text == null || text.isEmpty() || !appliesTo(role)) {
            return text;
        }
        String out = text;
        for (Map.Entry<Pattern, String> e : PATTERNS.entrySet()) {
            out = e.getKey().matcher(out).replaceAll(e.getValue());
        }
        return out;
    }
}
