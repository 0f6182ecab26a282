package com.deepansh.codeagent.tool;

import java.util.Map;

/**
 * Typed reads from the canonical argument map. Arguments have already passed
 * schema validation, so these only deal with defaults and numeric widening.
 */
public final class ToolArguments {

    private ToolArguments() {
    }

    public static String string(Map<String, Object> args, String key, String defaultValue) {
        Object value = args.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public static String requiredString(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            throw new IllegalArgumentException("'" + key + "' is required");
        }
        return value.toString();
    }

    public static int integer(Map<String, Object> args, String key, int defaultValue) {
        Object value = args.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Integer.parseInt(text.trim());
        }
        return defaultValue;
    }

    public static int clampedInteger(Map<String, Object> args, String key, int defaultValue, int min, int max) {
        return Math.max(min, Math.min(integer(args, key, defaultValue), max));
    }

    public static boolean bool(Map<String, Object> args, String key, boolean defaultValue) {
        Object value = args.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value == null ? defaultValue : Boolean.parseBoolean(value.toString());
    }
}
