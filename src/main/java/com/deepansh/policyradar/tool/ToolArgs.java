package com.deepansh.policyradar.tool;

import java.util.Map;

/**
 * Lenient readers for model-supplied arguments. Models send numbers as strings and
 * strings as numbers often enough that strict casting is not an option.
 */
public final class ToolArgs {

    private ToolArgs() {}

    public static String string(Map<String, Object> args, String key) {
        Object raw = args.get(key);
        if (raw == null) return null;
        String s = raw.toString().trim();
        return s.isEmpty() ? null : s;
    }

    public static String string(Map<String, Object> args, String key, String fallback) {
        String s = string(args, key);
        return s != null ? s : fallback;
    }

    public static int clampedInt(Map<String, Object> args, String key, int fallback, int min, int max) {
        Object raw = args.get(key);
        if (raw == null) return fallback;
        try {
            int val = raw instanceof Number n ? n.intValue() : (int) Double.parseDouble(raw.toString().trim());
            return Math.min(Math.max(val, min), max);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static Integer optionalInt(Map<String, Object> args, String key) {
        Object raw = args.get(key);
        if (raw == null) return null;
        try {
            return raw instanceof Number n ? n.intValue() : (int) Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) return "";
        return value.length() <= max ? value : value.substring(0, max);
    }
}
