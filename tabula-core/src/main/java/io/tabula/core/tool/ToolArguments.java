package io.tabula.core.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class ToolArguments {

    private ToolArguments() {
    }

    static String requireText(Map<String, Object> args, String key) {
        String value = optionalText(args, key);
        if (value == null || value.isBlank()) {
            throw new ToolArgumentException("'" + key + "' is required");
        }
        return value;
    }

    static String optionalText(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        throw new ToolArgumentException("'" + key + "' must be a string");
    }

    static List<String> stringList(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new ToolArgumentException("'" + key + "' must be an array of strings");
        }
        List<String> out = new ArrayList<>();
        for (Object item : items) {
            out.add(item == null ? "" : String.valueOf(item));
        }
        return out;
    }

    static List<List<Object>> rows(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new ToolArgumentException("'" + key + "' must be an array of arrays");
        }
        List<List<Object>> rows = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof List<?> cells) {
                rows.add(new ArrayList<>(cells));
            } else if (item instanceof Map<?, ?> record) {
                rows.add(new ArrayList<>(record.values()));
            } else {
                throw new ToolArgumentException("'" + key + "' must contain arrays, found " + describe(item));
            }
        }
        return rows;
    }

    static Map<String, Object> object(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (!(value instanceof Map<?, ?> map)) {
            throw new ToolArgumentException("'" + key + "' must be an object");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
