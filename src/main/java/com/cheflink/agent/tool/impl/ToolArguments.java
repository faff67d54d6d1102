package com.cheflink.agent.tool.impl;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Readers for arguments that already passed schema validation.
 * JSON numbers arrive as Integer, Long or Double depending on the decoder.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String string(Map<String, Object> args, String name) {
        Object value = args.get(name);
        return value instanceof String s && !s.isBlank() ? s.trim() : null;
    }

    static Integer integer(Map<String, Object> args, String name, Integer defaultValue) {
        Object value = args.get(name);
        return value instanceof Number n ? Integer.valueOf(n.intValue()) : defaultValue;
    }

    static Double number(Map<String, Object> args, String name) {
        Object value = args.get(name);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    static List<String> strings(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }

    /**
     * @throws IllegalArgumentException when the value is not yyyy-MM-dd
     */
    static LocalDate date(Map<String, Object> args, String name) {
        String value = string(args, name);
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("'" + name + "' must be a date in yyyy-MM-dd format, got '" + value + "'");
        }
    }
}
