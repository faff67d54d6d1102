package com.cheflink.agent.tool;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks tool schemas at registration time and tool arguments at call time.
 *
 * Only the subset of JSON Schema the tools actually use is understood:
 * an object with typed properties, a required list, per-property enums and
 * an optional {@code additionalProperties: false}.
 */
public final class ToolSchemaValidator {

    private static final Set<String> KNOWN_TYPES =
            Set.of("string", "integer", "number", "boolean", "array", "object");

    private ToolSchemaValidator() {
    }

    /**
     * Fails fast on a schema the executor could not validate against.
     *
     * @throws IllegalStateException describing the first problem found
     */
    public static void checkSchema(String toolName, Map<String, Object> schema) {
        if (schema == null) {
            throw new IllegalStateException("Tool [" + toolName + "] has no input schema");
        }
        if (!"object".equals(schema.get("type"))) {
            throw new IllegalStateException("Tool [" + toolName + "] schema type must be 'object'");
        }
        Map<String, Object> properties = properties(schema);
        properties.forEach((name, raw) -> {
            if (!(raw instanceof Map<?, ?> property)) {
                throw new IllegalStateException(
                        "Tool [" + toolName + "] property '" + name + "' is not an object");
            }
            Object type = property.get("type");
            if (!(type instanceof String t) || !KNOWN_TYPES.contains(t)) {
                throw new IllegalStateException(
                        "Tool [" + toolName + "] property '" + name + "' has unsupported type: " + type);
            }
        });
        for (String required : required(schema)) {
            if (!properties.containsKey(required)) {
                throw new IllegalStateException(
                        "Tool [" + toolName + "] requires undeclared property '" + required + "'");
            }
        }
    }

    /**
     * @return human-readable violations; empty when the arguments are acceptable
     */
    public static List<String> validate(Map<String, Object> schema, Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        Map<String, Object> properties = properties(schema);

        for (String required : required(schema)) {
            if (args.get(required) == null) {
                violations.add("missing required argument '" + required + "'");
            }
        }

        boolean closed = Boolean.FALSE.equals(schema.get("additionalProperties"));

        for (Map.Entry<String, Object> entry : args.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            Object rawProperty = properties.get(name);

            if (rawProperty == null) {
                if (closed) {
                    violations.add("unexpected argument '" + name + "'");
                }
                continue;
            }
            if (value == null) {
                continue;
            }

            Map<?, ?> property = (Map<?, ?>) rawProperty;
            String type = (String) property.get("type");
            if (!matchesType(type, value)) {
                violations.add("argument '" + name + "' must be of type " + type
                        + " but was " + describe(value));
                continue;
            }

            Object allowed = property.get("enum");
            if (allowed instanceof Collection<?> values && !values.contains(value)) {
                violations.add("argument '" + name + "' must be one of " + values + " but was '" + value + "'");
            }
        }
        return violations;
    }

    static boolean matchesType(String type, Object value) {
        return switch (type) {
            case "string" -> value instanceof String;
            case "integer" -> isIntegral(value);
            case "number" -> value instanceof Number;
            case "boolean" -> value instanceof Boolean;
            case "array" -> value instanceof List<?>;
            case "object" -> value instanceof Map<?, ?>;
            default -> false;
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        // JSON decoders sometimes hand back 3.0 for 3
        if (value instanceof Double d) {
            return !d.isInfinite() && d == Math.rint(d);
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    private static String describe(Object value) {
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Number) return "number";
        if (value instanceof List<?>) return "array";
        if (value instanceof Map<?, ?>) return "object";
        return value.getClass().getSimpleName();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> properties(Map<String, Object> schema) {
        Object properties = schema.get("properties");
        return properties instanceof Map<?, ?> ? (Map<String, Object>) properties : Map.of();
    }

    private static List<String> required(Map<String, Object> schema) {
        Object required = schema.get("required");
        if (!(required instanceof Collection<?> names)) {
            return List.of();
        }
        return names.stream().map(String::valueOf).toList();
    }
}
