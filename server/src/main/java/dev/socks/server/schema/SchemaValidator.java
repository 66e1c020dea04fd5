package dev.socks.server.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Depth-first structural check of a JSON value against a {@link Schema}. Stateless.
 */
public final class SchemaValidator {

    private SchemaValidator() {
    }

    /**
     * @throws ValidationException naming the first violating field
     */
    public static void validate(JsonNode value, Schema schema) {
        if (value == null || !value.isObject()) {
            throw new ValidationException("Top-level JSON must be an object.", "",
                JsonType.OBJECT.wireName(), JsonType.of(value).wireName());
        }
        validate(value, schema, "");
    }

    private static void validate(JsonNode object, Schema schema, String prefix) {
        for (Map.Entry<String, Schema.Rule> entry : schema.fields().entrySet()) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            JsonNode field = object.get(entry.getKey());
            if (field == null) {
                throw new ValidationException("Missing key: " + path, path, null, null);
            }
            JsonType actual = JsonType.of(field);
            Schema.Rule rule = entry.getValue();
            if (rule instanceof Schema.TypeRule single) {
                if (actual != single.type()) {
                    throw new ValidationException("Wrong type for key '" + path + "' (expected " + single.type()
                        + ", got " + actual + ")", path, single.type().wireName(), actual.wireName());
                }
            } else if (rule instanceof Schema.AnyOfRule anyOf) {
                if (!anyOf.types().contains(actual)) {
                    String expected = anyOf.types().stream().map(JsonType::wireName)
                        .collect(Collectors.joining(", ", "[", "]"));
                    throw new ValidationException("Wrong type for key '" + path + "' (expected one of " + expected
                        + ", got " + actual + ")", path, expected, actual.wireName());
                }
            } else if (rule instanceof Schema.NestedRule nested) {
                if (actual != JsonType.OBJECT) {
                    throw new ValidationException("Expected object at key: " + path, path,
                        JsonType.OBJECT.wireName(), actual.wireName());
                }
                validate(field, nested.schema(), path);
            } else {
                throw new IllegalArgumentException("Unsupported schema rule: " + rule);
            }
        }
    }
}
