package dev.socks.server.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON value kinds a schema can demand. Numbers are split into integral and fractional.
 */
public enum JsonType {
    NULL("null"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    FLOAT("float"),
    STRING("string"),
    ARRAY("array"),
    OBJECT("object");

    private final String wireName;

    JsonType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static JsonType of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isBoolean()) {
            return BOOLEAN;
        }
        if (node.isIntegralNumber()) {
            return INTEGER;
        }
        if (node.isNumber()) {
            return FLOAT;
        }
        if (node.isTextual()) {
            return STRING;
        }
        if (node.isArray()) {
            return ARRAY;
        }
        if (node.isObject()) {
            return OBJECT;
        }
        throw new IllegalArgumentException("Unsupported JSON node type: " + node.getNodeType());
    }

    @Override
    public String toString() {
        return wireName;
    }
}
