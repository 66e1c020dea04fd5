package dev.socks.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Reserved envelope keys and helpers for building and reading envelopes.
 *
 * <pre>
 * request:  {"command": "fibo", "n": 10}
 * success:  {"success": true, "result": 55}
 * failure:  {"success": false, "message": "Unknown command: fib"}
 * </pre>
 */
public final class Envelopes {

    /** Name of the routed operation in a request. */
    public static final String COMMAND = "command";

    /** Boolean outcome flag of a response. A response without it counts as failed. */
    public static final String SUCCESS = "success";

    /** Human-readable failure text of a response. */
    public static final String MESSAGE = "message";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Envelopes() {
    }

    public static ObjectNode object() {
        return NODES.objectNode();
    }

    /**
     * Copy {@code result} and mark it successful.
     */
    public static ObjectNode okay(ObjectNode result) {
        ObjectNode response = result == null ? object() : result.deepCopy();
        response.put(SUCCESS, true);
        return response;
    }

    public static ObjectNode error(String message) {
        return error(null, message);
    }

    /**
     * Copy {@code partial} and mark it failed with {@code message}.
     */
    public static ObjectNode error(ObjectNode partial, String message) {
        ObjectNode response = partial == null ? object() : partial.deepCopy();
        response.put(SUCCESS, false);
        response.put(MESSAGE, message);
        return response;
    }

    public static boolean isSuccess(JsonNode envelope) {
        JsonNode flag = envelope == null ? null : envelope.get(SUCCESS);
        return flag != null && flag.isBoolean() && flag.booleanValue();
    }

    public static Optional<String> message(JsonNode envelope) {
        JsonNode message = envelope == null ? null : envelope.get(MESSAGE);
        return message != null && message.isTextual() ? Optional.of(message.textValue()) : Optional.empty();
    }

    public static Optional<String> command(JsonNode envelope) {
        JsonNode command = envelope == null ? null : envelope.get(COMMAND);
        return command != null && command.isTextual() ? Optional.of(command.textValue()) : Optional.empty();
    }
}
