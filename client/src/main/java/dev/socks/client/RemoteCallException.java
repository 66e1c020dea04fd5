package dev.socks.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;

/**
 * The server answered with {@code success} false or missing. The exception message is the
 * server's {@code message} field.
 */
public class RemoteCallException extends IOException {

    private final String command;
    private final ObjectNode response;

    public RemoteCallException(String command, String message, ObjectNode response) {
        super(message);
        this.command = command;
        this.response = response;
    }

    public String command() {
        return command;
    }

    /**
     * The full failure envelope as received.
     */
    public ObjectNode response() {
        return response;
    }
}
