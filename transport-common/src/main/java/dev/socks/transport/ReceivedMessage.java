package dev.socks.transport;

import java.util.Objects;

/**
 * One inbound message and the handle to answer it with.
 */
public record ReceivedMessage(byte[] payload, ClientHandle handle) {

    public ReceivedMessage {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(handle, "handle");
    }
}
