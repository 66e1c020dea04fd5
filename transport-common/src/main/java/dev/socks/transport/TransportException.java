package dev.socks.transport;

import java.io.IOException;

/**
 * Base type for transport I/O failures.
 */
public class TransportException extends IOException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
