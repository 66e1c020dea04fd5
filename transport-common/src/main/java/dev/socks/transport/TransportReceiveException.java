package dev.socks.transport;

/**
 * No message could be read from the transport.
 */
public class TransportReceiveException extends TransportException {

    public TransportReceiveException(String message) {
        super(message);
    }

    public TransportReceiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
