package dev.socks.transport;

/**
 * A client could not reach the destination.
 */
public class TransportConnectException extends TransportException {

    public TransportConnectException(String message) {
        super(message);
    }

    public TransportConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
