package dev.socks.transport;

/**
 * The listening endpoint could not be opened or bound.
 */
public class TransportBindException extends TransportException {

    public TransportBindException(String message) {
        super(message);
    }

    public TransportBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
