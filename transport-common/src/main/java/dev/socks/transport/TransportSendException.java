package dev.socks.transport;

/**
 * A payload could not be written to its peer.
 */
public class TransportSendException extends TransportException {

    public TransportSendException(String message) {
        super(message);
    }

    public TransportSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
