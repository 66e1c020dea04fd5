package dev.socks.envelope;

import java.io.IOException;

/**
 * A payload is not a JSON object.
 */
public class EnvelopeParseException extends IOException {

    public EnvelopeParseException(String message) {
        super(message);
    }

    public EnvelopeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
