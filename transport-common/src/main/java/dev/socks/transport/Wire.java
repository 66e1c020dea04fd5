package dev.socks.transport;

import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging raw traffic in a consistent format so that client and server logs
 * look identical.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int PREVIEW_LENGTH = 200;

    private Wire() {
    }

    public static void rx(String peer, byte[] payload) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX peer={} bytes={} json={}", peer, payload.length, preview(payload));
        }
    }

    public static void tx(String peer, byte[] payload) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX peer={} bytes={} json={}", peer, payload.length, preview(payload));
        }
    }

    /**
     * Warn about a read that filled the whole buffer; anything beyond it was cut off.
     */
    static void truncated(String peer, int length) {
        LOGGER.warn("Message from {} filled the {} byte read buffer and may be truncated", peer, length);
    }

    private static String preview(byte[] payload) {
        return truncate(new String(payload, StandardCharsets.UTF_8), PREVIEW_LENGTH);
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
