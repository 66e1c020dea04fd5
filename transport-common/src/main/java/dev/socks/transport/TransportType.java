package dev.socks.transport;

import java.util.Locale;

public enum TransportType {
    UNIX, UDP, TCP;

    public static TransportType parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown transport type: " + value + " (expected unix, udp or tcp)");
        }
    }
}
