package dev.socks.transport;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Addressing for one transport. UNIX transports use {@code path}; UDP and TCP use {@code host}
 * and {@code port}. Servers always bind the wildcard address, so {@code host} only matters to
 * clients.
 */
public record TransportSettings(TransportType type, String host, int port, Path path) {

    public TransportSettings {
        Objects.requireNonNull(type, "type");
        if (type == TransportType.UNIX && path == null) {
            throw new IllegalArgumentException("UNIX transport requires a socket path");
        }
        if (type != TransportType.UNIX && (port < 0 || port > 0xFFFF)) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
        if (host == null || host.isBlank()) {
            host = TcpTransport.DEFAULT_HOST;
        }
    }

    public static TransportSettings unix(Path path) {
        return new TransportSettings(TransportType.UNIX, null, 0, path);
    }

    public static TransportSettings udp(String host, int port) {
        return new TransportSettings(TransportType.UDP, host, port, null);
    }

    public static TransportSettings tcp(String host, int port) {
        return new TransportSettings(TransportType.TCP, host, port, null);
    }
}
