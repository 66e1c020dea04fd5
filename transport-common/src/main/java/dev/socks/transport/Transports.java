package dev.socks.transport;

/**
 * Picks the transport variant named by a {@link TransportSettings}.
 */
public final class Transports {

    private Transports() {
    }

    public static Transport create(TransportSettings settings) {
        return switch (settings.type()) {
            case UNIX -> new UnixSocketTransport(settings.path());
            case UDP -> new UdpTransport(settings.host(), settings.port());
            case TCP -> new TcpTransport(settings.host(), settings.port());
        };
    }
}
