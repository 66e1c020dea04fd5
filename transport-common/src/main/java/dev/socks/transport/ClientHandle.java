package dev.socks.transport;

/**
 * Opaque identity of the peer that sent one message. Only the transport that produced a
 * handle can reply through it.
 */
public interface ClientHandle {

    /**
     * Printable identifier, {@code conn-<n>} for stream transports and {@code <ip>:<port>}
     * for datagrams.
     */
    String id();
}
