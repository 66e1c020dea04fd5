package dev.socks.transport;

import java.io.Closeable;

/**
 * Pluggable message transport shared by servers and clients.
 *
 * <p>Every variant delivers exactly one logical message per {@link #receive()} call and
 * reads at most {@link #MAX_MESSAGE_SIZE} bytes for it. Larger messages are truncated; the
 * envelope decoder reports them as malformed JSON.</p>
 *
 * <p>Server side: {@link #bind()} once, then loop on {@link #receive()} and answer each
 * message with {@link #send(byte[], ClientHandle)}. Client side: {@link #send(byte[])} performs
 * a full request/reply round trip and needs no bind.</p>
 */
public interface Transport extends Closeable {

    /**
     * Size of the single read buffer used for every message.
     */
    int MAX_MESSAGE_SIZE = 2048;

    /**
     * Open and bind the listening endpoint. Must be called once before {@link #receive()}.
     * @throws TransportBindException when the endpoint is unavailable, in use, or already bound
     */
    void bind() throws TransportBindException;

    /**
     * Block until one message arrives.
     * @return the raw payload together with the handle used to address the reply
     * @throws TransportReceiveException on I/O failure; callers should log and keep receiving
     */
    ReceivedMessage receive() throws TransportReceiveException;

    /**
     * Deliver a reply to the peer that sent the message identified by {@code handle}.
     * Connection-oriented handles are closed afterwards and cannot be reused.
     * @param payload reply body
     * @param handle handle returned by {@link #receive()} on this transport
     * @throws TransportSendException when the reply cannot be delivered
     */
    void send(byte[] payload, ClientHandle handle) throws TransportSendException;

    /**
     * Client-side round trip: deliver {@code payload} to the configured destination and block
     * for exactly one reply. There is no timeout.
     * @param payload request body
     * @return the reply body
     * @throws TransportException with the connect, send or receive subtype matching the failing step
     */
    byte[] send(byte[] payload) throws TransportException;

    /**
     * Release all resources. Safe to call more than once.
     */
    @Override
    void close();
}
