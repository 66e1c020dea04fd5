package dev.socks.transport;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channel;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-connection-per-message plumbing shared by the TCP and UNIX socket transports.
 * Each accepted connection carries one request and receives one reply, then closes.
 */
final class StreamChannels {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamChannels.class);

    private StreamChannels() {
    }

    static ReceivedMessage accept(ServerSocketChannel listener, Transport owner, AtomicLong connectionCounter)
        throws TransportReceiveException {
        SocketChannel connection;
        try {
            connection = listener.accept();
        } catch (IOException e) {
            throw new TransportReceiveException("Failed to accept connection", e);
        }
        StreamHandle handle = new StreamHandle("conn-" + connectionCounter.incrementAndGet(), connection, owner);
        try {
            byte[] payload = readMessage(connection, handle.id());
            Wire.rx(handle.id(), payload);
            return new ReceivedMessage(payload, handle);
        } catch (IOException e) {
            closeLogged(connection, handle.id());
            throw new TransportReceiveException("Failed to read request from " + handle.id(), e);
        }
    }

    static void reply(byte[] payload, ClientHandle handle, Transport owner) throws TransportSendException {
        if (!(handle instanceof StreamHandle stream) || stream.owner() != owner) {
            throw new TransportSendException("Handle " + describe(handle) + " does not belong to this transport");
        }
        try {
            writeFully(stream.channel(), payload);
            Wire.tx(stream.id(), payload);
        } catch (IOException e) {
            throw new TransportSendException("Failed to send reply to " + stream.id(), e);
        } finally {
            closeLogged(stream.channel(), stream.id());
        }
    }

    static byte[] roundTrip(SocketChannel channel, byte[] payload, String peer) throws TransportException {
        try {
            try {
                writeFully(channel, payload);
            } catch (IOException e) {
                throw new TransportSendException("Failed to send request to " + peer, e);
            }
            Wire.tx(peer, payload);
            try {
                byte[] reply = readMessage(channel, peer);
                Wire.rx(peer, reply);
                return reply;
            } catch (IOException e) {
                throw new TransportReceiveException("Failed to read reply from " + peer, e);
            }
        } finally {
            closeLogged(channel, peer);
        }
    }

    static byte[] readMessage(SocketChannel channel, String peer) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(Transport.MAX_MESSAGE_SIZE);
        int read = channel.read(buffer);
        if (read <= 0) {
            throw new EOFException("Connection " + peer + " closed before any data arrived");
        }
        if (read == buffer.capacity()) {
            Wire.truncated(peer, read);
        }
        return Arrays.copyOf(buffer.array(), read);
    }

    static void writeFully(SocketChannel channel, byte[] payload) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    static void closeLogged(Channel channel, String what) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing {}", what, e);
        }
    }

    static String describe(ClientHandle handle) {
        return handle == null ? "null" : handle.id();
    }

    /**
     * Handle for an accepted connection; the connection is closed once the reply is written.
     */
    record StreamHandle(String id, SocketChannel channel, Transport owner) implements ClientHandle {
    }
}
