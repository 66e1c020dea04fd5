package dev.socks.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.nio.channels.UnresolvedAddressException;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * UDP transport. Every datagram is one message; replies go back to the sender address.
 *
 * <p>The client round trip waits for the first datagram that reaches its ephemeral socket and
 * has no timeout, so a lost request or reply blocks the caller.</p>
 */
public class UdpTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(UdpTransport.class);

    private final String host;
    private final int port;

    private volatile DatagramChannel channel;
    private volatile int boundPort = -1;

    public UdpTransport(int port) {
        this(TcpTransport.DEFAULT_HOST, port);
    }

    public UdpTransport(String host, int port) {
        this.host = host;
        this.port = port;
    }

    @Override
    public synchronized void bind() throws TransportBindException {
        if (channel != null) {
            throw new TransportBindException("UDP transport already bound to port " + boundPort);
        }
        DatagramChannel opened = null;
        try {
            opened = DatagramChannel.open(StandardProtocolFamily.INET);
            opened.bind(new InetSocketAddress(port));
            boundPort = ((InetSocketAddress) opened.getLocalAddress()).getPort();
        } catch (IOException e) {
            StreamChannels.closeLogged(opened, "UDP socket");
            throw new TransportBindException("Failed to bind UDP socket on port " + port, e);
        }
        channel = opened;
        LOGGER.info("UDP transport bound to port {}", boundPort);
    }

    @Override
    public ReceivedMessage receive() throws TransportReceiveException {
        DatagramChannel bound = channel;
        if (bound == null) {
            throw new TransportReceiveException("UDP transport is not bound");
        }
        ByteBuffer buffer = ByteBuffer.allocate(MAX_MESSAGE_SIZE);
        SocketAddress sender;
        try {
            sender = bound.receive(buffer);
        } catch (IOException e) {
            throw new TransportReceiveException("Failed to receive from UDP socket", e);
        }
        DatagramHandle handle = new DatagramHandle((InetSocketAddress) sender, this);
        byte[] payload = drain(buffer, handle.id());
        if (payload.length == 0) {
            throw new TransportReceiveException("Empty datagram from " + handle.id());
        }
        Wire.rx(handle.id(), payload);
        return new ReceivedMessage(payload, handle);
    }

    @Override
    public void send(byte[] payload, ClientHandle handle) throws TransportSendException {
        if (!(handle instanceof DatagramHandle datagram) || datagram.owner() != this) {
            throw new TransportSendException("Handle " + StreamChannels.describe(handle)
                + " does not belong to this transport");
        }
        DatagramChannel bound = channel;
        if (bound == null) {
            throw new TransportSendException("UDP transport is not bound");
        }
        try {
            bound.send(ByteBuffer.wrap(payload), datagram.address());
            Wire.tx(datagram.id(), payload);
        } catch (IOException e) {
            throw new TransportSendException("Failed to send UDP reply to " + datagram.id(), e);
        }
    }

    @Override
    public byte[] send(byte[] payload) throws TransportException {
        String peer = host + ":" + port;
        DatagramChannel client;
        try {
            client = DatagramChannel.open(StandardProtocolFamily.INET);
        } catch (IOException e) {
            throw new TransportConnectException("Failed to open UDP client socket", e);
        }
        try {
            try {
                client.send(ByteBuffer.wrap(payload), new InetSocketAddress(host, port));
            } catch (UnresolvedAddressException e) {
                throw new TransportConnectException("Unable to resolve UDP server " + peer, e);
            } catch (IOException e) {
                throw new TransportSendException("Failed to send UDP packet to " + peer, e);
            }
            Wire.tx(peer, payload);
            ByteBuffer buffer = ByteBuffer.allocate(MAX_MESSAGE_SIZE);
            try {
                client.receive(buffer);
            } catch (IOException e) {
                throw new TransportReceiveException("Failed to receive UDP response from " + peer, e);
            }
            byte[] reply = drain(buffer, peer);
            if (reply.length == 0) {
                throw new TransportReceiveException("Empty UDP response from " + peer);
            }
            Wire.rx(peer, reply);
            return reply;
        } finally {
            StreamChannels.closeLogged(client, "UDP client socket");
        }
    }

    /**
     * Port the socket is bound to, or -1 before {@link #bind()}.
     */
    public int localPort() {
        return boundPort;
    }

    @Override
    public synchronized void close() {
        DatagramChannel bound = channel;
        channel = null;
        if (bound != null) {
            StreamChannels.closeLogged(bound, "UDP socket");
            LOGGER.info("UDP transport on port {} closed", boundPort);
        }
    }

    @Override
    public String toString() {
        return "udp://" + host + ":" + port;
    }

    private static byte[] drain(ByteBuffer buffer, String peer) {
        buffer.flip();
        int length = buffer.remaining();
        if (length == buffer.capacity()) {
            Wire.truncated(peer, length);
        }
        return Arrays.copyOf(buffer.array(), length);
    }

    /**
     * Sender address of one datagram. Unlike stream handles it can be replied to repeatedly.
     */
    record DatagramHandle(InetSocketAddress address, Transport owner) implements ClientHandle {

        @Override
        public String id() {
            return address.getAddress().getHostAddress() + ":" + address.getPort();
        }
    }
}
