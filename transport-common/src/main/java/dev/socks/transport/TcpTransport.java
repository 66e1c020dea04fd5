package dev.socks.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TCP transport. The server side listens on the wildcard address; the client side opens one
 * connection per request to {@code host:port}.
 */
public class TcpTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpTransport.class);

    public static final String DEFAULT_HOST = "127.0.0.1";

    private static final int BACKLOG = 5;

    private final String host;
    private final int port;
    private final AtomicLong connectionCounter = new AtomicLong();

    private volatile ServerSocketChannel listener;
    private volatile int boundPort = -1;

    public TcpTransport(int port) {
        this(DEFAULT_HOST, port);
    }

    public TcpTransport(String host, int port) {
        this.host = host;
        this.port = port;
    }

    @Override
    public synchronized void bind() throws TransportBindException {
        if (listener != null) {
            throw new TransportBindException("TCP transport already bound to port " + boundPort);
        }
        ServerSocketChannel channel = null;
        try {
            channel = ServerSocketChannel.open();
            channel.bind(new InetSocketAddress(port), BACKLOG);
            boundPort = ((InetSocketAddress) channel.getLocalAddress()).getPort();
        } catch (IOException e) {
            StreamChannels.closeLogged(channel, "TCP listener");
            throw new TransportBindException("Failed to bind TCP socket on port " + port, e);
        }
        listener = channel;
        LOGGER.info("TCP transport listening on port {}", boundPort);
    }

    @Override
    public ReceivedMessage receive() throws TransportReceiveException {
        ServerSocketChannel channel = listener;
        if (channel == null) {
            throw new TransportReceiveException("TCP transport is not bound");
        }
        return StreamChannels.accept(channel, this, connectionCounter);
    }

    @Override
    public void send(byte[] payload, ClientHandle handle) throws TransportSendException {
        StreamChannels.reply(payload, handle, this);
    }

    @Override
    public byte[] send(byte[] payload) throws TransportException {
        String peer = host + ":" + port;
        SocketChannel channel;
        try {
            channel = SocketChannel.open(new InetSocketAddress(host, port));
        } catch (IOException | UnresolvedAddressException e) {
            throw new TransportConnectException("Failed to connect to TCP server " + peer, e);
        }
        return StreamChannels.roundTrip(channel, payload, peer);
    }

    /**
     * Port the listener is bound to, or -1 before {@link #bind()}.
     */
    public int localPort() {
        return boundPort;
    }

    @Override
    public synchronized void close() {
        ServerSocketChannel channel = listener;
        listener = null;
        if (channel != null) {
            StreamChannels.closeLogged(channel, "TCP listener");
            LOGGER.info("TCP transport on port {} closed", boundPort);
        }
    }

    @Override
    public String toString() {
        return "tcp://" + host + ":" + port;
    }
}
