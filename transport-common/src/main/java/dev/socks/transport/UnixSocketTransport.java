package dev.socks.transport;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * UNIX domain socket transport addressed by a filesystem path, e.g. {@code /tmp/socks.sock}.
 *
 * <p>Binding removes whatever file already sits at the path so a socket left behind by a
 * crashed server does not block a restart. Closing removes the socket file again.</p>
 */
public class UnixSocketTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(UnixSocketTransport.class);

    private static final int BACKLOG = 5;

    private final Path socketPath;
    private final AtomicLong connectionCounter = new AtomicLong();

    private volatile ServerSocketChannel listener;

    public UnixSocketTransport(Path socketPath) {
        this.socketPath = Objects.requireNonNull(socketPath, "socketPath");
    }

    public Path socketPath() {
        return socketPath;
    }

    @Override
    public synchronized void bind() throws TransportBindException {
        if (listener != null) {
            throw new TransportBindException("UNIX socket already bound at " + socketPath);
        }
        ServerSocketChannel channel = null;
        try {
            Files.deleteIfExists(socketPath);
            channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            channel.bind(UnixDomainSocketAddress.of(socketPath), BACKLOG);
        } catch (IOException | UnsupportedOperationException e) {
            StreamChannels.closeLogged(channel, "UNIX listener");
            throw new TransportBindException("Failed to bind UNIX socket " + socketPath, e);
        }
        listener = channel;
        LOGGER.info("UNIX socket transport listening on {}", socketPath);
    }

    @Override
    public ReceivedMessage receive() throws TransportReceiveException {
        ServerSocketChannel channel = listener;
        if (channel == null) {
            throw new TransportReceiveException("UNIX socket transport is not bound");
        }
        return StreamChannels.accept(channel, this, connectionCounter);
    }

    @Override
    public void send(byte[] payload, ClientHandle handle) throws TransportSendException {
        StreamChannels.reply(payload, handle, this);
    }

    @Override
    public byte[] send(byte[] payload) throws TransportException {
        String peer = socketPath.toString();
        SocketChannel channel = null;
        try {
            channel = SocketChannel.open(StandardProtocolFamily.UNIX);
            channel.connect(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException | UnsupportedOperationException e) {
            StreamChannels.closeLogged(channel, peer);
            throw new TransportConnectException("Failed to connect to UNIX socket " + peer, e);
        }
        return StreamChannels.roundTrip(channel, payload, peer);
    }

    @Override
    public synchronized void close() {
        ServerSocketChannel channel = listener;
        listener = null;
        if (channel == null) {
            return;
        }
        StreamChannels.closeLogged(channel, "UNIX listener");
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            LOGGER.warn("Unable to remove socket file {}", socketPath, e);
        }
        LOGGER.info("UNIX socket transport at {} closed", socketPath);
    }

    @Override
    public String toString() {
        return "unix://" + socketPath;
    }
}
