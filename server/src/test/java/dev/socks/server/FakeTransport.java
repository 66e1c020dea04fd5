package dev.socks.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.socks.envelope.EnvelopeCodec;
import dev.socks.envelope.EnvelopeParseException;
import dev.socks.transport.ClientHandle;
import dev.socks.transport.ReceivedMessage;
import dev.socks.transport.Transport;
import dev.socks.transport.TransportBindException;
import dev.socks.transport.TransportConnectException;
import dev.socks.transport.TransportReceiveException;
import dev.socks.transport.TransportSendException;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory server-side transport. Tests inject inbound payloads and read back what the server
 * sent to each handle.
 */
final class FakeTransport implements Transport {

    record Reply(String handleId, byte[] payload) {

        ObjectNode json() throws EnvelopeParseException {
            return new EnvelopeCodec().decode(payload);
        }
    }

    private record ReceiveFailure(String message) {
    }

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final BlockingQueue<Reply> replies = new LinkedBlockingQueue<>();
    private final AtomicInteger handles = new AtomicInteger();
    private final AtomicInteger sendAttempts = new AtomicInteger();

    private volatile boolean bound;
    private volatile boolean closed;
    private volatile boolean failBind;
    private volatile boolean failSends;

    /**
     * @return id of the handle the reply will be addressed to
     */
    String inject(String json) {
        String id = "fake-" + handles.incrementAndGet();
        inbound.add(new ReceivedMessage(json.getBytes(StandardCharsets.UTF_8), () -> id));
        return id;
    }

    void injectReceiveFailure(String message) {
        inbound.add(new ReceiveFailure(message));
    }

    void failBind() {
        failBind = true;
    }

    void failSends(boolean fail) {
        failSends = fail;
    }

    Reply awaitReply() throws InterruptedException {
        Reply reply = replies.poll(5, TimeUnit.SECONDS);
        if (reply == null) {
            throw new AssertionError("No reply within 5 seconds");
        }
        return reply;
    }

    void awaitSendAttempts(int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (sendAttempts.get() < expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Only " + sendAttempts.get() + " of " + expected + " sends attempted");
            }
            Thread.sleep(10);
        }
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public void bind() throws TransportBindException {
        if (failBind) {
            throw new TransportBindException("address in use");
        }
        if (bound) {
            throw new TransportBindException("already bound");
        }
        bound = true;
    }

    @Override
    public ReceivedMessage receive() throws TransportReceiveException {
        while (!closed) {
            Object next;
            try {
                next = inbound.poll(20, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportReceiveException("interrupted", e);
            }
            if (next instanceof ReceiveFailure failure) {
                throw new TransportReceiveException(failure.message());
            }
            if (next != null) {
                return (ReceivedMessage) next;
            }
        }
        throw new TransportReceiveException("closed");
    }

    @Override
    public void send(byte[] payload, ClientHandle handle) throws TransportSendException {
        sendAttempts.incrementAndGet();
        if (failSends) {
            throw new TransportSendException("peer went away");
        }
        replies.add(new Reply(handle.id(), payload));
    }

    @Override
    public byte[] send(byte[] payload) throws TransportConnectException {
        throw new TransportConnectException("server-side fake has no destination");
    }

    @Override
    public void close() {
        closed = true;
    }
}
