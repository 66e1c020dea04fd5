package dev.socks.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.socks.envelope.EnvelopeCodec;
import dev.socks.envelope.EnvelopeParseException;
import dev.socks.envelope.Envelopes;
import dev.socks.server.pool.PoolClosedException;
import dev.socks.server.pool.WorkerPool;
import dev.socks.transport.ClientHandle;
import dev.socks.transport.ReceivedMessage;
import dev.socks.transport.Transport;
import dev.socks.transport.TransportBindException;
import dev.socks.transport.TransportReceiveException;
import dev.socks.transport.TransportSendException;
import java.io.Closeable;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes JSON requests arriving on a {@link Transport} to registered {@link Handler}s.
 *
 * <p>One loop thread receives messages one at a time. Without a {@link WorkerPool} each request
 * is handled and answered on that thread, strictly in arrival order. With a pool every request
 * becomes one pool task, so slow handlers do not hold up receiving and replies may complete in
 * any order.</p>
 *
 * <p>Handlers should all be registered before {@link #start()}.</p>
 */
public class Server implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Server.class);

    /**
     * Command name used when a request carries no usable {@code command} field.
     */
    public static final String UNKNOWN_COMMAND = "<unknown>";

    private static final Duration STOP_JOIN_TIMEOUT = Duration.ofSeconds(1);

    private enum State {
        IDLE, RUNNING, STOPPED
    }

    private final Transport transport;
    private final WorkerPool workerPool;
    private final Map<String, Handler> handlers = new ConcurrentHashMap<>();
    private final EnvelopeCodec codec = new EnvelopeCodec();

    private volatile State state = State.IDLE;
    private Thread loopThread;

    public Server(Transport transport) {
        this(transport, null);
    }

    /**
     * @param workerPool pool running the handlers, or null to handle requests on the loop thread.
     * The server never stops the pool; its owner does.
     */
    public Server(Transport transport, WorkerPool workerPool) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.workerPool = workerPool;
    }

    /**
     * Register or replace the handler for {@code command}.
     */
    public void addHandler(String command, Handler handler) {
        handlers.put(Objects.requireNonNull(command, "command"), Objects.requireNonNull(handler, "handler"));
    }

    /**
     * Bind the transport and serve on the calling thread until {@link #stop()}.
     */
    public void start() throws TransportBindException {
        bind();
        serve();
    }

    /**
     * Bind the transport on the calling thread, so bind failures surface here, and serve on a
     * dedicated non-daemon thread.
     */
    public synchronized void startAsync() throws TransportBindException {
        bind();
        loopThread = new Thread(this::serve, "socks-server-loop");
        loopThread.start();
    }

    /**
     * Stop serving and close the transport. Closing the transport unblocks a loop thread waiting
     * in {@link Transport#receive()}; requests already handed to the pool still get their reply
     * attempt. Idempotent.
     */
    public void stop() {
        Thread loop;
        synchronized (this) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.STOPPED;
            loop = loopThread;
        }
        transport.close();
        if (loop != null && loop != Thread.currentThread()) {
            try {
                loop.join(STOP_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (loop.isAlive()) {
                LOGGER.warn("Server loop did not exit within {} ms", STOP_JOIN_TIMEOUT.toMillis());
            }
        }
        LOGGER.info("Server stopped");
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    @Override
    public void close() {
        stop();
    }

    private synchronized void bind() throws TransportBindException {
        if (state != State.IDLE) {
            throw new IllegalStateException("Server cannot be started while " + state.name().toLowerCase(Locale.ROOT));
        }
        transport.bind();
        state = State.RUNNING;
        LOGGER.info("Server started on {}, waiting for requests ({})", transport,
            workerPool == null ? "inline" : workerPool.size() + " workers");
    }

    private void serve() {
        while (state == State.RUNNING) {
            ReceivedMessage message;
            try {
                message = transport.receive();
            } catch (TransportReceiveException e) {
                if (state != State.RUNNING) {
                    break;
                }
                LOGGER.error("Receive error", e);
                continue;
            }
            if (workerPool == null) {
                respond(message);
                continue;
            }
            try {
                workerPool.enqueue(() -> respond(message));
            } catch (PoolClosedException e) {
                LOGGER.error("Worker pool rejected request from {}", message.handle().id(), e);
                reply(Envelopes.error("Server is shutting down"), message.handle());
            }
        }
        LOGGER.debug("Serve loop exited");
    }

    private void respond(ReceivedMessage message) {
        ObjectNode response;
        try {
            response = dispatch(message.payload());
        } catch (Throwable t) {
            LOGGER.error("Request from {} failed outside its handler", message.handle().id(), t);
            response = Envelopes.error(describe(t));
        }
        reply(response, message.handle());
    }

    /**
     * Decode, route and run one request. Never throws; every failure becomes a failure envelope.
     */
    ObjectNode dispatch(byte[] payload) {
        ObjectNode request;
        try {
            request = codec.decode(payload);
        } catch (EnvelopeParseException e) {
            LOGGER.error("Invalid JSON request: {}", e.getMessage());
            return Envelopes.error("Invalid JSON: " + e.getMessage());
        }
        String command = Envelopes.command(request).orElse(UNKNOWN_COMMAND);
        LOGGER.info("Received request for command: {}", command);

        Handler handler = handlers.get(command);
        if (handler == null) {
            LOGGER.warn("Unknown command: {}", command);
            return Envelopes.error("Unknown command: " + command);
        }

        ObjectNode response;
        try {
            response = handler.handle(request);
        } catch (Throwable t) {
            LOGGER.warn("Command '{}' threw", command, t);
            return Envelopes.error(describe(t));
        }
        if (response == null) {
            LOGGER.warn("Command '{}' returned no response", command);
            return Envelopes.error("Handler for '" + command + "' returned no response");
        }
        if (Envelopes.isSuccess(response)) {
            LOGGER.info("Command '{}' handled successfully", command);
        } else {
            LOGGER.warn("Command '{}' failed: {}", command, Envelopes.message(response).orElse("No error message"));
        }
        return response;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    private void reply(ObjectNode response, ClientHandle handle) {
        try {
            transport.send(codec.encode(response), handle);
        } catch (TransportSendException e) {
            LOGGER.error("Send error to {}", handle.id(), e);
        }
    }
}
