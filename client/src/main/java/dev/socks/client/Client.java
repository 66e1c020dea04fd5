package dev.socks.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.socks.envelope.EnvelopeCodec;
import dev.socks.envelope.Envelopes;
import dev.socks.transport.Transport;
import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends commands to a server over one {@link Transport}.
 *
 * <p>Three calling styles share one request path guarded by a single lock, so a client never
 * has more than one round trip on the wire. Use separate clients, each with its own transport,
 * for parallel requests.</p>
 * <ul>
 *   <li>{@link #call} blocks and throws on failure</li>
 *   <li>{@link #callAsync} returns a future that fails with the same exceptions</li>
 *   <li>{@link #callBackground} never throws; the callback receives a failure envelope instead</li>
 * </ul>
 */
public class Client implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Client.class);

    static final String UNKNOWN_SERVER_ERROR = "Unknown server error.";

    private final Transport transport;
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final Object requestLock = new Object();
    private final AtomicInteger backgroundCounter = new AtomicInteger();
    private final ExecutorService asyncExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "socks-client-async");
        t.setDaemon(true);
        return t;
    });

    public Client(Transport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Send {@code request} tagged with {@code command} and wait for the reply.
     * @param request caller fields; not modified, may be null
     * @return the successful response envelope
     * @throws RemoteCallException when the server reports failure
     * @throws IOException when the transport fails or the reply is not a JSON object
     */
    public ObjectNode call(String command, ObjectNode request) throws IOException {
        Objects.requireNonNull(command, "command");
        synchronized (requestLock) {
            ObjectNode envelope = request == null ? Envelopes.object() : request.deepCopy();
            envelope.put(Envelopes.COMMAND, command);
            byte[] reply = transport.send(codec.encode(envelope));

            ObjectNode response = codec.decode(reply);
            if (!Envelopes.isSuccess(response)) {
                String message = Envelopes.message(response).orElse(UNKNOWN_SERVER_ERROR);
                throw new RemoteCallException(command, message, response);
            }
            return response;
        }
    }

    /**
     * Run {@link #call} on a client-owned executor. The future fails with the exception
     * {@code call} would have thrown, wrapped in a {@link CompletionException}, or with an
     * {@link IllegalStateException} once the client is closed.
     */
    public CompletableFuture<ObjectNode> callAsync(String command, ObjectNode request) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return call(command, request);
                } catch (IOException e) {
                    throw new CompletionException(e);
                }
            }, asyncExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Client is closed", e));
        }
    }

    /**
     * Run {@link #call} on a detached thread and hand the outcome to {@code onComplete} exactly
     * once: the response on success, otherwise {@code {"success": false, "message": <error>}}.
     */
    public void callBackground(String command, ObjectNode request, Consumer<ObjectNode> onComplete) {
        Objects.requireNonNull(onComplete, "onComplete");
        Thread thread = new Thread(() -> {
            ObjectNode outcome;
            try {
                outcome = call(command, request);
            } catch (Exception e) {
                LOGGER.debug("Background call '{}' failed", command, e);
                outcome = Envelopes.error(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            }
            try {
                onComplete.accept(outcome);
            } catch (RuntimeException e) {
                LOGGER.error("Callback for '{}' threw", command, e);
            }
        }, "socks-client-background-" + backgroundCounter.incrementAndGet());
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Close the transport and stop the async executor. Calls already in flight are not
     * interrupted.
     */
    @Override
    public void close() {
        transport.close();
        asyncExecutor.shutdown();
    }
}
