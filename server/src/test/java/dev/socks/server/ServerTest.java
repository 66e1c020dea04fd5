package dev.socks.server;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.socks.envelope.Envelopes;
import dev.socks.server.pool.WorkerPool;
import dev.socks.server.schema.JsonType;
import dev.socks.server.schema.Schema;
import dev.socks.server.schema.SchemaValidator;
import dev.socks.transport.TransportBindException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ServerTest {

    private final FakeTransport transport = new FakeTransport();
    private WorkerPool pool;
    private Server server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (pool != null) {
            pool.immediateStop();
        }
    }

    private Server inlineEchoServer() {
        server = new Server(transport);
        server.addHandler("echo", request -> {
            ObjectNode response = Envelopes.object();
            response.set("value", request.get("value"));
            return Envelopes.okay(response);
        });
        return server;
    }

    @Test
    void successfulHandlerOutputIsSentUnchanged() throws Exception {
        ObjectNode output = Envelopes.object().put("success", true).put("custom", "kept");
        server = new Server(transport);
        server.addHandler("fixed", request -> output);
        server.startAsync();

        String handle = transport.inject("{\"command\":\"fixed\"}");

        FakeTransport.Reply reply = transport.awaitReply();
        assertEquals(handle, reply.handleId());
        assertEquals(output, reply.json());
    }

    @Test
    void echoRoundTrip() throws Exception {
        inlineEchoServer().startAsync();

        transport.inject("{\"command\":\"echo\",\"value\":7}");

        ObjectNode expected = Envelopes.object().put("value", 7).put("success", true);
        assertEquals(expected, transport.awaitReply().json());
    }

    @Test
    void unknownCommandIsReportedByName() throws Exception {
        inlineEchoServer().startAsync();

        transport.inject("{\"command\":\"nope\"}");

        ObjectNode reply = transport.awaitReply().json();
        assertFalse(Envelopes.isSuccess(reply));
        assertEquals("Unknown command: nope", Envelopes.message(reply).orElseThrow());
    }

    @Test
    void missingCommandFallsBackToTheUnknownSentinel() throws Exception {
        inlineEchoServer().startAsync();

        transport.inject("{\"value\":1}");

        assertEquals("Unknown command: " + Server.UNKNOWN_COMMAND,
            Envelopes.message(transport.awaitReply().json()).orElseThrow());
    }

    @Test
    void malformedJsonGetsAFailureAndTheLoopKeepsServing() throws Exception {
        inlineEchoServer().startAsync();

        transport.inject("{\"command\":\"echo\",");
        transport.inject("[1, 2, 3]");
        transport.inject("{\"command\":\"echo\",\"value\":\"after\"}");

        ObjectNode truncated = transport.awaitReply().json();
        assertFalse(Envelopes.isSuccess(truncated));
        assertTrue(Envelopes.message(truncated).orElseThrow().startsWith("Invalid JSON"));
        assertFalse(Envelopes.isSuccess(transport.awaitReply().json()));
        assertEquals("after", transport.awaitReply().json().get("value").textValue());
    }

    @Test
    void handlerExceptionBecomesAFailureWithItsMessage() throws Exception {
        server = new Server(transport);
        server.addHandler("explode", request -> {
            throw new IllegalStateException("disk on fire");
        });
        server.startAsync();

        transport.inject("{\"command\":\"explode\"}");

        ObjectNode reply = transport.awaitReply().json();
        assertFalse(Envelopes.isSuccess(reply));
        assertEquals("disk on fire", Envelopes.message(reply).orElseThrow());
    }

    @Test
    void handlerErrorOnTheLoopThreadIsAnsweredAndServingContinues() throws Exception {
        inlineEchoServer();
        server.addHandler("assert", request -> {
            throw new AssertionError("invariant broken");
        });
        server.startAsync();

        transport.inject("{\"command\":\"assert\"}");
        transport.inject("{\"command\":\"echo\",\"value\":3}");

        assertEquals("invariant broken", Envelopes.message(transport.awaitReply().json()).orElseThrow());
        assertEquals(3, transport.awaitReply().json().get("value").intValue());
        assertTrue(server.isRunning());
    }

    @Test
    void handlerErrorOnAWorkerIsAnsweredAndTheWorkerSurvives() throws Exception {
        pool = new WorkerPool(2);
        server = new Server(transport, pool);
        server.addHandler("recurse", request -> {
            throw new StackOverflowError();
        });
        server.startAsync();

        transport.inject("{\"command\":\"recurse\"}");
        transport.inject("{\"command\":\"recurse\"}");

        assertEquals(StackOverflowError.class.getName(),
            Envelopes.message(transport.awaitReply().json()).orElseThrow());
        assertEquals(StackOverflowError.class.getName(),
            Envelopes.message(transport.awaitReply().json()).orElseThrow());
        assertEquals(2, pool.liveThreads());
    }

    @Test
    void handlerReturningNullIsAFailure() throws Exception {
        server = new Server(transport);
        server.addHandler("void", request -> null);
        server.startAsync();

        transport.inject("{\"command\":\"void\"}");

        assertEquals("Handler for 'void' returned no response",
            Envelopes.message(transport.awaitReply().json()).orElseThrow());
    }

    @Test
    void schemaViolationReachesTheCallerAsTheFailureMessage() throws Exception {
        Schema schema = Schema.builder().field("n", JsonType.INTEGER).build();
        server = new Server(transport);
        server.addHandler("square", request -> {
            SchemaValidator.validate(request, schema);
            long n = request.get("n").longValue();
            return Envelopes.okay(Envelopes.object().put("result", n * n));
        });
        server.startAsync();

        transport.inject("{\"command\":\"square\",\"n\":\"x\"}");

        assertEquals("Wrong type for key 'n' (expected integer, got string)",
            Envelopes.message(transport.awaitReply().json()).orElseThrow());
    }

    @Test
    void receiveAndSendFailuresDoNotStopTheLoop() throws Exception {
        inlineEchoServer().startAsync();

        transport.injectReceiveFailure("connection reset");
        transport.failSends(true);
        transport.inject("{\"command\":\"echo\",\"value\":1}");
        transport.awaitSendAttempts(1);
        transport.failSends(false);
        transport.inject("{\"command\":\"echo\",\"value\":2}");

        assertEquals(2, transport.awaitReply().json().get("value").intValue());
        assertTrue(server.isRunning());
    }

    @Test
    void withoutAPoolRequestsAreAnsweredInArrivalOrder() throws Exception {
        inlineEchoServer().startAsync();

        List<String> handles = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            handles.add(transport.inject("{\"command\":\"echo\",\"value\":" + i + "}"));
        }

        for (int i = 0; i < 20; i++) {
            FakeTransport.Reply reply = transport.awaitReply();
            assertEquals(handles.get(i), reply.handleId());
            assertEquals(i, reply.json().get("value").intValue());
        }
    }

    @Test
    void withAPoolASlowHandlerDoesNotHoldUpLaterRequests() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        pool = new WorkerPool(2);
        server = new Server(transport, pool);
        server.addHandler("slow", request -> {
            release.await(5, TimeUnit.SECONDS);
            return Envelopes.okay(Envelopes.object().put("who", "slow"));
        });
        server.addHandler("fast", request -> Envelopes.okay(Envelopes.object().put("who", "fast")));
        server.startAsync();

        transport.inject("{\"command\":\"slow\"}");
        transport.inject("{\"command\":\"fast\"}");

        assertEquals("fast", transport.awaitReply().json().get("who").textValue());
        release.countDown();
        assertEquals("slow", transport.awaitReply().json().get("who").textValue());
    }

    @Test
    void closedPoolAnswersThatTheServerIsShuttingDown() throws Exception {
        pool = new WorkerPool(1);
        server = new Server(transport, pool);
        server.addHandler("echo", request -> Envelopes.okay(request));
        server.startAsync();
        pool.gracefulStop();

        transport.inject("{\"command\":\"echo\"}");

        assertEquals("Server is shutting down", Envelopes.message(transport.awaitReply().json()).orElseThrow());
    }

    @Test
    void lifecycleIsIdleRunningStopped() throws Exception {
        inlineEchoServer();
        assertFalse(server.isRunning());

        server.startAsync();
        assertTrue(server.isRunning());
        assertThrows(IllegalStateException.class, server::startAsync);

        server.stop();
        assertFalse(server.isRunning());
        assertTrue(transport.isClosed());
        assertDoesNotThrow(server::stop);
        assertThrows(IllegalStateException.class, server::start);
    }

    @Test
    void bindFailureSurfacesFromStartAsync() {
        transport.failBind();
        server = new Server(transport);

        assertThrows(TransportBindException.class, server::startAsync);
        assertFalse(server.isRunning());
    }

    @Test
    void laterRegistrationReplacesTheHandler() throws Exception {
        server = new Server(transport);
        server.addHandler("v", request -> Envelopes.okay(Envelopes.object().put("version", 1)));
        server.addHandler("v", request -> Envelopes.okay(Envelopes.object().put("version", 2)));
        server.startAsync();

        transport.inject("{\"command\":\"v\"}");

        assertEquals(2, transport.awaitReply().json().get("version").intValue());
    }
}
