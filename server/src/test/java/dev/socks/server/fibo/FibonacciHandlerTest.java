package dev.socks.server.fibo;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.socks.envelope.Envelopes;
import dev.socks.server.schema.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class FibonacciHandlerTest {

    private final FibonacciHandler handler = new FibonacciHandler();

    private static ObjectNode request(long n) {
        return Envelopes.object().put(Envelopes.COMMAND, FibonacciHandler.COMMAND).put("n", n);
    }

    @Test
    void computesFibonacciNumbers() {
        ObjectNode response = handler.handle(request(10));

        assertTrue(Envelopes.isSuccess(response));
        assertEquals(55L, response.get("result").longValue());
        assertEquals(0L, handler.handle(request(0)).get("result").longValue());
        assertEquals(1L, handler.handle(request(1)).get("result").longValue());
    }

    @Test
    void largestSupportedInputFitsInALong() {
        assertEquals(7540113804746346429L, handler.handle(request(FibonacciHandler.MAX_N)).get("result").longValue());
    }

    @Test
    void outOfRangeInputIsAFailureEnvelope() {
        ObjectNode tooLarge = handler.handle(request(FibonacciHandler.MAX_N + 1));
        ObjectNode negative = handler.handle(request(-1));
        ObjectNode huge = handler.handle(request(Long.MAX_VALUE));

        assertFalse(Envelopes.isSuccess(tooLarge));
        assertFalse(Envelopes.isSuccess(negative));
        assertFalse(Envelopes.isSuccess(huge));
        assertEquals("n must be between 0 and 92", Envelopes.message(negative).orElseThrow());
    }

    @Test
    void nonIntegerInputFailsValidation() {
        ObjectNode request = Envelopes.object().put("n", "ten");

        ValidationException e = assertThrows(ValidationException.class, () -> handler.handle(request));
        assertEquals("n", e.path());
    }

    @Test
    void resultsAreMemoized() {
        handler.handle(request(30));
        int cached = handler.memoSize();

        handler.handle(request(30));

        assertEquals(29, cached);
        assertEquals(cached, handler.memoSize());
    }
}
