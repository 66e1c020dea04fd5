package dev.socks.server.fibo;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.socks.envelope.Envelopes;
import dev.socks.server.Handler;
import dev.socks.server.schema.JsonType;
import dev.socks.server.schema.Schema;
import dev.socks.server.schema.SchemaValidator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code fibo} command: {@code {"n": 10}} answers {@code {"success": true, "result": 55}}.
 * Results are memoized across requests and safe to compute from several workers at once.
 */
public class FibonacciHandler implements Handler {

    private static final Logger LOGGER = LoggerFactory.getLogger(FibonacciHandler.class);

    public static final String COMMAND = "fibo";

    /** Largest n whose Fibonacci number fits in a long. */
    public static final int MAX_N = 92;

    private static final Schema SCHEMA = Schema.builder()
        .field("n", JsonType.INTEGER)
        .build();

    private final Map<Integer, Long> memo = new ConcurrentHashMap<>();

    @Override
    public ObjectNode handle(ObjectNode request) {
        SchemaValidator.validate(request, SCHEMA);
        if (!request.get("n").canConvertToInt()) {
            return Envelopes.error("n must be between 0 and " + MAX_N);
        }
        int n = request.get("n").intValue();
        if (n < 0 || n > MAX_N) {
            return Envelopes.error("n must be between 0 and " + MAX_N);
        }
        ObjectNode result = Envelopes.object();
        result.put("result", compute(n));
        return Envelopes.okay(result);
    }

    long compute(int n) {
        if (n <= 1) {
            return n;
        }
        Long known = memo.get(n);
        if (known != null) {
            return known;
        }
        LOGGER.debug("Calculating fib({})", n);
        long value = compute(n - 1) + compute(n - 2);
        memo.put(n, value);
        return value;
    }

    int memoSize() {
        return memo.size();
    }
}
