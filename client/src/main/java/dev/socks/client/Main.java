package dev.socks.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.socks.envelope.Envelopes;
import dev.socks.transport.TcpTransport;
import dev.socks.transport.TransportSettings;
import dev.socks.transport.TransportType;
import dev.socks.transport.Transports;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Console client for the {@code fibo} demo server. Reads numbers from stdin until {@code -1}.
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) throws IOException {
        TransportSettings settings;
        try {
            settings = parse(new ArrayList<>(Arrays.asList(args)));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            return;
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try (Client client = new Client(Transports.create(settings))) {
            while (true) {
                System.out.print("Enter Fibonacci number to calculate (or -1 to exit): ");
                System.out.flush();
                String line = in.readLine();
                if (line == null) {
                    break;
                }
                int n;
                try {
                    n = Integer.parseInt(line.trim());
                } catch (NumberFormatException e) {
                    System.err.println("Invalid input. Exiting.");
                    break;
                }
                if (n == -1) {
                    System.out.println("Goodbye!");
                    break;
                }
                ObjectNode request = Envelopes.object();
                request.put("n", n);
                try {
                    ObjectNode response = client.call("fibo", request);
                    System.out.println("fib(" + n + ") = " + response.path("result").asLong());
                } catch (IOException e) {
                    System.err.println("Request failed: " + e.getMessage());
                }
            }
        }
    }

    static TransportSettings parse(List<String> arguments) {
        TransportType type = TransportType.UDP;
        String host = TcpTransport.DEFAULT_HOST;
        int port = 8080;
        String path = "/tmp/fibo.sock";
        while (!arguments.isEmpty()) {
            String flag = arguments.remove(0);
            if (arguments.isEmpty()) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String value = arguments.remove(0);
            switch (flag) {
                case "--transport" -> type = TransportType.parse(value);
                case "--host" -> host = value;
                case "--port" -> port = parsePort(value);
                case "--path" -> path = value;
                default -> throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }
        return new TransportSettings(type, host, port, type == TransportType.UNIX ? Paths.get(path) : null);
    }

    private static int parsePort(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar socks-client.jar [options]\n" +
            "Options:\n" +
            "  --transport unix|udp|tcp   (default udp)\n" +
            "  --host <ip>                (default 127.0.0.1)\n" +
            "  --port <port>              (default 8080)\n" +
            "  --path <socket file>       (default /tmp/fibo.sock)");
    }
}
