package dev.socks.server.config;

import dev.socks.transport.TransportSettings;
import dev.socks.transport.TransportType;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "socks.transport")
public class TransportProperties {

    /**
     * Transport the server listens on.
     */
    private TransportType type = TransportType.UDP;

    private int port = 8080;

    /**
     * Socket file for the UNIX transport.
     */
    private Path path = Paths.get("/tmp/fibo.sock");

    public TransportType getType() {
        return type;
    }

    public void setType(TransportType type) {
        this.type = Objects.requireNonNullElse(type, TransportType.UDP);
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public Path getPath() {
        return path;
    }

    public void setPath(Path path) {
        this.path = path.toAbsolutePath().normalize();
    }

    public TransportSettings toSettings() {
        return new TransportSettings(type, null, port, type == TransportType.UNIX ? path : null);
    }
}
