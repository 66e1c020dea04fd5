package dev.socks.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "socks.pool")
public class PoolProperties {

    /**
     * Worker threads running handlers. 0 handles every request on the receive loop thread.
     */
    private int threads = 4;

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        if (threads < 0) {
            throw new IllegalArgumentException("socks.pool.threads must not be negative");
        }
        this.threads = threads;
    }

    public boolean isEnabled() {
        return threads > 0;
    }
}
