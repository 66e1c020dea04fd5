package dev.socks.server.pool;

/**
 * Thrown when a task is offered to a pool that is stopping or stopped.
 */
public class PoolClosedException extends IllegalStateException {

    public PoolClosedException(String message) {
        super(message);
    }
}
