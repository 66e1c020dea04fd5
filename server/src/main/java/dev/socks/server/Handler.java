package dev.socks.server;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Implementation of one named command. Receives the full request envelope, including the
 * {@code command} field, and returns the response envelope verbatim. Failures may be reported
 * either by returning {@code Envelopes.error(...)} or by throwing; a thrown exception becomes a
 * failure envelope carrying its message.
 *
 * <p>Handlers may run concurrently on pool threads and must not block indefinitely.</p>
 */
@FunctionalInterface
public interface Handler {

    ObjectNode handle(ObjectNode request) throws Exception;
}
