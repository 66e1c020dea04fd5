package dev.socks.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;

/**
 * Converts envelopes to and from UTF-8 JSON text. Instances are thread-safe.
 */
public class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public byte[] encode(ObjectNode envelope) {
        try {
            return mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            // a tree of plain JSON nodes always serializes
            throw new IllegalStateException("Unable to serialize envelope", e);
        }
    }

    /**
     * @throws EnvelopeParseException when the payload is empty, malformed, truncated, or not an object
     */
    public ObjectNode decode(byte[] payload) throws EnvelopeParseException {
        JsonNode node;
        try {
            node = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new EnvelopeParseException(e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new EnvelopeParseException("Unable to read payload: " + e.getMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new EnvelopeParseException("Empty payload");
        }
        if (!node.isObject()) {
            throw new EnvelopeParseException("Top-level JSON value must be an object, got " + node.getNodeType());
        }
        return (ObjectNode) node;
    }
}
