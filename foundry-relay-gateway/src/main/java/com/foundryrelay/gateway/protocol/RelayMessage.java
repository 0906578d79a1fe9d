package com.foundryrelay.gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A wire frame exchanged with the peer: a JSON object with a required
 * {@code type}, an optional {@code requestId} used only for correlation, and
 * any number of payload fields the relay passes through untouched.
 *
 * <p>
 * Instances are mutable only through {@link #withRequestId(String)}, which the
 * correlator uses to stamp a generated id before transmission.
 */
public final class RelayMessage {

    private final ObjectNode node;

    private RelayMessage(ObjectNode node) {
        this.node = node;
    }

    /**
     * Create an empty message of the given type.
     */
    public static RelayMessage of(String type) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(MessageTypes.FIELD_TYPE, requireType(type));
        return new RelayMessage(node);
    }

    /**
     * Wrap an existing JSON object. The node must carry a non-blank string
     * {@code type}.
     */
    public static RelayMessage wrap(ObjectNode node) {
        Objects.requireNonNull(node, "node");
        JsonNode type = node.get(MessageTypes.FIELD_TYPE);
        if (type == null || !type.isTextual()) {
            throw new IllegalArgumentException("message type is required");
        }
        requireType(type.asText());
        return new RelayMessage(node);
    }

    /**
     * Parse a raw text frame.
     *
     * @throws MalformedFrameException if the frame is not a JSON object with a
     *                                 string {@code type}
     */
    public static RelayMessage parse(String raw, ObjectMapper mapper) {
        JsonNode node;
        try {
            node = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedFrameException("frame is not a JSON object");
        }
        try {
            return wrap((ObjectNode) node);
        } catch (IllegalArgumentException e) {
            throw new MalformedFrameException(e.getMessage(), e);
        }
    }

    public String type() {
        return node.get(MessageTypes.FIELD_TYPE).asText();
    }

    /**
     * The correlation id, or null when absent or blank.
     */
    public String requestId() {
        JsonNode id = node.get(MessageTypes.FIELD_REQUEST_ID);
        if (id == null || id.isNull()) {
            return null;
        }
        String text = id.asText();
        return text.isBlank() ? null : text;
    }

    public boolean hasRequestId() {
        return requestId() != null;
    }

    public RelayMessage withRequestId(String requestId) {
        node.put(MessageTypes.FIELD_REQUEST_ID, requestId);
        return this;
    }

    /**
     * Set a payload field. Null values are skipped.
     */
    public RelayMessage with(String field, Object value) {
        if (value == null) {
            return this;
        }
        if (value instanceof JsonNode json) {
            node.set(field, json);
        } else if (value instanceof String s) {
            node.put(field, s);
        } else if (value instanceof Integer i) {
            node.put(field, i);
        } else if (value instanceof Long l) {
            node.put(field, l);
        } else if (value instanceof Boolean b) {
            node.put(field, b);
        } else {
            node.putPOJO(field, value);
        }
        return this;
    }

    public JsonNode get(String field) {
        return node.get(field);
    }

    /**
     * Classify this frame for the dispatcher.
     */
    public MessageKind kind() {
        String type = type();
        if (MessageTypes.PING.equals(type)) {
            return MessageKind.PING;
        }
        if (MessageTypes.PONG.equals(type)) {
            return MessageKind.PONG;
        }
        return hasRequestId() ? MessageKind.CORRELATED : MessageKind.EVENT;
    }

    /**
     * Whether the peer reported a failure: a non-empty {@code error} field or
     * {@code status} equal to {@code "error"}.
     */
    public boolean isError() {
        if (isTruthy(node.get(MessageTypes.FIELD_ERROR))) {
            return true;
        }
        JsonNode status = node.get(MessageTypes.FIELD_STATUS);
        return status != null && "error".equals(status.asText());
    }

    /**
     * The peer's error text, if it sent one as a string.
     */
    public String errorText() {
        JsonNode error = node.get(MessageTypes.FIELD_ERROR);
        if (error != null && error.isTextual() && !error.asText().isBlank()) {
            return error.asText();
        }
        if (error != null && error.isObject() && error.hasNonNull("message")) {
            return error.get("message").asText();
        }
        return null;
    }

    /**
     * The underlying JSON object. Callers must not change {@code type}.
     */
    public ObjectNode json() {
        return node;
    }

    public String toJson(ObjectMapper mapper) throws JsonProcessingException {
        return mapper.writeValueAsString(node);
    }

    @Override
    public String toString() {
        return "RelayMessage{type=" + type() + ", requestId=" + requestId() + "}";
    }

    private static boolean isTruthy(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0;
        }
        return true;
    }

    private static String requireType(String type) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("message type is required");
        }
        return type;
    }

    /**
     * Thrown by {@link #parse} for frames the relay cannot interpret.
     */
    public static class MalformedFrameException extends RuntimeException {
        public MalformedFrameException(String message) {
            super(message);
        }

        public MalformedFrameException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
