package org.netpreserve.sitemirror.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.netpreserve.sitemirror.util.Json;

import java.io.IOException;

/**
 * The wire form of every message: {@code {"type": "DOWNLOAD", "payload": {...}}}.
 */
public record Envelope(MessageType type, JsonNode payload) {

    public static byte[] encode(Message message) {
        ObjectNode envelope = Json.MAPPER.createObjectNode();
        envelope.put("type", message.type().name());
        envelope.set("payload", Json.MAPPER.valueToTree(message));
        try {
            return Json.MAPPER.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable " + message.type() + " message", e);
        }
    }

    /**
     * Parses and validates a frame.
     *
     * @throws ProtocolException if the frame isn't JSON, names an unknown type, or has a payload that
     *                           doesn't satisfy that type's schema
     */
    public static Message decode(byte[] frame) throws ProtocolException {
        JsonNode root;
        try {
            root = Json.MAPPER.readTree(frame);
        } catch (IOException e) {
            throw new ProtocolException("Frame is not JSON", e);
        }
        if (root == null || !root.isObject()) throw new ProtocolException("Frame is not a JSON object");
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) throw new ProtocolException("Missing message type");
        MessageType type;
        try {
            type = MessageType.valueOf(typeNode.asText());
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Unknown message type " + typeNode.asText());
        }
        JsonNode payload = root.get("payload");
        if (payload == null || payload.isNull()) payload = Json.MAPPER.createObjectNode();
        if (!payload.isObject()) throw new ProtocolException(type + " payload is not an object");
        try {
            return Json.MAPPER.treeToValue(payload, type.payloadClass());
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid " + type + " payload: " + e.getOriginalMessage(), e);
        }
    }
}
