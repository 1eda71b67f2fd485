package com.shardchat.shard.push.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shardchat.common.serialization.ChatJson;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of push frames. Frames are objects tagged by {@code type}; {@code kind} is accepted as the tag name
 * too, and camelCase field names are accepted next to the snake_case ones.
 */
@Component
public class FrameCodec {

    private final ObjectMapper objectMapper = ChatJson.mapper();

    public InboundFrame decode(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            return new InvalidFrame("Malformed frame: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return new InvalidFrame("Frame must be a JSON object");
        }

        String type = text(root, "type", "kind");
        if (type == null) {
            return new InvalidFrame("Frame type is missing");
        }

        switch (type) {
            case "register":
                return new RegisterFrame(text(root, "user_id", "userId"));
            case "send_message":
            case "sendMessage":
                return new SendMessageFrame(
                        text(root, "from_user_id", "fromId"),
                        text(root, "to_user_id", "toId"),
                        text(root, "content"));
            default:
                return new InvalidFrame("Unknown message type: " + type);
        }
    }

    public String encode(OutboundFrame frame) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", frame.type());
        node.setAll((ObjectNode) objectMapper.valueToTree(frame));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + frame.type() + " frame", e);
        }
    }

    private static String text(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode value = root.get(name);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }
}
