package com.shardchat.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shardchat.common.serialization.ChatJson;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ChatMessageJsonTest {

    private final ObjectMapper mapper = ChatJson.mapper();

    @Test
    void writesSnakeCaseFieldsAndIsoTimestamp() throws Exception {
        ChatMessage message = ChatMessage.builder()
                .id("m-1")
                .fromUserId("1")
                .toUserId("2")
                .content("Hello!")
                .createdAt(Instant.parse("2024-05-01T10:15:30.123Z"))
                .shardId(1)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(message));

        assertThat(json.get("from_user_id").asText()).isEqualTo("1");
        assertThat(json.get("to_user_id").asText()).isEqualTo("2");
        assertThat(json.get("created_at").asText()).isEqualTo("2024-05-01T10:15:30.123Z");
        assertThat(json.get("shard_id").asInt()).isEqualTo(1);
        assertThat(json.has("createdAtMillis")).isFalse();
    }

    @Test
    void readsPayloadOfOriginalClient() throws Exception {
        String body = "{\"from_user_id\":\"1\",\"to_user_id\":\"2\",\"content\":\"hi\",\"extra\":true}";

        SendMessageRequest request = mapper.readValue(body, SendMessageRequest.class);

        assertThat(request.fromUserId()).isEqualTo("1");
        assertThat(request.toUserId()).isEqualTo("2");
        assertThat(request.content()).isEqualTo("hi");
    }

    @Test
    void withContentKeepsIdentityFields() {
        Instant createdAt = Instant.parse("2024-05-01T10:15:30Z");
        ChatMessage original = new ChatMessage("m-1", "1", "2", "old", createdAt, 1);

        ChatMessage updated = original.withContent("new");

        assertThat(updated.id()).isEqualTo("m-1");
        assertThat(updated.fromUserId()).isEqualTo("1");
        assertThat(updated.toUserId()).isEqualTo("2");
        assertThat(updated.createdAt()).isEqualTo(createdAt);
        assertThat(updated.content()).isEqualTo("new");
    }

    @Test
    void conversationMembershipIsSymmetric() {
        ChatMessage message = new ChatMessage("m-1", "1", "2", "x", Instant.EPOCH, 1);

        assertThat(message.isBetween("1", "2")).isTrue();
        assertThat(message.isBetween("2", "1")).isTrue();
        assertThat(message.isBetween("1", "3")).isFalse();
        assertThat(message.involves("2")).isTrue();
        assertThat(message.involves("3")).isFalse();
    }
}
