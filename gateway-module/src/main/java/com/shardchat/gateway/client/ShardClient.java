package com.shardchat.gateway.client;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.SendMessageRequest;
import com.shardchat.common.model.ServiceStatus;
import com.shardchat.common.model.ShardConversationResponse;
import com.shardchat.common.model.ShardUsersResponse;
import com.shardchat.common.model.UserMessagesResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Optional;

/**
 * Client of one shard node endpoint.
 */
@Slf4j
public class ShardClient {

    private static final String SHARD_API_BASE_PATH = "/api/v1/shard";

    private final WebClient shardWebClient;
    private final URI baseUri;

    public ShardClient(WebClient shardWebClient, URI baseUri) {
        this.shardWebClient = shardWebClient;
        this.baseUri = baseUri;
    }

    public URI baseUri() {
        return baseUri;
    }

    public Mono<ChatMessage> sendMessage(SendMessageRequest request) {
        log.debug("Sending message from {} to {} via {}", request.fromUserId(), request.toUserId(), baseUri);

        return shardWebClient
                .post()
                .uri(SHARD_API_BASE_PATH + "/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(ChatMessage.class)
                .doOnNext(message -> log.debug("Message {} stored via {}", message.id(), baseUri));
    }

    public Mono<UserMessagesResponse> getUserMessages(String userId, Integer limit) {
        return shardWebClient
                .get()
                .uri(uriBuilder -> uriBuilder
                        .path(SHARD_API_BASE_PATH + "/messages/{userId}")
                        .queryParamIfPresent("limit", Optional.ofNullable(limit))
                        .build(userId))
                .retrieve()
                .bodyToMono(UserMessagesResponse.class);
    }

    public Mono<ShardConversationResponse> getConversation(String userId, String otherUserId, Integer limit) {
        return shardWebClient
                .get()
                .uri(uriBuilder -> uriBuilder
                        .path(SHARD_API_BASE_PATH + "/conversations/{userId}/{otherUserId}")
                        .queryParamIfPresent("limit", Optional.ofNullable(limit))
                        .build(userId, otherUserId))
                .retrieve()
                .bodyToMono(ShardConversationResponse.class);
    }

    public Mono<ShardUsersResponse> listUsers() {
        return shardWebClient
                .get()
                .uri(SHARD_API_BASE_PATH + "/users")
                .retrieve()
                .bodyToMono(ShardUsersResponse.class);
    }

    public Mono<ServiceStatus> health() {
        return shardWebClient
                .get()
                .uri(SHARD_API_BASE_PATH + "/health")
                .retrieve()
                .bodyToMono(ServiceStatus.class);
    }
}
