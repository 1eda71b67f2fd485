package com.shardchat.gateway.service;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.SendMessageRequest;
import com.shardchat.common.model.ShardConversationResponse;
import com.shardchat.common.model.ShardUsersResponse;
import com.shardchat.common.model.UserMessagesResponse;
import com.shardchat.common.model.UserRecord;
import com.shardchat.common.routing.UserIds;
import com.shardchat.gateway.client.ShardClient;
import com.shardchat.gateway.cluster.failover.FailoverExecutor;
import com.shardchat.gateway.cluster.health.ShardHealthMonitor;
import com.shardchat.gateway.cluster.health.ShardProber;
import com.shardchat.gateway.cluster.model.ShardDescriptor;
import com.shardchat.gateway.cluster.router.ShardRouter;
import com.shardchat.gateway.dto.ConversationResponse;
import com.shardchat.gateway.dto.ShardHealthReport;
import com.shardchat.gateway.dto.ShardHealthView;
import com.shardchat.gateway.dto.UserListResponse;
import com.shardchat.gateway.exception.ShardUnavailableException;
import com.shardchat.gateway.merge.ConversationMerger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Routing, fan-out and merge of client requests over the shard nodes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final ShardRouter shardRouter;
    private final FailoverExecutor failoverExecutor;
    private final ShardHealthMonitor healthMonitor;
    private final ShardProber shardProber;
    private final ConversationMerger conversationMerger;

    /**
     * Store a message on the sender's shard.
     *
     * @param request message to send
     * @return the stored message as returned by the shard
     * @throws IllegalArgumentException if a user id is invalid
     */
    public Mono<ChatMessage> sendMessage(SendMessageRequest request) {
        ShardDescriptor shard = shardRouter.route(request.fromUserId());
        UserIds.parse(request.toUserId());
        log.info("Routing message from user {} to shard {}", request.fromUserId(), shard.id());

        return failoverExecutor.execute(shard, "send message", client -> client.sendMessage(request));
    }

    /**
     * Messages of a user, read from the user's own shard.
     *
     * @param userId user id
     * @param limit  maximum number of messages, shard default when null
     */
    public Mono<UserMessagesResponse> getUserMessages(String userId, Integer limit) {
        ShardDescriptor shard = shardRouter.route(userId);
        log.info("Fetching messages for user {} from shard {}", userId, shard.id());

        return failoverExecutor.execute(shard, "get messages", client -> client.getUserMessages(userId, limit));
    }

    /**
     * Conversation between two users, merged from both users' shards.
     * <p>
     * When the users live on different shards both are queried in parallel and a shard that cannot be reached
     * contributes nothing. The request fails only when none of the queried shards answered.
     */
    public Mono<ConversationResponse> getConversation(String userId, String otherUserId, Integer limit) {
        String user = UserIds.normalize(userId);
        String other = UserIds.normalize(otherUserId);
        ShardDescriptor userShard = shardRouter.route(user);
        ShardDescriptor otherShard = shardRouter.route(other);
        log.info("Fetching conversation between {} (shard {}) and {} (shard {})",
                user, userShard.id(), other, otherShard.id());

        if (userShard.id() == otherShard.id()) {
            return conversationFrom(userShard, user, other, limit)
                    .map(messages -> new ConversationResponse(
                            conversationMerger.merge(messages), user, other, List.of(userShard.id())));
        }

        Mono<ShardPart> fromUserShard = tolerant(userShard, conversationFrom(userShard, user, other, limit));
        Mono<ShardPart> fromOtherShard = tolerant(otherShard, conversationFrom(otherShard, user, other, limit));

        return Mono.zip(fromUserShard, fromOtherShard)
                .flatMap(parts -> {
                    ShardPart first = parts.getT1();
                    ShardPart second = parts.getT2();
                    if (first.error() != null && second.error() != null) {
                        return Mono.error(first.error());
                    }
                    return Mono.just(new ConversationResponse(
                            conversationMerger.merge(first.messages(), second.messages()),
                            user,
                            other,
                            List.of(userShard.id(), otherShard.id())));
                });
    }

    /**
     * Users of every shard. A shard that cannot be reached contributes nothing.
     */
    public Mono<UserListResponse> listUsers() {
        log.info("Fetching all users from {} shards", shardRouter.allShards().size());

        return Flux.fromIterable(shardRouter.allShards())
                .flatMapSequential(shard -> failoverExecutor.execute(shard, "list users", ShardClient::listUsers)
                        .map(ShardUsersResponse::users)
                        .defaultIfEmpty(List.of())
                        .onErrorResume(ShardUnavailableException.class, error -> {
                            log.warn("Failed to get users from shard {}: {}", shard.id(), error.getMessage());
                            return Mono.just(List.<UserRecord>of());
                        }))
                .flatMapIterable(users -> users)
                .collectList()
                .map(UserListResponse::of);
    }

    /**
     * Health of every shard: the cached request-path state, plus a live probe of each endpoint when asked.
     * Probing never changes the cached state.
     */
    public Mono<ShardHealthReport> shardHealth(boolean probe) {
        if (!probe) {
            return Mono.just(new ShardHealthReport(cachedHealth(), false));
        }

        return Flux.fromIterable(shardRouter.allShards())
                .flatMapSequential(shard -> shardProber.probe(shard)
                        .map(probes -> ShardHealthView.of(shard, healthMonitor.health(shard.id()), probes)))
                .collectList()
                .map(views -> new ShardHealthReport(views, true));
    }

    public List<ShardHealthView> cachedHealth() {
        return shardRouter.allShards().stream()
                .map(shard -> ShardHealthView.of(shard, healthMonitor.health(shard.id()), null))
                .toList();
    }

    private Mono<List<ChatMessage>> conversationFrom(ShardDescriptor shard, String user, String other, Integer limit) {
        return failoverExecutor.execute(shard, "get conversation", client -> client.getConversation(user, other, limit))
                .map(ShardConversationResponse::messages)
                .defaultIfEmpty(List.of());
    }

    private Mono<ShardPart> tolerant(ShardDescriptor shard, Mono<List<ChatMessage>> messages) {
        return messages
                .map(ShardPart::success)
                .onErrorResume(ShardUnavailableException.class, error -> {
                    log.warn("Shard {} unavailable for conversation, returning partial result: {}",
                            shard.id(), error.getMessage());
                    return Mono.just(ShardPart.failure(error));
                });
    }

    private record ShardPart(List<ChatMessage> messages, Throwable error) {

        static ShardPart success(List<ChatMessage> messages) {
            return new ShardPart(messages, null);
        }

        static ShardPart failure(Throwable error) {
            return new ShardPart(List.of(), error);
        }
    }
}
