package com.shardchat.shard.controller;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.SendMessageRequest;
import com.shardchat.common.model.ServiceStatus;
import com.shardchat.common.model.ShardConversationResponse;
import com.shardchat.common.model.ShardUsersResponse;
import com.shardchat.common.model.UserMessagesResponse;
import com.shardchat.shard.config.ShardProperties;
import com.shardchat.shard.service.ShardMessageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping(ShardController.SHARD_API_BASE_PATH)
@RequiredArgsConstructor
@Tag(name = "Shard", description = "Message write and read path of a single shard")
public class ShardController {
    public static final String SHARD_API_BASE_PATH = "/api/v1/shard";

    private final ShardMessageService messageService;
    private final ShardProperties properties;

    @PostMapping("/messages")
    @Operation(summary = "Store a message",
               description = "Persist a message on this shard, invalidate cached reads and push it to the recipient if connected")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Message stored"),
        @ApiResponse(responseCode = "400", description = "Invalid user id or empty content"),
        @ApiResponse(responseCode = "500", description = "Message could not be persisted")
    })
    public ResponseEntity<ChatMessage> sendMessage(@Valid @RequestBody SendMessageRequest request) {
        log.info("Received message from {} to {}", request.fromUserId(), request.toUserId());
        ChatMessage message = messageService.sendMessage(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    @GetMapping("/messages/{userId}")
    @Operation(summary = "Get user messages", description = "Messages sent or received by the user, newest first")
    public ResponseEntity<UserMessagesResponse> getUserMessages(
            @PathVariable String userId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        log.debug("Received request for messages of user {} (limit {})", userId, limit);
        return ResponseEntity.ok(messageService.messagesFor(userId, limit));
    }

    @GetMapping("/conversations/{userId}/{otherUserId}")
    @Operation(summary = "Get conversation", description = "Messages between two users on this shard, oldest first")
    public ResponseEntity<ShardConversationResponse> getConversation(
            @PathVariable String userId,
            @PathVariable String otherUserId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        log.debug("Received request for conversation {} <-> {} (limit {})", userId, otherUserId, limit);
        return ResponseEntity.ok(messageService.conversation(userId, otherUserId, limit));
    }

    @GetMapping("/users")
    @Operation(summary = "List users", description = "User records of this shard plus senders without a record")
    public ResponseEntity<ShardUsersResponse> listUsers() {
        return ResponseEntity.ok(messageService.listUsers());
    }

    @GetMapping("/health")
    @Operation(summary = "Shard health")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Store is reachable"),
        @ApiResponse(responseCode = "503", description = "Store is not reachable")
    })
    public ResponseEntity<ServiceStatus> getHealth() {
        boolean healthy = messageService.isHealthy();
        return healthy ? ResponseEntity.ok(ServiceStatus.ok(properties.serviceName()))
                       : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ServiceStatus.down(properties.serviceName()));
    }
}
