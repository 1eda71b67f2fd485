package com.shardchat.gateway.controller;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.SendMessageRequest;
import com.shardchat.common.model.UserMessagesResponse;
import com.shardchat.gateway.dto.ConversationResponse;
import com.shardchat.gateway.service.GatewayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Messages", description = "Send and read chat messages")
public class MessageController {

    private final GatewayService gatewayService;

    @PostMapping("/messages")
    @Operation(summary = "Send a message",
               description = "Store the message on the sender's shard, failing over to the shard's backup endpoints")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Message stored"),
        @ApiResponse(responseCode = "400", description = "Missing fields or invalid user id"),
        @ApiResponse(responseCode = "503", description = "No endpoint of the sender's shard is reachable")
    })
    public Mono<ResponseEntity<ChatMessage>> sendMessage(@Valid @RequestBody SendMessageRequest request) {
        log.info("Received message from user {} to user {}", request.fromUserId(), request.toUserId());

        return gatewayService.sendMessage(request)
                .map(message -> ResponseEntity.status(HttpStatus.CREATED).body(message));
    }

    @GetMapping("/messages/{userId}")
    @Operation(summary = "Get user messages", description = "Messages sent or received by the user, newest first")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Messages retrieved"),
        @ApiResponse(responseCode = "400", description = "Invalid user id"),
        @ApiResponse(responseCode = "503", description = "No endpoint of the user's shard is reachable")
    })
    public Mono<ResponseEntity<UserMessagesResponse>> getUserMessages(
            @Parameter(description = "User id") @PathVariable String userId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        log.info("Received request for messages of user {}", userId);

        return gatewayService.getUserMessages(userId, limit).map(ResponseEntity::ok);
    }

    @GetMapping("/conversations/{userId}/{otherUserId}")
    @Operation(summary = "Get conversation",
               description = "Messages between two users merged from both users' shards, oldest first")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Conversation retrieved, possibly partial"),
        @ApiResponse(responseCode = "400", description = "Invalid user id"),
        @ApiResponse(responseCode = "503", description = "None of the queried shards is reachable")
    })
    public Mono<ResponseEntity<ConversationResponse>> getConversation(
            @PathVariable String userId,
            @PathVariable String otherUserId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        log.info("Received request for conversation between {} and {}", userId, otherUserId);

        return gatewayService.getConversation(userId, otherUserId, limit).map(ResponseEntity::ok);
    }
}
