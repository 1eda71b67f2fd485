package com.shardchat.shard.controller;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.UserRecord;
import com.shardchat.shard.service.ShardMessageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Ingest side of replication, called by the primary of the same shard.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/shard/replica")
@RequiredArgsConstructor
@Tag(name = "Replica", description = "Batch upserts from the primary node of this shard")
public class ReplicaController {

    private final ShardMessageService messageService;

    @PostMapping("/messages")
    @Operation(summary = "Upsert replicated messages",
               description = "Insert new messages; for known ids only the content is overwritten")
    public ResponseEntity<Void> upsertMessages(@RequestBody List<ChatMessage> messages) {
        log.debug("Received {} replicated messages", messages.size());
        messageService.applyReplicatedMessages(messages);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/users")
    @Operation(summary = "Upsert replicated users")
    public ResponseEntity<Void> upsertUsers(@RequestBody List<UserRecord> users) {
        log.debug("Received {} replicated users", users.size());
        messageService.applyReplicatedUsers(users);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/ping")
    @Operation(summary = "Replica connectivity check")
    public ResponseEntity<String> ping() {
        return messageService.isHealthy() ? ResponseEntity.ok("UP")
                                          : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("DOWN");
    }
}
