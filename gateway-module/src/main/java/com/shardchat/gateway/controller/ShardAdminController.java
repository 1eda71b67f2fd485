package com.shardchat.gateway.controller;

import com.shardchat.gateway.dto.ShardHealthReport;
import com.shardchat.gateway.service.GatewayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the static shard table.
 */
@Slf4j
@RestController
@RequestMapping("/api/shards")
@RequiredArgsConstructor
@Tag(name = "Shards", description = "Configured shards and their endpoints")
public class ShardAdminController {

    private final GatewayService gatewayService;

    @GetMapping
    @Operation(summary = "List shards", description = "Shard ids, endpoints in failover order and cached health")
    public ResponseEntity<ShardHealthReport> getShards() {
        log.debug("Received request for shard table");
        return ResponseEntity.ok(new ShardHealthReport(gatewayService.cachedHealth(), false));
    }
}
