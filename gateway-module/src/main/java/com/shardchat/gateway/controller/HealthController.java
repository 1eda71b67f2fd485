package com.shardchat.gateway.controller;

import com.shardchat.common.model.ServiceStatus;
import com.shardchat.gateway.dto.GatewayStatus;
import com.shardchat.gateway.dto.ShardHealthReport;
import com.shardchat.gateway.service.GatewayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Tag(name = "Health Check", description = "Health check endpoints for monitoring")
public class HealthController {
    private static final String SERVICE_NAME = "gateway";

    private final GatewayService gatewayService;

    @GetMapping
    @Operation(summary = "Health check", description = "Gateway liveness with the cached health of every shard")
    public ResponseEntity<GatewayStatus> getHealth() {
        log.debug("Health check requested");
        return ResponseEntity.ok(new GatewayStatus(ServiceStatus.OK, SERVICE_NAME, gatewayService.cachedHealth()));
    }

    @GetMapping("/shards")
    @Operation(summary = "Shard health",
               description = "Cached health of every shard; with probe=true every endpoint is probed as well")
    public Mono<ResponseEntity<ShardHealthReport>> getShardHealth(
            @Parameter(description = "Actively probe every endpoint")
            @RequestParam(name = "probe", defaultValue = "false") boolean probe) {
        log.debug("Shard health requested (probe={})", probe);
        return gatewayService.shardHealth(probe).map(ResponseEntity::ok);
    }
}
