package com.shardchat.gateway.controller;

import com.shardchat.gateway.dto.UserListResponse;
import com.shardchat.gateway.service.GatewayService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Tag(name = "Users", description = "Users across all shards")
public class UserController {

    private final GatewayService gatewayService;

    @GetMapping
    @Operation(summary = "List users", description = "Users of every reachable shard")
    public Mono<ResponseEntity<UserListResponse>> listUsers() {
        log.info("Received request to list users");
        return gatewayService.listUsers().map(ResponseEntity::ok);
    }
}
