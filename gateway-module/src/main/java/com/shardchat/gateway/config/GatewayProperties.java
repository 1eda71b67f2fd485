package com.shardchat.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /**
     * Static shard table. Ids must be exactly 1..N.
     */
    @Valid
    @NotEmpty
    private List<Shard> shards = new ArrayList<>();

    /**
     * Per-attempt timeout of a call to one shard endpoint.
     */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(2);

    @Data
    public static class Shard {
        @Min(1)
        private int id;

        /**
         * Endpoints in failover order: primary first, then backups.
         */
        @NotEmpty
        private List<URI> endpoints = new ArrayList<>();
    }
}
