package com.shardchat.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Liveness payload returned by health endpoints.
 */
public record ServiceStatus(
    @JsonProperty("status")
    String status,

    @JsonProperty("service")
    String service
) {
    public static final String OK = "ok";
    public static final String DOWN = "down";

    @JsonCreator
    public ServiceStatus {
    }

    public static ServiceStatus ok(String service) {
        return new ServiceStatus(OK, service);
    }

    public static ServiceStatus down(String service) {
        return new ServiceStatus(DOWN, service);
    }
}
