package com.shardchat.gateway.exception;

import lombok.Getter;

/**
 * Every endpoint of a shard failed for one request.
 */
@Getter
public class ShardUnavailableException extends RuntimeException {

    private final int shardId;

    public ShardUnavailableException(int shardId, String operation, Throwable lastError) {
        super("All endpoints failed for shard " + shardId + " (" + operation + ")"
                + (lastError != null ? ": " + lastError.getMessage() : ""), lastError);
        this.shardId = shardId;
    }
}
