package com.shardchat.shard.id;

import java.util.UUID;

/**
 * Random (version 4) UUID message ids, the same format the shard stores have always used.
 */
public class UuidMessageIdGenerator implements MessageIdGenerator {

    @Override
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
