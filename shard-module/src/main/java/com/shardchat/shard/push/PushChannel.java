package com.shardchat.shard.push;

import java.io.IOException;

/**
 * A live bidirectional connection to one client.
 */
public interface PushChannel {

    String id();

    void send(String payload) throws IOException;

    boolean isOpen();
}
