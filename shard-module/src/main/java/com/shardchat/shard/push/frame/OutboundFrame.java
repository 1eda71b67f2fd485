package com.shardchat.shard.push.frame;

/**
 * A frame sent to a client. Encoded as the record's fields plus a {@code type} tag.
 */
public interface OutboundFrame {

    String type();
}
