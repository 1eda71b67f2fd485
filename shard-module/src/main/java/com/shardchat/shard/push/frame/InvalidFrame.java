package com.shardchat.shard.push.frame;

/**
 * Malformed or unknown frame. Carries the reason reported back to the client.
 */
public record InvalidFrame(String reason) implements InboundFrame {

    @Override
    public <C> void dispatch(InboundFrameHandler<C> handler, C context) {
        handler.onInvalid(this, context);
    }
}
