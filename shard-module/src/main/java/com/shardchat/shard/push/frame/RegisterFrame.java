package com.shardchat.shard.push.frame;

public record RegisterFrame(String userId) implements InboundFrame {

    @Override
    public <C> void dispatch(InboundFrameHandler<C> handler, C context) {
        handler.onRegister(this, context);
    }
}
