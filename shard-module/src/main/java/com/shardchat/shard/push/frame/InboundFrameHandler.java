package com.shardchat.shard.push.frame;

public interface InboundFrameHandler<C> {

    void onRegister(RegisterFrame frame, C context);

    void onSendMessage(SendMessageFrame frame, C context);

    void onInvalid(InvalidFrame frame, C context);
}
