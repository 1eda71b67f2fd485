package com.shardchat.shard.push.frame;

import com.shardchat.common.model.SendMessageRequest;

public record SendMessageFrame(String fromUserId, String toUserId, String content) implements InboundFrame {

    public SendMessageRequest toRequest() {
        return new SendMessageRequest(fromUserId, toUserId, content);
    }

    @Override
    public <C> void dispatch(InboundFrameHandler<C> handler, C context) {
        handler.onSendMessage(this, context);
    }
}
