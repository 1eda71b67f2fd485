package com.shardchat.shard.push.frame;

/**
 * A frame received from a client. The set of kinds is closed; anything unrecognized decodes to {@link InvalidFrame}.
 */
public sealed interface InboundFrame permits RegisterFrame, SendMessageFrame, InvalidFrame {

    <C> void dispatch(InboundFrameHandler<C> handler, C context);
}
