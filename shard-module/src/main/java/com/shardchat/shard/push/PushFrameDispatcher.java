package com.shardchat.shard.push;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.routing.UserIds;
import com.shardchat.shard.config.ShardProperties;
import com.shardchat.shard.push.frame.ErrorFrame;
import com.shardchat.shard.push.frame.FrameCodec;
import com.shardchat.shard.push.frame.InboundFrameHandler;
import com.shardchat.shard.push.frame.InvalidFrame;
import com.shardchat.shard.push.frame.MessageSentFrame;
import com.shardchat.shard.push.frame.RegisterFrame;
import com.shardchat.shard.push.frame.RegisteredFrame;
import com.shardchat.shard.push.frame.SendMessageFrame;
import com.shardchat.shard.service.ShardMessageService;
import com.shardchat.shard.store.MessageStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handles frames arriving on push channels. Every frame gets exactly one reply on the channel it came from.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PushFrameDispatcher implements InboundFrameHandler<PushChannel> {

    private final FrameCodec frameCodec;
    private final ConnectionRegistry connectionRegistry;
    private final PushNotifier pushNotifier;
    private final ShardMessageService messageService;
    private final ShardProperties properties;

    public void handle(PushChannel channel, String payload) {
        frameCodec.decode(payload).dispatch(this, channel);
    }

    @Override
    public void onRegister(RegisterFrame frame, PushChannel channel) {
        String userId;
        try {
            userId = UserIds.normalize(frame.userId());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected registration on channel {}: {}", channel.id(), e.getMessage());
            pushNotifier.send(channel, new ErrorFrame(e.getMessage()));
            return;
        }

        connectionRegistry.register(userId, channel);
        pushNotifier.send(channel, new RegisteredFrame(userId, properties.getId()));
    }

    @Override
    public void onSendMessage(SendMessageFrame frame, PushChannel channel) {
        try {
            // recipient push happens inside the write path
            ChatMessage message = messageService.sendMessage(frame.toRequest());
            pushNotifier.send(channel, MessageSentFrame.delivered(message.id()));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected message on channel {}: {}", channel.id(), e.getMessage());
            pushNotifier.send(channel, new ErrorFrame(e.getMessage()));
        } catch (MessageStoreException e) {
            log.error("Failed to store message sent over channel {}", channel.id(), e);
            pushNotifier.send(channel, new ErrorFrame("Failed to send message"));
        }
    }

    @Override
    public void onInvalid(InvalidFrame frame, PushChannel channel) {
        log.warn("Invalid frame on channel {}: {}", channel.id(), frame.reason());
        pushNotifier.send(channel, new ErrorFrame(frame.reason()));
    }
}
