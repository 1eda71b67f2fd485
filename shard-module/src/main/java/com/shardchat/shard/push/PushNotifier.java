package com.shardchat.shard.push;

import com.shardchat.shard.push.frame.FrameCodec;
import com.shardchat.shard.push.frame.OutboundFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Best effort delivery of frames to connected clients. Never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PushNotifier {

    private final ConnectionRegistry connectionRegistry;
    private final FrameCodec frameCodec;

    /**
     * @return true if the user had a live channel and the frame was handed to it
     */
    public boolean deliver(String userId, OutboundFrame frame) {
        Optional<PushChannel> channel = connectionRegistry.lookup(userId);
        if (channel.isEmpty()) {
            log.debug("User {} is not connected, {} frame not pushed", userId, frame.type());
            return false;
        }
        return send(channel.get(), frame);
    }

    public boolean send(PushChannel channel, OutboundFrame frame) {
        if (!channel.isOpen()) {
            log.debug("Channel {} is closed, dropping {} frame", channel.id(), frame.type());
            return false;
        }
        try {
            channel.send(frameCodec.encode(frame));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to push {} frame to channel {}: {}", frame.type(), channel.id(), e.getMessage());
            return false;
        }
    }
}
