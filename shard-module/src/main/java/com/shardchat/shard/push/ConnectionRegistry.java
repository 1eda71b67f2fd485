package com.shardchat.shard.push;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection registry: user id -> push channel.
 * <p>
 * Owned by one shard node process, never shared with the backup and never persisted.
 * At most one channel per user: a new registration replaces the previous one without closing it.
 */
@Slf4j
@Component
public class ConnectionRegistry {

    private final Map<String, PushChannel> channels = new ConcurrentHashMap<>();

    /**
     * Bind the channel to the user.
     *
     * @return the channel previously bound to this user, if any
     */
    public Optional<PushChannel> register(String userId, PushChannel channel) {
        PushChannel previous = channels.put(userId, channel);
        if (previous != null && previous != channel) {
            log.info("User {} re-registered, channel {} replaced by {}", userId, previous.id(), channel.id());
        } else {
            log.info("User {} registered on channel {}", userId, channel.id());
        }
        return Optional.ofNullable(previous);
    }

    public Optional<PushChannel> lookup(String userId) {
        return Optional.ofNullable(channels.get(userId));
    }

    /**
     * Remove every binding that points at this channel. Linear in the number of connected users.
     *
     * @return user ids that were bound to the channel
     */
    public List<String> unregister(PushChannel channel) {
        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, PushChannel> entry : channels.entrySet()) {
            // remove(key, value): a concurrent re-registration for the same user survives
            if (entry.getValue() == channel && channels.remove(entry.getKey(), channel)) {
                removed.add(entry.getKey());
            }
        }
        if (!removed.isEmpty()) {
            log.info("Channel {} closed, unregistered users {}", channel.id(), removed);
        }
        return removed;
    }

    public int size() {
        return channels.size();
    }

    @PreDestroy
    public void clear() {
        log.info("Clearing connection registry with {} entries", channels.size());
        channels.clear();
    }
}
