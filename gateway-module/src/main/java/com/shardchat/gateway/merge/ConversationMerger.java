package com.shardchat.gateway.merge;

import com.shardchat.common.model.ChatMessage;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges per-shard conversation results into one chronological list.
 * <p>
 * Results are concatenated in the order given, stably sorted by creation time and deduplicated on
 * (sender, recipient, creation time); the first occurrence wins, so on equal timestamps the earlier
 * result list takes precedence.
 */
@Component
public class ConversationMerger {

    @SafeVarargs
    public final List<ChatMessage> merge(List<ChatMessage>... perShardResults) {
        List<ChatMessage> all = new ArrayList<>();
        for (List<ChatMessage> result : perShardResults) {
            all.addAll(result);
        }
        // List.sort is stable
        all.sort(Comparator.comparing(ChatMessage::createdAt));

        Set<DedupKey> seen = new HashSet<>();
        List<ChatMessage> merged = new ArrayList<>(all.size());
        for (ChatMessage message : all) {
            if (seen.add(new DedupKey(message.fromUserId(), message.toUserId(), message.createdAt()))) {
                merged.add(message);
            }
        }
        return merged;
    }

    private record DedupKey(String fromUserId, String toUserId, Instant createdAt) {
    }
}
