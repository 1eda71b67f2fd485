package com.shardchat.shard.store;

import com.shardchat.common.model.UserRecord;
import com.shardchat.common.routing.ShardAssigner;
import com.shardchat.common.routing.UserIds;
import com.shardchat.shard.config.ShardProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts the configured seed users that the store does not know yet.
 * Only users owned by this shard are inserted; the others belong to another shard's list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SeedUserLoader implements ApplicationRunner {

    private final MessageStore messageStore;
    private final ShardProperties properties;
    private final ShardAssigner shardAssigner;

    @Override
    public void run(ApplicationArguments args) {
        List<UserRecord> missing = new ArrayList<>();
        for (ShardProperties.SeedUser seed : properties.getStorage().getSeedUsers()) {
            String id = UserIds.normalize(seed.getId());
            int owner = shardAssigner.shardOf(id);
            if (owner != properties.getId()) {
                log.debug("Skipping seed user {}: owned by shard {}", id, owner);
                continue;
            }
            if (messageStore.findUser(id).isEmpty()) {
                missing.add(new UserRecord(id, seed.getName(), owner));
            }
        }

        if (!missing.isEmpty()) {
            messageStore.upsertUsers(missing);
            log.info("Seeded {} users into shard {}", missing.size(), properties.getId());
        }
    }
}
