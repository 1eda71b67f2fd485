package com.shardchat.shard.replication;

import java.time.Instant;

/**
 * Outcome of one replication pass.
 *
 * @param users    user records pushed to the backup
 * @param messages message records pushed to the backup
 * @param since    exclusive lower bound on message creation time used for this pass
 */
public record ReplicationResult(int users, int messages, Instant since) {
}
