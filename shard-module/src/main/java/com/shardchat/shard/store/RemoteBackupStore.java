package com.shardchat.shard.store;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.UserRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Backup store living in another shard node process, reached over its replica API.
 */
@Slf4j
public class RemoteBackupStore implements BackupStore {
    public static final String REPLICA_API_BASE_PATH = "/api/v1/shard/replica";

    private final WebClient webClient;
    private final String baseUrl;
    private final Duration timeout;

    public RemoteBackupStore(WebClient.Builder webClientBuilder, String baseUrl, Duration timeout) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.baseUrl = baseUrl;
        this.timeout = timeout;
    }

    @Override
    public void verifyConnectivity() {
        try {
            webClient.get()
                    .uri(REPLICA_API_BASE_PATH + "/ping")
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
        } catch (RuntimeException e) {
            throw new MessageStoreException("Backup store at " + baseUrl + " is not reachable", e);
        }
    }

    @Override
    public void upsertUsers(List<UserRecord> users) {
        if (users.isEmpty()) {
            return;
        }
        post("/users", users);
        log.debug("Pushed {} users to backup {}", users.size(), baseUrl);
    }

    @Override
    public void upsertMessages(List<ChatMessage> messages) {
        if (messages.isEmpty()) {
            return;
        }
        post("/messages", messages);
        log.debug("Pushed {} messages to backup {}", messages.size(), baseUrl);
    }

    private void post(String path, Object body) {
        try {
            webClient.post()
                    .uri(REPLICA_API_BASE_PATH + path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
        } catch (RuntimeException e) {
            throw new MessageStoreException("Backup write to " + baseUrl + path + " failed", e);
        }
    }
}
