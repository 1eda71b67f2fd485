package com.shardchat.gateway.client;

import com.shardchat.common.model.ChatMessage;
import com.shardchat.common.model.SendMessageRequest;
import com.shardchat.gateway.cluster.ShardTable;
import com.shardchat.gateway.cluster.failover.FailoverExecutor;
import com.shardchat.gateway.cluster.health.ShardHealthMonitor;
import com.shardchat.gateway.cluster.model.ShardDescriptor;
import com.shardchat.gateway.config.GatewayProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ShardClientTest {

    private static final URI PRIMARY = URI.create("http://shard-1:4001");
    private static final URI BACKUP = URI.create("http://shard-1-backup:4101");

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void storedMessageIsReadFromTheResponse() {
        ShardClient client = client(ClientResponse.create(HttpStatus.CREATED)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"id\":\"m1\",\"from_user_id\":\"1\",\"to_user_id\":\"2\",\"content\":\"hi\","
                        + "\"created_at\":\"2024-05-01T10:00:00Z\",\"shard_id\":1}")
                .build());

        ChatMessage message = client.sendMessage(new SendMessageRequest("1", "2", "hi")).block();

        assertThat(message.id()).isEqualTo("m1");
        assertThat(message.createdAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(requests).singleElement()
                .extracting(request -> request.url().getPath())
                .isEqualTo("/api/v1/shard/messages");
    }

    @Test
    void emptySuccessfulResponseCompletesWithoutError() {
        ShardClient client = client(emptyCreated());

        assertThat(client.sendMessage(new SendMessageRequest("1", "2", "hi")).blockOptional()).isEmpty();
    }

    @Test
    void emptySuccessfulResponseIsNotRetriedOnBackup() {
        ShardClientPool pool = mock(ShardClientPool.class);
        ShardClient backup = mock(ShardClient.class);
        when(pool.get(PRIMARY)).thenReturn(client(emptyCreated()));
        when(pool.get(BACKUP)).thenReturn(backup);

        ShardDescriptor shard = new ShardDescriptor(1, List.of(PRIMARY, BACKUP));
        GatewayProperties properties = new GatewayProperties();
        properties.setRequestTimeout(Duration.ofSeconds(1));
        ShardHealthMonitor healthMonitor = new ShardHealthMonitor(new ShardTable(List.of(shard)), Clock.systemUTC());
        FailoverExecutor executor = new FailoverExecutor(pool, healthMonitor, properties);

        executor.execute(shard, "send message", c -> c.sendMessage(new SendMessageRequest("1", "2", "hi"))).block();

        assertThat(requests).hasSize(1);
        verify(backup, never()).sendMessage(any());
        assertThat(healthMonitor.health(1).healthy()).isTrue();
    }

    private ShardClient client(ClientResponse response) {
        WebClient webClient = WebClient.builder()
                .baseUrl(PRIMARY.toString())
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(response);
                })
                .build();
        return new ShardClient(webClient, PRIMARY);
    }

    private static ClientResponse emptyCreated() {
        return ClientResponse.create(HttpStatus.CREATED)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
