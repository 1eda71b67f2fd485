package com.shardchat.gateway.client;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;

@Component
@RequiredArgsConstructor
public class ShardClientFactory {

    private final WebClient.Builder shardWebClientBuilder;

    public ShardClient create(URI baseUri) {
        WebClient client = shardWebClientBuilder.clone()
                .baseUrl(baseUri.toString())
                .build();
        return new ShardClient(client, baseUri);
    }
}
