package com.shardchat.shard.push;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link PushChannel} over a WebSocket session. Sends from concurrent request threads are serialized by the decorator.
 */
public class WebSocketPushChannel implements PushChannel {
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketPushChannel(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
