package com.shardchat.shard.push;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private final PushFrameDispatcher dispatcher;
    private final ConnectionRegistry connectionRegistry;
    private final Map<String, PushChannel> channelsBySession = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        channelsBySession.put(session.getId(), new WebSocketPushChannel(session));
        log.info("WebSocket connection {} established from {}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        PushChannel channel = channelsBySession.computeIfAbsent(session.getId(), id -> new WebSocketPushChannel(session));
        dispatcher.handle(channel, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error on {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("WebSocket connection {} closed: {}", session.getId(), status);
        release(session);
    }

    private void release(WebSocketSession session) {
        PushChannel channel = channelsBySession.remove(session.getId());
        if (channel != null) {
            connectionRegistry.unregister(channel);
        }
    }
}
