package com.shardchat.shard.push;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory push channel that keeps everything sent to it.
 */
public class RecordingPushChannel implements PushChannel {

    private final String id;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failing;

    public RecordingPushChannel(String id) {
        this.id = id;
    }

    public List<String> sent() {
        return sent;
    }

    public void close() {
        open = false;
    }

    public void failOnSend() {
        failing = true;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String payload) throws IOException {
        if (failing) {
            throw new IOException("Broken pipe");
        }
        sent.add(payload);
    }

    @Override
    public boolean isOpen() {
        return open;
    }
}
