package io.meshpager.bus;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory {@link BusClient} that records calls and lets tests inject deliveries and failures. */
final class FakeBusClient implements BusClient {
    final List<String> calls = new CopyOnWriteArrayList<>();
    final AtomicInteger connectAttempts = new AtomicInteger();
    final AtomicInteger failuresRemaining = new AtomicInteger();
    volatile boolean closed;

    private volatile Listener listener;
    private volatile boolean connected;

    @Override
    public void connect(Listener listener) {
        connectAttempts.incrementAndGet();
        if (failuresRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new BusConnectionException("broker unavailable");
        }
        this.listener = listener;
        connected = true;
        calls.add("connect");
    }

    @Override
    public void subscribe(String topicFilter) {
        if (!connected) {
            throw new BusConnectionException("not connected");
        }
        calls.add("subscribe:" + topicFilter);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public void close() {
        closed = true;
    }

    void deliver(String topic, byte[] payload) {
        listener.messageArrived(topic, payload);
    }

    void dropConnection() {
        connected = false;
        listener.connectionLost(new RuntimeException("broker went away"));
    }

    void dropSilently() {
        connected = false;
    }

    long subscribeCount() {
        return calls.stream().filter(call -> call.startsWith("subscribe:")).count();
    }
}
