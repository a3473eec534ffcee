package io.meshpager.bus;

/**
 * Minimal publish/subscribe primitives {@link BusConnection} builds its lifecycle on.
 *
 * <p>Implementations deliver messages and connection-loss notices through the listener given to
 * {@link #connect}. They must not reconnect on their own.
 */
public interface BusClient extends AutoCloseable {

    void connect(Listener listener);

    void subscribe(String topicFilter);

    boolean isConnected();

    void disconnect();

    @Override
    void close();

    interface Listener {
        void messageArrived(String topic, byte[] payload);

        void connectionLost(Throwable cause);
    }
}
