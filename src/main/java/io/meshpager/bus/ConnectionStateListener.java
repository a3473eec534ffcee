package io.meshpager.bus;

import io.meshpager.model.ConnectionState;

@FunctionalInterface
public interface ConnectionStateListener {
    void onTransition(ConnectionState from, ConnectionState to);
}
