package io.meshpager.model;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    SHUTTING_DOWN;

    public boolean canTransitionTo(ConnectionState next) {
        if (this == SHUTTING_DOWN) {
            return false;
        }
        if (next == SHUTTING_DOWN) {
            return true;
        }
        return switch (this) {
            case DISCONNECTED -> next == CONNECTING;
            case CONNECTING -> next == CONNECTED;
            case CONNECTED -> next == RECONNECTING;
            case RECONNECTING -> next == CONNECTING;
            case SHUTTING_DOWN -> false;
        };
    }
}
