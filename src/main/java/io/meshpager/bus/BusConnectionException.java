package io.meshpager.bus;

public final class BusConnectionException extends RuntimeException {
    public BusConnectionException(String message) {
        super(message);
    }

    public BusConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
