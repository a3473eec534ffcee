package io.meshpager.storage;

/**
 * The database stayed locked through every busy retry. The operation did not take effect and may be
 * repeated later.
 */
public final class PersistenceBusyException extends PersistenceException {
    private final int attempts;

    public PersistenceBusyException(String operation, int attempts, Throwable cause) {
        super("Database busy during " + operation + " after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
