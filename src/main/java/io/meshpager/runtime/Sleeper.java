package io.meshpager.runtime;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    /**
     * Waits for {@code duration}.
     *
     * @return {@code true} if the full duration elapsed, {@code false} if the wait was cut short by
     *         shutdown or interruption
     */
    boolean sleep(Duration duration);

    /** Whether blocking work in progress should be abandoned. */
    default boolean cancelled() {
        return false;
    }
}
