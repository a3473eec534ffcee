package io.meshpager.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide cancellation token. Triggering it is one-way; every backoff sleep in the bridge
 * waits on it so a shutdown request wakes sleepers immediately.
 */
public final class ShutdownSignal implements Sleeper {
    private static final Logger log = LoggerFactory.getLogger(ShutdownSignal.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicReference<String> reason = new AtomicReference<>();

    public void trigger(String why) {
        if (reason.compareAndSet(null, why == null ? "unspecified" : why)) {
            log.info("Shutdown requested: {}", reason.get());
            latch.countDown();
        }
    }

    public boolean isTriggered() {
        return latch.getCount() == 0L;
    }

    public String reason() {
        return reason.get();
    }

    @Override
    public boolean cancelled() {
        return isTriggered();
    }

    @Override
    public boolean sleep(Duration duration) {
        if (isTriggered()) {
            return false;
        }
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            return !latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
