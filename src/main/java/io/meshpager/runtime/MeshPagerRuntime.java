package io.meshpager.runtime;

import io.meshpager.bus.BusClient;
import io.meshpager.bus.BusConnection;
import io.meshpager.bus.PahoBusClient;
import io.meshpager.codec.EnvelopeDecoder;
import io.meshpager.codec.ServiceEnvelopeParser;
import io.meshpager.config.MeshPagerConfig;
import io.meshpager.gateway.DapnetForwarder;
import io.meshpager.gateway.MessageForwarder;
import io.meshpager.logging.LogMarkers;
import io.meshpager.storage.Database;
import io.meshpager.storage.DedupeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Composition root: builds the pipeline from configuration, runs it on a dedicated worker thread
 * and tears it down when the {@link ShutdownSignal} fires.
 */
public final class MeshPagerRuntime {
    private static final Logger log = LoggerFactory.getLogger(MeshPagerRuntime.class);
    private static final Duration WORKER_JOIN_TIMEOUT = Duration.ofSeconds(15);

    private final MeshPagerConfig config;
    private final ShutdownSignal shutdown;

    public MeshPagerRuntime(MeshPagerConfig config) {
        this(config, new ShutdownSignal());
    }

    public MeshPagerRuntime(MeshPagerConfig config, ShutdownSignal shutdown) {
        this.config = config;
        this.shutdown = shutdown;
    }

    public ShutdownSignal shutdownSignal() {
        return shutdown;
    }

    public Database openDatabase() {
        Database database = new Database(config.databaseFile());
        database.init();
        return database;
    }

    public BusClient newBusClient() {
        int connectTimeoutSeconds = (int) Math.max(1L, config.apiTimeout().toSeconds());
        return new PahoBusClient(
                config.mqttBroker(),
                config.mqttPort(),
                config.mqttClientId(),
                config.mqttUsername(),
                config.mqttPassword(),
                config.mqttKeepalive(),
                connectTimeoutSeconds
        );
    }

    public Pipeline buildPipeline(BusClient busClient, MessageForwarder forwarder) {
        DedupeStore store = new DedupeStore(openDatabase());
        BusConnection bus = new BusConnection(
                busClient,
                config.topicFilter(),
                BackoffPolicy.unbounded(config.retryDelay(), BackoffPolicy.DEFAULT_MAX_DELAY),
                config.maxRetries(),
                shutdown,
                new ServiceEnvelopeParser(config.channel())
        );
        bus.start();
        return new Pipeline(
                bus,
                config.channelKey(),
                new EnvelopeDecoder(config.maxTextBytes()),
                store,
                forwarder,
                shutdown,
                config.broadcastOnly()
        );
    }

    /**
     * Runs until SIGINT/SIGTERM. Returns after the worker has closed the store and the bus.
     *
     * <p>A signal starts JVM exit before this method can return, so the shutdown hook ends the
     * process itself with status 0 once the worker has finished cleanly.
     */
    public int run() {
        Pipeline pipeline = buildPipeline(newBusClient(), new DapnetForwarder(config.gateway(), shutdown));
        Thread worker = new Thread(pipeline, "meshpager-worker");
        Thread hook = new Thread(() -> {
            boolean signalled = !shutdown.isTriggered();
            shutdown.trigger("signal received");
            try {
                worker.join(WORKER_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (worker.isAlive()) {
                log.error(LogMarkers.CRITICAL, "Worker did not stop within {} ms; exiting without clean shutdown",
                        WORKER_JOIN_TIMEOUT.toMillis());
                return;
            }
            if (signalled) {
                log.info("Application shutdown completed");
                Runtime.getRuntime().halt(0);
            }
        }, "meshpager-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        worker.start();
        log.info("Application is now running. Press Ctrl+C to stop.");
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown.trigger("main thread interrupted");
        }
        log.info("Application shutdown completed");
        return 0;
    }
}
