package io.meshpager.bus;

import io.meshpager.codec.EnvelopeParseException;
import io.meshpager.codec.ServiceEnvelopeParser;
import io.meshpager.logging.LogMarkers;
import io.meshpager.model.ConnectionState;
import io.meshpager.model.RawPacket;
import io.meshpager.runtime.BackoffPolicy;
import io.meshpager.runtime.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the subscription to the message bus and its {@link ConnectionState} machine.
 *
 * <p>A supervisor thread performs the initial connect and every reconnect, retrying with
 * {@link BackoffPolicy} until it succeeds or shutdown is requested. The topic is re-subscribed on
 * every connect before the state returns to {@link ConnectionState#CONNECTED}. Delivery callbacks
 * are serialized and hand parsed packets to a bounded queue drained through {@link #receive}.
 */
public final class BusConnection implements PacketSource {
    public static final int DEFAULT_QUEUE_CAPACITY = 1_000;
    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(10);
    private static final Duration SUPERVISOR_JOIN_TIMEOUT = Duration.ofSeconds(5);

    private static final Logger log = LoggerFactory.getLogger(BusConnection.class);

    private final BusClient client;
    private final String topicFilter;
    private final BackoffPolicy backoff;
    private final int criticalAfterFailures;
    private final ShutdownSignal shutdown;
    private final ServiceEnvelopeParser parser;
    private final Duration healthCheckInterval;
    private final BlockingQueue<RawPacket> inbound;
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();
    private final Semaphore reconnectRequested = new Semaphore(0);
    private final Object stateLock = new Object();
    private final Object deliveryLock = new Object();
    private final AtomicLong droppedPackets = new AtomicLong();
    private final ClientListener clientListener = new ClientListener();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private Thread supervisor;

    public BusConnection(BusClient client, String topicFilter, BackoffPolicy backoff, int criticalAfterFailures,
                         ShutdownSignal shutdown, ServiceEnvelopeParser parser) {
        this(client, topicFilter, backoff, criticalAfterFailures, shutdown, parser,
                DEFAULT_HEALTH_CHECK_INTERVAL, DEFAULT_QUEUE_CAPACITY);
    }

    public BusConnection(BusClient client, String topicFilter, BackoffPolicy backoff, int criticalAfterFailures,
                         ShutdownSignal shutdown, ServiceEnvelopeParser parser,
                         Duration healthCheckInterval, int queueCapacity) {
        this.client = client;
        this.topicFilter = topicFilter;
        this.backoff = backoff;
        this.criticalAfterFailures = Math.max(1, criticalAfterFailures);
        this.shutdown = shutdown;
        this.parser = parser;
        this.healthCheckInterval = healthCheckInterval;
        this.inbound = new LinkedBlockingQueue<>(Math.max(1, queueCapacity));
    }

    public ConnectionState state() {
        return state;
    }

    public String topicFilter() {
        return topicFilter;
    }

    public long droppedPackets() {
        return droppedPackets.get();
    }

    public void addStateListener(ConnectionStateListener listener) {
        stateListeners.add(listener);
    }

    public synchronized void start() {
        if (supervisor != null) {
            throw new IllegalStateException("BusConnection already started");
        }
        supervisor = new Thread(this::supervise, "meshpager-bus-supervisor");
        supervisor.setDaemon(true);
        supervisor.start();
    }

    @Override
    public Optional<RawPacket> receive(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void close() {
        transition(ConnectionState.SHUTTING_DOWN);
        reconnectRequested.release();
        Thread running;
        synchronized (this) {
            running = supervisor;
        }
        if (running != null && running != Thread.currentThread()) {
            try {
                running.join(SUPERVISOR_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (running.isAlive()) {
                log.warn("Bus supervisor did not stop within {} ms", SUPERVISOR_JOIN_TIMEOUT.toMillis());
            }
        }
        try {
            client.disconnect();
        } catch (BusConnectionException e) {
            log.warn("Error disconnecting from bus: {}", e.getMessage());
        } finally {
            client.close();
        }
        log.info("Bus connection closed ({} packets dropped on full queue)", droppedPackets.get());
    }

    private boolean running() {
        return !shutdown.isTriggered() && state != ConnectionState.SHUTTING_DOWN;
    }

    private void supervise() {
        while (running()) {
            ConnectionState current = state;
            if (current == ConnectionState.DISCONNECTED || current == ConnectionState.RECONNECTING) {
                connectWithBackoff();
                continue;
            }
            try {
                if (reconnectRequested.tryAcquire(healthCheckInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (state == ConnectionState.CONNECTED && !client.isConnected()) {
                onConnectionLost(new BusConnectionException("health check found client disconnected"));
            }
        }
        transition(ConnectionState.SHUTTING_DOWN);
    }

    private void connectWithBackoff() {
        if (!transition(ConnectionState.CONNECTING)) {
            return;
        }
        int failures = 0;
        while (running()) {
            try {
                log.info("Connecting to bus (attempt {})", failures + 1);
                client.connect(clientListener);
                client.subscribe(topicFilter);
                log.info("Subscribed to topic {}", topicFilter);
                transition(ConnectionState.CONNECTED);
                return;
            } catch (BusConnectionException e) {
                failures++;
                if (failures % criticalAfterFailures == 0) {
                    log.error(LogMarkers.CRITICAL, "Bus connection failed {} consecutive times: {}", failures, e.getMessage());
                } else {
                    log.warn("Bus connection attempt {} failed: {}", failures, e.getMessage());
                }
                disconnectQuietly();
                Duration delay = backoff.delayFor(failures - 1);
                log.info("Retrying bus connection in {} ms", delay.toMillis());
                if (!shutdown.sleep(delay)) {
                    return;
                }
            }
        }
    }

    private void disconnectQuietly() {
        try {
            client.disconnect();
        } catch (BusConnectionException e) {
            log.debug("Disconnect after failed attempt: {}", e.getMessage());
        }
    }

    private void onConnectionLost(Throwable cause) {
        if (transition(ConnectionState.RECONNECTING)) {
            log.warn("Bus connection lost: {}", cause == null ? "unknown cause" : cause.getMessage());
            reconnectRequested.release();
        }
    }

    private void onMessage(String topic, byte[] payload) {
        synchronized (deliveryLock) {
            if (state == ConnectionState.SHUTTING_DOWN) {
                return;
            }
            Optional<RawPacket> packet;
            try {
                packet = parser.parse(payload);
            } catch (EnvelopeParseException e) {
                log.warn("Dropping message on {}: {}", topic, e.getMessage());
                return;
            }
            if (packet.isEmpty()) {
                log.debug("Ignoring message on {} without encrypted payload", topic);
                return;
            }
            if (!inbound.offer(packet.get())) {
                droppedPackets.incrementAndGet();
                log.warn("Inbound queue full; dropping packet {}", packet.get().packetId());
            }
        }
    }

    private boolean transition(ConnectionState next) {
        ConnectionState previous;
        synchronized (stateLock) {
            previous = state;
            if (!previous.canTransitionTo(next)) {
                return false;
            }
            state = next;
        }
        log.info("Bus connection state {} -> {}", previous, next);
        for (ConnectionStateListener listener : stateListeners) {
            listener.onTransition(previous, next);
        }
        return true;
    }

    private final class ClientListener implements BusClient.Listener {
        @Override
        public void messageArrived(String topic, byte[] payload) {
            onMessage(topic, payload);
        }

        @Override
        public void connectionLost(Throwable cause) {
            onConnectionLost(cause);
        }
    }
}
