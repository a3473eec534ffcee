package io.meshpager.bus;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.meshpager.codec.ServiceEnvelopeParser;
import io.meshpager.logging.LogMarkers;
import io.meshpager.model.ConnectionState;
import io.meshpager.model.RawPacket;
import io.meshpager.runtime.BackoffPolicy;
import io.meshpager.runtime.ShutdownSignal;
import io.meshpager.testutil.MeshtasticFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

final class BusConnectionTest {
    private static final String TOPIC = "msh/MY_919/2/e/LongFast/#";

    @Test
    void connectsSubscribesAndQueuesPackets() throws Exception {
        FakeBusClient client = new FakeBusClient();
        BusConnection bus = connection(client, new ShutdownSignal(), Duration.ofSeconds(10), 10);
        try {
            bus.start();
            awaitTrue(() -> bus.state() == ConnectionState.CONNECTED);

            client.deliver("msh/MY_919/2/e/LongFast/!a1b2c3d4", envelope(5001L));
            RawPacket packet = bus.receive(Duration.ofSeconds(2)).orElseThrow();

            Assertions.assertEquals(5001L, packet.packetId());
            Assertions.assertEquals(List.of("connect", "subscribe:" + TOPIC), client.calls);
        } finally {
            bus.close();
        }
        Assertions.assertEquals(ConnectionState.SHUTTING_DOWN, bus.state());
        Assertions.assertTrue(client.closed);
    }

    @Test
    void lostConnectionWalksStateMachineAndResubscribes() throws Exception {
        FakeBusClient client = new FakeBusClient();
        BusConnection bus = connection(client, new ShutdownSignal(), Duration.ofSeconds(10), 10);
        List<String> transitions = Collections.synchronizedList(new ArrayList<>());
        bus.addStateListener((from, to) -> transitions.add(from + "->" + to));
        try {
            bus.start();
            awaitTrue(() -> bus.state() == ConnectionState.CONNECTED);

            client.dropConnection();
            awaitTrue(() -> transitions.size() == 5);

            Assertions.assertEquals(List.of(
                    "DISCONNECTED->CONNECTING",
                    "CONNECTING->CONNECTED",
                    "CONNECTED->RECONNECTING",
                    "RECONNECTING->CONNECTING",
                    "CONNECTING->CONNECTED"
            ), new ArrayList<>(transitions));
            Assertions.assertEquals(List.of("connect", "subscribe:" + TOPIC, "connect", "subscribe:" + TOPIC), client.calls);

            client.deliver("msh/MY_919/2/e/LongFast/!a1b2c3d4", envelope(5002L));
            Assertions.assertEquals(5002L, bus.receive(Duration.ofSeconds(2)).orElseThrow().packetId());
        } finally {
            bus.close();
        }
    }

    @Test
    void healthCheckDetectsSilentDisconnect() throws Exception {
        FakeBusClient client = new FakeBusClient();
        BusConnection bus = connection(client, new ShutdownSignal(), Duration.ofMillis(50), 10);
        try {
            bus.start();
            awaitTrue(() -> bus.state() == ConnectionState.CONNECTED);

            client.dropSilently();

            awaitTrue(() -> client.subscribeCount() == 2 && bus.state() == ConnectionState.CONNECTED);
        } finally {
            bus.close();
        }
    }

    @Test
    void failedConnectsAreRetriedWithBackoff() throws Exception {
        FakeBusClient client = new FakeBusClient();
        client.failuresRemaining.set(3);
        BusConnection bus = connection(client, new ShutdownSignal(), Duration.ofSeconds(10), 10);
        try {
            bus.start();
            awaitTrue(() -> bus.state() == ConnectionState.CONNECTED);

            Assertions.assertEquals(4, client.connectAttempts.get());
            Assertions.assertEquals(1L, client.subscribeCount());
        } finally {
            bus.close();
        }
    }

    @Test
    void repeatedConnectFailuresLogCritical() throws Exception {
        Logger busLogger = (Logger) LoggerFactory.getLogger(BusConnection.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        busLogger.addAppender(appender);
        FakeBusClient client = new FakeBusClient();
        client.failuresRemaining.set(3);
        BusConnection bus = connection(client, new ShutdownSignal(), Duration.ofSeconds(10), 10);
        try {
            bus.start();
            awaitTrue(() -> bus.state() == ConnectionState.CONNECTED);

            List<ILoggingEvent> critical = appender.list.stream()
                    .filter(event -> event.getMarkerList() != null && event.getMarkerList().contains(LogMarkers.CRITICAL))
                    .toList();
            Assertions.assertEquals(1, critical.size());
            Assertions.assertEquals(Level.ERROR, critical.get(0).getLevel());
            Assertions.assertTrue(critical.get(0).getFormattedMessage().contains("3 consecutive times"));
        } finally {
            bus.close();
            busLogger.detachAppender(appender);
        }
    }

    @Test
    void shutdownInterruptsReconnectBackoff() throws Exception {
        FakeBusClient client = new FakeBusClient();
        client.failuresRemaining.set(Integer.MAX_VALUE);
        ShutdownSignal shutdown = new ShutdownSignal();
        BusConnection bus = new BusConnection(client, TOPIC, BackoffPolicy.unbounded(Duration.ofSeconds(30), Duration.ofSeconds(60)),
                5, shutdown, new ServiceEnvelopeParser("LongFast"));
        bus.start();
        awaitTrue(() -> client.connectAttempts.get() >= 1);

        long started = System.nanoTime();
        shutdown.trigger("test");
        bus.close();
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        Assertions.assertTrue(elapsedMs < 2_000L, "close took " + elapsedMs + " ms");
        Assertions.assertEquals(1, client.connectAttempts.get());
        Assertions.assertEquals(ConnectionState.SHUTTING_DOWN, bus.state());
    }

    @Test
    void unparseableMessagesAreDropped() throws Exception {
        FakeBusClient client = new FakeBusClient();
        BusConnection bus = connection(client, new ShutdownSignal(), Duration.ofSeconds(10), 10);
        try {
            bus.start();
            awaitTrue(() -> bus.state() == ConnectionState.CONNECTED);

            client.deliver("msh/MY_919/2/e/LongFast/!a1b2c3d4", new byte[]{0x0A, 0x10, 0x01});
            client.deliver("msh/MY_919/2/e/LongFast/!a1b2c3d4", new byte[0]);
            Assertions.assertTrue(bus.receive(Duration.ofMillis(100)).isEmpty());

            client.deliver("msh/MY_919/2/e/LongFast/!a1b2c3d4", envelope(5003L));
            Optional<RawPacket> next = bus.receive(Duration.ofSeconds(2));
            Assertions.assertEquals(5003L, next.orElseThrow().packetId());
        } finally {
            bus.close();
        }
    }

    @Test
    void fullQueueDropsAndCounts() throws Exception {
        FakeBusClient client = new FakeBusClient();
        BusConnection bus = connection(client, new ShutdownSignal(), Duration.ofSeconds(10), 1);
        try {
            bus.start();
            awaitTrue(() -> bus.state() == ConnectionState.CONNECTED);

            client.deliver("t", envelope(1L));
            client.deliver("t", envelope(2L));

            Assertions.assertEquals(1L, bus.droppedPackets());
            Assertions.assertEquals(1L, bus.receive(Duration.ofSeconds(1)).orElseThrow().packetId());
        } finally {
            bus.close();
        }
    }

    @Test
    void startTwiceIsRejected() {
        FakeBusClient client = new FakeBusClient();
        BusConnection bus = connection(client, new ShutdownSignal(), Duration.ofSeconds(10), 10);
        try {
            bus.start();
            Assertions.assertThrows(IllegalStateException.class, bus::start);
        } finally {
            bus.close();
        }
    }

    private static BusConnection connection(FakeBusClient client, ShutdownSignal shutdown,
                                            Duration healthCheck, int capacity) {
        return new BusConnection(client, TOPIC, BackoffPolicy.unbounded(Duration.ofMillis(10), Duration.ofMillis(50)),
                3, shutdown, new ServiceEnvelopeParser("LongFast"), healthCheck, capacity);
    }

    private static byte[] envelope(long packetId) {
        byte[] packet = MeshtasticFixtures.meshPacket(0xa1b2c3d4L, RawPacket.BROADCAST_NODE_ID, packetId, new byte[]{1, 2, 3});
        return MeshtasticFixtures.serviceEnvelope(packet, "LongFast");
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                Assertions.fail("condition not reached within 5s");
            }
            Thread.sleep(10L);
        }
    }
}
