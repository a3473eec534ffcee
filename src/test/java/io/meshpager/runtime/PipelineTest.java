package io.meshpager.runtime;

import io.meshpager.bus.PacketSource;
import io.meshpager.codec.EnvelopeDecoder;
import io.meshpager.gateway.ForwardResult;
import io.meshpager.gateway.MessageForwarder;
import io.meshpager.model.ForwardStatus;
import io.meshpager.model.PortNum;
import io.meshpager.model.RawPacket;
import io.meshpager.model.TextMessage;
import io.meshpager.security.ChannelCrypto;
import io.meshpager.storage.Database;
import io.meshpager.storage.DedupeStore;
import io.meshpager.testutil.MeshtasticFixtures;
import io.meshpager.testutil.TempDirs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

final class PipelineTest {
    private static final long SENDER = 0xa1b2c3d4L;

    private Path root;
    private DedupeStore store;
    private final List<TextMessage> forwarded = new CopyOnWriteArrayList<>();
    private volatile Function<TextMessage, ForwardResult> forwardBehaviour = m -> ForwardResult.delivered(1, 201);

    @BeforeEach
    void openStore() throws Exception {
        root = TempDirs.create("pipeline");
        Database db = new Database(root.resolve("meshtastic.db"));
        db.init();
        store = new DedupeStore(db);
    }

    @AfterEach
    void cleanUp() throws Exception {
        TempDirs.deleteRecursively(root);
    }

    @Test
    void sameBroadcastTwiceIsForwardedOnce() {
        Pipeline pipeline = pipeline(new QueueSource(), new ShutdownSignal(), true);
        RawPacket packet = MeshtasticFixtures.encryptedBroadcastText(SENDER, 0x1001L, "hello");

        Assertions.assertEquals(PipelineOutcome.DELIVERED, pipeline.process(packet));
        Assertions.assertEquals(PipelineOutcome.DUPLICATE, pipeline.process(packet));

        Assertions.assertEquals(1, forwarded.size());
        Assertions.assertEquals("hello", forwarded.get(0).text());
        Assertions.assertEquals(SENDER, forwarded.get(0).fromNodeId());
        Assertions.assertEquals(ForwardStatus.DELIVERED, store.find(0x1001L).orElseThrow().forwardStatus());
        Assertions.assertEquals(1, store.recent(10).size());
    }

    @Test
    void wrongKeyIsDroppedAsMalformed() {
        Pipeline pipeline = pipeline(new QueueSource(), new ShutdownSignal(), true);
        RawPacket packet = MeshtasticFixtures.encryptedText(ChannelCrypto.prepareKey("Ag=="), SENDER,
                RawPacket.BROADCAST_NODE_ID, 0x1001L, "hello");

        Assertions.assertEquals(PipelineOutcome.MALFORMED, pipeline.process(packet));
        Assertions.assertTrue(forwarded.isEmpty());
        Assertions.assertFalse(store.hasSeen(0x1001L));
    }

    @Test
    void directMessagesAreSkippedWhenBroadcastOnly() {
        RawPacket direct = MeshtasticFixtures.encryptedText(MeshtasticFixtures.defaultKey(), SENDER, 0x1234L, 9L, "psst");

        Assertions.assertEquals(PipelineOutcome.SKIPPED_NOT_BROADCAST,
                pipeline(new QueueSource(), new ShutdownSignal(), true).process(direct));
        Assertions.assertEquals(PipelineOutcome.DELIVERED,
                pipeline(new QueueSource(), new ShutdownSignal(), false).process(direct));
        Assertions.assertEquals(1, forwarded.size());
    }

    @Test
    void telemetryIsDroppedWithoutRecord() {
        Pipeline pipeline = pipeline(new QueueSource(), new ShutdownSignal(), true);
        byte[] data = MeshtasticFixtures.dataMessage(PortNum.TELEMETRY_APP.number(), new byte[]{1, 2});
        RawPacket packet = new RawPacket(SENDER, RawPacket.BROADCAST_NODE_ID, "LongFast", 31L,
                ChannelCrypto.encrypt(MeshtasticFixtures.defaultKey(), 31L, SENDER, data), Instant.now());

        Assertions.assertEquals(PipelineOutcome.TELEMETRY_DROPPED, pipeline.process(packet));
        Assertions.assertFalse(store.hasSeen(31L));
        Assertions.assertTrue(forwarded.isEmpty());
    }

    @Test
    void failedForwardsAreRecordedAndNotRetriedOnRedelivery() {
        forwardBehaviour = m -> ForwardResult.failedAfterRetries(3, 503, "status 503");
        Pipeline pipeline = pipeline(new QueueSource(), new ShutdownSignal(), true);
        RawPacket packet = MeshtasticFixtures.encryptedBroadcastText(SENDER, 77L, "will fail");

        Assertions.assertEquals(PipelineOutcome.FORWARD_FAILED, pipeline.process(packet));
        Assertions.assertEquals(ForwardStatus.FAILED, store.find(77L).orElseThrow().forwardStatus());
        Assertions.assertEquals(PipelineOutcome.DUPLICATE, pipeline.process(packet));
        Assertions.assertEquals(1, forwarded.size());
    }

    @Test
    void authenticationFailureMarksFailed() {
        forwardBehaviour = m -> ForwardResult.authenticationFailed(1, 401);
        Pipeline pipeline = pipeline(new QueueSource(), new ShutdownSignal(), true);

        Assertions.assertEquals(PipelineOutcome.AUTHENTICATION_FAILED,
                pipeline.process(MeshtasticFixtures.encryptedBroadcastText(SENDER, 78L, "denied")));
        Assertions.assertEquals(ForwardStatus.FAILED, store.find(78L).orElseThrow().forwardStatus());
    }

    @Test
    void forwarderBugDoesNotStopProcessing() {
        forwardBehaviour = m -> {
            if (m.packetId() == 1L) {
                throw new IllegalStateException("boom");
            }
            return ForwardResult.delivered(1, 200);
        };
        Pipeline pipeline = pipeline(new QueueSource(), new ShutdownSignal(), true);

        Assertions.assertEquals(PipelineOutcome.UNEXPECTED_ERROR,
                pipeline.process(MeshtasticFixtures.encryptedBroadcastText(SENDER, 1L, "first")));
        Assertions.assertEquals(PipelineOutcome.DELIVERED,
                pipeline.process(MeshtasticFixtures.encryptedBroadcastText(SENDER, 2L, "second")));
    }

    @Test
    void runLoopProcessesUntilShutdownThenClosesSource() throws Exception {
        QueueSource source = new QueueSource();
        ShutdownSignal shutdown = new ShutdownSignal();
        Pipeline pipeline = pipeline(source, shutdown, true);
        source.packets.add(MeshtasticFixtures.encryptedBroadcastText(SENDER, 11L, "one"));
        source.packets.add(MeshtasticFixtures.encryptedBroadcastText(SENDER, 11L, "one"));
        source.packets.add(MeshtasticFixtures.encryptedBroadcastText(SENDER, 12L, "two"));

        Thread worker = new Thread(pipeline, "pipeline-test-worker");
        worker.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (forwarded.size() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(10L);
        }
        shutdown.trigger("test");
        worker.join(5_000L);

        Assertions.assertFalse(worker.isAlive());
        Assertions.assertTrue(source.closed);
        Assertions.assertEquals(2, forwarded.size());
        Assertions.assertEquals(List.of(11L, 12L), forwarded.stream().map(TextMessage::packetId).toList());
    }

    private Pipeline pipeline(PacketSource source, ShutdownSignal shutdown, boolean broadcastOnly) {
        MessageForwarder forwarder = message -> {
            forwarded.add(message);
            return forwardBehaviour.apply(message);
        };
        return new Pipeline(source, MeshtasticFixtures.defaultKey(), new EnvelopeDecoder(), store, forwarder,
                shutdown, broadcastOnly, Duration.ofMillis(20));
    }

    private static final class QueueSource implements PacketSource {
        final BlockingQueue<RawPacket> packets = new LinkedBlockingQueue<>();
        volatile boolean closed;

        @Override
        public Optional<RawPacket> receive(Duration timeout) throws InterruptedException {
            return Optional.ofNullable(packets.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
