package io.meshpager.runtime;

import io.meshpager.bus.PacketSource;
import io.meshpager.codec.EnvelopeDecoder;
import io.meshpager.gateway.ForwardResult;
import io.meshpager.gateway.MessageForwarder;
import io.meshpager.model.AppMessage;
import io.meshpager.model.ForwardStatus;
import io.meshpager.model.Malformed;
import io.meshpager.model.OtherTelemetry;
import io.meshpager.model.RawPacket;
import io.meshpager.model.TextMessage;
import io.meshpager.security.ChannelCrypto;
import io.meshpager.security.DecryptionException;
import io.meshpager.storage.DedupeStore;
import io.meshpager.storage.PersistenceBusyException;
import io.meshpager.storage.PersistenceException;
import io.meshpager.util.NodeIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Single worker loop: receive, decrypt, decode, dedupe, forward, record.
 *
 * <p>No stage failure ends the loop. Only the {@link ShutdownSignal} does; the message in flight
 * when it fires is finished, then the store and the packet source are closed.
 */
public final class Pipeline implements Runnable {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final PacketSource source;
    private final byte[] channelKey;
    private final EnvelopeDecoder decoder;
    private final DedupeStore store;
    private final MessageForwarder forwarder;
    private final ShutdownSignal shutdown;
    private final boolean broadcastOnly;
    private final Duration pollInterval;

    public Pipeline(PacketSource source, byte[] channelKey, EnvelopeDecoder decoder, DedupeStore store,
                    MessageForwarder forwarder, ShutdownSignal shutdown, boolean broadcastOnly) {
        this(source, channelKey, decoder, store, forwarder, shutdown, broadcastOnly, DEFAULT_POLL_INTERVAL);
    }

    public Pipeline(PacketSource source, byte[] channelKey, EnvelopeDecoder decoder, DedupeStore store,
                    MessageForwarder forwarder, ShutdownSignal shutdown, boolean broadcastOnly, Duration pollInterval) {
        this.source = source;
        this.channelKey = channelKey.clone();
        this.decoder = decoder;
        this.store = store;
        this.forwarder = forwarder;
        this.shutdown = shutdown;
        this.broadcastOnly = broadcastOnly;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        log.info("Pipeline started");
        try {
            while (!shutdown.isTriggered()) {
                Optional<RawPacket> next;
                try {
                    next = source.receive(pollInterval);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    shutdown.trigger("worker interrupted");
                    break;
                }
                next.ifPresent(this::process);
            }
        } finally {
            closeResources();
        }
        log.info("Pipeline stopped");
    }

    public PipelineOutcome process(RawPacket packet) {
        try {
            return handle(packet);
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing packet {}", packet.packetId(), e);
            return PipelineOutcome.UNEXPECTED_ERROR;
        }
    }

    private PipelineOutcome handle(RawPacket packet) {
        String from = NodeIds.format(packet.sourceNodeId());
        if (broadcastOnly && !packet.isBroadcast()) {
            log.debug("Ignoring non-broadcast packet {} from {}", packet.packetId(), from);
            return PipelineOutcome.SKIPPED_NOT_BROADCAST;
        }
        byte[] decrypted;
        try {
            decrypted = ChannelCrypto.decrypt(channelKey, packet.packetId(), packet.sourceNodeId(), packet.encryptedPayload());
        } catch (DecryptionException e) {
            log.warn("Dropping packet {} from {}: {}", packet.packetId(), from, e.getMessage());
            return PipelineOutcome.DECRYPTION_FAILED;
        }
        AppMessage message = decoder.decode(decrypted, packet);
        return message.accept(new AppMessage.Visitor<>() {
            @Override
            public PipelineOutcome text(TextMessage text) {
                return deliver(text, from);
            }

            @Override
            public PipelineOutcome telemetry(OtherTelemetry telemetry) {
                log.debug("Dropping {} packet {} from {} ({} bytes)",
                        telemetry.portNum(), packet.packetId(), from, telemetry.payloadLength());
                return PipelineOutcome.TELEMETRY_DROPPED;
            }

            @Override
            public PipelineOutcome malformed(Malformed malformed) {
                log.warn("Dropping packet {} from {}: {}", packet.packetId(), from, malformed.reason());
                return PipelineOutcome.MALFORMED;
            }
        });
    }

    private PipelineOutcome deliver(TextMessage text, String from) {
        if (text.truncated()) {
            log.warn("Text of packet {} from {} truncated to {} bytes", text.packetId(), from, decoder.maxTextBytes());
        }
        DedupeStore.RecordResult recorded;
        try {
            recorded = store.recordPending(text.packetId(), text.fromNodeId(), text.text());
        } catch (PersistenceBusyException e) {
            log.warn("Packet {} not recorded, database busy; it will be handled if redelivered", text.packetId());
            return PipelineOutcome.STORE_BUSY;
        } catch (PersistenceException e) {
            log.error("Packet {} not recorded: {}", text.packetId(), e.getMessage(), e);
            return PipelineOutcome.STORE_FAILED;
        }
        if (recorded == DedupeStore.RecordResult.ALREADY_EXISTS) {
            log.info("Packet {} from {} already processed; skipping", text.packetId(), from);
            return PipelineOutcome.DUPLICATE;
        }

        log.info("Text message {} from {}: {}", text.packetId(), from, text.text());
        ForwardResult result = forwarder.forward(text);
        ForwardStatus status = result.delivered() ? ForwardStatus.DELIVERED : ForwardStatus.FAILED;
        try {
            store.markOutcome(text.packetId(), status);
        } catch (PersistenceException e) {
            log.error("Failed to record outcome {} for packet {}: {}", status, text.packetId(), e.getMessage());
        }
        return switch (result.outcome()) {
            case DELIVERED -> PipelineOutcome.DELIVERED;
            case AUTHENTICATION_FAILED -> PipelineOutcome.AUTHENTICATION_FAILED;
            case FAILED_AFTER_RETRIES, CANCELLED -> PipelineOutcome.FORWARD_FAILED;
        };
    }

    private void closeResources() {
        try {
            store.close();
        } catch (RuntimeException e) {
            log.error("Error closing dedupe store", e);
        }
        try {
            source.close();
        } catch (RuntimeException e) {
            log.error("Error closing packet source", e);
        }
    }
}
