package io.meshpager.codec;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import io.meshpager.model.RawPacket;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * Reads the {@code ServiceEnvelope} a Meshtastic gateway publishes to MQTT and extracts the
 * routing fields and encrypted bytes of its {@code MeshPacket}.
 *
 * <p>Packets that arrive already decoded (gateways with the channel key configured) carry no
 * ciphertext and are reported as empty.
 */
public final class ServiceEnvelopeParser {
    private static final int ENVELOPE_PACKET = 1;
    private static final int ENVELOPE_CHANNEL_ID = 2;

    private static final int PACKET_FROM = 1;
    private static final int PACKET_TO = 2;
    private static final int PACKET_ENCRYPTED = 5;
    private static final int PACKET_ID = 6;

    private final String defaultChannel;
    private final Clock clock;

    public ServiceEnvelopeParser(String defaultChannel) {
        this(defaultChannel, Clock.systemUTC());
    }

    public ServiceEnvelopeParser(String defaultChannel, Clock clock) {
        this.defaultChannel = defaultChannel == null ? "" : defaultChannel;
        this.clock = clock;
    }

    public Optional<RawPacket> parse(byte[] envelopeBytes) {
        if (envelopeBytes == null || envelopeBytes.length == 0) {
            throw new EnvelopeParseException("empty ServiceEnvelope");
        }
        try {
            CodedInputStream in = CodedInputStream.newInstance(envelopeBytes);
            ByteString packetBytes = null;
            String channelId = "";
            while (true) {
                int tag = in.readTag();
                if (tag == 0) {
                    break;
                }
                int field = WireFormat.getTagFieldNumber(tag);
                int wireType = WireFormat.getTagWireType(tag);
                if (field == ENVELOPE_PACKET) {
                    EnvelopeDecoder.requireWireType(field, wireType, WireFormat.WIRETYPE_LENGTH_DELIMITED);
                    packetBytes = in.readBytes();
                } else if (field == ENVELOPE_CHANNEL_ID) {
                    EnvelopeDecoder.requireWireType(field, wireType, WireFormat.WIRETYPE_LENGTH_DELIMITED);
                    channelId = in.readStringRequireUtf8();
                } else if (!in.skipField(tag)) {
                    throw new IOException("unexpected end-group tag for field " + field);
                }
            }
            if (packetBytes == null) {
                throw new EnvelopeParseException("ServiceEnvelope has no packet");
            }
            return readPacket(packetBytes, channelId.isBlank() ? defaultChannel : channelId);
        } catch (IOException e) {
            throw new EnvelopeParseException("Failed to parse ServiceEnvelope: " + e.getMessage(), e);
        }
    }

    private Optional<RawPacket> readPacket(ByteString packetBytes, String channel) throws IOException {
        CodedInputStream in = packetBytes.newCodedInput();
        long from = 0L;
        long to = 0L;
        long id = 0L;
        ByteString encrypted = ByteString.EMPTY;
        while (true) {
            int tag = in.readTag();
            if (tag == 0) {
                break;
            }
            int field = WireFormat.getTagFieldNumber(tag);
            int wireType = WireFormat.getTagWireType(tag);
            switch (field) {
                case PACKET_FROM -> {
                    EnvelopeDecoder.requireWireType(field, wireType, WireFormat.WIRETYPE_FIXED32);
                    from = Integer.toUnsignedLong(in.readFixed32());
                }
                case PACKET_TO -> {
                    EnvelopeDecoder.requireWireType(field, wireType, WireFormat.WIRETYPE_FIXED32);
                    to = Integer.toUnsignedLong(in.readFixed32());
                }
                case PACKET_ID -> {
                    EnvelopeDecoder.requireWireType(field, wireType, WireFormat.WIRETYPE_FIXED32);
                    id = Integer.toUnsignedLong(in.readFixed32());
                }
                case PACKET_ENCRYPTED -> {
                    EnvelopeDecoder.requireWireType(field, wireType, WireFormat.WIRETYPE_LENGTH_DELIMITED);
                    encrypted = in.readBytes();
                }
                default -> {
                    if (!in.skipField(tag)) {
                        throw new IOException("unexpected end-group tag for field " + field);
                    }
                }
            }
        }
        if (encrypted.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RawPacket(from, to, channel, id, encrypted.toByteArray(), clock.instant()));
    }
}
