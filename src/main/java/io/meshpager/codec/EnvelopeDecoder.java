package io.meshpager.codec;

import com.google.protobuf.ByteString;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import io.meshpager.model.AppMessage;
import io.meshpager.model.Malformed;
import io.meshpager.model.OtherTelemetry;
import io.meshpager.model.PortNum;
import io.meshpager.model.RawPacket;
import io.meshpager.model.TextMessage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Classifies a decrypted Meshtastic {@code Data} message.
 *
 * <p>Input is untrusted: a packet decrypted with the wrong key is indistinguishable from random
 * bytes, so every parse failure becomes a {@link Malformed} value rather than an exception.
 */
public final class EnvelopeDecoder {
    public static final int DEFAULT_MAX_TEXT_BYTES = 512;

    private static final int FIELD_PORTNUM = 1;
    private static final int FIELD_PAYLOAD = 2;

    private final int maxTextBytes;

    public EnvelopeDecoder() {
        this(DEFAULT_MAX_TEXT_BYTES);
    }

    public EnvelopeDecoder(int maxTextBytes) {
        if (maxTextBytes <= 0) {
            throw new IllegalArgumentException("maxTextBytes must be > 0");
        }
        this.maxTextBytes = maxTextBytes;
    }

    public int maxTextBytes() {
        return maxTextBytes;
    }

    public AppMessage decode(byte[] decrypted) {
        return decode(decrypted, 0L, 0L, 0L);
    }

    public AppMessage decode(byte[] decrypted, RawPacket source) {
        return decode(decrypted, source.sourceNodeId(), source.destNodeId(), source.packetId());
    }

    private AppMessage decode(byte[] decrypted, long fromNodeId, long toNodeId, long packetId) {
        if (decrypted == null || decrypted.length == 0) {
            return new Malformed("empty payload");
        }
        DataFields fields;
        try {
            fields = readDataFields(decrypted);
        } catch (IOException e) {
            return new Malformed("invalid Data message: " + e.getMessage());
        }
        if (fields.portNumber() == null) {
            return new Malformed("Data message has no portnum");
        }
        Optional<PortNum> port = PortNum.fromNumber(fields.portNumber());
        if (port.isEmpty()) {
            return new Malformed("unknown portnum " + fields.portNumber());
        }
        if (!port.get().isText()) {
            return new OtherTelemetry(port.get(), fields.payload().size());
        }
        return toText(fields.payload().toByteArray(), fromNodeId, toNodeId, packetId);
    }

    private AppMessage toText(byte[] payload, long fromNodeId, long toNodeId, long packetId) {
        String text;
        try {
            text = strictUtf8().decode(ByteBuffer.wrap(payload)).toString();
        } catch (CharacterCodingException e) {
            return new Malformed("text payload is not valid UTF-8");
        }
        if (text.isBlank()) {
            return new Malformed("empty text payload");
        }
        if (payload.length <= maxTextBytes) {
            return new TextMessage(text, fromNodeId, toNodeId, packetId, false);
        }
        int cut = maxTextBytes;
        // back off to the start of a UTF-8 sequence
        while (cut > 0 && (payload[cut] & 0xC0) == 0x80) {
            cut--;
        }
        String truncated = new String(payload, 0, cut, StandardCharsets.UTF_8);
        if (truncated.isBlank()) {
            return new Malformed("text payload empty after truncation to " + maxTextBytes + " bytes");
        }
        return new TextMessage(truncated, fromNodeId, toNodeId, packetId, true);
    }

    private static DataFields readDataFields(byte[] bytes) throws IOException {
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        Integer portNumber = null;
        ByteString payload = ByteString.EMPTY;
        while (true) {
            int tag = in.readTag();
            if (tag == 0) {
                break;
            }
            int field = WireFormat.getTagFieldNumber(tag);
            int wireType = WireFormat.getTagWireType(tag);
            if (field == FIELD_PORTNUM) {
                requireWireType(field, wireType, WireFormat.WIRETYPE_VARINT);
                portNumber = in.readEnum();
            } else if (field == FIELD_PAYLOAD) {
                requireWireType(field, wireType, WireFormat.WIRETYPE_LENGTH_DELIMITED);
                payload = in.readBytes();
            } else if (!in.skipField(tag)) {
                throw new IOException("unexpected end-group tag for field " + field);
            }
        }
        return new DataFields(portNumber, payload);
    }

    static void requireWireType(int field, int actual, int expected) throws IOException {
        if (actual != expected) {
            throw new IOException("field " + field + " has wire type " + actual + ", expected " + expected);
        }
    }

    private static CharsetDecoder strictUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private record DataFields(Integer portNumber, ByteString payload) {
    }
}
