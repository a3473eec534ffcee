package io.meshpager.codec;

import io.meshpager.model.AppMessage;
import io.meshpager.model.Malformed;
import io.meshpager.model.OtherTelemetry;
import io.meshpager.model.PortNum;
import io.meshpager.model.RawPacket;
import io.meshpager.model.TextMessage;
import io.meshpager.security.ChannelCrypto;
import io.meshpager.testutil.MeshtasticFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Random;

final class EnvelopeDecoderTest {
    private final EnvelopeDecoder decoder = new EnvelopeDecoder();

    @Test
    void decodesTextMessage() {
        AppMessage message = decoder.decode(MeshtasticFixtures.textData("hello mesh"));

        TextMessage text = Assertions.assertInstanceOf(TextMessage.class, message);
        Assertions.assertEquals("hello mesh", text.text());
        Assertions.assertFalse(text.truncated());
    }

    @Test
    void carriesRoutingFieldsFromSourcePacket() {
        RawPacket packet = MeshtasticFixtures.encryptedBroadcastText(0x0badcafeL, 77L, "QRV?");
        byte[] plain = ChannelCrypto.decrypt(MeshtasticFixtures.defaultKey(), packet.packetId(),
                packet.sourceNodeId(), packet.encryptedPayload());

        TextMessage text = Assertions.assertInstanceOf(TextMessage.class, decoder.decode(plain, packet));

        Assertions.assertEquals(new TextMessage("QRV?", 0x0badcafeL, RawPacket.BROADCAST_NODE_ID, 77L), text);
    }

    @Test
    void nonTextPortsBecomeTelemetry() {
        byte[] data = MeshtasticFixtures.dataMessage(PortNum.POSITION_APP.number(), new byte[]{1, 2, 3, 4});

        OtherTelemetry telemetry = Assertions.assertInstanceOf(OtherTelemetry.class, decoder.decode(data));

        Assertions.assertEquals(PortNum.POSITION_APP, telemetry.portNum());
        Assertions.assertEquals(4, telemetry.payloadLength());
    }

    @Test
    void unknownPortIsMalformed() {
        Malformed malformed = Assertions.assertInstanceOf(Malformed.class,
                decoder.decode(MeshtasticFixtures.dataMessage(4242, new byte[]{9})));
        Assertions.assertTrue(malformed.reason().contains("4242"));
    }

    @Test
    void invalidUtf8IsMalformed() {
        byte[] data = MeshtasticFixtures.dataMessage(PortNum.TEXT_MESSAGE_APP.number(), new byte[]{(byte) 0xC3, 0x28});
        Assertions.assertInstanceOf(Malformed.class, decoder.decode(data));
    }

    @Test
    void emptyOrBlankPayloadIsMalformed() {
        Assertions.assertInstanceOf(Malformed.class, decoder.decode(new byte[0]));
        Assertions.assertInstanceOf(Malformed.class, decoder.decode(null));
        Assertions.assertInstanceOf(Malformed.class, decoder.decode(MeshtasticFixtures.textData("   ")));
    }

    @Test
    void missingPortnumIsMalformed() {
        // field 2 only: length 1, byte 'x'
        Assertions.assertInstanceOf(Malformed.class, decoder.decode(new byte[]{0x12, 0x01, 0x78}));
    }

    @Test
    void wrongWireTypeIsMalformed() {
        // field 1 encoded as length-delimited
        Assertions.assertInstanceOf(Malformed.class, decoder.decode(new byte[]{0x0A, 0x01, 0x01}));
    }

    @Test
    void longTextIsTruncatedOnCharacterBoundary() {
        String text = "a" + "é".repeat(300);

        TextMessage message = Assertions.assertInstanceOf(TextMessage.class,
                decoder.decode(MeshtasticFixtures.textData(text)));

        Assertions.assertTrue(message.truncated());
        Assertions.assertEquals(511, message.text().getBytes(StandardCharsets.UTF_8).length);
        Assertions.assertTrue(text.startsWith(message.text()));
    }

    @Test
    void customLimitApplies() {
        TextMessage message = Assertions.assertInstanceOf(TextMessage.class,
                new EnvelopeDecoder(5).decode(MeshtasticFixtures.textData("abcdefgh")));
        Assertions.assertEquals("abcde", message.text());
        Assertions.assertTrue(message.truncated());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new EnvelopeDecoder(0));
    }

    @Test
    void truncationThatLeavesNothingIsMalformed() {
        AppMessage message = new EnvelopeDecoder(1).decode(MeshtasticFixtures.textData("é and more"));

        Malformed malformed = Assertions.assertInstanceOf(Malformed.class, message);
        Assertions.assertTrue(malformed.reason().contains("truncation"));
    }

    @Test
    void wrongKeyYieldsMalformed() {
        RawPacket packet = MeshtasticFixtures.encryptedText(MeshtasticFixtures.defaultKey(),
                0xa1b2c3d4L, RawPacket.BROADCAST_NODE_ID, 0x1001L, "hello");
        byte[] otherKey = ChannelCrypto.prepareKey("Ag==");

        byte[] garbage = ChannelCrypto.decrypt(otherKey, packet.packetId(), packet.sourceNodeId(),
                packet.encryptedPayload());

        Assertions.assertInstanceOf(Malformed.class, decoder.decode(garbage, packet));
    }

    @Test
    void randomBytesNeverThrow() {
        Random random = new Random(20260101L);
        for (int i = 0; i < 1000; i++) {
            byte[] input = new byte[random.nextInt(64)];
            random.nextBytes(input);
            AppMessage message = Assertions.assertDoesNotThrow(() -> decoder.decode(input));
            Assertions.assertNotNull(message);
        }
    }
}
