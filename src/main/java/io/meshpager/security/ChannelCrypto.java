package io.meshpager.security;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * AES-CTR transform used by Meshtastic channels.
 *
 * <p>The initial counter block is the packet id followed by the sending node number, each as
 * 8 little-endian bytes. Decryption needs no state beyond the key and these two numbers, so any
 * packet can be replayed through it.
 */
public final class ChannelCrypto {
    private static final String TRANSFORMATION = "AES/CTR/NoPadding";
    private static final int NONCE_BYTES = 16;
    private static final byte[] DEFAULT_CHANNEL_KEY = {
            (byte) 0xd4, (byte) 0xf1, (byte) 0xbb, (byte) 0x3a,
            (byte) 0x20, (byte) 0x29, (byte) 0x07, (byte) 0x59,
            (byte) 0xf0, (byte) 0xbc, (byte) 0xff, (byte) 0xab,
            (byte) 0xcf, (byte) 0x4e, (byte) 0x69, (byte) 0x01
    };

    private ChannelCrypto() {
    }

    public static byte[] decrypt(byte[] key, long nonceSeed, byte[] ciphertext) {
        return decrypt(key, nonceSeed, 0L, ciphertext);
    }

    public static byte[] decrypt(byte[] key, long packetId, long senderNodeId, byte[] ciphertext) {
        return transform(key, packetId, senderNodeId, ciphertext);
    }

    public static byte[] encrypt(byte[] key, long packetId, long senderNodeId, byte[] plaintext) {
        return transform(key, packetId, senderNodeId, plaintext);
    }

    /**
     * Decodes a channel key as written in Meshtastic configs: standard or URL-safe base64, padding
     * optional. A single-byte key selects the well-known default key by index.
     */
    public static byte[] prepareKey(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new DecryptionException("Encryption key is empty");
        }
        String normalized = base64Key.trim().replace('-', '+').replace('_', '/');
        int pad = (4 - normalized.length() % 4) % 4;
        normalized = normalized + "=".repeat(pad);
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(normalized);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Encryption key is not valid base64", e);
        }
        byte[] key = expandShorthand(raw);
        requireValidLength(key);
        return key;
    }

    static byte[] nonce(long packetId, long senderNodeId) {
        return ByteBuffer.allocate(NONCE_BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putLong(packetId)
                .putLong(senderNodeId)
                .array();
    }

    private static byte[] transform(byte[] key, long packetId, long senderNodeId, byte[] input) {
        requireValidLength(key);
        if (input == null || input.length == 0) {
            return new byte[0];
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new IvParameterSpec(nonce(packetId, senderNodeId)));
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("AES-CTR transform failed", e);
        }
    }

    private static byte[] expandShorthand(byte[] raw) {
        if (raw.length != 1) {
            return raw;
        }
        int index = raw[0] & 0xFF;
        if (index == 0) {
            throw new DecryptionException("Channel key index 0 means encryption is disabled");
        }
        byte[] key = DEFAULT_CHANNEL_KEY.clone();
        key[key.length - 1] = (byte) (key[key.length - 1] + index - 1);
        return key;
    }

    private static void requireValidLength(byte[] key) {
        if (key == null || (key.length != 16 && key.length != 32)) {
            int length = key == null ? 0 : key.length;
            throw new DecryptionException("Invalid AES key length: " + length + " bytes (expected 16 or 32)");
        }
    }
}
