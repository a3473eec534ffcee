package io.meshpager.model;

import java.time.Instant;
import java.util.Arrays;

public record RawPacket(
        long sourceNodeId,
        long destNodeId,
        String channelName,
        long packetId,
        byte[] encryptedPayload,
        Instant receivedAt
) {
    public static final long BROADCAST_NODE_ID = 0xFFFFFFFFL;

    public RawPacket {
        channelName = channelName == null ? "" : channelName;
        encryptedPayload = encryptedPayload == null ? new byte[0] : encryptedPayload.clone();
        receivedAt = receivedAt == null ? Instant.now() : receivedAt;
    }

    @Override
    public byte[] encryptedPayload() {
        return encryptedPayload.clone();
    }

    public boolean isBroadcast() {
        return destNodeId == BROADCAST_NODE_ID;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawPacket other)) {
            return false;
        }
        return sourceNodeId == other.sourceNodeId
                && destNodeId == other.destNodeId
                && packetId == other.packetId
                && channelName.equals(other.channelName)
                && Arrays.equals(encryptedPayload, other.encryptedPayload)
                && receivedAt.equals(other.receivedAt);
    }

    @Override
    public int hashCode() {
        int h = Long.hashCode(packetId);
        h = 31 * h + Long.hashCode(sourceNodeId);
        h = 31 * h + Long.hashCode(destNodeId);
        h = 31 * h + channelName.hashCode();
        h = 31 * h + Arrays.hashCode(encryptedPayload);
        return h;
    }

    @Override
    public String toString() {
        return "RawPacket[packetId=" + packetId
                + ", sourceNodeId=" + sourceNodeId
                + ", destNodeId=" + destNodeId
                + ", channelName=" + channelName
                + ", payloadBytes=" + encryptedPayload.length
                + ", receivedAt=" + receivedAt + "]";
    }
}
