package io.meshpager.model;

public record ProcessedRecord(
        long packetId,
        long fromNodeId,
        String text,
        ForwardStatus forwardStatus,
        long createdAtMs,
        long updatedAtMs,
        Long forwardedAtMs
) {
}
