package io.meshpager.runtime;

public enum PipelineOutcome {
    SKIPPED_NOT_BROADCAST,
    DECRYPTION_FAILED,
    MALFORMED,
    TELEMETRY_DROPPED,
    DUPLICATE,
    STORE_BUSY,
    STORE_FAILED,
    DELIVERED,
    FORWARD_FAILED,
    AUTHENTICATION_FAILED,
    UNEXPECTED_ERROR
}
