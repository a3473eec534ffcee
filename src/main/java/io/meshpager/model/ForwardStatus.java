package io.meshpager.model;

import java.util.Locale;

public enum ForwardStatus {
    PENDING,
    DELIVERED,
    FAILED;

    public static ForwardStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        return ForwardStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
