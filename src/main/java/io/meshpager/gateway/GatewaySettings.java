package io.meshpager.gateway;

import java.net.URI;
import java.time.Duration;

/**
 * DAPNET endpoint and sender identity. The callsign doubles as the basic-auth user.
 * {@link #toString()} leaves the password out.
 */
public record GatewaySettings(
        URI apiUrl,
        String password,
        String callsign,
        String transmitterGroup,
        int maxRetries,
        Duration retryDelay,
        Duration apiTimeout
) {
    public GatewaySettings {
        if (apiUrl == null) {
            throw new IllegalArgumentException("apiUrl must not be null");
        }
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be > 0");
        }
        if (callsign == null || callsign.isBlank()) {
            throw new IllegalArgumentException("callsign must not be blank");
        }
        password = password == null ? "" : password;
    }

    @Override
    public String toString() {
        return "GatewaySettings[apiUrl=" + apiUrl
                + ", callsign=" + callsign
                + ", transmitterGroup=" + transmitterGroup
                + ", maxRetries=" + maxRetries
                + ", retryDelay=" + retryDelay
                + ", apiTimeout=" + apiTimeout + "]";
    }
}
