package io.meshpager.logging;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

public final class LogMarkers {
    /** Attached to ERROR entries that threaten the service as a whole, not a single message. */
    public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    private LogMarkers() {
    }
}
