package io.meshpager.util;

public final class NodeIds {
    private NodeIds() {
    }

    /** Renders a node number the way Meshtastic clients show it, e.g. {@code !a1b2c3d4}. */
    public static String format(long nodeNumber) {
        return "!" + Long.toHexString(nodeNumber & 0xFFFFFFFFL);
    }
}
