package io.meshpager.bus;

import io.meshpager.model.RawPacket;

import java.time.Duration;
import java.util.Optional;

public interface PacketSource extends AutoCloseable {
    /** Blocks up to {@code timeout} for the next packet. */
    Optional<RawPacket> receive(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
