package io.meshpager.model;

public record OtherTelemetry(PortNum portNum, int payloadLength) implements AppMessage {
    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.telemetry(this);
    }
}
