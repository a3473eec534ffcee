package io.meshpager.model;

public record TextMessage(String text, long fromNodeId, long toNodeId, long packetId, boolean truncated)
        implements AppMessage {

    public TextMessage {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
    }

    public TextMessage(String text, long fromNodeId, long toNodeId, long packetId) {
        this(text, fromNodeId, toNodeId, packetId, false);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.text(this);
    }
}
