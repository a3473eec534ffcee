package io.meshpager.model;

public record Malformed(String reason) implements AppMessage {
    public Malformed {
        reason = reason == null || reason.isBlank() ? "unparseable payload" : reason;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.malformed(this);
    }
}
