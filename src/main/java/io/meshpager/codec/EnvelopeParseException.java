package io.meshpager.codec;

public final class EnvelopeParseException extends RuntimeException {
    public EnvelopeParseException(String message) {
        super(message);
    }

    public EnvelopeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
