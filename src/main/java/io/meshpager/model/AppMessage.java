package io.meshpager.model;

/**
 * Application-level content recovered from a decrypted packet.
 *
 * <p>Callers branch on the variant through {@link Visitor}, which the compiler keeps exhaustive.
 */
public sealed interface AppMessage permits TextMessage, OtherTelemetry, Malformed {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R text(TextMessage message);

        R telemetry(OtherTelemetry telemetry);

        R malformed(Malformed malformed);
    }
}
