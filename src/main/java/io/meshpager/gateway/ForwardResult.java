package io.meshpager.gateway;

public record ForwardResult(Outcome outcome, int attempts, int lastStatusCode, String detail) {

    public enum Outcome {
        DELIVERED,
        FAILED_AFTER_RETRIES,
        AUTHENTICATION_FAILED,
        CANCELLED
    }

    public static ForwardResult delivered(int attempts, int statusCode) {
        return new ForwardResult(Outcome.DELIVERED, attempts, statusCode, "");
    }

    public static ForwardResult failedAfterRetries(int attempts, int lastStatusCode, String detail) {
        return new ForwardResult(Outcome.FAILED_AFTER_RETRIES, attempts, lastStatusCode, detail);
    }

    public static ForwardResult authenticationFailed(int attempts, int statusCode) {
        return new ForwardResult(Outcome.AUTHENTICATION_FAILED, attempts, statusCode, "gateway rejected credentials");
    }

    public static ForwardResult cancelled(int attempts, int lastStatusCode) {
        return new ForwardResult(Outcome.CANCELLED, attempts, lastStatusCode, "shutdown requested");
    }

    public boolean delivered() {
        return outcome == Outcome.DELIVERED;
    }
}
