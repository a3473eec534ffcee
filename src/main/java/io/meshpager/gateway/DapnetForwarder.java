package io.meshpager.gateway;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meshpager.model.TextMessage;
import io.meshpager.runtime.BackoffPolicy;
import io.meshpager.runtime.Sleeper;
import io.meshpager.util.Jsons;
import io.meshpager.util.NodeIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Posts text messages to the DAPNET calls endpoint.
 *
 * <p>Transport errors, timeouts and non-2xx responses are retried with exponential backoff up to
 * {@link GatewaySettings#maxRetries()} attempts. 401 and 403 end the call at once: retrying a
 * credential problem only delays the report.
 */
public final class DapnetForwarder implements MessageForwarder {
    private static final Logger log = LoggerFactory.getLogger(DapnetForwarder.class);
    private static final int MAX_LOGGED_BODY_CHARS = 200;
    private static final int LOGGED_TEXT_CHARS = 50;
    private static final Duration CANCEL_POLL = Duration.ofMillis(100);

    private final GatewaySettings settings;
    private final HttpClient http;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final String authorization;

    public DapnetForwarder(GatewaySettings settings, Sleeper sleeper) {
        this(settings,
                HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(settings.apiTimeout())
                        .build(),
                BackoffPolicy.bounded(settings.maxRetries(), settings.retryDelay()),
                sleeper);
    }

    public DapnetForwarder(GatewaySettings settings, HttpClient http, BackoffPolicy backoff, Sleeper sleeper) {
        this.settings = settings;
        this.http = http;
        this.backoff = backoff;
        this.sleeper = sleeper;
        String credentials = settings.callsign() + ":" + settings.password();
        this.authorization = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public ForwardResult forward(TextMessage message) {
        String from = NodeIds.format(message.fromNodeId());
        String body = Jsons.toJson(requestBody(message.text()));
        int lastStatus = 0;
        String lastDetail = "";
        int attempt = 0;
        while (true) {
            attempt++;
            log.info("Sending to DAPNET (attempt {}/{}): {} from {}",
                    attempt, backoff.maxAttempts(), preview(message.text()), from);
            try {
                Optional<HttpResponse<String>> sent = send(request(body));
                if (sent.isEmpty()) {
                    log.warn("Shutdown during DAPNET call; abandoning packet {} on attempt {}", message.packetId(), attempt);
                    return ForwardResult.cancelled(attempt, lastStatus);
                }
                HttpResponse<String> response = sent.get();
                lastStatus = response.statusCode();
                if (lastStatus >= 200 && lastStatus < 300) {
                    log.info("Message {} from {} delivered to DAPNET (status {})", message.packetId(), from, lastStatus);
                    return ForwardResult.delivered(attempt, lastStatus);
                }
                if (lastStatus == 401 || lastStatus == 403) {
                    log.error("DAPNET rejected credentials for callsign {} (status {}); not retrying packet {}",
                            settings.callsign(), lastStatus, message.packetId());
                    return ForwardResult.authenticationFailed(attempt, lastStatus);
                }
                lastDetail = "status " + lastStatus + ": " + clip(response.body());
                log.warn("DAPNET API returned {}", lastDetail);
            } catch (HttpTimeoutException e) {
                lastDetail = "timeout after " + settings.apiTimeout().toMillis() + " ms";
                log.warn("DAPNET API timeout (attempt {})", attempt);
            } catch (IOException e) {
                lastDetail = "I/O error: " + e.getClass().getSimpleName();
                log.warn("DAPNET API connection error (attempt {}): {}", attempt, e.toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("DAPNET call for packet {} interrupted", message.packetId());
                return ForwardResult.cancelled(attempt, lastStatus);
            } catch (RuntimeException e) {
                lastDetail = "unexpected error: " + e.getClass().getSimpleName();
                log.error("Unexpected error sending to DAPNET (attempt {})", attempt, e);
            }

            if (!backoff.hasAttemptsLeft(attempt)) {
                break;
            }
            Duration delay = backoff.delayFor(attempt - 1);
            log.info("Retrying DAPNET in {} ms", delay.toMillis());
            if (!sleeper.sleep(delay)) {
                log.warn("Shutdown during DAPNET backoff; giving up on packet {} after {} attempts",
                        message.packetId(), attempt);
                return ForwardResult.cancelled(attempt, lastStatus);
            }
        }
        log.error("Failed to send packet {} to DAPNET after {} attempts ({})", message.packetId(), attempt, lastDetail);
        return ForwardResult.failedAfterRetries(attempt, lastStatus, lastDetail);
    }

    /**
     * Sends one request, waking every {@link #CANCEL_POLL} to check for shutdown. Returns empty if
     * the call was abandoned; the request timeout still bounds the wait otherwise.
     */
    private Optional<HttpResponse<String>> send(HttpRequest request) throws IOException, InterruptedException {
        CompletableFuture<HttpResponse<String>> pending =
                http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        while (true) {
            if (sleeper.cancelled()) {
                pending.cancel(true);
                return Optional.empty();
            }
            try {
                return Optional.of(pending.get(CANCEL_POLL.toMillis(), TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                continue;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof IOException io) {
                    throw io;
                }
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IOException("DAPNET call failed", cause);
            } catch (InterruptedException e) {
                pending.cancel(true);
                throw e;
            }
        }
    }

    ObjectNode requestBody(String text) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("text", text);
        root.putArray("callSignNames").add(settings.callsign());
        root.putArray("transmitterGroupNames").add(settings.transmitterGroup());
        root.put("emergency", false);
        return root;
    }

    private HttpRequest request(String body) {
        return HttpRequest.newBuilder(settings.apiUrl())
                .timeout(settings.apiTimeout())
                .header("Content-Type", "application/json")
                .header("Authorization", authorization)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
    }

    private static String preview(String text) {
        return text.length() <= LOGGED_TEXT_CHARS ? text : text.substring(0, LOGGED_TEXT_CHARS) + "...";
    }

    private static String clip(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_LOGGED_BODY_CHARS ? body : body.substring(0, MAX_LOGGED_BODY_CHARS) + "...";
    }
}
