package io.meshpager.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meshpager.gateway.GatewaySettings;
import io.meshpager.security.ChannelCrypto;
import io.meshpager.security.DecryptionException;
import io.meshpager.security.SensitiveDataMasker;
import io.meshpager.util.Jsons;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Validated runtime settings. Built once at startup from the merged {@code .env} file and process
 * environment; any missing or malformed value fails the whole load.
 */
public final class MeshPagerConfig {
    public static final String DEFAULT_ROOT_TOPIC = "msh/MY_919/2/e/";
    public static final String DEFAULT_CHANNEL = "LongFast";
    public static final int DEFAULT_MQTT_PORT = 1883;
    public static final int DEFAULT_MQTT_KEEPALIVE = 60;
    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final int DEFAULT_RETRY_DELAY_SECONDS = 5;
    public static final int DEFAULT_API_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_MAX_TEXT_BYTES = 512;
    public static final String DEFAULT_DATABASE_FILE = "meshtastic.db";
    public static final String DEFAULT_LOG_FILE = "meshtastic_debug.log";
    public static final String DEFAULT_LOG_LEVEL = "INFO";

    private static final List<String> REQUIRED = List.of(
            "ENCRYPTION_KEY",
            "MQTT_BROKER",
            "MQTT_USERNAME",
            "MQTT_PASSWORD",
            "DAPNET_USER",
            "DAPNET_PASSWORD",
            "CALLSIGN",
            "DAPNET_API_URL",
            "TRANSMITTER_GROUP"
    );

    private final byte[] channelKey;
    private final String mqttBroker;
    private final int mqttPort;
    private final String mqttUsername;
    private final String mqttPassword;
    private final int mqttKeepalive;
    private final String mqttClientId;
    private final String rootTopic;
    private final String channel;
    private final String dapnetUser;
    private final GatewaySettings gateway;
    private final Path databaseFile;
    private final Path logFile;
    private final String logLevel;
    private final int maxTextBytes;
    private final boolean broadcastOnly;

    private MeshPagerConfig(Map<String, String> env) {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED) {
            if (value(env, key, "").isBlank()) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required environment variables: " + String.join(", ", missing));
        }
        try {
            this.channelKey = ChannelCrypto.prepareKey(value(env, "ENCRYPTION_KEY", ""));
        } catch (DecryptionException e) {
            throw new ConfigurationException("Invalid encryption key format in ENCRYPTION_KEY: " + e.getMessage(), e);
        }
        this.mqttBroker = value(env, "MQTT_BROKER", "").trim();
        this.mqttPort = intValue(env, "MQTT_PORT", DEFAULT_MQTT_PORT);
        if (mqttPort <= 0 || mqttPort > 65535) {
            throw new ConfigurationException("MQTT_PORT must be between 1 and 65535");
        }
        this.mqttUsername = value(env, "MQTT_USERNAME", "");
        this.mqttPassword = value(env, "MQTT_PASSWORD", "");
        this.mqttKeepalive = positive(env, "MQTT_KEEPALIVE", DEFAULT_MQTT_KEEPALIVE);
        String clientId = value(env, "MQTT_CLIENT_ID", "");
        this.mqttClientId = clientId.isBlank()
                ? "meshpager-" + UUID.randomUUID().toString().substring(0, 8)
                : clientId.trim();
        this.rootTopic = normalizeRootTopic(value(env, "ROOT_TOPIC", DEFAULT_ROOT_TOPIC));
        this.channel = value(env, "CHANNEL", DEFAULT_CHANNEL).trim();
        if (channel.isEmpty() || channel.contains("/") || channel.contains("#") || channel.contains("+")) {
            throw new ConfigurationException("CHANNEL must be a single topic level, got '" + channel + "'");
        }

        int maxRetries = positive(env, "MAX_RETRIES", DEFAULT_MAX_RETRIES);
        int retryDelay = positive(env, "RETRY_DELAY", DEFAULT_RETRY_DELAY_SECONDS);
        int apiTimeout = positive(env, "API_TIMEOUT", DEFAULT_API_TIMEOUT_SECONDS);
        this.dapnetUser = value(env, "DAPNET_USER", "").trim();
        this.gateway = new GatewaySettings(
                parseApiUrl(value(env, "DAPNET_API_URL", "")),
                value(env, "DAPNET_PASSWORD", ""),
                value(env, "CALLSIGN", "").trim(),
                value(env, "TRANSMITTER_GROUP", "").trim(),
                maxRetries,
                Duration.ofSeconds(retryDelay),
                Duration.ofSeconds(apiTimeout)
        );

        this.databaseFile = Paths.get(value(env, "DATABASE_FILE", DEFAULT_DATABASE_FILE).trim());
        this.logFile = Paths.get(value(env, "LOG_FILE", DEFAULT_LOG_FILE).trim());
        this.logLevel = normalizeLevel(value(env, "LOG_LEVEL", DEFAULT_LOG_LEVEL));
        this.maxTextBytes = positive(env, "MAX_TEXT_BYTES", DEFAULT_MAX_TEXT_BYTES);
        this.broadcastOnly = booleanValue(env, "BROADCAST_ONLY", true);
    }

    public static MeshPagerConfig load(Map<String, String> env) {
        return new MeshPagerConfig(env == null ? Map.of() : env);
    }

    public static MeshPagerConfig fromEnvironment(Path envFile) {
        return load(EnvFile.merge(EnvFile.read(envFile), System.getenv()));
    }

    public byte[] channelKey() {
        return channelKey.clone();
    }

    public String mqttBroker() {
        return mqttBroker;
    }

    public int mqttPort() {
        return mqttPort;
    }

    public String mqttUsername() {
        return mqttUsername;
    }

    public String mqttPassword() {
        return mqttPassword;
    }

    public int mqttKeepalive() {
        return mqttKeepalive;
    }

    public String mqttClientId() {
        return mqttClientId;
    }

    public String rootTopic() {
        return rootTopic;
    }

    public String channel() {
        return channel;
    }

    public String topicFilter() {
        return rootTopic + channel + "/#";
    }

    /** DAPNET account name. Reported in the summary; requests authenticate with the callsign. */
    public String dapnetUser() {
        return dapnetUser;
    }

    public GatewaySettings gateway() {
        return gateway;
    }

    public int maxRetries() {
        return gateway.maxRetries();
    }

    public Duration retryDelay() {
        return gateway.retryDelay();
    }

    public Duration apiTimeout() {
        return gateway.apiTimeout();
    }

    public Path databaseFile() {
        return databaseFile;
    }

    public Path logFile() {
        return logFile;
    }

    public String logLevel() {
        return logLevel;
    }

    public int maxTextBytes() {
        return maxTextBytes;
    }

    public boolean broadcastOnly() {
        return broadcastOnly;
    }

    /** Settings overview with every credential masked, safe to log. */
    public JsonNode summary() {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("mqtt_broker", mqttBroker + ":" + mqttPort);
        root.put("mqtt_topic", topicFilter());
        root.put("mqtt_username", mqttUsername);
        root.put("mqtt_password", mqttPassword);
        root.put("mqtt_client_id", mqttClientId);
        root.put("encryption_key", "configured (" + channelKey.length + " bytes)");
        root.put("dapnet_api_url", gateway.apiUrl().toString());
        root.put("dapnet_user", dapnetUser);
        root.put("dapnet_password", gateway.password());
        root.put("callsign", gateway.callsign());
        root.put("transmitter_group", gateway.transmitterGroup());
        root.put("database_file", databaseFile.toString());
        root.put("log_file", logFile.toString());
        root.put("log_level", logLevel);
        root.put("max_retries", gateway.maxRetries());
        root.put("retry_delay_s", gateway.retryDelay().toSeconds());
        root.put("api_timeout_s", gateway.apiTimeout().toSeconds());
        root.put("max_text_bytes", maxTextBytes);
        root.put("broadcast_only", broadcastOnly);
        return SensitiveDataMasker.masked(root);
    }

    @Override
    public String toString() {
        return "MeshPagerConfig" + Jsons.toJson(summary());
    }

    private static String value(Map<String, String> env, String key, String fallback) {
        String raw = env.get(key);
        return raw == null || raw.isBlank() ? fallback : raw;
    }

    private static int intValue(Map<String, String> env, String key, int fallback) {
        String raw = value(env, key, "");
        if (raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + raw.trim() + "'", e);
        }
    }

    private static int positive(Map<String, String> env, String key, int fallback) {
        int parsed = intValue(env, key, fallback);
        if (parsed <= 0) {
            throw new ConfigurationException(key + " must be greater than 0");
        }
        return parsed;
    }

    private static boolean booleanValue(Map<String, String> env, String key, boolean fallback) {
        String raw = value(env, key, "").trim().toLowerCase(Locale.ROOT);
        return switch (raw) {
            case "" -> fallback;
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new ConfigurationException(key + " must be true or false, got '" + raw + "'");
        };
    }

    private static URI parseApiUrl(String raw) {
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
                throw new ConfigurationException("DAPNET_API_URL must be an absolute http(s) URL");
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ConfigurationException("DAPNET_API_URL is not a valid URL", e);
        }
    }

    private static String normalizeRootTopic(String raw) {
        String trimmed = raw.trim();
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }

    private static String normalizeLevel(String raw) {
        String level = raw.trim().toUpperCase(Locale.ROOT);
        return switch (level) {
            case "TRACE", "DEBUG", "INFO", "WARN", "ERROR" -> level;
            case "WARNING" -> "WARN";
            case "CRITICAL" -> "ERROR";
            default -> throw new ConfigurationException("LOG_LEVEL must be one of TRACE, DEBUG, INFO, WARN, ERROR");
        };
    }
}
