package io.meshpager.bus;

import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

/**
 * {@link BusClient} backed by the Eclipse Paho MQTT v3 synchronous client. Paho's own automatic
 * reconnect stays off; {@link BusConnection} drives reconnects.
 */
public final class PahoBusClient implements BusClient {
    private static final int SUBSCRIBE_QOS = 0;
    private static final long DISCONNECT_QUIESCE_MS = 2_000L;

    private final MqttClient client;
    private final MqttConnectOptions options;

    public PahoBusClient(String host, int port, String clientId, String username, String password,
                         int keepAliveSeconds, int connectTimeoutSeconds) {
        try {
            this.client = new MqttClient("tcp://" + host + ":" + port, clientId, new MemoryPersistence());
        } catch (MqttException e) {
            throw new BusConnectionException("Invalid MQTT client settings for " + host + ":" + port + " (reason " + e.getReasonCode() + ")", e);
        }
        this.options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setKeepAliveInterval(keepAliveSeconds);
        options.setConnectionTimeout(connectTimeoutSeconds);
        if (username != null && !username.isBlank()) {
            options.setUserName(username);
        }
        if (password != null && !password.isEmpty()) {
            options.setPassword(password.toCharArray());
        }
    }

    @Override
    public void connect(Listener listener) {
        client.setCallback(new MqttCallback() {
            @Override
            public void connectionLost(Throwable cause) {
                listener.connectionLost(cause);
            }

            @Override
            public void messageArrived(String topic, MqttMessage message) {
                listener.messageArrived(topic, message.getPayload());
            }

            @Override
            public void deliveryComplete(IMqttDeliveryToken token) {
                // subscribe-only client
            }
        });
        try {
            client.connect(options);
        } catch (MqttException e) {
            throw new BusConnectionException(describe("connect", e), e);
        }
    }

    @Override
    public void subscribe(String topicFilter) {
        try {
            client.subscribe(topicFilter, SUBSCRIBE_QOS);
        } catch (MqttException e) {
            throw new BusConnectionException(describe("subscribe to " + topicFilter, e), e);
        }
    }

    @Override
    public boolean isConnected() {
        return client.isConnected();
    }

    @Override
    public void disconnect() {
        if (!client.isConnected()) {
            return;
        }
        try {
            client.disconnect(DISCONNECT_QUIESCE_MS);
        } catch (MqttException e) {
            throw new BusConnectionException(describe("disconnect", e), e);
        }
    }

    @Override
    public void close() {
        try {
            client.close();
        } catch (MqttException e) {
            throw new BusConnectionException(describe("close", e), e);
        }
    }

    private static String describe(String action, MqttException e) {
        return switch (e.getReasonCode()) {
            case MqttException.REASON_CODE_INVALID_PROTOCOL_VERSION -> action + " refused: incorrect protocol version";
            case MqttException.REASON_CODE_INVALID_CLIENT_ID -> action + " refused: invalid client identifier";
            case MqttException.REASON_CODE_BROKER_UNAVAILABLE -> action + " refused: server unavailable";
            case MqttException.REASON_CODE_FAILED_AUTHENTICATION -> action + " refused: bad username or password";
            case MqttException.REASON_CODE_NOT_AUTHORIZED -> action + " refused: not authorised";
            default -> action + " failed: " + e.getMessage() + " (reason " + e.getReasonCode() + ")";
        };
    }
}
