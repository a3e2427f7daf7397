package com.watcherbridge.bus;

import com.watcherbridge.common.error.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link BusClient} over the Eclipse Paho MQTT v3 client.
 * <p>
 * Uses automatic reconnect with a clean session, so subscriptions are
 * replayed from {@code connectComplete} on a separate thread (Paho's
 * callback thread must not block on a subscribe).
 */
@Slf4j
public class PahoBusClient implements BusClient, MqttCallbackExtended {

    public static final int CONNECT_TIMEOUT_SECONDS = 10;
    public static final int KEEP_ALIVE_SECONDS = 60;
    private static final int QOS = 0;

    private final String serverUri;
    private final String clientId;
    private final String username;
    private final String password;
    private final Map<String, BusMessageListener> subscriptions = new ConcurrentHashMap<>();
    private final ExecutorService resubscriber = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "bus-resubscribe");
        t.setDaemon(true);
        return t;
    });

    private volatile MqttClient client;

    public PahoBusClient(String host, int port, String clientId, String username, String password) {
        this.serverUri = "tcp://" + host + ":" + port;
        this.clientId = clientId;
        this.username = username;
        this.password = password;
    }

    @Override
    public void connect(LastWill will) {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(true);
        options.setCleanSession(true);
        options.setConnectionTimeout(CONNECT_TIMEOUT_SECONDS);
        options.setKeepAliveInterval(KEEP_ALIVE_SECONDS);
        if (username != null && !username.isBlank() && password != null && !password.isBlank()) {
            options.setUserName(username);
            options.setPassword(password.toCharArray());
        }
        if (will != null) {
            options.setWill(will.topic(), will.payload().getBytes(StandardCharsets.UTF_8), QOS, will.retain());
        }

        try {
            MqttClient c = client;
            if (c == null) {
                c = new MqttClient(serverUri, clientId, new MemoryPersistence());
                c.setCallback(this);
                client = c;
            }
            c.connect(options);
            log.info("Connected to MQTT broker {}", serverUri);
        } catch (MqttException e) {
            throw new TransportException("MQTT connect to " + serverUri + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void publish(String topic, byte[] payload, boolean retain) {
        MqttClient c = client;
        if (c == null || !c.isConnected()) {
            throw new TransportException("not connected to MQTT broker");
        }
        try {
            c.publish(topic, payload, QOS, retain);
        } catch (MqttException e) {
            throw new TransportException("publish to " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void subscribe(String topicFilter, BusMessageListener listener) {
        subscriptions.put(topicFilter, listener);
        MqttClient c = client;
        if (c != null && c.isConnected()) {
            doSubscribe(c, topicFilter, listener);
        }
    }

    @Override
    public void disconnect() {
        MqttClient c = client;
        client = null;
        resubscriber.shutdownNow();
        if (c == null) {
            return;
        }
        try {
            if (c.isConnected()) {
                c.disconnect();
            }
        } catch (MqttException e) {
            log.warn("MQTT disconnect failed: {}", e.getMessage());
        }
        try {
            c.close();
        } catch (MqttException e) {
            log.warn("MQTT close failed: {}", e.getMessage());
        }
        log.info("Disconnected from MQTT broker");
    }

    @Override
    public boolean isConnected() {
        MqttClient c = client;
        return c != null && c.isConnected();
    }

    // --- MqttCallbackExtended ---

    @Override
    public void connectComplete(boolean reconnect, String serverURI) {
        if (!reconnect) {
            return;
        }
        log.info("Reconnected to MQTT broker, restoring {} subscription(s)", subscriptions.size());
        resubscriber.execute(() -> {
            MqttClient c = client;
            if (c != null) {
                subscriptions.forEach((filter, listener) -> doSubscribe(c, filter, listener));
            }
        });
    }

    @Override
    public void connectionLost(Throwable cause) {
        log.warn("Disconnected from MQTT broker: {}", cause != null ? cause.getMessage() : "unknown");
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        // delivered through per-subscription listeners
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
    }

    private void doSubscribe(MqttClient c, String filter, BusMessageListener listener) {
        try {
            c.subscribe(filter, QOS, (topic, message) -> listener.onMessage(topic, message.getPayload()));
            log.info("Subscribed to {}", filter);
        } catch (MqttException e) {
            log.error("Subscribe to {} failed: {}", filter, e.getMessage());
        }
    }
}
