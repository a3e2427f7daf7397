package com.watcherbridge.gateway.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.watcherbridge.bus.BusAdapter;
import com.watcherbridge.common.collab.SpeechProvider;
import com.watcherbridge.common.collab.VisionResult;
import com.watcherbridge.common.config.WatcherConfig;
import com.watcherbridge.common.error.ProtocolException;
import com.watcherbridge.common.error.TransportException;
import com.watcherbridge.gateway.runtime.GatewayLane;
import com.watcherbridge.gateway.runtime.GatewayTimings;
import com.watcherbridge.perception.PerceptionPipeline;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the single device session slot and the outbox.
 * <p>
 * Every public entry point only hands work to the {@link GatewayLane}; the
 * slot, the outbox and perception state are touched on the lane alone.
 * Transport callbacks for a connection that is no longer current are ignored.
 */
@Slf4j
public class DeviceSessionManager {

    static final int MAX_STATE_LENGTH = 255;
    static final int MAX_LOG_LENGTH = 500;
    static final String VISION_INGEST_PATH = "/vision-ingest";

    private final GatewayLane lane;
    private final DeviceMessageParser parser;
    private final DeviceCommands commands;
    private final BusAdapter bus;
    private final PerceptionPipeline perception;
    private final SpeechProvider speech;
    private final Executor collaboratorExecutor;
    private final ReconnectController reconnect;
    private final WatcherConfig config;
    private final GatewayTimings timings;
    private final Clock clock;

    private final Outbox outbox = new Outbox();
    private final AtomicLong mcpIds = new AtomicLong();
    private volatile DeviceSession current;
    private boolean flushing;
    private ScheduledFuture<?> pendingFlush;
    private long binaryFrames;

    public DeviceSessionManager(GatewayLane lane, DeviceMessageParser parser, DeviceCommands commands,
            BusAdapter bus, PerceptionPipeline perception, SpeechProvider speech,
            Executor collaboratorExecutor, ReconnectController reconnect, WatcherConfig config,
            GatewayTimings timings, Clock clock) {
        this.lane = lane;
        this.parser = parser;
        this.commands = commands;
        this.bus = bus;
        this.perception = perception;
        this.speech = speech;
        this.collaboratorExecutor = collaboratorExecutor;
        this.reconnect = reconnect;
        this.config = config;
        this.timings = timings;
        this.clock = clock;
    }

    // --- Transport callbacks (any thread) ---

    public void onChannelOpened(DeviceChannel channel) {
        log.info("Device connected: conn={} local={}", channel.id(), channel.localHost());
        lane.execute(() -> adopt(channel));
    }

    public void onText(DeviceChannel channel, String text) {
        lane.execute(() -> {
            DeviceSession session = current;
            if (session == null || session.getChannel() != channel) {
                log.debug("Dropping frame from superseded connection {}", channel.id());
                return;
            }
            handleText(session, text);
        });
    }

    public void onBinary(DeviceChannel channel, int length) {
        lane.execute(() -> {
            binaryFrames++;
            if (binaryFrames == 1 || binaryFrames % 100 == 0) {
                log.debug("Received {} audio frames ({} bytes)", binaryFrames, length);
            }
        });
    }

    public void onChannelClosed(DeviceChannel channel, String reason) {
        lane.execute(() -> {
            DeviceSession session = current;
            if (session == null || session.getChannel() != channel) {
                log.debug("Superseded connection {} closed", channel.id());
                return;
            }
            session.setState(DeviceSessionState.CLOSED);
            current = null;
            stopFlush();
            log.warn("Device disconnected: conn={} reason={}", channel.id(), reason);
            reconnect.onDisconnected();
        });
    }

    // --- Outbound ---

    /**
     * Deliver a command now when a session is active, otherwise queue it.
     * Safe to call from any thread; never drops the message.
     */
    public void sendToDevice(String message) {
        lane.execute(() -> deliver(message));
    }

    /** Drain the outbox into the active session, one message per pacing interval. */
    public void flushOutbox() {
        lane.execute(this::startFlush);
    }

    /**
     * Send only when a session is active; nothing is queued otherwise.
     * Must be called on the lane.
     *
     * @return whether the message was written
     */
    public boolean sendIfActive(String message) {
        DeviceSession session = current;
        return session != null && session.isActive() && sendDirect(session, message);
    }

    /**
     * Close the current connection without recording a disconnect; used on shutdown.
     */
    public CompletableFuture<Void> closeCurrent() {
        return lane.submit(() -> {
            DeviceSession session = current;
            if (session != null) {
                session.setState(DeviceSessionState.CLOSED);
                current = null;
                stopFlush();
                session.getChannel().close();
                log.info("Closed device connection {}", session.getChannel().id());
            }
            return null;
        });
    }

    public long nextMcpId() {
        return mcpIds.incrementAndGet();
    }

    // --- State for health reporting (any thread) ---

    public Optional<DeviceSession> getCurrentSession() {
        return Optional.ofNullable(current);
    }

    public boolean isActive() {
        DeviceSession session = current;
        return session != null && session.isActive();
    }

    public int getOutboxDepth() {
        return outbox.size();
    }

    // --- Lane-confined ---

    private void adopt(DeviceChannel channel) {
        DeviceSession prior = current;
        if (prior != null) {
            prior.setState(DeviceSessionState.CLOSED);
            log.info("Connection {} supersedes {}", channel.id(), prior.getChannel().id());
            prior.getChannel().close();
        }
        DeviceSession session = new DeviceSession(channel, clock.instant());
        session.setState(DeviceSessionState.HANDSHAKING);
        current = session;
        stopFlush();
    }

    private void handleText(DeviceSession session, String text) {
        DeviceMessage message;
        try {
            message = parser.parse(text);
        } catch (ProtocolException e) {
            log.error("{}", e.getMessage());
            return;
        }
        log.debug("Device message: type={}", message.type());

        if (message instanceof DeviceMessage.Hello) {
            handleHello(session);
        } else if (message instanceof DeviceMessage.Listen listen) {
            handleListen(session, listen);
        } else if (message instanceof DeviceMessage.Audio audio) {
            handleAudio(audio.data());
        } else if (message instanceof DeviceMessage.Image image) {
            handleImage(image.data());
        } else if (message instanceof DeviceMessage.Mcp mcp) {
            handleMcp(mcp.payload());
        } else if (message instanceof DeviceMessage.Informational info) {
            log.info("Device {} event: {}", info.type(), info.payload());
        } else {
            log.debug("Ignoring device message type '{}'", message.type());
        }
    }

    private void handleHello(DeviceSession session) {
        String sessionId = UUID.randomUUID().toString();
        session.setSessionId(sessionId);
        if (!sendDirect(session, commands.helloAck(sessionId))) {
            return;
        }
        if (!sendDirect(session, commands.initialize(nextMcpId(), visionUrl(session), config.getVisionToken()))) {
            return;
        }
        session.setState(DeviceSessionState.ACTIVE);
        log.info("Hello handshake completed, session: {}", sessionId);
        reconnect.onConnected(this::startFlush);
    }

    private void handleListen(DeviceSession session, DeviceMessage.Listen listen) {
        log.info("Device listen state: {}", listen.state());
        if (!listen.opensTurn()) {
            return;
        }
        lane.schedule(() -> {
            if (current == session && session.isActive() && sendDirect(session, commands.ttsStop())) {
                log.info("Sent TTS stop to end listen session");
            }
            startFlush();
        }, timings.listenStopDelay());
    }

    private void handleAudio(byte[] pcm) {
        if (pcm.length == 0) {
            return;
        }
        boolean noise = perception.detectNoise(pcm);
        bus.publishState("binary_sensor/noise_detected", noise ? "ON" : "OFF");

        CompletableFuture.supplyAsync(() -> speech.recognize(pcm), collaboratorExecutor)
                .whenCompleteAsync((text, err) -> {
                    if (err != null) {
                        log.warn("Speech recognition failed: {}", err.getMessage());
                    } else if (text != null && !text.isBlank()) {
                        log.info("STT result: {}", text);
                        bus.fireEvent("voice_command", Map.of("text", text));
                    }
                }, lane);
    }

    private void handleImage(byte[] frame) {
        if (frame.length == 0) {
            return;
        }
        bus.publishImage(frame);

        boolean motion = perception.detectMotion(frame);
        bus.publishState("binary_sensor/motion_detected", motion ? "ON" : "OFF");

        boolean forced = perception.consumeForcedAnalysis();
        if (!motion && !forced) {
            return;
        }
        perception.analyzeScene(frame, config.getCustomPrompt(), forced)
                .thenAcceptAsync(result -> result.ifPresent(this::publishAnalysis), lane);
    }

    private void publishAnalysis(VisionResult result) {
        bus.publishState("sensor/last_event", truncate(result.description(), MAX_STATE_LENGTH));
        if (result.confidence() >= config.getConfidenceThreshold()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("description", result.description());
            data.put("confidence", result.confidence());
            bus.fireEvent("alert", data);
        }
    }

    private void handleMcp(JsonNode payload) {
        String json = payload.toString();
        log.info("MCP message from device: {}", truncate(json, MAX_LOG_LENGTH));
        bus.publishState("sensor/last_event", truncate("MCP: " + json, MAX_STATE_LENGTH));
    }

    private void deliver(String message) {
        DeviceSession session = current;
        boolean idle = !flushing && outbox.isEmpty();
        if (session != null && session.isActive() && idle && sendDirect(session, message)) {
            log.debug("Sent to device via WebSocket");
            return;
        }
        CommandEnvelope envelope = outbox.enqueue(message);
        log.info("Command #{} queued for delivery (queue size: {})", envelope.sequence(), outbox.size());
        if (session != null && session.isActive()) {
            startFlush();
        }
    }

    private void startFlush() {
        if (flushing || outbox.isEmpty() || !isActive()) {
            return;
        }
        flushing = true;
        log.info("Flushing {} queued commands", outbox.size());
        flushNext();
    }

    private void flushNext() {
        pendingFlush = null;
        DeviceSession session = current;
        if (!flushing || session == null || !session.isActive() || outbox.isEmpty()) {
            flushing = false;
            return;
        }
        CommandEnvelope envelope = outbox.poll();
        if (!sendDirect(session, envelope.text())) {
            outbox.pushFront(envelope);
            flushing = false;
            return;
        }
        log.info("Delivered queued command #{}", envelope.sequence());
        if (outbox.isEmpty()) {
            flushing = false;
            return;
        }
        pendingFlush = lane.schedule(this::flushNext, timings.flushPacing());
        if (pendingFlush == null) {
            flushing = false;
        }
    }

    /** End the running flush chain; the next one starts from the outbox head. */
    private void stopFlush() {
        flushing = false;
        if (pendingFlush != null) {
            pendingFlush.cancel(false);
            pendingFlush = null;
        }
    }

    private boolean sendDirect(DeviceSession session, String text) {
        try {
            session.getChannel().sendText(text);
            return true;
        } catch (TransportException e) {
            log.warn("WebSocket send failed: {}", e.getMessage());
            return false;
        }
    }

    private String visionUrl(DeviceSession session) {
        String host = config.getHostIp();
        if (host == null || host.isBlank()) {
            host = session.getChannel().localHost();
        }
        if (host == null || host.isBlank()) {
            host = "localhost";
        }
        return "http://" + host + ":" + config.getHttpPort() + VISION_INGEST_PATH;
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
