package com.watcherbridge.gateway.bridge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound connection to the remote tool broker.
 * <p>
 * Dials the broker, hands every text frame to the {@link ToolBridgeDispatcher}
 * and writes back its reply. Lost or failed connections are retried at a
 * fixed interval until {@link #stop()}; an open connection is pinged
 * periodically. All work runs on the bridge's own thread. A client built
 * without a URI stays idle.
 */
@Slf4j
public class ToolBridgeClient extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 1024 * 1024;
    private static final long CONNECT_TIMEOUT_SECONDS = 10;

    private final WebSocketClient client;
    private final URI uri;
    private final ToolBridgeDispatcher dispatcher;
    private final Duration retryInterval;
    private final Duration pingInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean reconnectPending = new AtomicBoolean(false);
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "tool-bridge");
        t.setDaemon(true);
        return t;
    });

    private volatile WebSocketSession session;
    private ScheduledFuture<?> pingTask;

    public ToolBridgeClient(WebSocketClient client, URI uri, ToolBridgeDispatcher dispatcher,
            Duration retryInterval, Duration pingInterval) {
        this.client = client;
        this.uri = uri;
        this.dispatcher = dispatcher;
        this.retryInterval = retryInterval;
        this.pingInterval = pingInterval;
    }

    public void start() {
        if (uri == null) {
            log.info("Tool bridge disabled (no tool_bridge_url)");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Tool bridge starting: {}", uri);
        scheduler.execute(this::connect);
        pingTask = scheduler.scheduleAtFixedRate(this::ping,
                pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            scheduler.shutdownNow();
            return;
        }
        if (pingTask != null) {
            pingTask.cancel(false);
        }
        WebSocketSession current = session;
        session = null;
        if (current != null) {
            try {
                current.close(CloseStatus.GOING_AWAY);
            } catch (IOException e) {
                log.debug("Error closing tool bridge session: {}", e.getMessage());
            }
        }
        scheduler.shutdownNow();
        log.info("Tool bridge stopped");
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    public boolean isEnabled() {
        return uri != null;
    }

    public boolean isRunning() {
        return running.get();
    }

    private void connect() {
        reconnectPending.set(false);
        if (!running.get() || isConnected()) {
            return;
        }
        try {
            WebSocketSession raw = client.execute(this, new WebSocketHttpHeaders(), uri)
                    .get(CONNECT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
            log.info("Tool bridge connected to {}", uri);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.warn("Tool bridge connection to {} failed: {}", uri, cause.getMessage());
            scheduleReconnect();
        } catch (RuntimeException e) {
            log.warn("Tool bridge connection to {} failed: {}", uri, e.getMessage());
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        if (!running.get() || !reconnectPending.compareAndSet(false, true)) {
            return;
        }
        log.info("Tool bridge reconnecting in {} s", retryInterval.toSeconds());
        try {
            scheduler.schedule(this::connect, retryInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Tool bridge scheduler stopped, not reconnecting");
        }
    }

    private void ping() {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            current.sendMessage(new PingMessage());
        } catch (IOException | IllegalStateException e) {
            log.warn("Tool bridge ping failed: {}", e.getMessage());
        }
    }

    private void reply(String frame) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            log.warn("Tool bridge reply dropped, not connected");
            return;
        }
        try {
            current.sendMessage(new TextMessage(frame));
        } catch (IOException | IllegalStateException e) {
            log.warn("Tool bridge reply failed: {}", e.getMessage());
        }
    }

    // --- WebSocketHandler ---

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        String payload = message.getPayload();
        try {
            scheduler.execute(() -> dispatcher.dispatch(payload).ifPresent(this::reply));
        } catch (RejectedExecutionException e) {
            log.debug("Tool bridge stopped, dropping frame");
        }
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.warn("Tool bridge transport error: {}", exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        log.info("Tool bridge disconnected: {}", status);
        session = null;
        scheduleReconnect();
    }
}
