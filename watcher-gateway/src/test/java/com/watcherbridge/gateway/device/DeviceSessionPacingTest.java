package com.watcherbridge.gateway.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.watcherbridge.gateway.GatewayFixture;
import com.watcherbridge.gateway.RecordingDeviceChannel;
import com.watcherbridge.gateway.runtime.GatewayTimings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.watcherbridge.gateway.Eventually.eventually;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the session manager with the production delays: 100 ms between
 * flushed commands and 500 ms before the TTS stop that ends a listen turn.
 */
class DeviceSessionPacingTest {

    private static final long PACING_MS = GatewayTimings.DEFAULT.flushPacing().toMillis();
    private static final long LISTEN_STOP_MS = GatewayTimings.DEFAULT.listenStopDelay().toMillis();
    // scheduled tasks never fire early; allow a little clock granularity
    private static final long SLACK_MS = 5;

    @TempDir
    Path tempDir;

    private GatewayFixture gw;

    @BeforeEach
    void setUp() {
        gw = new GatewayFixture(tempDir, GatewayTimings.DEFAULT);
    }

    @AfterEach
    void tearDown() {
        gw.close();
    }

    @Test
    void queuedCommands_areSpacedByFlushPacing() {
        gw.devices.sendToDevice("A");
        gw.devices.sendToDevice("B");
        gw.devices.sendToDevice("C");
        eventually(() -> assertEquals(3, gw.devices.getOutboxDepth()));

        RecordingDeviceChannel channel = gw.connectDevice();

        eventually(() -> assertEquals(5, channel.sentAt.size()));
        assertEquals(List.of("A", "B", "C"), channel.sent.subList(2, 5));
        assertTrue(minGapMs(channel.sentAt.subList(2, 5)) >= PACING_MS - SLACK_MS,
                "gaps " + gapsMs(channel.sentAt.subList(2, 5)));
    }

    @Test
    void listenStart_waitsBeforeTtsStop() {
        RecordingDeviceChannel channel = gw.connectDevice();
        eventually(() -> assertEquals(2, channel.sentAt.size()));

        long start = System.nanoTime();
        gw.devices.onText(channel, "{\"type\":\"listen\",\"state\":\"start\"}");

        eventually(() -> assertEquals(3, channel.sentAt.size()));
        JsonNode stop = gw.json(channel.sent.get(2));
        assertEquals("stop", stop.get("state").asText());
        long waited = TimeUnit.NANOSECONDS.toMillis(channel.sentAt.get(2) - start);
        assertTrue(waited >= LISTEN_STOP_MS - SLACK_MS, "tts stop after " + waited + " ms");
    }

    @Test
    void reconnectDuringFlush_resumesOneSingleFlush() {
        List<String> queued = IntStream.rangeClosed(1, 8).mapToObj(i -> "m" + i).toList();
        queued.forEach(gw.devices::sendToDevice);
        eventually(() -> assertEquals(8, gw.devices.getOutboxDepth()));

        RecordingDeviceChannel first = gw.connectDevice();
        eventually(() -> assertTrue(first.sentAt.size() >= 4));
        gw.devices.onChannelClosed(first, "dropped");
        RecordingDeviceChannel second = gw.connectDevice();

        eventually(() -> assertEquals(0, gw.devices.getOutboxDepth()));
        eventually(() -> assertEquals(8, first.sent.size() - 2 + second.sent.size() - 2));

        List<String> delivered = new ArrayList<>(first.sent.subList(2, first.sent.size()));
        delivered.addAll(second.sent.subList(2, second.sent.size()));
        assertEquals(queued, delivered);

        List<Long> resumed = second.sentAt.subList(2, second.sentAt.size());
        assertTrue(resumed.size() >= 2, "resumed " + resumed.size());
        assertTrue(minGapMs(resumed) >= PACING_MS - SLACK_MS, "gaps " + gapsMs(resumed));
    }

    private static long minGapMs(List<Long> times) {
        return gapsMs(times).stream().mapToLong(Long::longValue).min().orElse(Long.MAX_VALUE);
    }

    private static List<Long> gapsMs(List<Long> times) {
        List<Long> gaps = new ArrayList<>();
        for (int i = 1; i < times.size(); i++) {
            gaps.add(TimeUnit.NANOSECONDS.toMillis(times.get(i) - times.get(i - 1)));
        }
        return gaps;
    }
}
