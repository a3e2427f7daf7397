package com.watcherbridge.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watcherbridge.bus.BusAdapter;
import com.watcherbridge.bus.EntityCatalog;
import com.watcherbridge.common.collab.SpeechProvider;
import com.watcherbridge.common.collab.VisionResult;
import com.watcherbridge.common.config.WatcherConfig;
import com.watcherbridge.gateway.device.DeviceCommands;
import com.watcherbridge.gateway.device.DeviceMessageParser;
import com.watcherbridge.gateway.device.DeviceSessionManager;
import com.watcherbridge.gateway.device.ReconnectController;
import com.watcherbridge.gateway.runtime.GatewayLane;
import com.watcherbridge.gateway.runtime.GatewayTimings;
import com.watcherbridge.perception.MotionDetector;
import com.watcherbridge.perception.NoiseDetector;
import com.watcherbridge.perception.PerceptionPipeline;
import com.watcherbridge.perception.SceneAnalyzer;
import com.watcherbridge.perception.SnapshotStore;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * A device session manager wired to in-memory fakes, by default with zero
 * listen and flush delays. Collaborators run inline on the calling thread.
 */
public class GatewayFixture implements AutoCloseable {

    public static final String NODE = "sensecap_watcher";
    public static final GatewayTimings FAST = new GatewayTimings(Duration.ZERO, Duration.ZERO,
            Duration.ofMillis(50), Duration.ofSeconds(30), Duration.ofMillis(50));

    public final ObjectMapper mapper = new ObjectMapper();
    public final GatewayLane lane = new GatewayLane("test-lane");
    public final Executor inline = Runnable::run;
    public final RecordingBusClient busClient = new RecordingBusClient();
    public final BusAdapter bus = new BusAdapter(busClient, new EntityCatalog("homeassistant", NODE), mapper);
    public final WatcherConfig config = new WatcherConfig();
    public final DeviceCommands commands = new DeviceCommands(mapper);
    public final FakeSpeech speech = new FakeSpeech();
    public volatile VisionResult visionResult = new VisionResult("A person at the door", 0.9);
    public final List<String> visionPrompts = new CopyOnWriteArrayList<>();
    public final PerceptionPipeline perception;
    public final ReconnectController reconnect = new ReconnectController(bus);
    public final DeviceSessionManager devices;

    public GatewayFixture(Path snapshotDir) {
        this(snapshotDir, FAST);
    }

    public GatewayFixture(Path snapshotDir, GatewayTimings timings) {
        SceneAnalyzer analyzer = new SceneAnalyzer((image, prompt) -> {
            visionPrompts.add(prompt);
            return visionResult;
        }, new SnapshotStore(snapshotDir, Clock.systemUTC()), Clock.systemUTC(), inline);
        perception = new PerceptionPipeline(new MotionDetector(config.getMotionThreshold()),
                new NoiseDetector(config.getNoiseThreshold()), analyzer);
        devices = new DeviceSessionManager(lane, new DeviceMessageParser(mapper), commands, bus, perception,
                speech, inline, reconnect, config, timings, Clock.systemUTC());
        bus.connect();
    }

    /** Open a channel and complete the hello handshake; returns once the session is active. */
    public RecordingDeviceChannel connectDevice() {
        RecordingDeviceChannel channel = new RecordingDeviceChannel();
        devices.onChannelOpened(channel);
        devices.onText(channel, "{\"type\":\"hello\",\"version\":1}");
        Eventually.eventually(() -> {
            if (!devices.isActive()) {
                throw new AssertionError("session not active");
            }
        });
        return channel;
    }

    public JsonNode json(String text) {
        try {
            return mapper.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public String stateTopic(String component, String objectId) {
        return NODE + "/" + component + "/" + objectId + "/state";
    }

    public String eventTopic(String type) {
        return NODE + "/event/" + type + "/state";
    }

    public static String hex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }

    /** A 64x48 PNG filled with one grey level. */
    public static byte[] solidFrame(int grey) {
        BufferedImage image = new BufferedImage(64, 48, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(new Color(grey, grey, grey));
        g.fillRect(0, 0, 64, 48);
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /** Little-endian 16-bit PCM, every sample set to {@code amplitude}. */
    public static byte[] pcm(int samples, int amplitude) {
        byte[] out = new byte[samples * 2];
        for (int i = 0; i < samples; i++) {
            out[2 * i] = (byte) (amplitude & 0xff);
            out[2 * i + 1] = (byte) ((amplitude >> 8) & 0xff);
        }
        return out;
    }

    @Override
    public void close() {
        lane.shutdown();
    }

    /** Speech backend with a settable transcript that records synthesis requests. */
    public static class FakeSpeech implements SpeechProvider {
        public volatile String transcript = "";
        public volatile byte[] audio = new byte[0];
        public final List<String> synthesized = new CopyOnWriteArrayList<>();

        @Override
        public String recognize(byte[] pcm) {
            return transcript;
        }

        @Override
        public byte[] synthesize(String text) {
            synthesized.add(text);
            return audio;
        }
    }
}
