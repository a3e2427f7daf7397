package com.watcherbridge.gateway.handshake;

import com.watcherbridge.common.collab.VisionResult;
import com.watcherbridge.gateway.GatewayFixture;
import com.watcherbridge.perception.MotionDetector;
import com.watcherbridge.perception.NoiseDetector;
import com.watcherbridge.perception.PerceptionPipeline;
import com.watcherbridge.perception.SceneAnalyzer;
import com.watcherbridge.perception.SnapshotStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class HandshakeControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private GatewayFixture gw;
    private HandshakeController controller;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        gw = new GatewayFixture(tempDir.resolve("snapshots"));
        gw.config.setDataDir(tempDir.toString());
        gw.config.setFirmwarePath(tempDir.resolve("firmware.bin").toString());
        gw.config.setWebsocketPort(8000);
        controller = new HandshakeController(gw.config, gw.bus, gw.perception, gw.mapper,
                Clock.fixed(NOW, ZoneOffset.UTC));
        mvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @AfterEach
    void tearDown() {
        gw.close();
    }

    @Test
    void version() throws Exception {
        mvc.perform(get("/version"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.build").exists())
                .andExpect(jsonPath("$.date").exists());
    }

    @Test
    void checkin_returnsWebSocketUrlForRequestHost() throws Exception {
        String body = "{\"mac_address\":\"AA:BB:CC:DD:EE:FF\",\"application\":{\"version\":\"2.0.1\"},"
                + "\"board\":{\"ip\":\"192.168.1.50\"}}";

        mvc.perform(post("/checkin").contentType(MediaType.APPLICATION_JSON).content(body)
                        .with(request -> {
                            request.setServerName("192.168.1.2");
                            return request;
                        }))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.websocket.url").value("ws://192.168.1.2:8000/ws"))
                .andExpect(jsonPath("$.server_time.timestamp").value(NOW.toEpochMilli()))
                .andExpect(jsonPath("$.server_time.timezone_offset").value(0))
                .andExpect(jsonPath("$.firmware").isMap());

        CheckinRecord last = controller.getLastCheckin().orElseThrow();
        assertEquals("aabbccddeeff", last.mac());
        assertEquals("2.0.1", last.version());
        assertEquals("192.168.1.50", last.ip());
        assertEquals(NOW, last.at());
    }

    @Test
    void checkin_toleratesGarbageBody() throws Exception {
        mvc.perform(post("/ota/").contentType(MediaType.TEXT_PLAIN).content("not json at all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.websocket.url").value("ws://localhost:8000/ws"));

        CheckinRecord last = controller.getLastCheckin().orElseThrow();
        assertEquals("unknown", last.mac());
        assertEquals("unknown", last.version());
        assertEquals("127.0.0.1", last.ip());
    }

    @Test
    void checkin_withoutBody() throws Exception {
        mvc.perform(post("/ota"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.websocket.url").exists());
    }

    @Test
    void normalizeMac_stripsSeparators() {
        assertEquals("a1b2c3d4e5f6", HandshakeController.normalizeMac("A1-B2-C3-D4-E5-F6"));
        assertEquals("unknown", HandshakeController.normalizeMac(null));
    }

    @Test
    void firmware_missingIs404() throws Exception {
        mvc.perform(get("/firmware"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Firmware not found"));
    }

    @Test
    void firmware_servesConfiguredFile() throws Exception {
        Files.write(tempDir.resolve("firmware.bin"), new byte[]{1, 2, 3, 4});

        mvc.perform(get("/firmware"))
                .andExpect(status().isOk())
                .andExpect(content().bytes(new byte[]{1, 2, 3, 4}));
    }

    @Test
    void visionIngest_analyzesWithQuestionAndPublishes() throws Exception {
        byte[] image = GatewayFixture.solidFrame(128);
        MockMultipartFile file = new MockMultipartFile("file", "photo.jpg", "image/jpeg", image);

        mvc.perform(multipart("/vision-ingest").file(file).param("question", "How many cups?"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("A person at the door"));

        assertEquals("How many cups?", gw.visionPrompts.get(0));
        assertArrayEquals(image, Files.readAllBytes(tempDir.resolve("last_photo.jpg")));
        assertEquals(1, gw.busClient.payloads(GatewayFixture.NODE + "/image/snapshot/image").size());
        assertEquals("A person at the door", gw.busClient.last(gw.stateTopic("sensor", "last_event")));
    }

    @Test
    void visionIngest_defaultsQuestionAndFallsBackWhenAnalysisFails() throws Exception {
        gw.visionResult = new VisionResult("", 0.0);
        MockMultipartFile file = new MockMultipartFile("file", "photo.jpg", "image/jpeg", new byte[]{9, 9, 9});

        mvc.perform(multipart("/vision-ingest").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Photo captured (3 bytes)"));

        assertEquals(HandshakeController.DEFAULT_QUESTION, gw.visionPrompts.get(0));
        assertEquals("Photo captured (3 bytes)", gw.busClient.last(gw.stateTopic("sensor", "last_event")));
    }

    @Test
    void visionIngest_withoutImageIs400() throws Exception {
        mvc.perform(multipart("/vision-ingest").param("question", "anything?"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("No image received"));
    }

    @Test
    void visionIngest_leavesMotionThrottleAndSnapshotsAlone() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "photo.jpg", "image/jpeg", new byte[]{7, 7});

        mvc.perform(multipart("/vision-ingest").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("A person at the door"));

        assertTrue(gw.perception.getSceneAnalyzer().getLastAnalysisAt().isEmpty());
        Path snapshots = tempDir.resolve("snapshots");
        if (Files.isDirectory(snapshots)) {
            try (Stream<Path> files = Files.list(snapshots)) {
                assertEquals(0, files.count());
            }
        }
    }

    @Test
    void visionIngest_slowBackendAnswersWithReceipt() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService backend = Executors.newSingleThreadExecutor();
        try {
            SceneAnalyzer slow = new SceneAnalyzer((image, prompt) -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new VisionResult("too late", 1.0);
            }, new SnapshotStore(tempDir.resolve("slow"), Clock.systemUTC()), Clock.systemUTC(), backend);
            PerceptionPipeline perception = new PerceptionPipeline(new MotionDetector(0.05),
                    new NoiseDetector(500), slow);
            HandshakeController impatient = new HandshakeController(gw.config, gw.bus, perception, gw.mapper,
                    Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMillis(100));
            MockMvc slowMvc = MockMvcBuilders.standaloneSetup(impatient).build();
            MockMultipartFile file = new MockMultipartFile("file", "photo.jpg", "image/jpeg", new byte[]{1, 2, 3, 4});

            slowMvc.perform(multipart("/vision-ingest").file(file))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.message").value("Photo captured (4 bytes)"));

            assertEquals("Photo captured (4 bytes)", gw.busClient.last(gw.stateTopic("sensor", "last_event")));
        } finally {
            release.countDown();
            backend.shutdownNow();
        }
    }
}
