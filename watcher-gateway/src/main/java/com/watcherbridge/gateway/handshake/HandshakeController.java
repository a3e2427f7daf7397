package com.watcherbridge.gateway.handshake;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watcherbridge.bus.BusAdapter;
import com.watcherbridge.common.collab.VisionResult;
import com.watcherbridge.common.config.WatcherConfig;
import com.watcherbridge.common.config.WatcherVersion;
import com.watcherbridge.perception.PerceptionPipeline;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * HTTP side of the device handshake: firmware check-in (which tells the
 * device where the WebSocket lives), version and firmware download, and the
 * image upload the device uses for tool-driven photos.
 */
@Slf4j
@RestController
public class HandshakeController {

    static final String DEFAULT_QUESTION = "What do you see?";
    private static final Duration INGEST_ANALYSIS_TIMEOUT = Duration.ofSeconds(60);
    private static final int MAX_STATE_LENGTH = 255;

    private final WatcherConfig config;
    private final BusAdapter bus;
    private final PerceptionPipeline perception;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration analysisTimeout;
    private final AtomicReference<CheckinRecord> lastCheckin = new AtomicReference<>();

    @Autowired
    public HandshakeController(WatcherConfig config, BusAdapter bus, PerceptionPipeline perception,
            ObjectMapper objectMapper, Clock clock) {
        this(config, bus, perception, objectMapper, clock, INGEST_ANALYSIS_TIMEOUT);
    }

    HandshakeController(WatcherConfig config, BusAdapter bus, PerceptionPipeline perception,
            ObjectMapper objectMapper, Clock clock, Duration analysisTimeout) {
        this.config = config;
        this.bus = bus;
        this.perception = perception;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.analysisTimeout = analysisTimeout;
    }

    @GetMapping("/version")
    public Map<String, Object> version() {
        return WatcherVersion.document();
    }

    @GetMapping("/firmware")
    public ResponseEntity<?> firmware() {
        Path path = Path.of(config.getFirmwarePath());
        if (!Files.isRegularFile(path)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("Firmware not found");
        }
        Resource resource = new FileSystemResource(path);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(resource);
    }

    /**
     * Device check-in. The body is best effort: anything that is not a JSON
     * object is treated as an empty one.
     */
    @PostMapping({"/checkin", "/ota", "/ota/"})
    public ResponseEntity<Map<String, Object>> checkin(@RequestBody(required = false) String body,
            HttpServletRequest request) {
        try {
            JsonNode info = parseBody(body);
            String mac = normalizeMac(info.path("mac_address").asText("unknown"));
            String version = info.path("application").path("version").asText("unknown");
            String ip = info.path("board").path("ip").asText(request.getRemoteAddr());
            lastCheckin.set(new CheckinRecord(mac, version, ip, clock.instant()));
            log.info("Device check-in: mac={}, version={}, ip={}", mac, version, ip);

            String wsUrl = "ws://" + request.getServerName() + ":" + config.getWebsocketPort() + "/ws";

            Map<String, Object> serverTime = new LinkedHashMap<>();
            serverTime.put("timestamp", clock.millis());
            serverTime.put("timezone_offset", 0);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("server_time", serverTime);
            response.put("websocket", Map.of("url", wsUrl));
            response.put("firmware", Map.of());
            log.info("Check-in response: websocket={}", wsUrl);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("Check-in failed: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Camera upload from the device: stores the image, publishes it and
     * answers with the vision backend's description, or a plain receipt when
     * the backend fails or is too slow.
     */
    @PostMapping(value = "/vision-ingest", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, Object>> visionIngest(
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "question", required = false) String question) {
        try {
            byte[] image = file != null ? file.getBytes() : new byte[0];
            if (image.length == 0) {
                return ResponseEntity.badRequest().body(result(false, "No image received"));
            }
            String prompt = question != null && !question.isBlank() ? question : DEFAULT_QUESTION;
            log.info("Received camera image: {} bytes, question: {}", image.length, prompt);

            storeLastPhoto(image);
            bus.publishImage(image);

            String description = "Photo captured (" + image.length + " bytes)";
            CompletableFuture<Optional<VisionResult>> pending = perception.describeImage(image, prompt);
            try {
                Optional<VisionResult> analysis = pending.get(analysisTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (analysis.isPresent() && !analysis.get().description().isBlank()) {
                    description = analysis.get().description();
                }
            } catch (TimeoutException e) {
                pending.cancel(true);
                log.warn("Vision analysis timed out after {} s", analysisTimeout.toSeconds());
            }

            bus.publishState("sensor/last_event", truncate(description, MAX_STATE_LENGTH));
            return ResponseEntity.ok(result(true, description));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result(false, "interrupted"));
        } catch (Exception e) {
            log.error("Vision ingest error: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(result(false, String.valueOf(e.getMessage())));
        }
    }

    public Optional<CheckinRecord> getLastCheckin() {
        return Optional.ofNullable(lastCheckin.get());
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node != null && node.isObject() ? node : objectMapper.createObjectNode();
        } catch (IOException e) {
            log.debug("Check-in body is not JSON: {}", e.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private void storeLastPhoto(byte[] image) {
        Path target = Path.of(config.getDataDir(), "last_photo.jpg");
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, image);
        } catch (IOException e) {
            log.warn("Could not store {}: {}", target, e.getMessage());
        }
    }

    static String normalizeMac(String mac) {
        if (mac == null || mac.isBlank() || "unknown".equals(mac)) {
            return "unknown";
        }
        return mac.replace(":", "").replace("-", "").toLowerCase();
    }

    private static Map<String, Object> result(boolean success, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", success);
        body.put("message", message);
        return body;
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
