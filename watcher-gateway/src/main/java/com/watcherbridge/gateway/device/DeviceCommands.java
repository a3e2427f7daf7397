package com.watcherbridge.gateway.device;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.watcherbridge.common.error.ProtocolException;
import com.watcherbridge.common.model.JsonRpcMessage;

import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializers for gateway-to-device frames.
 */
public class DeviceCommands {

    public static final int SAMPLE_RATE = 24000;
    public static final int FRAME_DURATION_MS = 60;

    private final ObjectMapper objectMapper;

    public DeviceCommands(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String helloAck(String sessionId) {
        Map<String, Object> msg = frame("hello");
        msg.put("transport", "websocket");
        msg.put("session_id", sessionId);
        msg.put("audio_params", Map.of("sample_rate", SAMPLE_RATE, "frame_duration", FRAME_DURATION_MS));
        return write(msg);
    }

    /**
     * Initialize push announcing where the device uploads images for analysis.
     */
    public String initialize(long id, String visionUrl, String token) {
        Map<String, Object> vision = new LinkedHashMap<>();
        vision.put("url", visionUrl);
        vision.put("token", token);
        return mcp(JsonRpcMessage.Request.create(id, "initialize",
                Map.of("capabilities", Map.of("vision", vision))));
    }

    public String toolCall(long id, String name, Object arguments) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments != null ? arguments : Map.of());
        return mcp(JsonRpcMessage.Request.create(id, "tools/call", params));
    }

    public String ttsStop() {
        Map<String, Object> msg = frame("tts");
        msg.put("state", "stop");
        return write(msg);
    }

    public String ttsSentence(String text) {
        Map<String, Object> msg = frame("tts");
        msg.put("state", "sentence_start");
        msg.put("text", text);
        return write(msg);
    }

    public String emotion(String emotion) {
        Map<String, Object> msg = frame("llm");
        msg.put("emotion", emotion);
        return write(msg);
    }

    public String alert(String status, String message, String emotion) {
        Map<String, Object> msg = frame("alert");
        msg.put("status", status);
        msg.put("message", message);
        msg.put("emotion", emotion);
        return write(msg);
    }

    public String requestFrame() {
        return write(frame("request_frame"));
    }

    public String audioPlay(byte[] audio) {
        Map<String, Object> msg = frame("audio_play");
        msg.put("payload", Map.of("data", HexFormat.of().formatHex(audio)));
        return write(msg);
    }

    private String mcp(JsonRpcMessage.Request request) {
        Map<String, Object> msg = frame("mcp");
        msg.put("payload", request);
        return write(msg);
    }

    private static Map<String, Object> frame(String type) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", type);
        return msg;
    }

    private String write(Map<String, Object> msg) {
        try {
            return objectMapper.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot encode " + msg.get("type") + " frame", e);
        }
    }
}
