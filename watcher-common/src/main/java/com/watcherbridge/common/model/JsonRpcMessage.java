package com.watcherbridge.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * JSON-RPC 2.0 message types shared by the device tool-call dialect and the
 * remote tool broker connection. Ids stay untyped: peers use numbers and
 * strings interchangeably and replies must echo them verbatim.
 */
public class JsonRpcMessage {

    public static final String VERSION = "2.0";

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Request {
        private String jsonrpc;
        private Object id;
        private String method;
        private Object params;

        public static Request create(Object id, String method, Object params) {
            return Request.builder()
                    .jsonrpc(VERSION)
                    .id(id)
                    .method(method)
                    .params(params)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Response {
        private String jsonrpc;
        private Object id;
        private Object result;
        private RpcError error;

        public static Response success(Object id, Object result) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .id(id)
                    .result(result)
                    .build();
        }

        public static Response error(Object id, int code, String message) {
            return Response.builder()
                    .jsonrpc(VERSION)
                    .id(id)
                    .error(new RpcError(code, message, null))
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RpcError {
        private int code;
        private String message;
        private Object data;
    }

    /**
     * Result payload of a {@code tools/call}: one or more content blocks plus
     * an error flag. Tool failures travel here, never as {@link RpcError}.
     */
    public record ToolCallResult(List<Map<String, String>> content,
            @JsonProperty("isError") boolean isError) {

        public static ToolCallResult text(String text) {
            return new ToolCallResult(List.of(Map.of("type", "text", "text", text)), false);
        }

        public static ToolCallResult failure(String message) {
            return new ToolCallResult(List.of(Map.of("type", "text", "text", "Error: " + message)), true);
        }
    }

    // Standard error codes
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
}
