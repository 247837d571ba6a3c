package com.support.resolve.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.support.resolve.exception.LlmException;
import com.support.resolve.model.LlmMessage;
import com.support.resolve.model.LlmReply;
import com.support.resolve.model.ToolCall;
import com.support.resolve.model.ToolDefinition;
import com.support.resolve.service.OllamaLlmService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ollama LLM 服務實作 (Ollama LLM Service Implementation)
 * <p>
 * 功能：
 * 呼叫 Ollama `/api/chat`，把工具定義以 function schema 送出，並解析模型回傳的 `tool_calls`。
 * <p>
 * 重試策略：
 * 1. HTTP 狀態碼在 `llm.retry.status-codes` 內，或連線層失敗時重試。
 * 2. 最多 `llm.retry.attempts` 次；第 n 次失敗後等待 `initialDelay * expBase^(n-1)`，上限 `max-delay-ms`。
 * 3. 其他狀態碼立即拋出 {@link LlmException}。
 */
@Service
public class OllamaLlmServiceImpl implements OllamaLlmService {

    private static final Logger logger = LoggerFactory.getLogger(OllamaLlmServiceImpl.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:llama3.1:8b}")
    private String model;

    @Value("${ollama.timeout:60000}")
    private int timeout;

    @Value("${ollama.temperature:0.2}")
    private double temperature;

    @Value("${llm.retry.attempts:5}")
    private int retryAttempts;

    @Value("${llm.retry.exp-base:7}")
    private double retryExpBase;

    @Value("${llm.retry.initial-delay-ms:1000}")
    private long retryInitialDelayMs;

    @Value("${llm.retry.max-delay-ms:60000}")
    private long retryMaxDelayMs;

    @Value("${llm.retry.status-codes:429,500,503,504}")
    private List<Integer> retryStatusCodes;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * 對話呼叫 (Chat Call)
     * <p>
     * 流程：
     * 1. 建構 JSON Body（model、messages、tools、stream=false、options）。
     * 2. POST 至 `/api/chat`，可重試的失敗依退避策略重送同一個 Body。
     * 3. 解析 `message.content` 與 `message.tool_calls`。
     */
    @Override
    public LlmReply chat(List<LlmMessage> messages, List<ToolDefinition> tools) {
        byte[] body = buildChatRequest(messages, tools);
        int attempts = Math.max(1, retryAttempts);

        for (int attempt = 1; ; attempt++) {
            try {
                return parseChatResponse(post("/api/chat", body));
            } catch (LlmException e) {
                if (attempt >= attempts || !isRetryable(e)) {
                    logger.error("Ollama Chat 呼叫失敗 (status={}, attempt={}/{}): {}",
                            e.getStatusCode(), attempt, attempts, e.getMessage());
                    throw e;
                }
                long delay = backoffDelayMs(attempt);
                logger.warn("Ollama Chat 呼叫失敗 (status={})，{}ms 後重試 ({}/{})",
                        e.getStatusCode(), delay, attempt, attempts);
                sleep(delay);
            }
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpURLConnection conn = createConnection("/api/tags");
            conn.setRequestMethod("GET");
            conn.setConnectTimeout(5000);
            return conn.getResponseCode() == 200;
        } catch (Exception e) {
            return false;
        }
    }

    long backoffDelayMs(int failedAttempt) {
        double delay = retryInitialDelayMs * Math.pow(retryExpBase, Math.max(0, failedAttempt - 1));
        return (long) Math.min(delay, (double) retryMaxDelayMs);
    }

    private boolean isRetryable(LlmException e) {
        return e.getStatusCode() < 0 || (retryStatusCodes != null && retryStatusCodes.contains(e.getStatusCode()));
    }

    private byte[] buildChatRequest(List<LlmMessage> messages, List<ToolDefinition> tools) {
        Map<String, Object> request = new HashMap<>();
        request.put("model", model);
        request.put("stream", false);

        List<Map<String, Object>> wireMessages = new ArrayList<>();
        for (LlmMessage m : messages) {
            Map<String, Object> wm = new LinkedHashMap<>();
            wm.put("role", m.role());
            wm.put("content", m.content() == null ? "" : m.content());
            if (m.toolCalls() != null && !m.toolCalls().isEmpty()) {
                List<Map<String, Object>> calls = new ArrayList<>();
                for (ToolCall call : m.toolCalls()) {
                    calls.add(Map.of("function", Map.of("name", call.name(), "arguments", call.arguments())));
                }
                wm.put("tool_calls", calls);
            }
            if (m.toolName() != null) {
                wm.put("tool_name", m.toolName());
            }
            wireMessages.add(wm);
        }
        request.put("messages", wireMessages);

        if (tools != null && !tools.isEmpty()) {
            List<Map<String, Object>> wireTools = new ArrayList<>();
            for (ToolDefinition t : tools) {
                Map<String, Object> fn = new LinkedHashMap<>();
                fn.put("name", t.name());
                fn.put("description", t.description());
                fn.put("parameters", t.parameters());
                wireTools.add(Map.of("type", "function", "function", fn));
            }
            request.put("tools", wireTools);
        }

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", temperature);
        request.put("options", options);

        try {
            return objectMapper.writeValueAsBytes(request);
        } catch (IOException e) {
            throw new LlmException("無法序列化 Chat 請求", e);
        }
    }

    private LlmReply parseChatResponse(String response) {
        try {
            JsonNode message = objectMapper.readTree(response).path("message");
            String content = message.path("content").asText("");

            List<ToolCall> toolCalls = new ArrayList<>();
            JsonNode calls = message.path("tool_calls");
            if (calls.isArray()) {
                for (JsonNode call : calls) {
                    JsonNode fn = call.path("function");
                    String name = fn.path("name").asText(null);
                    if (name == null || name.isEmpty()) {
                        continue;
                    }
                    toolCalls.add(new ToolCall(name, parseArguments(fn.path("arguments"))));
                }
            }
            return new LlmReply(content, toolCalls);
        } catch (IOException e) {
            throw new LlmException("無法解析 Ollama 回應: " + e.getMessage(), e);
        }
    }

    // 有些模型把 arguments 當成 JSON 字串回傳
    private Map<String, Object> parseArguments(JsonNode arguments) throws IOException {
        if (arguments.isObject()) {
            return objectMapper.convertValue(arguments, new TypeReference<Map<String, Object>>() {});
        }
        if (arguments.isTextual() && !arguments.asText().isBlank()) {
            return objectMapper.readValue(arguments.asText(), new TypeReference<Map<String, Object>>() {});
        }
        return Map.of();
    }

    private String post(String path, byte[] body) {
        try {
            HttpURLConnection conn = createConnection(path);
            conn.setRequestMethod("POST");
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json");

            try (OutputStream os = conn.getOutputStream()) {
                os.write(body);
            }

            int status = conn.getResponseCode();
            if (status != HttpURLConnection.HTTP_OK) {
                String error = readQuietly(conn.getErrorStream());
                throw new LlmException("Ollama API 回應 " + status + ": " + error, status);
            }
            try (InputStream is = conn.getInputStream()) {
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new LlmException("Ollama API 呼叫失敗: " + e.getMessage(), e);
        }
    }

    private static String readQuietly(InputStream is) {
        if (is == null) {
            return "";
        }
        try (InputStream in = is) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("LLM 重試等待被中斷", e);
        }
    }

    private HttpURLConnection createConnection(String path) throws IOException {
        URI uri = URI.create(baseUrl + path);
        HttpURLConnection conn = (HttpURLConnection) uri.toURL().openConnection();
        conn.setConnectTimeout(timeout);
        conn.setReadTimeout(timeout);
        return conn;
    }
}
