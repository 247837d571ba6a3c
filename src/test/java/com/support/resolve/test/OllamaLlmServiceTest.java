package com.support.resolve.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.support.resolve.exception.LlmException;
import com.support.resolve.model.LlmMessage;
import com.support.resolve.model.LlmReply;
import com.support.resolve.model.ToolCall;
import com.support.resolve.model.ToolDefinition;
import com.support.resolve.service.impl.OllamaLlmServiceImpl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ollama LLM 服務測試
 * 以 MockWebServer 模擬 /api/chat，驗證請求格式、tool_calls 解析與重試策略
 */
public class OllamaLlmServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private OllamaLlmServiceImpl llmService;

    @BeforeEach
    public void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        String url = server.url("/").toString();
        llmService = new OllamaLlmServiceImpl();
        ReflectionTestUtils.setField(llmService, "baseUrl", url.substring(0, url.length() - 1));
        ReflectionTestUtils.setField(llmService, "model", "llama3.1:8b");
        ReflectionTestUtils.setField(llmService, "timeout", 5000);
        ReflectionTestUtils.setField(llmService, "temperature", 0.2);
        ReflectionTestUtils.setField(llmService, "retryAttempts", 5);
        ReflectionTestUtils.setField(llmService, "retryExpBase", 7.0);
        ReflectionTestUtils.setField(llmService, "retryInitialDelayMs", 1L);
        ReflectionTestUtils.setField(llmService, "retryMaxDelayMs", 20L);
        ReflectionTestUtils.setField(llmService, "retryStatusCodes", List.of(429, 500, 503, 504));
    }

    @AfterEach
    public void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    @DisplayName("純文字回覆")
    public void testPlainReply() {
        server.enqueue(json("{\"message\":{\"role\":\"assistant\",\"content\":\"Hello Jane\"},\"done\":true}"));

        LlmReply reply = llmService.chat(List.of(LlmMessage.user("hi")), List.of());

        assertEquals("Hello Jane", reply.content());
        assertFalse(reply.hasToolCalls());
    }

    @Test
    @DisplayName("請求包含 messages、tools 與 stream=false")
    public void testRequestFormat() throws Exception {
        server.enqueue(json("{\"message\":{\"content\":\"ok\"}}"));
        ToolDefinition tool = new ToolDefinition("get_policy_info", "Look up a policy",
                Map.of("type", "object", "properties", Map.of(), "required", List.of()), args -> "");

        llmService.chat(List.of(
                LlmMessage.system("instructions"),
                LlmMessage.user("question"),
                LlmMessage.assistant("", List.of(new ToolCall("get_policy_info", Map.of("topic", "refund")))),
                LlmMessage.tool("get_policy_info", "policy text")), List.of(tool));

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/api/chat", request.getPath());

        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertEquals("llama3.1:8b", body.path("model").asText());
        assertFalse(body.path("stream").asBoolean(true));
        assertEquals(4, body.path("messages").size());
        assertEquals("refund",
                body.path("messages").get(2).path("tool_calls").get(0).path("function").path("arguments").path("topic").asText());
        assertEquals("get_policy_info", body.path("messages").get(3).path("tool_name").asText());
        assertEquals("function", body.path("tools").get(0).path("type").asText());
        assertEquals("get_policy_info", body.path("tools").get(0).path("function").path("name").asText());
        assertFalse(body.path("tools").get(0).path("function").has("handler"));
    }

    @Test
    @DisplayName("解析 tool_calls（物件或 JSON 字串參數）")
    public void testToolCallsParsed() {
        server.enqueue(json("{\"message\":{\"content\":\"\",\"tool_calls\":["
                + "{\"function\":{\"name\":\"get_customer_history\",\"arguments\":{\"email\":\"jane@example.com\"}}},"
                + "{\"function\":{\"name\":\"get_policy_info\",\"arguments\":\"{\\\"topic\\\":\\\"refund\\\"}\"}},"
                + "{\"function\":{\"name\":\"generate_ticket_id\"}}]}}"));

        LlmReply reply = llmService.chat(List.of(LlmMessage.user("hi")), List.of());

        assertTrue(reply.hasToolCalls());
        assertEquals(3, reply.toolCalls().size());
        assertEquals("jane@example.com", reply.toolCalls().get(0).arguments().get("email"));
        assertEquals("refund", reply.toolCalls().get(1).arguments().get("topic"));
        assertTrue(reply.toolCalls().get(2).arguments().isEmpty());
    }

    @Test
    @DisplayName("503 後重試成功")
    public void testRetryOnServiceUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        server.enqueue(json("{\"message\":{\"content\":\"recovered\"}}"));

        LlmReply reply = llmService.chat(List.of(LlmMessage.user("hi")), List.of());

        assertEquals("recovered", reply.content());
        assertEquals(3, server.getRequestCount());
    }

    @Test
    @DisplayName("不可重試的狀態碼立即失敗")
    public void testNoRetryOnBadRequest() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("bad request"));

        LlmException e = assertThrows(LlmException.class,
                () -> llmService.chat(List.of(LlmMessage.user("hi")), List.of()));

        assertEquals(400, e.getStatusCode());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("重試次數用盡後拋出例外")
    public void testAttemptsExhausted() {
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        }

        LlmException e = assertThrows(LlmException.class,
                () -> llmService.chat(List.of(LlmMessage.user("hi")), List.of()));

        assertEquals(500, e.getStatusCode());
        assertEquals(5, server.getRequestCount());
    }

    @Test
    @DisplayName("連線失敗視為可重試")
    public void testConnectionFailure() throws IOException {
        server.shutdown();
        ReflectionTestUtils.setField(llmService, "retryAttempts", 2);

        LlmException e = assertThrows(LlmException.class,
                () -> llmService.chat(List.of(LlmMessage.user("hi")), List.of()));

        assertEquals(-1, e.getStatusCode());
    }

    @Test
    @DisplayName("退避時間為 initialDelay * expBase^(n-1)，並有上限")
    public void testBackoffDelay() {
        ReflectionTestUtils.setField(llmService, "retryInitialDelayMs", 1000L);
        ReflectionTestUtils.setField(llmService, "retryMaxDelayMs", 60000L);

        assertEquals(1000L, (long) ReflectionTestUtils.invokeMethod(llmService, "backoffDelayMs", 1));
        assertEquals(7000L, (long) ReflectionTestUtils.invokeMethod(llmService, "backoffDelayMs", 2));
        assertEquals(49000L, (long) ReflectionTestUtils.invokeMethod(llmService, "backoffDelayMs", 3));
        assertEquals(60000L, (long) ReflectionTestUtils.invokeMethod(llmService, "backoffDelayMs", 4));
    }

    @Test
    public void testAvailability() throws IOException {
        server.enqueue(json("{\"models\":[]}"));
        assertTrue(llmService.isAvailable());

        server.shutdown();
        assertFalse(llmService.isAvailable());
    }
}
