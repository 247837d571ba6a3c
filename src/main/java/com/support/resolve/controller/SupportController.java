package com.support.resolve.controller;

import com.support.resolve.model.ChatSession;
import com.support.resolve.model.ToolDefinition;
import com.support.resolve.service.ChatService;
import com.support.resolve.service.OllamaLlmService;
import com.support.resolve.service.SessionService;
import com.support.resolve.service.ToolRegistryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 客服控制器
 * 提供對話、Session 與工具呼叫的 REST API 端點
 */
@RestController
@RequestMapping("/api/support")
@CrossOrigin(origins = "*")
public class SupportController {

    private static final Logger logger = LoggerFactory.getLogger(SupportController.class);

    @Autowired
    private ChatService chatService;

    @Autowired
    private SessionService sessionService;

    @Autowired
    private ToolRegistryService toolRegistryService;

    @Autowired
    private OllamaLlmService llmService;

    /**
     * 建立 Session（收集一次姓名與 Email）
     */
    @PostMapping("/session")
    public Map<String, Object> startSession(
            @RequestParam(required = false, defaultValue = "") String name,
            @RequestParam String email) {

        Map<String, Object> response = new HashMap<>();
        if (!sessionService.isValidEmail(email)) {
            response.put("success", false);
            response.put("message", "Please enter a valid email address");
            return response;
        }

        ChatSession session = sessionService.startSession(name, email);
        response.put("success", true);
        response.put("sessionId", session.getSessionId());
        return response;
    }

    /**
     * 對話回合
     */
    @PostMapping("/chat")
    public Map<String, Object> chat(
            @RequestParam String sessionId,
            @RequestParam String message) {

        logger.info("收到對話請求: sessionId={}", sessionId);

        Map<String, Object> response = new HashMap<>();
        if (sessionService.getSession(sessionId) == null) {
            response.put("success", false);
            response.put("message", "Session not found");
            return response;
        }

        ChatService.ChatResult result = chatService.processChat(sessionId, message);
        response.put("success", true);
        response.put("sessionId", result.sessionId());
        response.put("firstTurn", result.firstTurn());
        response.put("reply", result.reply());
        response.put("toolCalls", result.toolCallCount());
        return response;
    }

    /**
     * 結束 Session
     */
    @DeleteMapping("/session/{sessionId}")
    public Map<String, Object> endSession(@PathVariable String sessionId) {
        boolean removed = sessionService.endSession(sessionId);
        Map<String, Object> response = new HashMap<>();
        response.put("success", removed);
        response.put("message", removed ? "Session ended" : "Session not found");
        return response;
    }

    /**
     * 列出工具定義（名稱、說明、參數 Schema）
     */
    @GetMapping("/tools")
    public Map<String, Object> listTools() {
        List<ToolDefinition> tools = toolRegistryService.definitions();
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", tools);
        response.put("count", tools.size());
        return response;
    }

    /**
     * 直接呼叫工具，結果一律為文字
     */
    @PostMapping("/tools/{name}")
    public Map<String, Object> invokeTool(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> arguments) {

        String result = toolRegistryService.invoke(name, arguments);
        Map<String, Object> response = new HashMap<>();
        response.put("tool", name);
        response.put("result", result);
        return response;
    }

    /**
     * 取得系統狀態
     */
    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("activeSessions", sessionService.getActiveSessionCount());
        status.put("toolCount", toolRegistryService.definitions().size());
        status.put("llmAvailable", llmService.isAvailable());
        return status;
    }
}
