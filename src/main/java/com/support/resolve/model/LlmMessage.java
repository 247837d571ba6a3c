package com.support.resolve.model;

import java.util.List;

/**
 * 送往語言模型的對話訊息
 * role 為 system / user / assistant / tool
 */
public record LlmMessage(
        String role,
        String content,
        List<ToolCall> toolCalls,
        String toolName) {

    public static LlmMessage system(String content) {
        return new LlmMessage("system", content, List.of(), null);
    }

    public static LlmMessage user(String content) {
        return new LlmMessage("user", content, List.of(), null);
    }

    public static LlmMessage assistant(String content, List<ToolCall> toolCalls) {
        return new LlmMessage("assistant", content, toolCalls == null ? List.of() : toolCalls, null);
    }

    public static LlmMessage tool(String toolName, String content) {
        return new LlmMessage("tool", content, List.of(), toolName);
    }
}
