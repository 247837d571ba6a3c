package com.support.resolve.model;

import java.util.List;

/**
 * 語言模型單次回應
 * toolCalls 不為空時代表模型要求先執行工具
 */
public record LlmReply(
        String content,
        List<ToolCall> toolCalls) {

    public LlmReply {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
