package com.support.resolve.model;

import java.util.Map;

/**
 * 語言模型要求執行的工具呼叫
 */
public record ToolCall(
        String name,
        Map<String, Object> arguments) {

    public ToolCall {
        arguments = arguments == null ? Map.of() : arguments;
    }
}
