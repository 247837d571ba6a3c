package com.support.resolve.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;
import java.util.function.Function;

/**
 * 工具定義
 * 名稱、說明與 JSON Schema 參數宣告會送給語言模型；handler 只在伺服器端執行
 */
public record ToolDefinition(
        String name,
        String description,
        Map<String, Object> parameters,
        @JsonIgnore Function<Map<String, Object>, String> handler) {
}
