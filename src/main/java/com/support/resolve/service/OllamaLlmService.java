package com.support.resolve.service;

import com.support.resolve.model.LlmMessage;
import com.support.resolve.model.LlmReply;
import com.support.resolve.model.ToolDefinition;

import java.util.List;

/**
 * Ollama LLM 服務介面
 * 封裝支援工具呼叫的 Chat API
 */
public interface OllamaLlmService {

    /**
     * 送出一次對話請求（非 Streaming）
     *
     * @param messages 完整訊息列表（system / user / assistant / tool）
     * @param tools    可供模型呼叫的工具定義
     * @return 模型回覆，可能包含工具呼叫
     * @throws com.support.resolve.exception.LlmException 重試用盡或不可重試的錯誤
     */
    LlmReply chat(List<LlmMessage> messages, List<ToolDefinition> tools);

    /**
     * 檢查 LLM 服務是否可用
     */
    boolean isAvailable();
}
