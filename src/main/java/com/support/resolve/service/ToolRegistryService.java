package com.support.resolve.service;

import com.support.resolve.model.ToolDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 工具註冊表服務介面
 * 提供給語言模型協作者的固定工具清單與呼叫入口
 */
public interface ToolRegistryService {

    String GENERATE_TICKET_ID = "generate_ticket_id";
    String GET_CUSTOMER_HISTORY = "get_customer_history";
    String GET_POLICY_INFO = "get_policy_info";
    String TOKENIZE_PII = "tokenize_pii";
    String SAVE_CUSTOMER_HISTORY = "save_customer_history";

    /**
     * 取得所有工具定義（依註冊順序）
     */
    List<ToolDefinition> definitions();

    Optional<ToolDefinition> find(String name);

    /**
     * 呼叫工具
     * <p>
     * 永遠回傳文字，不拋出例外；未知工具或執行失敗時回傳以 "Error:" 開頭的訊息。
     *
     * @param name      工具名稱
     * @param arguments 具名參數（可為 null）
     */
    String invoke(String name, Map<String, Object> arguments);
}
