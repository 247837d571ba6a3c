package com.support.resolve.service;

/**
 * 聊天服務介面
 * 把客戶訊息交給語言模型協作者，並執行其要求的工具呼叫
 */
public interface ChatService {

    /**
     * 處理 Session 中的一個回合
     *
     * @param sessionId Session ID（必須已由 {@link SessionService#startSession} 建立）
     * @param message   客戶訊息
     * @return 聊天結果；Session 不存在或已過期時回覆為通用道歉訊息
     */
    ChatResult processChat(String sessionId, String message);

    /**
     * 以單一提示詞執行一個無狀態回合
     *
     * @param prompt 已包含客戶身分的提示詞
     * @return 給客戶的回覆；失敗時為通用道歉訊息
     */
    TurnResult respond(String prompt);

    /**
     * 單一回合結果
     */
    record TurnResult(String reply, int toolCallCount, boolean failed) {
    }

    /**
     * 聊天結果
     */
    record ChatResult(
            String sessionId,
            boolean firstTurn,
            String reply,
            int toolCallCount) {
    }
}
