package com.support.resolve.service;

import com.support.resolve.model.ChatSession;

/**
 * Session 服務介面
 * 負責管理客戶身分（姓名、Email）在對話期間的生命週期
 */
public interface SessionService {

    /**
     * 建立新 Session
     *
     * @param customerName 客戶姓名
     * @param email        客戶 Email（必須符合 Email 格式）
     * @return 新建立的 Session
     * @throws IllegalArgumentException Email 格式不正確
     */
    ChatSession startSession(String customerName, String email);

    /**
     * 取得指定 Session
     *
     * @param sessionId Session ID
     * @return ChatSession 或 null
     */
    ChatSession getSession(String sessionId);

    /**
     * 結束指定 Session
     *
     * @return true 如果 Session 存在並已移除
     */
    boolean endSession(String sessionId);

    /**
     * 清理所有過期的 Session
     */
    void cleanExpiredSessions();

    /**
     * 取得目前活躍的 Session 數量
     */
    int getActiveSessionCount();

    /**
     * 檢查 Email 格式
     */
    boolean isValidEmail(String email);
}
