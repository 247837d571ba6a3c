package com.support.resolve.service.impl;

import com.support.resolve.model.ChatSession;
import com.support.resolve.service.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session 服務實作 (Session Service Implementation)
 * <p>
 * 功能：
 * 對話開始時收集一次客戶姓名與 Email，之後每個回合由 {@link ChatSession} 提供身分資訊。
 * 對話內容本身不保存，每個回合都是獨立請求。
 * <p>
 * 流程概述：
 * 1. 使用 ConcurrentHashMap 儲存所有活躍 Session。
 * 2. 建立 Session 前以與個資遮蔽相同的 Email pattern 驗證格式。
 * 3. 超過 `session.timeout-minutes` 未活動的 Session 視為不存在：取得時移除，建立新 Session 時整批清理。
 */
@Service
public class SessionServiceImpl implements SessionService {

    private static final Logger logger = LoggerFactory.getLogger(SessionServiceImpl.class);

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();

    @Value("${session.timeout-minutes:30}")
    private int sessionTimeoutMinutes = 30;

    @Override
    public ChatSession startSession(String customerName, String email) {
        if (!isValidEmail(email)) {
            throw new IllegalArgumentException("Please enter a valid email address");
        }
        cleanExpiredSessions();
        String sid = UUID.randomUUID().toString();
        String name = customerName == null ? "" : customerName.trim();
        ChatSession session = new ChatSession(sid, name, email.trim());
        sessions.put(sid, session);
        logger.info("已建立 Session: {}", sid);
        return session;
    }

    @Override
    public ChatSession getSession(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        ChatSession session = sessions.get(sessionId);
        if (session != null && isExpired(session, System.currentTimeMillis())) {
            sessions.remove(sessionId, session);
            logger.info("Session 已過期: {}", sessionId);
            return null;
        }
        return session;
    }

    @Override
    public boolean endSession(String sessionId) {
        boolean removed = sessionId != null && sessions.remove(sessionId) != null;
        logger.info("已結束 Session: {} (existed={})", sessionId, removed);
        return removed;
    }

    /**
     * 清理過期 Session
     * <p>
     * 移除 `lastActiveAt` 早於 (當前時間 - sessionTimeoutMinutes) 的 Session。
     */
    @Override
    public void cleanExpiredSessions() {
        long now = System.currentTimeMillis();
        int before = sessions.size();
        sessions.entrySet().removeIf(entry -> isExpired(entry.getValue(), now));
        int removed = before - sessions.size();
        if (removed > 0) {
            logger.info("已清理 {} 個過期 Session", removed);
        }
    }

    private boolean isExpired(ChatSession session, long now) {
        return now - session.getLastActiveAt() > sessionTimeoutMinutes * 60L * 1000L;
    }

    @Override
    public int getActiveSessionCount() {
        cleanExpiredSessions();
        return sessions.size();
    }

    @Override
    public boolean isValidEmail(String email) {
        return email != null && PiiRedactionServiceImpl.EMAIL_PATTERN.matcher(email.trim()).matches();
    }
}
