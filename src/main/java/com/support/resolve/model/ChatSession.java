package com.support.resolve.model;

/**
 * 對話 Session 模型
 * 只保存客戶身分與回合數，對話內容不跨回合保存
 */
public class ChatSession {

    private final String sessionId;
    private final String customerName;
    private final String email;
    private final long createdAt;
    private long lastActiveAt;
    private int turnCount;
    private final Object lock = new Object();

    public ChatSession(String sessionId, String customerName, String email) {
        this.sessionId = sessionId;
        this.customerName = customerName;
        this.email = email;
        this.createdAt = System.currentTimeMillis();
        this.lastActiveAt = this.createdAt;
        this.turnCount = 0;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCustomerName() {
        return customerName;
    }

    public String getEmail() {
        return email;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastActiveAt() {
        synchronized (lock) {
            return lastActiveAt;
        }
    }

    public int getTurnCount() {
        synchronized (lock) {
            return turnCount;
        }
    }

    /**
     * 記錄一個新回合
     *
     * @return 本回合是否為第一個回合
     */
    public boolean beginTurn() {
        synchronized (lock) {
            turnCount++;
            lastActiveAt = System.currentTimeMillis();
            return turnCount == 1;
        }
    }
}
