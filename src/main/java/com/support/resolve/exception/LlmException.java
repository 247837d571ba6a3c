package com.support.resolve.exception;

/**
 * 語言模型呼叫失敗
 */
public class LlmException extends RuntimeException {

    private final int statusCode;

    public LlmException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP 狀態碼，連線層失敗時為 -1
     */
    public int getStatusCode() {
        return statusCode;
    }
}
