package com.support.resolve.exception;

/**
 * 歷史紀錄儲存失敗（不可重試）
 */
public class HistoryStoreException extends RuntimeException {

    public HistoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
