package com.support.resolve.exception;

/**
 * 資料庫檔案被其他寫入者鎖定（可重試）
 */
public class HistoryStoreLockedException extends HistoryStoreException {

    public HistoryStoreLockedException(String message, Throwable cause) {
        super(message, cause);
    }
}
