package com.support.resolve.service;

import java.util.List;

/**
 * 工具呼叫紀錄服務
 * 保存最近的工具呼叫摘要供後台查詢（不含參數內容）
 */
public interface ToolActivityService {
    record Entry(long timestampMs, String tool, String status, long durationMs, String detail) {
    }

    String STATUS_OK = "OK";

    String STATUS_ERROR = "ERROR";

    void record(String tool, String status, long durationMs, String detail);

    List<Entry> query(Long sinceMs, Integer limit, String tool, String status);
}
