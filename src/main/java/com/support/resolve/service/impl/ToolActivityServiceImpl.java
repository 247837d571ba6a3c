package com.support.resolve.service.impl;

import com.support.resolve.service.ToolActivityService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 工具呼叫紀錄服務實作 (Tool Activity Service Implementation)
 * <p>
 * 記憶體內的滾動緩衝區，超過 `maxEntries` 時移除最舊的項目。重啟後清空。
 */
@Service
public class ToolActivityServiceImpl implements ToolActivityService {

    @Value("${tool.activity.max:1000}")
    private int maxEntries = 1000;

    private final Deque<Entry> entries = new ConcurrentLinkedDeque<>();

    @Override
    public void record(String tool, String status, long durationMs, String detail) {
        entries.addLast(new Entry(System.currentTimeMillis(), tool, status, durationMs, detail));
        while (entries.size() > Math.max(1, maxEntries)) {
            entries.pollFirst();
        }
    }

    /**
     * 查詢紀錄
     * <p>
     * 篩選條件皆可為 null：sinceMs 之後、工具名稱完全相符、狀態（不分大小寫）。
     * 回傳最新的 limit 筆（預設 200），依時間由舊到新。
     */
    @Override
    public List<Entry> query(Long sinceMs, Integer limit, String tool, String status) {
        long since = sinceMs != null ? sinceMs : 0L;
        int lim = limit != null ? Math.max(1, limit) : 200;
        String statusUpper = status != null ? status.toUpperCase(Locale.ROOT) : null;

        List<Entry> out = new ArrayList<>();
        for (Entry e : entries) {
            if (e.timestampMs() < since) {
                continue;
            }
            if (tool != null && !tool.equals(e.tool())) {
                continue;
            }
            if (statusUpper != null && !statusUpper.equals(e.status())) {
                continue;
            }
            out.add(e);
        }

        int from = Math.max(0, out.size() - lim);
        return new ArrayList<>(out.subList(from, out.size()));
    }
}
