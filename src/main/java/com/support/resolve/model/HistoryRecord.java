package com.support.resolve.model;

/**
 * 客戶歷史紀錄
 * history 資料表的一列，寫入後不可修改
 */
public record HistoryRecord(
        long id,
        String email,
        String summary,
        String timestamp) {
}
