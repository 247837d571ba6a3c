package com.support.resolve.repository;

import com.support.resolve.model.HistoryRecord;

import java.util.List;

/**
 * 客戶歷史紀錄儲存庫
 * 只提供新增與查詢，紀錄寫入後不可修改或刪除
 */
public interface HistoryRepository {

    /**
     * 建立資料表與索引（可重複呼叫）
     *
     * @return true 若初始化成功
     */
    boolean initialize();

    /**
     * 依建立時間由舊到新取得指定客戶的紀錄
     *
     * @param email 已正規化（小寫）的客戶 Email
     */
    List<HistoryRecord> findByEmail(String email);

    /**
     * 新增一筆紀錄，時間戳由資料庫指定
     *
     * @throws com.support.resolve.exception.HistoryStoreLockedException 檔案被其他寫入者鎖定
     * @throws com.support.resolve.exception.HistoryStoreException        其他儲存錯誤
     */
    void insert(String email, String summary);
}
