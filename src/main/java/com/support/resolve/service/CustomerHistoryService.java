package com.support.resolve.service;

import com.support.resolve.model.HistoryRecord;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 客戶歷史紀錄服務介面
 * 所有對外方法皆回傳描述文字，不拋出儲存層例外
 */
public interface CustomerHistoryService {

    /**
     * 未提供 Email 時協作者會填入的代表值
     */
    String UNKNOWN_CUSTOMER = "Unknown";

    /**
     * 取得客戶過去的支援紀錄（由舊到新）
     *
     * @param email 客戶 Email（不分大小寫）
     * @return 紀錄內容、查無紀錄訊息或錯誤訊息
     */
    String lookup(String email);

    /**
     * 保存本次問題摘要，檔案被鎖定時依設定重試
     *
     * @param email    客戶 Email（不分大小寫）
     * @param ticketId 工單編號
     * @param summary  已遮蔽個資的摘要
     * @return 成功或錯誤訊息
     */
    String save(String email, String ticketId, String summary);

    /**
     * {@link #save} 的非同步版本，重試等待不佔用呼叫端執行緒
     */
    CompletableFuture<String> saveAsync(String email, String ticketId, String summary);

    /**
     * 取得原始紀錄（後台用）
     */
    List<HistoryRecord> listRecords(String email);
}
