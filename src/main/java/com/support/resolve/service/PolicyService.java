package com.support.resolve.service;

import com.support.resolve.model.PolicyLookupResult;

import java.util.List;

/**
 * 政策查詢服務介面
 * 依主題關鍵字路由到知識庫中的政策章節
 */
public interface PolicyService {

    /**
     * 查詢主題對應的政策內容
     *
     * @param topic 自由文字主題（內部轉小寫比對）
     * @return 查詢結果，找不到時 found 為 false 並附說明訊息
     */
    PolicyLookupResult lookup(String topic);

    /**
     * 取得知識庫中所有章節名稱（依文件順序）
     */
    List<String> sections();
}
