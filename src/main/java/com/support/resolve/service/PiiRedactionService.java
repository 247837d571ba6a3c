package com.support.resolve.service;

/**
 * 個資遮蔽服務介面
 * 將文字中的 Email 與電話號碼替換為固定標記
 */
public interface PiiRedactionService {

    String EMAIL_PLACEHOLDER = "[REDACTED_EMAIL]";

    String PHONE_PLACEHOLDER = "[REDACTED_PHONE]";

    /**
     * 遮蔽文字中的 Email 與電話號碼
     *
     * @param text 任意文字（可為 null，視為空字串）
     * @return 遮蔽後的文字
     */
    String redact(String text);
}
