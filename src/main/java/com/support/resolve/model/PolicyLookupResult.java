package com.support.resolve.model;

/**
 * 政策查詢結果
 * found 為 false 時 text 為給協作者看的說明訊息
 */
public record PolicyLookupResult(
        boolean found,
        String text) {

    public static PolicyLookupResult found(String text) {
        return new PolicyLookupResult(true, text);
    }

    public static PolicyLookupResult notFound(String message) {
        return new PolicyLookupResult(false, message);
    }
}
