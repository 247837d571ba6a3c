package com.support.resolve.service.impl;

import com.support.resolve.service.PiiRedactionService;
import org.springframework.stereotype.Service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 個資遮蔽服務實作 (PII Redaction Service Implementation)
 * <p>
 * 每個 pattern 由左至右做一次不重疊替換，先 Email 後電話。
 * 電話格式：可選括號區碼，分隔符為空白、點或連字號（也可無分隔），3-3-4 位數。
 */
@Service
public class PiiRedactionServiceImpl implements PiiRedactionService {

    public static final Pattern EMAIL_PATTERN =
            Pattern.compile("[a-zA-Z0-9_.+-]+@[a-zA-Z0-9-]+\\.[a-zA-Z0-9-.]+");

    // \d 與 \s 需涵蓋全形數字與不斷行空白 (U+00A0)
    public static final Pattern PHONE_PATTERN =
            Pattern.compile("\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public String redact(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String redacted = EMAIL_PATTERN.matcher(text).replaceAll(Matcher.quoteReplacement(EMAIL_PLACEHOLDER));
        return PHONE_PATTERN.matcher(redacted).replaceAll(Matcher.quoteReplacement(PHONE_PLACEHOLDER));
    }
}
