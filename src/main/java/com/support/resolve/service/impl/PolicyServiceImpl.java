package com.support.resolve.service.impl;

import com.support.resolve.model.PolicyLookupResult;
import com.support.resolve.service.PolicyService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 政策查詢服務實作 (Policy Lookup Service Implementation)
 * <p>
 * 功能：
 * 將主題文字依優先順序的關鍵字表路由到政策章節，章節內容來自 classpath 上的 Markdown 知識庫。
 * <p>
 * 流程：
 * 1. 啟動時載入知識庫，以 {@code ###} 開頭的行切分章節，建立「章節名稱 → 內文」對照表。
 * 2. 同時建立路由表（關鍵字集合 → 章節或固定回覆），路由與內文擷取互相獨立。
 * 3. 查詢時依序比對路由，第一個命中的路由決定結果；皆未命中則回傳 not found。
 */
@Service
public class PolicyServiceImpl implements PolicyService {

    private static final Logger logger = LoggerFactory.getLogger(PolicyServiceImpl.class);

    static final String RETURN_SECTION = "Return Policies";
    static final String SHIPPING_SECTION = "Shipping Policies";

    static final String ORDER_NUMBER_ANSWER = "If you've forgotten your order number, please provide the email "
            + "address associated with your purchase and the approximate date of the order. Our team can locate "
            + "your order details using this information. Note that for guest checkouts, the order number is sent "
            + "in the confirmation email.";

    private static final Pattern HEADING = Pattern.compile("^###[ \\t]*(.+?)[ \\t]*$", Pattern.MULTILINE);

    @Value("${policy.knowledge-base:policies/policy_knowledge_base.md}")
    private String knowledgeBase = "policies/policy_knowledge_base.md";

    private volatile Map<String, String> sectionsByKey = Map.of();
    private volatile List<String> sectionNames = List.of();
    private final List<PolicyRoute> routes = List.of(
            PolicyRoute.section(Set.of("return", "damaged", "defective", "refund"), RETURN_SECTION,
                    "Error: Could not find return policies."),
            PolicyRoute.section(Set.of("shipping", "lost", "missing"), SHIPPING_SECTION, null),
            PolicyRoute.canned(Set.of("order", "forgot"), ORDER_NUMBER_ANSWER));

    @PostConstruct
    public void init() {
        String document = loadDocument(knowledgeBase);
        Map<String, String> parsed = new LinkedHashMap<>();
        List<String> names = new ArrayList<>();

        Matcher m = HEADING.matcher(document);
        String currentName = null;
        int bodyStart = -1;
        while (m.find()) {
            if (currentName != null) {
                putSection(parsed, names, currentName, document.substring(bodyStart, m.start()));
            }
            currentName = m.group(1);
            bodyStart = m.end();
        }
        if (currentName != null) {
            putSection(parsed, names, currentName, document.substring(bodyStart));
        }

        sectionsByKey = Collections.unmodifiableMap(parsed);
        sectionNames = List.copyOf(names);
        logger.info("Policy knowledge base loaded: source={}, sections={}", knowledgeBase, sectionNames);
    }

    /**
     * 查詢政策 (Lookup Policy)
     * <p>
     * 路由規則（依序）：
     * 1. 退貨類關鍵字 → Return Policies 章節；章節擷取失敗時回傳專屬錯誤訊息。
     * 2. 運送類關鍵字 → Shipping Policies 章節；章節擷取失敗時直接落到通用 not found。
     * 3. 訂單類關鍵字 → 固定的訂單編號說明。
     * 4. 其他 → not found，訊息包含原始主題。
     */
    @Override
    public PolicyLookupResult lookup(String topic) {
        String original = topic == null ? "" : topic;
        logger.info("Searching policy for topic: {}", original);
        String topicLower = original.toLowerCase(Locale.ROOT);

        for (PolicyRoute route : routes) {
            if (!route.matches(topicLower)) {
                continue;
            }
            if (route.cannedText() != null) {
                return PolicyLookupResult.found(route.cannedText());
            }
            String body = sectionsByKey.get(route.sectionKey());
            if (body != null && !body.isBlank()) {
                return PolicyLookupResult.found(body);
            }
            if (route.missingSectionMessage() != null) {
                logger.warn("Policy section '{}' is missing from the knowledge base", route.sectionName());
                return PolicyLookupResult.notFound(route.missingSectionMessage());
            }
            break;
        }

        logger.warn("No matching policy section found for '{}'", original);
        return PolicyLookupResult.notFound(
                String.format("Error: No policy information found for the topic '%s'.", original));
    }

    @Override
    public List<String> sections() {
        return sectionNames;
    }

    private static void putSection(Map<String, String> parsed, List<String> names, String name, String body) {
        // 標題重複時以第一個章節為準
        if (parsed.putIfAbsent(key(name), body.trim()) == null) {
            names.add(name);
        }
    }

    private static String key(String sectionName) {
        return sectionName.trim().toLowerCase(Locale.ROOT);
    }

    private static String loadDocument(String resource) {
        try (InputStream is = PolicyServiceImpl.class.getResourceAsStream("/" + resource)) {
            if (is == null) {
                logger.error("找不到政策知識庫: {}", resource);
                return "";
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8).replace("\r\n", "\n");
        } catch (Exception e) {
            logger.error("載入政策知識庫時發生錯誤: {}", e.getMessage());
            return "";
        }
    }

    /**
     * 路由表項目：關鍵字集合 → 章節（或固定回覆）
     */
    private record PolicyRoute(Set<String> keywords, String sectionName, String cannedText,
            String missingSectionMessage) {

        static PolicyRoute section(Set<String> keywords, String sectionName, String missingSectionMessage) {
            return new PolicyRoute(keywords, sectionName, null, missingSectionMessage);
        }

        static PolicyRoute canned(Set<String> keywords, String text) {
            return new PolicyRoute(keywords, null, text, null);
        }

        boolean matches(String topicLower) {
            for (String keyword : keywords) {
                if (topicLower.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }

        String sectionKey() {
            return key(sectionName);
        }
    }
}
