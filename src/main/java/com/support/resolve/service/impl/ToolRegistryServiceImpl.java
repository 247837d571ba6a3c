package com.support.resolve.service.impl;

import com.support.resolve.model.ToolDefinition;
import com.support.resolve.service.CustomerHistoryService;
import com.support.resolve.service.PiiRedactionService;
import com.support.resolve.service.PolicyService;
import com.support.resolve.service.TicketService;
import com.support.resolve.service.ToolActivityService;
import com.support.resolve.service.ToolRegistryService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 工具註冊表服務實作 (Tool Registry Service Implementation)
 * <p>
 * 功能：
 * 以明確的資料結構（名稱 → 說明、參數 Schema、處理函式）宣告五個可被語言模型呼叫的工具，
 * 不依賴反射或註解掃描。
 * <p>
 * 呼叫約定：
 * 1. 參數以名稱取值，缺少的字串參數視為 null，由各服務自行處理。
 * 2. 每次呼叫都記錄 log 與 {@link ToolActivityService}。
 * 3. 任何失敗都轉成文字回傳，協作者只會收到字串。
 */
@Service
public class ToolRegistryServiceImpl implements ToolRegistryService {

    private static final Logger logger = LoggerFactory.getLogger(ToolRegistryServiceImpl.class);

    @Autowired
    private TicketService ticketService;

    @Autowired
    private CustomerHistoryService customerHistoryService;

    @Autowired
    private PolicyService policyService;

    @Autowired
    private PiiRedactionService piiRedactionService;

    @Autowired
    private ToolActivityService toolActivityService;

    private volatile Map<String, ToolDefinition> tools = Map.of();

    @PostConstruct
    public void init() {
        Map<String, ToolDefinition> registry = new LinkedHashMap<>();

        register(registry, GENERATE_TICKET_ID,
                "Generates a new, unique ticket ID for the current support request.",
                schema(Map.of(), List.of()),
                args -> ticketService.issue());

        register(registry, GET_CUSTOMER_HISTORY,
                "Retrieves the past support history for a customer by email address.",
                schema(Map.of("email", stringParam("Customer email address taken from the message.")),
                        List.of("email")),
                args -> customerHistoryService.lookup(asString(args.get("email"))));

        register(registry, GET_POLICY_INFO,
                "Retrieves the store policy section that matches a topic such as returns, refunds, shipping "
                        + "or a forgotten order number.",
                schema(Map.of("topic", stringParam("Short topic phrase identified from the customer request.")),
                        List.of("topic")),
                args -> policyService.lookup(asString(args.get("topic"))).text());

        register(registry, TOKENIZE_PII,
                "Finds personal data (emails, phone numbers) in a text and replaces it with redaction tokens.",
                schema(Map.of("text_to_tokenize", stringParam("Text that may contain emails or phone numbers.")),
                        List.of("text_to_tokenize")),
                args -> {
                    String text = asString(args.get("text_to_tokenize"));
                    logger.debug("Tokenizing {} chars", text == null ? 0 : text.length());
                    return piiRedactionService.redact(text);
                });

        Map<String, Object> saveProps = new LinkedHashMap<>();
        saveProps.put("email", stringParam("Customer email address."));
        saveProps.put("ticket_id", stringParam("Ticket ID generated for this request."));
        saveProps.put("summary", stringParam("Short summary of the issue with personal data already redacted."));
        register(registry, SAVE_CUSTOMER_HISTORY,
                "Saves a summary of the current issue to the customer's support history.",
                schema(saveProps, List.of("email", "ticket_id", "summary")),
                args -> customerHistoryService.save(
                        asString(args.get("email")),
                        asString(args.get("ticket_id")),
                        asString(args.get("summary"))));

        tools = Collections.unmodifiableMap(registry);
        logger.info("Tool registry initialized: {}", tools.keySet());
    }

    @Override
    public List<ToolDefinition> definitions() {
        return new ArrayList<>(tools.values());
    }

    @Override
    public Optional<ToolDefinition> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    @Override
    public String invoke(String name, Map<String, Object> arguments) {
        ToolDefinition tool = find(name).orElse(null);
        if (tool == null) {
            logger.warn("[Tool Call: {}] unknown tool", name);
            toolActivityService.record(String.valueOf(name), ToolActivityService.STATUS_ERROR, 0L, "unknown tool");
            return String.format("Error: Unknown tool '%s'.", name);
        }

        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        logger.info("[Tool Call: {}]", name);
        long t0 = System.nanoTime();
        try {
            String result = tool.handler().apply(args);
            long ms = (System.nanoTime() - t0) / 1_000_000;
            String out = result == null ? "" : result;
            toolActivityService.record(name,
                    out.startsWith("Error") ? ToolActivityService.STATUS_ERROR : ToolActivityService.STATUS_OK,
                    ms, null);
            return out;
        } catch (RuntimeException e) {
            long ms = (System.nanoTime() - t0) / 1_000_000;
            logger.error("[Tool Call: {}] failed: {}", name, e.getMessage(), e);
            toolActivityService.record(name, ToolActivityService.STATUS_ERROR, ms, e.getClass().getSimpleName());
            return String.format("Error: Tool '%s' failed: %s", name, e.getMessage());
        }
    }

    private static void register(Map<String, ToolDefinition> registry, String name, String description,
            Map<String, Object> parameters, Function<Map<String, Object>, String> handler) {
        registry.put(name, new ToolDefinition(name, description, parameters, handler));
    }

    private static Map<String, Object> schema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    private static Map<String, Object> stringParam(String description) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("type", "string");
        p.put("description", description);
        return p;
    }

    private static String asString(Object o) {
        return o == null ? null : String.valueOf(o);
    }
}
