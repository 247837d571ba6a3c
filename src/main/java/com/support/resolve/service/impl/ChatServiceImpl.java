package com.support.resolve.service.impl;

import com.support.resolve.model.ChatSession;
import com.support.resolve.model.LlmMessage;
import com.support.resolve.model.LlmReply;
import com.support.resolve.model.ToolCall;
import com.support.resolve.model.ToolDefinition;
import com.support.resolve.service.ChatService;
import com.support.resolve.service.OllamaLlmService;
import com.support.resolve.service.RuntimeConfigService;
import com.support.resolve.service.SessionService;
import com.support.resolve.service.ToolRegistryService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 聊天服務實作 (Chat Service Implementation)
 * <p>
 * 功能：
 * 每個回合都以全新的訊息列表呼叫語言模型（系統指令 + 一則使用者提示詞），
 * 模型要求工具時透過 {@link ToolRegistryService} 執行並把結果回填，直到模型給出最終回覆。
 * <p>
 * 核心流程：
 * 1. 由 Session 取得客戶姓名與 Email，第一回合附上姓名，之後只附 Email。
 * 2. 呼叫 {@link OllamaLlmService#chat}，若回覆含 tool_calls 則逐一執行並加入 tool 訊息。
 * 3. 超過 `agent.max-tool-rounds` 仍未得到最終回覆時，回傳預設訊息。
 * 4. 清理回覆外層引號；任何例外都轉為通用道歉訊息，不把錯誤內容顯示給客戶。
 */
@Service
public class ChatServiceImpl implements ChatService {

    private static final Logger logger = LoggerFactory.getLogger(ChatServiceImpl.class);

    static final String EMPTY_REPLY = "I'm sorry, I couldn't process your request. How can I assist you?";
    static final String GENERIC_APOLOGY =
            "I'm sorry, something went wrong on our side. Please try again or ask me something else.";

    @Autowired
    private OllamaLlmService llmService;

    @Autowired
    private ToolRegistryService toolRegistryService;

    @Autowired
    private SessionService sessionService;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Value("${agent.instruction:prompts/coordinator_instruction.txt}")
    private String instructionResource = "prompts/coordinator_instruction.txt";

    private volatile String systemInstruction = "";

    @PostConstruct
    public void init() {
        try (InputStream is = ChatServiceImpl.class.getResourceAsStream("/" + instructionResource)) {
            if (is == null) {
                logger.error("找不到系統指令檔: {}", instructionResource);
                return;
            }
            systemInstruction = new String(is.readAllBytes(), StandardCharsets.UTF_8).trim();
            logger.info("Coordinator instruction loaded: {} chars", systemInstruction.length());
        } catch (Exception e) {
            logger.error("載入系統指令檔時發生錯誤: {}", e.getMessage());
        }
    }

    @Override
    public ChatResult processChat(String sessionId, String message) {
        ChatSession session = sessionService.getSession(sessionId);
        if (session == null) {
            // 控制器檢查後才結束或過期的 Session
            logger.warn("Session 不存在或已過期: {}", sessionId);
            return new ChatResult(sessionId, false, GENERIC_APOLOGY, 0);
        }

        boolean firstTurn = session.beginTurn();
        String text = message == null ? "" : message.trim();
        String prompt = firstTurn
                ? String.format("My name is %s and my email is %s. %s", session.getCustomerName(), session.getEmail(), text)
                : String.format("My email is %s. %s", session.getEmail(), text);

        TurnResult turn = respond(prompt);
        return new ChatResult(session.getSessionId(), firstTurn, turn.reply(), turn.toolCallCount());
    }

    /**
     * 執行單一回合 (Run One Turn)
     * <p>
     * 流程：
     * 1. 建立訊息列表：system 指令 + user 提示詞。
     * 2. 迴圈呼叫 LLM；每次回覆若含工具呼叫，依序執行並以 tool 角色回填結果。
     * 3. 回覆不含工具呼叫時結束，清理後回傳。
     * 4. 例外一律記錄並回傳通用道歉訊息。
     */
    @Override
    public TurnResult respond(String prompt) {
        final long t0 = System.nanoTime();
        int toolCalls = 0;
        try {
            List<LlmMessage> messages = new ArrayList<>();
            messages.add(LlmMessage.system(systemInstruction));
            messages.add(LlmMessage.user(prompt));
            List<ToolDefinition> tools = toolRegistryService.definitions();

            int maxRounds = Math.max(1, runtimeConfigService.getAgentMaxToolRounds());
            for (int round = 1; round <= maxRounds; round++) {
                LlmReply reply = llmService.chat(messages, tools);
                if (!reply.hasToolCalls()) {
                    String text = cleanReply(reply.content());
                    logger.info("PERF(turn) rounds={} toolCalls={} totalMs={}",
                            round, toolCalls, (System.nanoTime() - t0) / 1_000_000);
                    return new TurnResult(text.isEmpty() ? EMPTY_REPLY : text, toolCalls, false);
                }

                messages.add(LlmMessage.assistant(reply.content(), reply.toolCalls()));
                for (ToolCall call : reply.toolCalls()) {
                    String result = toolRegistryService.invoke(call.name(), call.arguments());
                    messages.add(LlmMessage.tool(call.name(), result));
                    toolCalls++;
                }
            }

            logger.warn("工具呼叫超過上限 {} 回合，回傳預設訊息", maxRounds);
            return new TurnResult(EMPTY_REPLY, toolCalls, false);
        } catch (Exception e) {
            logger.error("回合處理失敗: {}: {}", e.getClass().getSimpleName(), e.getMessage());
            return new TurnResult(GENERIC_APOLOGY, toolCalls, true);
        }
    }

    /**
     * 去除模型回覆外層的三引號、雙引號或單引號（只去一層）
     */
    static String cleanReply(String content) {
        if (content == null) {
            return "";
        }
        String text = content.trim();
        if (text.length() >= 6 && text.startsWith("\"\"\"") && text.endsWith("\"\"\"")) {
            return text.substring(3, text.length() - 3).trim();
        }
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1).trim();
        }
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            return text.substring(1, text.length() - 1).trim();
        }
        return text;
    }
}
