package com.support.resolve.test;

import com.support.resolve.model.ChatSession;
import com.support.resolve.model.LlmReply;
import com.support.resolve.model.ToolCall;
import com.support.resolve.service.ChatService;
import com.support.resolve.service.CustomerHistoryService;
import com.support.resolve.service.OllamaLlmService;
import com.support.resolve.service.SessionService;
import com.support.resolve.service.ToolActivityService;
import com.support.resolve.service.ToolRegistryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

/**
 * 整合測試：Spring Context + SQLite 測試資料庫 + Mock 語言模型
 */
@SpringBootTest
public class SupportApplicationTests {

    @Autowired
    private ChatService chatService;

    @Autowired
    private SessionService sessionService;

    @Autowired
    private ToolRegistryService toolRegistryService;

    @Autowired
    private CustomerHistoryService customerHistoryService;

    @Autowired
    private ToolActivityService toolActivityService;

    @MockBean
    private OllamaLlmService llmService;

    private static String uniqueEmail() {
        return "it-" + System.nanoTime() + "@example.com";
    }

    @Test
    public void contextLoadsWithFiveTools() {
        assertEquals(5, toolRegistryService.definitions().size());
    }

    @Test
    public void toolsShouldPersistThroughRegistry() {
        String email = uniqueEmail();

        assertEquals("No past history found for this customer.",
                toolRegistryService.invoke("get_customer_history", Map.of("email", email)));

        String ticket = toolRegistryService.invoke("generate_ticket_id", Map.of());
        assertEquals("Successfully saved new history record for " + email + ".",
                toolRegistryService.invoke("save_customer_history",
                        Map.of("email", email, "ticket_id", ticket, "summary", "Package marked delivered but missing")));

        assertEquals("Found past customer history:\nIssue " + ticket + " (Current): Package marked delivered but missing",
                toolRegistryService.invoke("get_customer_history", Map.of("email", email.toUpperCase())));
        assertEquals(1, customerHistoryService.listRecords(email).size());
    }

    @Test
    public void chatTurnShouldRunToolsAgainstStore() {
        String email = uniqueEmail();
        ChatSession session = sessionService.startSession("Jane", email);

        when(llmService.chat(anyList(), any())).thenReturn(
                new LlmReply("", List.of(new ToolCall("get_customer_history", Map.of("email", email)))),
                new LlmReply("", List.of(new ToolCall("save_customer_history",
                        Map.of("email", email, "ticket_id", "TICKET_TEST0001", "summary", "Damaged shoes")))),
                new LlmReply("\"I've opened ticket TICKET_TEST0001 for you.\"", null));

        ChatService.ChatResult result = chatService.processChat(session.getSessionId(), "My shoes arrived damaged");

        assertTrue(result.firstTurn());
        assertEquals(2, result.toolCallCount());
        assertEquals("I've opened ticket TICKET_TEST0001 for you.", result.reply());
        assertEquals("Found past customer history:\nIssue TICKET_TEST0001 (Current): Damaged shoes",
                customerHistoryService.lookup(email));
        assertFalse(toolActivityService.query(null, null, "save_customer_history", null).isEmpty());

        sessionService.endSession(session.getSessionId());
    }
}
