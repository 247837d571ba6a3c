package com.support.resolve.console;

import com.support.resolve.model.ChatSession;
import com.support.resolve.service.ChatService;
import com.support.resolve.service.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 終端機對話模式
 * 啟動後詢問姓名與 Email，之後每一行都是一個回合，輸入 quit 結束
 */
@Component
@ConditionalOnProperty(name = "support.console.enabled", havingValue = "true")
public class ConsoleChatRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleChatRunner.class);

    static final String EXIT_KEYWORD = "quit";

    private final ChatService chatService;
    private final SessionService sessionService;

    public ConsoleChatRunner(ChatService chatService, SessionService sessionService) {
        this.chatService = chatService;
        this.sessionService = sessionService;
    }

    @Override
    public void run(String... args) throws Exception {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        converse(in, System.out);
    }

    /**
     * 執行對話迴圈，輸入結束 (EOF) 或 quit 時返回
     */
    public void converse(BufferedReader in, PrintStream out) throws IOException {
        out.println("Welcome! Please enter your information to begin");

        out.print("Your Name: ");
        out.flush();
        String name = in.readLine();
        if (name == null) {
            return;
        }

        String email;
        while (true) {
            out.print("Your Email: ");
            out.flush();
            email = in.readLine();
            if (email == null) {
                return;
            }
            if (sessionService.isValidEmail(email)) {
                break;
            }
            out.println("Please enter a valid email address");
        }

        ChatSession session = sessionService.startSession(name.trim(), email.trim());
        out.println();
        out.println("Chat started. Type '" + EXIT_KEYWORD + "' to exit.");

        try {
            while (true) {
                out.println();
                out.print("You: ");
                out.flush();
                String line = in.readLine();
                if (line == null || EXIT_KEYWORD.equals(line.trim().toLowerCase(Locale.ROOT))) {
                    break;
                }

                try {
                    ChatService.ChatResult result = chatService.processChat(session.getSessionId(), line.trim());
                    out.println("Assistant: " + result.reply());
                } catch (RuntimeException e) {
                    logger.error("Console turn failed: {}", e.getMessage());
                    out.println("Assistant: Sorry, I encountered an error. Please try again.");
                }
            }
        } finally {
            sessionService.endSession(session.getSessionId());
        }
    }
}
