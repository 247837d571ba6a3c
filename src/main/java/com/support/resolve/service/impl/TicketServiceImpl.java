package com.support.resolve.service.impl;

import com.support.resolve.service.TicketService;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;

/**
 * 工單編號服務實作
 * 固定前綴加 8 個大寫英數字（約 41 bits 亂數），不保存、不檢查重複
 */
@Service
public class TicketServiceImpl implements TicketService {

    private static final char[] ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();
    private static final int TOKEN_LENGTH = 8;

    private final SecureRandom random = new SecureRandom();

    @Override
    public String issue() {
        StringBuilder sb = new StringBuilder(TICKET_PREFIX.length() + TOKEN_LENGTH);
        sb.append(TICKET_PREFIX);
        for (int i = 0; i < TOKEN_LENGTH; i++) {
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }
}
