package com.support.resolve.test;

import com.support.resolve.service.impl.TicketServiceImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TicketServiceTest {

    private final TicketServiceImpl ticketService = new TicketServiceImpl();

    @Test
    @DisplayName("工單編號格式：TICKET_ + 8 個大寫英數字")
    public void testFormat() {
        String id = ticketService.issue();
        assertTrue(id.matches("TICKET_[A-Z0-9]{8}"), "unexpected ticket id: " + id);
    }

    @Test
    @DisplayName("10,000 個工單編號兩兩不同")
    public void testTenThousandDistinct() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add(ticketService.issue());
        }
        assertEquals(10_000, ids.size());
    }
}
