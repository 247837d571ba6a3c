package com.support.resolve.service;

/**
 * 工單編號服務介面
 */
public interface TicketService {

    String TICKET_PREFIX = "TICKET_";

    /**
     * 產生新的工單編號，例如 {@code TICKET_AB12CD34}
     */
    String issue();
}
