package com.support.resolve.service;

import java.util.Map;

public interface RuntimeConfigService {
    int getHistorySaveMaxAttempts();

    long getHistorySaveBackoffMs();

    int getAgentMaxToolRounds();

    void updateHistory(Integer saveMaxAttempts, Long saveBackoffMs);

    void updateAgent(Integer maxToolRounds);

    Map<String, Object> snapshot();
}
