package com.support.resolve.service.impl;

import com.support.resolve.service.RuntimeConfigService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 執行時配置服務實作 (Runtime Configuration Service Implementation)
 * <p>
 * 功能：
 * 不重啟伺服器即可調整歷史紀錄寫入的重試策略與工具呼叫回合上限。
 * <p>
 * 機制：
 * 1. 使用 `AtomicReference` 儲存覆蓋值 (Override)。
 * 2. 讀取時優先回傳 Override 值，若無則回傳 `application.properties` 中的預設值。
 */
@Service
public class RuntimeConfigServiceImpl implements RuntimeConfigService {

    @Value("${history.save.max-attempts:5}")
    private int historySaveMaxAttemptsDefault = 5;

    @Value("${history.save.backoff-ms:500}")
    private long historySaveBackoffMsDefault = 500L;

    @Value("${agent.max-tool-rounds:8}")
    private int agentMaxToolRoundsDefault = 8;

    private final AtomicReference<Integer> historySaveMaxAttemptsOverride = new AtomicReference<>();
    private final AtomicReference<Long> historySaveBackoffMsOverride = new AtomicReference<>();
    private final AtomicReference<Integer> agentMaxToolRoundsOverride = new AtomicReference<>();

    @Override
    public int getHistorySaveMaxAttempts() {
        Integer v = historySaveMaxAttemptsOverride.get();
        return v != null ? v : historySaveMaxAttemptsDefault;
    }

    @Override
    public long getHistorySaveBackoffMs() {
        Long v = historySaveBackoffMsOverride.get();
        return v != null ? v : historySaveBackoffMsDefault;
    }

    @Override
    public int getAgentMaxToolRounds() {
        Integer v = agentMaxToolRoundsOverride.get();
        return v != null ? v : agentMaxToolRoundsDefault;
    }

    /**
     * 更新歷史紀錄寫入重試策略
     * <p>
     * - saveMaxAttempts: 含第一次在內的最多寫入次數，至少 1。
     * - saveBackoffMs: 每次重試前的固定等待毫秒數，至少 0。
     */
    @Override
    public void updateHistory(Integer saveMaxAttempts, Long saveBackoffMs) {
        if (saveMaxAttempts != null) {
            historySaveMaxAttemptsOverride.set(Math.max(1, saveMaxAttempts));
        }
        if (saveBackoffMs != null) {
            historySaveBackoffMsOverride.set(Math.max(0L, saveBackoffMs));
        }
    }

    @Override
    public void updateAgent(Integer maxToolRounds) {
        if (maxToolRounds != null) {
            agentMaxToolRoundsOverride.set(Math.max(1, maxToolRounds));
        }
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> out = new HashMap<>();
        Map<String, Object> history = new HashMap<>();
        history.put("saveMaxAttempts", getHistorySaveMaxAttempts());
        history.put("saveBackoffMs", getHistorySaveBackoffMs());
        out.put("history", history);

        Map<String, Object> agent = new HashMap<>();
        agent.put("maxToolRounds", getAgentMaxToolRounds());
        out.put("agent", agent);

        return out;
    }
}
