package com.support.resolve.test;

import com.support.resolve.service.ToolActivityService;
import com.support.resolve.service.impl.RuntimeConfigServiceImpl;
import com.support.resolve.service.impl.ToolActivityServiceImpl;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 執行時配置與工具呼叫紀錄測試
 */
public class RuntimeConfigServiceTest {

    @Test
    public void defaultsAndOverrides() {
        RuntimeConfigServiceImpl config = new RuntimeConfigServiceImpl();
        assertEquals(5, config.getHistorySaveMaxAttempts());
        assertEquals(500L, config.getHistorySaveBackoffMs());
        assertEquals(8, config.getAgentMaxToolRounds());

        config.updateHistory(0, -10L);
        config.updateAgent(3);
        assertEquals(1, config.getHistorySaveMaxAttempts());
        assertEquals(0L, config.getHistorySaveBackoffMs());
        assertEquals(3, config.getAgentMaxToolRounds());

        config.updateHistory(null, 250L);
        assertEquals(1, config.getHistorySaveMaxAttempts());
        assertEquals(250L, config.getHistorySaveBackoffMs());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void snapshotIsNested() {
        RuntimeConfigServiceImpl config = new RuntimeConfigServiceImpl();
        Map<String, Object> snapshot = config.snapshot();
        assertEquals(5, ((Map<String, Object>) snapshot.get("history")).get("saveMaxAttempts"));
        assertEquals(8, ((Map<String, Object>) snapshot.get("agent")).get("maxToolRounds"));
    }

    @Test
    public void activityBufferKeepsNewestEntries() {
        ToolActivityServiceImpl activity = new ToolActivityServiceImpl();
        ReflectionTestUtils.setField(activity, "maxEntries", 3);
        for (int i = 0; i < 5; i++) {
            activity.record("tool-" + i, ToolActivityService.STATUS_OK, i, "");
        }

        List<ToolActivityService.Entry> entries = activity.query(null, null, null, null);
        assertEquals(3, entries.size());
        assertEquals("tool-2", entries.get(0).tool());
        assertEquals("tool-4", entries.get(2).tool());

        assertEquals(1, activity.query(null, 1, null, "ok").size());
        assertEquals("tool-4", activity.query(null, 1, null, "ok").get(0).tool());
        assertTrue(activity.query(null, null, null, ToolActivityService.STATUS_ERROR).isEmpty());
    }
}
