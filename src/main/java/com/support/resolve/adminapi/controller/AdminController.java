package com.support.resolve.adminapi.controller;

import com.support.resolve.model.HistoryRecord;
import com.support.resolve.service.CustomerHistoryService;
import com.support.resolve.service.PolicyService;
import com.support.resolve.service.RuntimeConfigService;
import com.support.resolve.service.ToolActivityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@CrossOrigin(origins = "*")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    @Autowired
    private CustomerHistoryService customerHistoryService;

    @Autowired
    private PolicyService policyService;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    @Autowired
    private ToolActivityService toolActivityService;

    @GetMapping("/history")
    public Map<String, Object> listHistory(@RequestParam String email) {
        Map<String, Object> out = new HashMap<>();
        try {
            List<HistoryRecord> records = customerHistoryService.listRecords(email);
            out.put("success", true);
            out.put("data", records);
            out.put("count", records.size());
        } catch (RuntimeException e) {
            logger.error("History listing failed: {}", e.getMessage());
            out.put("success", false);
            out.put("message", e.getMessage());
        }
        return out;
    }

    @GetMapping("/policies")
    public Map<String, Object> listPolicies() {
        List<String> sections = policyService.sections();
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", sections);
        out.put("count", sections.size());
        return out;
    }

    @GetMapping("/config")
    public Map<String, Object> getConfig() {
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", runtimeConfigService.snapshot());
        return out;
    }

    @PutMapping("/config")
    @SuppressWarnings("unchecked")
    public Map<String, Object> updateConfig(@RequestBody Map<String, Object> body) {
        Map<String, Object> history = body.get("history") instanceof Map ? (Map<String, Object>) body.get("history") : null;
        Map<String, Object> agent = body.get("agent") instanceof Map ? (Map<String, Object>) body.get("agent") : null;

        if (history != null) {
            Integer attempts = asInt(history.get("saveMaxAttempts"));
            Integer backoff = asInt(history.get("saveBackoffMs"));
            runtimeConfigService.updateHistory(attempts, backoff == null ? null : backoff.longValue());
        }

        if (agent != null) {
            runtimeConfigService.updateAgent(asInt(agent.get("maxToolRounds")));
        }

        logger.info("Runtime config updated: {}", runtimeConfigService.snapshot());

        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", runtimeConfigService.snapshot());
        return out;
    }

    @GetMapping("/logs")
    public Map<String, Object> queryToolActivity(
            @RequestParam(required = false) Long sinceMs,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String tool,
            @RequestParam(required = false) String status) {

        List<ToolActivityService.Entry> entries = toolActivityService.query(sinceMs, limit, tool, status);
        Map<String, Object> out = new HashMap<>();
        out.put("success", true);
        out.put("data", entries);
        out.put("count", entries.size());
        return out;
    }

    private static Integer asInt(Object o) {
        if (o == null) {
            return null;
        }
        if (o instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(o));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
