package com.support.resolve.service.impl;

import com.support.resolve.exception.HistoryStoreException;
import com.support.resolve.exception.HistoryStoreLockedException;
import com.support.resolve.model.HistoryRecord;
import com.support.resolve.repository.HistoryRepository;
import com.support.resolve.service.CustomerHistoryService;
import com.support.resolve.service.RuntimeConfigService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 客戶歷史紀錄服務實作 (Customer History Service Implementation)
 * <p>
 * 功能：
 * 以客戶 Email（小寫）為鍵讀寫 {@link HistoryRepository}，並把所有失敗轉成描述文字回傳給呼叫端。
 * <p>
 * 寫入流程 (save)：
 * 1. Email 為空或為 "Unknown" 時直接回傳說明，不存取資料庫。
 * 2. 組成紀錄標籤 `Issue {ticketId} (Current): {summary}` 並寫入。
 * 3. 若檔案被其他寫入者鎖定，延遲 `saveBackoffMs` 後在寫入執行緒池重試，最多 `saveMaxAttempts` 次（含第一次）。
 * 4. 其他儲存錯誤不重試，立即回傳錯誤訊息；重試用盡回傳 "Database locked after retries"。
 */
@Service
public class CustomerHistoryServiceImpl implements CustomerHistoryService {

    private static final Logger logger = LoggerFactory.getLogger(CustomerHistoryServiceImpl.class);

    static final String NO_EMAIL_LOOKUP = "No customer email provided. Cannot retrieve history.";
    static final String NO_EMAIL_SAVE = "No customer email provided. Cannot save history.";
    static final String NO_HISTORY = "No past history found for this customer.";
    static final String HISTORY_HEADER = "Found past customer history:\n";
    static final String LOCKED_AFTER_RETRIES = "Database locked after retries";

    @Autowired
    private HistoryRepository historyRepository;

    @Autowired
    private RuntimeConfigService runtimeConfigService;

    private final ThreadPoolExecutor writeExecutor = new ThreadPoolExecutor(
            2,
            8,
            60L,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(200),
            new ThreadPoolExecutor.AbortPolicy());

    @PreDestroy
    public void shutdownExecutor() {
        writeExecutor.shutdown();
        try {
            writeExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String lookup(String email) {
        logger.info("Looking up history for: {}", email);
        if (isMissing(email)) {
            return NO_EMAIL_LOOKUP;
        }

        List<HistoryRecord> records;
        try {
            records = historyRepository.findByEmail(normalize(email));
        } catch (HistoryStoreException e) {
            logger.error("Database read error: {}", e.getMessage());
            return "Error retrieving history: " + e.getMessage();
        }

        if (records.isEmpty()) {
            return NO_HISTORY;
        }
        return HISTORY_HEADER + records.stream()
                .map(HistoryRecord::summary)
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String save(String email, String ticketId, String summary) {
        return saveAsync(email, ticketId, summary).join();
    }

    /**
     * 非同步保存 (Save Asynchronously)
     * <p>
     * 第一次寫入在呼叫端執行緒執行；需要重試時透過 {@link CompletableFuture#delayedExecutor}
     * 排程到寫入執行緒池，等待期間不佔用任何執行緒。回傳的 Future 一定以描述文字完成。
     */
    @Override
    public CompletableFuture<String> saveAsync(String email, String ticketId, String summary) {
        logger.info("Saving history for: {}", email);
        if (isMissing(email)) {
            return CompletableFuture.completedFuture(NO_EMAIL_SAVE);
        }

        String normalized = normalize(email);
        String record = String.format("Issue %s (Current): %s", ticketId, summary);
        int maxAttempts = Math.max(1, runtimeConfigService.getHistorySaveMaxAttempts());
        long backoffMs = Math.max(0L, runtimeConfigService.getHistorySaveBackoffMs());

        CompletableFuture<String> result = new CompletableFuture<>();
        attemptWrite(new PendingWrite(normalized, record, maxAttempts, backoffMs, result), 1);
        return result;
    }

    @Override
    public List<HistoryRecord> listRecords(String email) {
        if (isMissing(email)) {
            return List.of();
        }
        return historyRepository.findByEmail(normalize(email));
    }

    private void attemptWrite(PendingWrite write, int attempt) {
        try {
            historyRepository.insert(write.email(), write.record());
            logger.info("Database updated for {}.", write.email());
            write.result().complete(String.format("Successfully saved new history record for %s.", write.email()));
        } catch (HistoryStoreLockedException e) {
            if (attempt >= write.maxAttempts()) {
                logger.error("Database write error: {} (attempts={})", LOCKED_AFTER_RETRIES, attempt);
                write.result().complete("Error saving history: " + LOCKED_AFTER_RETRIES);
                return;
            }
            logger.warn("History store locked, retrying in {}ms (attempt {}/{})",
                    write.backoffMs(), attempt, write.maxAttempts());
            scheduleRetry(write, attempt + 1);
        } catch (HistoryStoreException e) {
            logger.error("Database write error: {}", e.getMessage());
            write.result().complete("Error saving history: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected history write error", e);
            write.result().complete("Error saving history: " + e.getMessage());
        }
    }

    private void scheduleRetry(PendingWrite write, int nextAttempt) {
        Executor delayed = CompletableFuture.delayedExecutor(write.backoffMs(), TimeUnit.MILLISECONDS, task -> {
            try {
                writeExecutor.execute(task);
            } catch (RejectedExecutionException e) {
                logger.error("History retry rejected: {}", e.getMessage());
                write.result().complete("Error saving history: history writer is unavailable");
            }
        });
        delayed.execute(() -> attemptWrite(write, nextAttempt));
    }

    private static boolean isMissing(String email) {
        return email == null || email.isBlank() || UNKNOWN_CUSTOMER.equalsIgnoreCase(email.trim());
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private record PendingWrite(String email, String record, int maxAttempts, long backoffMs,
            CompletableFuture<String> result) {
    }
}
