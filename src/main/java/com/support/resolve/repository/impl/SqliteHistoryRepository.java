package com.support.resolve.repository.impl;

import com.support.resolve.exception.HistoryStoreException;
import com.support.resolve.exception.HistoryStoreLockedException;
import com.support.resolve.model.HistoryRecord;
import com.support.resolve.repository.HistoryRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * SQLite 歷史紀錄儲存庫 (SQLite-backed History Repository)
 * <p>
 * 功能：
 * 以單一 SQLite 檔案保存客戶支援紀錄，同一檔案可能同時被多個請求或多個行程寫入。
 * <p>
 * 機制：
 * 1. 啟動時以 {@code CREATE ... IF NOT EXISTS} 建立 history 資料表與 email 索引，失敗只記錄錯誤。
 * 2. 寫入失敗時依錯誤碼區分「檔案被鎖定」(SQLITE_BUSY / SQLITE_LOCKED) 與其他錯誤，
 * 分別拋出 {@link HistoryStoreLockedException} 與 {@link HistoryStoreException}，由服務層決定是否重試。
 */
@Repository
public class SqliteHistoryRepository implements HistoryRepository {

    private static final Logger logger = LoggerFactory.getLogger(SqliteHistoryRepository.class);

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS history (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                email TEXT NOT NULL,
                summary TEXT NOT NULL,
                timestamp DATETIME DEFAULT CURRENT_TIMESTAMP
            )
            """;

    private static final String CREATE_INDEX = "CREATE INDEX IF NOT EXISTS idx_email ON history (email)";

    private static final String SELECT_BY_EMAIL =
            "SELECT id, email, summary, timestamp FROM history WHERE email = ? ORDER BY timestamp ASC, id ASC";

    private static final String INSERT =
            "INSERT INTO history (email, summary, timestamp) VALUES (?, ?, CURRENT_TIMESTAMP)";

    private static final RowMapper<HistoryRecord> ROW_MAPPER = (rs, rowNum) -> new HistoryRecord(
            rs.getLong("id"),
            rs.getString("email"),
            rs.getString("summary"),
            rs.getString("timestamp"));

    private final JdbcTemplate jdbcTemplate;

    public SqliteHistoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void init() {
        initialize();
    }

    @Override
    public boolean initialize() {
        logger.info("Initializing history store");
        try {
            jdbcTemplate.execute(CREATE_TABLE);
            jdbcTemplate.execute(CREATE_INDEX);
            return true;
        } catch (DataAccessException e) {
            // 不中斷啟動，之後的讀寫會以錯誤訊息回報
            logger.error("Database initialization error: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<HistoryRecord> findByEmail(String email) {
        try {
            return jdbcTemplate.query(SELECT_BY_EMAIL, ROW_MAPPER, email);
        } catch (DataAccessException e) {
            throw new HistoryStoreException(rootMessage(e), e);
        }
    }

    @Override
    public void insert(String email, String summary) {
        try {
            jdbcTemplate.update(INSERT, email, summary);
        } catch (DataAccessException e) {
            if (isLocked(e)) {
                throw new HistoryStoreLockedException(rootMessage(e), e);
            }
            throw new HistoryStoreException(rootMessage(e), e);
        }
    }

    /**
     * 判斷是否為暫時性的檔案鎖定錯誤
     * <p>
     * 沿著 cause 鏈找 SQLException：vendor code 為 SQLITE_BUSY / SQLITE_LOCKED（含 extended code），
     * 或訊息包含 "database is locked"。
     */
    static boolean isLocked(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof SQLException sql) {
                int primary = sql.getErrorCode() & 0xff;
                if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
                    return true;
                }
            }
            String msg = t.getMessage();
            if (msg != null && msg.toLowerCase(Locale.ROOT).contains("database is locked")) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    private static String rootMessage(Throwable error) {
        Throwable t = error;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() != null ? t.getMessage() : error.getMessage();
    }
}
