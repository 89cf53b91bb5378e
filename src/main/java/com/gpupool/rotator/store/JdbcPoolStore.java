package com.gpupool.rotator.store;

import com.alibaba.fastjson2.JSON;
import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.pool.AccountStatus;
import com.gpupool.rotator.pool.AccountTier;
import com.gpupool.rotator.pool.CooldownCause;
import com.gpupool.rotator.pool.PoolSettings;
import com.gpupool.rotator.pool.ProviderType;
import com.gpupool.rotator.pool.ResourceTelemetry;
import com.gpupool.rotator.pool.RotationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * SQLite 持久化
 * <p>
 * 时间和时长以 ISO-8601 文本保存，遥测保存为 JSON，保证读回的快照与保存时完全一致
 */
public class JdbcPoolStore implements PoolStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPoolStore.class);

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public JdbcPoolStore(JdbcTemplate jdbc, TransactionTemplate tx) {
        this.jdbc = jdbc;
        this.tx = tx;
    }

    @Override
    public PoolSnapshot loadPool() {
        List<AccountSnapshot> accounts = jdbc.query("SELECT * FROM accounts ORDER BY position", ACCOUNT_ROW_MAPPER);
        List<PoolSettings> settings = jdbc.query("SELECT * FROM pool_settings WHERE id = 1", SETTINGS_ROW_MAPPER);
        log.info("加载账号池: {} 个账号, 设置{}", accounts.size(), settings.isEmpty() ? "未保存" : "已加载");
        return new PoolSnapshot(accounts, settings.isEmpty() ? null : settings.get(0));
    }

    @Override
    public void savePool(List<AccountSnapshot> accounts, PoolSettings settings) {
        tx.executeWithoutResult(status -> {
            jdbc.update("DELETE FROM accounts");
            int position = 0;
            for (AccountSnapshot a : accounts) {
                insertAccount(a, position++);
            }
            if (settings != null) {
                saveSettings(settings);
            }
        });
        log.debug("账号池已保存: {} 个账号", accounts.size());
    }

    private void insertAccount(AccountSnapshot a, int position) {
        jdbc.update("""
                        INSERT INTO accounts (id, position, name, display_name, provider, tier, priority, enabled,
                            emergency, endpoint, status, daily_quota, used_today, last_reset_day, cooldown_until,
                            cooldown_cause, next_retry_at, last_used_at, last_error, session_start_time,
                            max_session_time, total_sessions, success_count, failure_count, consecutive_failures,
                            reboot_count, telemetry, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                a.id(), position, a.name(), a.displayName(), a.provider().name(), a.tier().name(), a.priority(),
                a.enabled() ? 1 : 0, a.emergency() ? 1 : 0, a.endpoint(), a.status().name(),
                text(a.dailyQuota()), text(a.usedToday()), text(a.lastResetDay()), text(a.cooldownUntil()),
                a.cooldownCause() != null ? a.cooldownCause().name() : null,
                text(a.nextRetryAt()), text(a.lastUsedAt()), a.lastError(), text(a.sessionStartTime()),
                text(a.maxSessionTime()), a.totalSessions(), a.successCount(), a.failureCount(),
                a.consecutiveFailures(), a.rebootCount(),
                a.telemetry() != null ? JSON.toJSONString(a.telemetry()) : null,
                text(a.createdAt()), text(a.updatedAt()));
    }

    private void saveSettings(PoolSettings s) {
        jdbc.update("""
                        INSERT OR REPLACE INTO pool_settings (id, strategy, cooldown, low_quota_threshold_percent,
                            auto_failover, auto_rotate_on_quota_low, max_consecutive_failures, error_retry_delay,
                            auto_prestart, prestart_lead_time, health_check_interval, updated_at)
                        VALUES (1, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                s.strategy().name(), text(s.cooldown()), s.lowQuotaThresholdPercent(),
                s.autoFailover() ? 1 : 0, s.autoRotateOnQuotaLow() ? 1 : 0, s.maxConsecutiveFailures(),
                text(s.errorRetryDelay()), s.autoPrestart() ? 1 : 0, text(s.prestartLeadTime()),
                text(s.healthCheckInterval()), Instant.now().toString());
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Instant instant(String value) {
        return value != null ? Instant.parse(value) : null;
    }

    private static Duration duration(String value) {
        return value != null ? Duration.parse(value) : null;
    }

    private static final RowMapper<AccountSnapshot> ACCOUNT_ROW_MAPPER = (rs, rowNum) -> {
        String cause = rs.getString("cooldown_cause");
        String lastResetDay = rs.getString("last_reset_day");
        String telemetry = rs.getString("telemetry");
        return new AccountSnapshot(
                rs.getString("id"), rs.getString("name"), rs.getString("display_name"),
                ProviderType.valueOf(rs.getString("provider")), AccountTier.valueOf(rs.getString("tier")),
                rs.getInt("priority"), rs.getInt("enabled") == 1, rs.getInt("emergency") == 1,
                rs.getString("endpoint"), AccountStatus.valueOf(rs.getString("status")),
                duration(rs.getString("daily_quota")), duration(rs.getString("used_today")),
                lastResetDay != null ? LocalDate.parse(lastResetDay) : null,
                instant(rs.getString("cooldown_until")),
                cause != null ? CooldownCause.valueOf(cause) : null,
                instant(rs.getString("next_retry_at")), instant(rs.getString("last_used_at")),
                rs.getString("last_error"), instant(rs.getString("session_start_time")),
                duration(rs.getString("max_session_time")),
                rs.getInt("total_sessions"), rs.getInt("success_count"), rs.getInt("failure_count"),
                rs.getInt("consecutive_failures"), rs.getInt("reboot_count"),
                telemetry != null ? JSON.parseObject(telemetry, ResourceTelemetry.class) : null,
                instant(rs.getString("created_at")), instant(rs.getString("updated_at")));
    };

    private static final RowMapper<PoolSettings> SETTINGS_ROW_MAPPER = (rs, rowNum) -> new PoolSettings(
            RotationStrategy.valueOf(rs.getString("strategy")),
            duration(rs.getString("cooldown")),
            rs.getInt("low_quota_threshold_percent"),
            rs.getInt("auto_failover") == 1,
            rs.getInt("auto_rotate_on_quota_low") == 1,
            rs.getInt("max_consecutive_failures"),
            duration(rs.getString("error_retry_delay")),
            rs.getInt("auto_prestart") == 1,
            duration(rs.getString("prestart_lead_time")),
            duration(rs.getString("health_check_interval")));
}
