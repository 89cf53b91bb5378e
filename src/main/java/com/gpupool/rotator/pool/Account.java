package com.gpupool.rotator.pool;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * 计算账号实体（轮换单元）
 * <p>
 * 只由 {@link AccountRegistry} 持有；包外只能读取，修改必须经过注册表和配额追踪器，
 * 对外发布时一律转换为 {@link AccountSnapshot}
 */
public class Account {

    private final String id;
    private final Instant createdAt;

    // 配置属性（updateAccount 整体替换）
    private String name;
    private String displayName;
    private ProviderType provider;
    private AccountTier tier;
    private int priority;
    private boolean enabled;
    private boolean emergency;
    private String endpoint;
    private Duration dailyQuota;
    private Duration maxSessionTime;

    // 运行时状态
    private AccountStatus status = AccountStatus.ACTIVE;
    private Duration usedToday = Duration.ZERO;
    private LocalDate lastResetDay;
    private Instant cooldownUntil;
    private CooldownCause cooldownCause;
    private Instant nextRetryAt;
    private Instant lastUsedAt;
    private String lastError;
    private Instant sessionStartTime;
    private int totalSessions;
    private int successCount;
    private int failureCount;
    private int consecutiveFailures;
    private int rebootCount;
    private ResourceTelemetry telemetry;
    private Instant updatedAt;

    Account(String id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    // 从快照恢复
    static Account restore(AccountSnapshot s) {
        Account a = new Account(s.id(), s.createdAt());
        a.applyConfig(s.name(), s.displayName(), s.provider(), s.tier(), s.priority(), s.enabled(),
                s.emergency(), s.endpoint(), s.dailyQuota(), s.maxSessionTime());
        a.status = s.status();
        a.usedToday = s.usedToday();
        a.lastResetDay = s.lastResetDay();
        a.cooldownUntil = s.cooldownUntil();
        a.cooldownCause = s.cooldownCause();
        a.nextRetryAt = s.nextRetryAt();
        a.lastUsedAt = s.lastUsedAt();
        a.lastError = s.lastError();
        a.sessionStartTime = s.sessionStartTime();
        a.totalSessions = s.totalSessions();
        a.successCount = s.successCount();
        a.failureCount = s.failureCount();
        a.consecutiveFailures = s.consecutiveFailures();
        a.rebootCount = s.rebootCount();
        a.telemetry = s.telemetry();
        a.updatedAt = s.updatedAt();
        return a;
    }

    void applyConfig(String name, String displayName, ProviderType provider, AccountTier tier, int priority,
                     boolean enabled, boolean emergency, String endpoint, Duration dailyQuota,
                     Duration maxSessionTime) {
        this.name = name;
        this.displayName = displayName;
        this.provider = provider;
        this.tier = tier;
        this.priority = priority;
        this.enabled = enabled;
        this.emergency = emergency;
        this.endpoint = endpoint;
        this.dailyQuota = dailyQuota;
        this.maxSessionTime = maxSessionTime;
    }

    /**
     * 剩余配额，永不为负
     */
    public Duration remainingQuota() {
        Duration remaining = dailyQuota.minus(usedToday);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean hasQuota() {
        return !remainingQuota().isZero();
    }

    public double successRate() {
        int total = successCount + failureCount;
        return total == 0 ? 100.0 : successCount * 100.0 / total;
    }

    public Duration sessionDuration(Instant now) {
        if (sessionStartTime == null || now.isBefore(sessionStartTime)) {
            return Duration.ZERO;
        }
        return Duration.between(sessionStartTime, now);
    }

    /**
     * 名称展示优先用 displayName
     */
    public String label() {
        return displayName != null && !displayName.isBlank() ? displayName : name;
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(id, name, displayName, provider, tier, priority, enabled, emergency, endpoint,
                status, dailyQuota, usedToday, lastResetDay, cooldownUntil, cooldownCause, nextRetryAt,
                lastUsedAt, lastError, sessionStartTime, maxSessionTime, totalSessions, successCount,
                failureCount, consecutiveFailures, rebootCount, telemetry, createdAt, updatedAt);
    }

    // --- 包内修改 ---

    void setStatus(AccountStatus status) { this.status = status; }
    void setUsedToday(Duration usedToday) { this.usedToday = usedToday; }
    void setLastResetDay(LocalDate lastResetDay) { this.lastResetDay = lastResetDay; }
    void setCooldown(Instant until, CooldownCause cause) {
        this.cooldownUntil = until;
        this.cooldownCause = cause;
    }
    void setNextRetryAt(Instant nextRetryAt) { this.nextRetryAt = nextRetryAt; }
    void setLastUsedAt(Instant lastUsedAt) { this.lastUsedAt = lastUsedAt; }
    void setLastError(String lastError) { this.lastError = lastError; }
    void setSessionStartTime(Instant sessionStartTime) { this.sessionStartTime = sessionStartTime; }
    void setTelemetry(ResourceTelemetry telemetry) { this.telemetry = telemetry; }
    void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    void incrementTotalSessions() { totalSessions++; }
    void incrementReboots() { rebootCount++; }

    void recordSuccess() {
        successCount++;
        consecutiveFailures = 0;
    }

    int recordFailure(String error) {
        failureCount++;
        lastError = error;
        return ++consecutiveFailures;
    }

    void clearFailures() {
        consecutiveFailures = 0;
        lastError = null;
    }

    // --- getter ---

    public String id() { return id; }
    public String name() { return name; }
    public String displayName() { return displayName; }
    public ProviderType provider() { return provider; }
    public AccountTier tier() { return tier; }
    public int priority() { return priority; }
    public boolean enabled() { return enabled; }
    public boolean emergency() { return emergency; }
    public String endpoint() { return endpoint; }
    public AccountStatus status() { return status; }
    public Duration dailyQuota() { return dailyQuota; }
    public Duration usedToday() { return usedToday; }
    public LocalDate lastResetDay() { return lastResetDay; }
    public Instant cooldownUntil() { return cooldownUntil; }
    public CooldownCause cooldownCause() { return cooldownCause; }
    public Instant nextRetryAt() { return nextRetryAt; }
    public Instant lastUsedAt() { return lastUsedAt; }
    public String lastError() { return lastError; }
    public Instant sessionStartTime() { return sessionStartTime; }
    public Duration maxSessionTime() { return maxSessionTime; }
    public int totalSessions() { return totalSessions; }
    public int successCount() { return successCount; }
    public int failureCount() { return failureCount; }
    public int consecutiveFailures() { return consecutiveFailures; }
    public int rebootCount() { return rebootCount; }
    public ResourceTelemetry telemetry() { return telemetry; }
    public Instant createdAt() { return createdAt; }
    public Instant updatedAt() { return updatedAt; }
}
