package com.gpupool.rotator.pool;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * 账号的只读副本，用于查询接口、事件和持久化
 */
public record AccountSnapshot(
        String id,
        String name,
        String displayName,
        ProviderType provider,
        AccountTier tier,
        int priority,
        boolean enabled,
        boolean emergency,
        String endpoint,
        AccountStatus status,
        Duration dailyQuota,
        Duration usedToday,
        LocalDate lastResetDay,
        Instant cooldownUntil,
        CooldownCause cooldownCause,
        Instant nextRetryAt,
        Instant lastUsedAt,
        String lastError,
        Instant sessionStartTime,
        Duration maxSessionTime,
        int totalSessions,
        int successCount,
        int failureCount,
        int consecutiveFailures,
        int rebootCount,
        ResourceTelemetry telemetry,
        Instant createdAt,
        Instant updatedAt) {

    public Duration remainingQuota() {
        Duration remaining = dailyQuota.minus(usedToday);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public double successRate() {
        int total = successCount + failureCount;
        return total == 0 ? 100.0 : successCount * 100.0 / total;
    }

    public String label() {
        return displayName != null && !displayName.isBlank() ? displayName : name;
    }
}
