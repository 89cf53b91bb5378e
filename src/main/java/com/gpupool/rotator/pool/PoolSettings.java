package com.gpupool.rotator.pool;

import com.gpupool.rotator.exception.ValidationException;

import java.time.Duration;

/**
 * 池级设置，只能通过 updateSettings 整体替换
 *
 * @param strategy                 候选排序策略
 * @param cooldown                 冷却时长
 * @param lowQuotaThresholdPercent 已用配额达到该百分比视为低配额
 * @param autoFailover             无正常候选时是否启用应急账号
 * @param autoRotateOnQuotaLow     低配额时是否提前轮换
 * @param maxConsecutiveFailures   连续失败多少次后挂起
 * @param errorRetryDelay          ERROR/DISCONNECTED 账号的健康复查间隔
 * @param autoPrestart             临近切换时是否预热下一个候选
 * @param prestartLeadTime         距离切换多久开始预热
 * @param healthCheckInterval      运行中会话的健康检查间隔
 */
public record PoolSettings(
        RotationStrategy strategy,
        Duration cooldown,
        int lowQuotaThresholdPercent,
        boolean autoFailover,
        boolean autoRotateOnQuotaLow,
        int maxConsecutiveFailures,
        Duration errorRetryDelay,
        boolean autoPrestart,
        Duration prestartLeadTime,
        Duration healthCheckInterval) {

    public static PoolSettings defaults() {
        return new PoolSettings(RotationStrategy.PRIORITY, Duration.ofMinutes(60), 90, true, true, 3,
                Duration.ofMinutes(1), true, Duration.ofMinutes(5), Duration.ofMinutes(1));
    }

    public void validate() {
        if (strategy == null) {
            throw new ValidationException("轮换策略不能为空");
        }
        requireNonNegative(cooldown, "cooldown");
        requireNonNegative(errorRetryDelay, "errorRetryDelay");
        requireNonNegative(prestartLeadTime, "prestartLeadTime");
        if (healthCheckInterval == null || healthCheckInterval.isZero() || healthCheckInterval.isNegative()) {
            throw new ValidationException("healthCheckInterval 必须大于 0");
        }
        if (lowQuotaThresholdPercent < 1 || lowQuotaThresholdPercent > 100) {
            throw new ValidationException("低配额阈值必须在 1-100 之间: " + lowQuotaThresholdPercent);
        }
        if (maxConsecutiveFailures < 1) {
            throw new ValidationException("maxConsecutiveFailures 至少为 1");
        }
    }

    private static void requireNonNegative(Duration value, String field) {
        if (value == null || value.isNegative()) {
            throw new ValidationException(field + " 不能为空或负数");
        }
    }

    public PoolSettings withStrategy(RotationStrategy strategy) {
        return new PoolSettings(strategy, cooldown, lowQuotaThresholdPercent, autoFailover, autoRotateOnQuotaLow,
                maxConsecutiveFailures, errorRetryDelay, autoPrestart, prestartLeadTime, healthCheckInterval);
    }

    public PoolSettings withAutoFailover(boolean autoFailover) {
        return new PoolSettings(strategy, cooldown, lowQuotaThresholdPercent, autoFailover, autoRotateOnQuotaLow,
                maxConsecutiveFailures, errorRetryDelay, autoPrestart, prestartLeadTime, healthCheckInterval);
    }

    public PoolSettings withLowQuota(int thresholdPercent, boolean autoRotate) {
        return new PoolSettings(strategy, cooldown, thresholdPercent, autoFailover, autoRotate,
                maxConsecutiveFailures, errorRetryDelay, autoPrestart, prestartLeadTime, healthCheckInterval);
    }

    public PoolSettings withCooldown(Duration cooldown) {
        return new PoolSettings(strategy, cooldown, lowQuotaThresholdPercent, autoFailover, autoRotateOnQuotaLow,
                maxConsecutiveFailures, errorRetryDelay, autoPrestart, prestartLeadTime, healthCheckInterval);
    }

    public PoolSettings withPrestart(boolean autoPrestart, Duration leadTime) {
        return new PoolSettings(strategy, cooldown, lowQuotaThresholdPercent, autoFailover, autoRotateOnQuotaLow,
                maxConsecutiveFailures, errorRetryDelay, autoPrestart, leadTime, healthCheckInterval);
    }

    public PoolSettings withFailureBudget(int maxConsecutiveFailures, Duration errorRetryDelay) {
        return new PoolSettings(strategy, cooldown, lowQuotaThresholdPercent, autoFailover, autoRotateOnQuotaLow,
                maxConsecutiveFailures, errorRetryDelay, autoPrestart, prestartLeadTime, healthCheckInterval);
    }
}
