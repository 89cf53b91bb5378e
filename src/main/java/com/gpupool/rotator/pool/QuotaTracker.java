package com.gpupool.rotator.pool;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * 每日配额追踪
 * <p>
 * 累计运行时长、按 UTC 日期重置、计算阈值。状态迁移委托给注册表
 */
public class QuotaTracker {

    private final AccountRegistry registry;

    public QuotaTracker(AccountRegistry registry) {
        this.registry = registry;
    }

    public static LocalDate utcDay(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    /**
     * 累计运行时长，已用不超过每日上限；超出部分作为 overflow 返回
     */
    public Accrual accrue(Account account, Duration elapsed, int lowQuotaThresholdPercent) {
        if (elapsed == null || elapsed.isNegative() || elapsed.isZero()) {
            return Accrual.NONE;
        }
        boolean wasLow = isLow(account, lowQuotaThresholdPercent);
        boolean hadQuota = account.hasQuota();

        Duration total = account.usedToday().plus(elapsed);
        Duration overflow = total.minus(account.dailyQuota());
        if (overflow.isNegative()) {
            overflow = Duration.ZERO;
        }
        account.setUsedToday(overflow.isZero() ? total : account.dailyQuota());

        boolean exhausted = !account.hasQuota();
        return new Accrual(elapsed.minus(overflow), overflow,
                !wasLow && isLow(account, lowQuotaThresholdPercent) && !exhausted,
                hadQuota && exhausted,
                exhausted);
    }

    /**
     * UTC 日期变化时重置；同一天内重复调用无效果
     *
     * @return 重置前的状态，未到重置时间返回 null
     */
    public AccountStatus resetIfDue(Account account, Instant now) {
        LocalDate today = utcDay(now);
        if (today.equals(account.lastResetDay())) {
            return null;
        }
        return reset(account, now);
    }

    /**
     * 无条件重置（手动操作）
     *
     * @return 重置前的状态
     */
    public AccountStatus reset(Account account, Instant now) {
        AccountStatus before = account.status();
        account.setUsedToday(Duration.ZERO);
        account.setLastResetDay(utcDay(now));
        account.setUpdatedAt(now);
        if (before == AccountStatus.QUOTA_EXHAUSTED
                || (before == AccountStatus.COOLDOWN && account.cooldownCause() == CooldownCause.QUOTA_EXHAUSTED)) {
            registry.transition(account, AccountStatus.ACTIVE, now);
        }
        return before;
    }

    public double percentUsed(Account account) {
        long limit = account.dailyQuota().toMillis();
        if (limit <= 0) {
            return 0;
        }
        return Math.min(100.0, account.usedToday().toMillis() * 100.0 / limit);
    }

    public double percentRemaining(Account account) {
        long limit = account.dailyQuota().toMillis();
        if (limit <= 0) {
            return 0;
        }
        return account.remainingQuota().toMillis() * 100.0 / limit;
    }

    /**
     * 剩余百分比低于 (100 - 阈值) 视为低配额
     */
    public boolean isLow(Account account, int lowQuotaThresholdPercent) {
        return percentRemaining(account) < 100 - lowQuotaThresholdPercent;
    }

    /**
     * 一次累计的结果
     *
     * @param accrued         实际计入的时长
     * @param overflow        超出每日上限、未计入的运行时长
     * @param crossedLow      本次从正常跨入低配额
     * @param crossedZero     本次耗尽配额
     * @param exhausted       累计后配额为零
     */
    public record Accrual(Duration accrued, Duration overflow, boolean crossedLow, boolean crossedZero,
                          boolean exhausted) {

        static final Accrual NONE = new Accrual(Duration.ZERO, Duration.ZERO, false, false, false);

        public boolean hasOverflow() {
            return !overflow.isZero();
        }
    }
}
