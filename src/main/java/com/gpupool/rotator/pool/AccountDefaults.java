package com.gpupool.rotator.pool;

import java.time.Duration;

/**
 * 新账号缺省值（来自配置）
 */
public record AccountDefaults(int priority, Duration dailyQuota, Duration maxSessionTime,
                              ProviderType provider, AccountTier tier) {

    public static AccountDefaults standard() {
        return new AccountDefaults(100, Duration.ofMinutes(720), Duration.ofHours(12),
                ProviderType.GOOGLE_COLAB, AccountTier.FREE);
    }
}
