package com.gpupool.rotator.pool;

import java.time.Duration;

/**
 * 新增/更新账号的输入
 * <p>
 * 可空字段在新增时取默认值；更新是整体替换，未给出的字段同样回落到默认值
 *
 * @param id             更新时必填，新增时忽略
 * @param name           唯一登录名（通常是邮箱），大小写不敏感
 * @param endpoint       节点 HTTP 地址，可空
 * @param dailyQuota     每日配额
 * @param maxSessionTime 单次会话最长时长
 */
public record AccountSpec(
        String id,
        String name,
        String displayName,
        ProviderType provider,
        AccountTier tier,
        Integer priority,
        Boolean enabled,
        Boolean emergency,
        String endpoint,
        Duration dailyQuota,
        Duration maxSessionTime) {

    public static AccountSpec of(String name) {
        return new AccountSpec(null, name, null, null, null, null, null, null, null, null, null);
    }

    public AccountSpec withId(String id) {
        return new AccountSpec(id, name, displayName, provider, tier, priority, enabled, emergency, endpoint,
                dailyQuota, maxSessionTime);
    }

    public AccountSpec withPriority(int priority) {
        return new AccountSpec(id, name, displayName, provider, tier, priority, enabled, emergency, endpoint,
                dailyQuota, maxSessionTime);
    }

    public AccountSpec withEnabled(boolean enabled) {
        return new AccountSpec(id, name, displayName, provider, tier, priority, enabled, emergency, endpoint,
                dailyQuota, maxSessionTime);
    }

    public AccountSpec withEmergency(boolean emergency) {
        return new AccountSpec(id, name, displayName, provider, tier, priority, enabled, emergency, endpoint,
                dailyQuota, maxSessionTime);
    }

    public AccountSpec withQuota(Duration dailyQuota, Duration maxSessionTime) {
        return new AccountSpec(id, name, displayName, provider, tier, priority, enabled, emergency, endpoint,
                dailyQuota, maxSessionTime);
    }

    public AccountSpec withEndpoint(String endpoint) {
        return new AccountSpec(id, name, displayName, provider, tier, priority, enabled, emergency, endpoint,
                dailyQuota, maxSessionTime);
    }
}
