package com.gpupool.rotator.pool;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 账号生命周期状态
 * <p>
 * 合法迁移只在 {@link #TRANSITIONS} 中定义，注册表据此拒绝非法迁移
 */
public enum AccountStatus {

    /** 空闲可用 */
    ACTIVE,
    /** 正在承载当前会话 */
    RUNNING,
    /** 定时冷却中（配额耗尽、会话超时或低配额轮换） */
    COOLDOWN,
    /** 冷却结束但当天配额仍为零，等待每日重置 */
    QUOTA_EXHAUSTED,
    /** 开通失败 */
    ERROR,
    /** 运行中会话健康检查失败 */
    DISCONNECTED,
    /** 连续失败或致命错误，只能手动恢复 */
    SUSPENDED,
    /** 手动暂停 */
    PAUSED;

    private static final Map<AccountStatus, Set<AccountStatus>> TRANSITIONS = new EnumMap<>(AccountStatus.class);

    static {
        TRANSITIONS.put(ACTIVE, EnumSet.of(RUNNING, ERROR, SUSPENDED));
        TRANSITIONS.put(RUNNING, EnumSet.of(ACTIVE, COOLDOWN, QUOTA_EXHAUSTED, ERROR, DISCONNECTED, SUSPENDED, PAUSED));
        // 强制激活和应急接管可以直接从冷却/耗尽进入运行
        TRANSITIONS.put(COOLDOWN, EnumSet.of(ACTIVE, QUOTA_EXHAUSTED, RUNNING));
        TRANSITIONS.put(QUOTA_EXHAUSTED, EnumSet.of(ACTIVE, RUNNING));
        TRANSITIONS.put(ERROR, EnumSet.of(ACTIVE, SUSPENDED, RUNNING));
        TRANSITIONS.put(DISCONNECTED, EnumSet.of(ACTIVE, ERROR, SUSPENDED, RUNNING));
        TRANSITIONS.put(SUSPENDED, EnumSet.of(ACTIVE));
        TRANSITIONS.put(PAUSED, EnumSet.of(ACTIVE, RUNNING));
    }

    public boolean canTransitionTo(AccountStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<AccountStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    /**
     * 是否处于失败分支（可以被健康检查或手动恢复拉回）
     */
    public boolean isFailure() {
        return this == ERROR || this == DISCONNECTED || this == SUSPENDED;
    }
}
