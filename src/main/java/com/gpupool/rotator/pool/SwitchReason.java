package com.gpupool.rotator.pool;

/**
 * 触发切换的条件，声明顺序即同一 tick 内的优先级
 */
public enum SwitchReason {
    QUOTA_EXHAUSTED(true),
    SESSION_LIMIT(true),
    LOW_QUOTA(false),
    ACCOUNT_DISABLED(true),
    // 应急会话期间正常账号恢复可用，交还应急账号
    NORMAL_AVAILABLE(false);

    private final boolean hard;

    SwitchReason(boolean hard) {
        this.hard = hard;
    }

    /**
     * 硬条件：即使没有替补账号也必须结束当前会话
     */
    public boolean isHard() {
        return hard;
    }
}
