package com.gpupool.rotator.pool;

/**
 * 进入冷却的原因
 * <p>
 * 每日重置只清除 {@link #QUOTA_EXHAUSTED} 引起的冷却
 */
public enum CooldownCause {
    QUOTA_EXHAUSTED,
    SESSION_LIMIT,
    LOW_QUOTA
}
