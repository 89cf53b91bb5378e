package com.gpupool.rotator.pool;

/**
 * 候选账号排序策略
 */
public enum RotationStrategy {
    PRIORITY,
    ROUND_ROBIN,
    LEAST_USED;

    /**
     * 兼容 "round-robin" / "least-used" 这类配置写法
     */
    public static RotationStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            return PRIORITY;
        }
        return valueOf(name.trim().toUpperCase().replace('-', '_'));
    }
}
