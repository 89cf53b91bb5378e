package com.gpupool.rotator.scheduler;

import com.gpupool.rotator.pool.RotationStrategy;

/**
 * 账号池概况
 *
 * @param available         满足正常资格的账号数
 * @param poolAvailable     有会话在运行，或能获取到正常账号/应急账号
 * @param engaged           自动轮换是否开启
 * @param prestartAccountId 已预热或预热中的候选
 */
public record PoolStatus(
        int total,
        int available,
        int running,
        int cooldown,
        int quotaExhausted,
        int error,
        int suspended,
        int paused,
        int disabled,
        int emergencyReady,
        boolean poolAvailable,
        boolean engaged,
        RotationStrategy strategy,
        SessionInfo currentSession,
        String prestartAccountId) {
}
