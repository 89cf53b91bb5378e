package com.gpupool.rotator.scheduler;

import com.gpupool.rotator.event.PoolEventType;
import com.gpupool.rotator.event.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * 聚合统计
 *
 * @param nextSwitchTime 当前会话预计切换时间，无会话为 null
 */
public record PoolStats(
        long totalEvents,
        Map<PoolEventType, Long> eventsByType,
        Map<Severity, Long> eventsBySeverity,
        long rotations,
        long emergencyActivations,
        long poolExhaustions,
        long totalSessions,
        long totalSuccess,
        long totalFailures,
        double successRate,
        Duration usedToday,
        Duration remainingToday,
        Instant nextSwitchTime) {
}
