package com.gpupool.rotator.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * 当前会话的只读视图
 *
 * @param timeUntilSwitch 距离下一次硬切换（会话上限或配额耗尽）
 */
public record SessionInfo(
        String sessionId,
        String accountId,
        String accountName,
        Instant startedAt,
        Duration duration,
        boolean emergency,
        boolean connected,
        Duration timeUntilSwitch) {
}
