package com.gpupool.rotator.pool;

import java.time.Duration;
import java.time.Instant;

/**
 * 当前会话（瞬态，不持久化）
 *
 * @param emergency 是否由应急账号承载
 */
public record Session(String sessionId, String accountId, Instant startedAt, boolean emergency) {

    public Duration duration(Instant now) {
        return now.isBefore(startedAt) ? Duration.ZERO : Duration.between(startedAt, now);
    }
}
