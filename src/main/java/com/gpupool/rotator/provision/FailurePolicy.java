package com.gpupool.rotator.provision;

import com.gpupool.rotator.event.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 失败预算 + 指数退避
 * <p>
 * 连续失败达到上限或致命错误时挂起账号；否则按 delay × 2^(n-1) 安排健康复查
 */
public class FailurePolicy {

    private static final Logger log = LoggerFactory.getLogger(FailurePolicy.class);
    private static final Duration MAX_RETRY_DELAY = Duration.ofMinutes(30);

    /**
     * 判断是否应挂起
     */
    public boolean shouldSuspend(int consecutiveFailures, boolean fatal, int maxConsecutiveFailures) {
        return fatal || consecutiveFailures >= maxConsecutiveFailures;
    }

    /**
     * 计算下一次复查的等待时间
     */
    public Duration retryDelay(Duration baseDelay, int consecutiveFailures) {
        int exponent = Math.max(0, Math.min(consecutiveFailures - 1, 16));
        Duration delay = baseDelay.multipliedBy(1L << exponent);
        if (delay.compareTo(MAX_RETRY_DELAY) > 0) {
            log.debug("复查间隔超过上限, 截断为 {}", MAX_RETRY_DELAY);
            return MAX_RETRY_DELAY;
        }
        return delay;
    }

    /**
     * 严重级别随连续失败升级：首次 WARNING，预算用尽或挂起为 CRITICAL
     */
    public Severity severity(int consecutiveFailures, boolean suspended, int maxConsecutiveFailures) {
        if (suspended || consecutiveFailures >= maxConsecutiveFailures) {
            return Severity.CRITICAL;
        }
        return Severity.WARNING;
    }
}
