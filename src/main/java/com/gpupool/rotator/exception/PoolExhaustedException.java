package com.gpupool.rotator.exception;

/**
 * 没有可用账号（含应急账号）
 * <p>
 * 调度器内部不抛出，仅在 HTTP 边界向取会话的调用方报告
 */
public class PoolExhaustedException extends PoolException {

    public PoolExhaustedException() {
        super("没有可用的计算账号", 503);
    }

    public PoolExhaustedException(String message) {
        super(message, 503);
    }
}
