package com.gpupool.rotator.event;

/**
 * 池事件订阅者
 * <p>
 * 在调度器锁内按提交顺序同步回调，实现方不应阻塞
 */
@FunctionalInterface
public interface PoolEventListener {

    void onEvent(PoolEvent event);
}
