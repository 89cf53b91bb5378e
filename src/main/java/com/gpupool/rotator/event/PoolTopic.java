package com.gpupool.rotator.event;

import java.util.EnumSet;
import java.util.Set;

/**
 * 对外订阅主题
 */
public enum PoolTopic {

    /** 全部事件 */
    POOL_EVENT(EnumSet.allOf(PoolEventType.class)),
    ACCOUNT_ROTATED(EnumSet.of(PoolEventType.ACCOUNT_ROTATED)),
    NODE_STATUS_CHANGED(EnumSet.of(PoolEventType.STATUS_CHANGED)),
    SWITCH_REQUIRED(EnumSet.of(PoolEventType.SWITCH_REQUIRED)),
    EMERGENCY_ACTIVATED(EnumSet.of(PoolEventType.EMERGENCY_ACTIVATED));

    private final Set<PoolEventType> types;

    PoolTopic(Set<PoolEventType> types) {
        this.types = types;
    }

    public boolean matches(PoolEventType type) {
        return types.contains(type);
    }
}
