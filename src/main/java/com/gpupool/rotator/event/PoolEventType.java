package com.gpupool.rotator.event;

/**
 * 池事件类型
 */
public enum PoolEventType {
    STATUS_CHANGED,
    CONNECTED,
    DISCONNECTED,
    TASK_STARTED,
    TASK_COMPLETED,
    TASK_FAILED,
    QUOTA_WARNING,
    QUOTA_EXCEEDED,
    QUOTA_RESET,
    SESSION_STARTED,
    SESSION_ENDED,
    REBOOTING,
    ERROR,
    EMERGENCY_ACTIVATED,
    PRESTART_TRIGGERED,
    ACCOUNT_ADDED,
    ACCOUNT_REMOVED,
    ACCOUNT_ROTATED,
    ACCOUNT_RECOVERED,
    SWITCH_REQUIRED,
    POOL_EXHAUSTED,
    SETTINGS_UPDATED
}
