package com.gpupool.rotator.provision;

/**
 * 异步 Provisioner 操作类型
 */
public enum OperationKind {
    /** 为当前会话开通 */
    START,
    /** 预热下一个候选 */
    PRESTART,
    /** 运行中会话的周期健康检查 */
    HEALTH,
    /** 故障账号的定时复查 */
    RETRY,
    /** 手动恢复前的健康检查 */
    RECOVER,
    /** 释放会话 */
    STOP
}
