package com.gpupool.rotator.exception;

import lombok.Getter;

/**
 * Provisioner 调用失败
 * <p>
 * 只在异步路径上产生，最终被折算为账号的 lastError 和状态迁移
 */
@Getter
public class ProvisioningException extends PoolException {

    private final String accountId;
    private final boolean fatal;

    public ProvisioningException(String accountId, String message, boolean fatal) {
        super(message, 502);
        this.accountId = accountId;
        this.fatal = fatal;
    }

    public ProvisioningException(String accountId, String message, boolean fatal, Throwable cause) {
        super(message, 502, cause);
        this.accountId = accountId;
        this.fatal = fatal;
    }
}
