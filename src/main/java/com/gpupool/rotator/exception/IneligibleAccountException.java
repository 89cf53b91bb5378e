package com.gpupool.rotator.exception;

import com.gpupool.rotator.pool.AccountStatus;
import lombok.Getter;

/**
 * 账号当前状态不允许该操作（手动激活、恢复、暂停等）
 */
@Getter
public class IneligibleAccountException extends PoolException {

    private final String accountId;
    private final AccountStatus status;

    public IneligibleAccountException(String accountId, AccountStatus status, String message) {
        super(message, 409);
        this.accountId = accountId;
        this.status = status;
    }
}
