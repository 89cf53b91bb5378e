package com.gpupool.rotator.exception;

import lombok.Getter;

/**
 * 账号不存在
 */
@Getter
public class AccountNotFoundException extends PoolException {

    private final String accountId;

    public AccountNotFoundException(String accountId) {
        super("账号不存在: " + accountId, 404);
        this.accountId = accountId;
    }
}
