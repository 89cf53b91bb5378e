package com.gpupool.rotator.exception;

/**
 * 参数校验失败（新增/更新账号、更新设置），不会改变池状态
 */
public class ValidationException extends PoolException {

    public ValidationException(String message) {
        super(message, 400);
    }
}
