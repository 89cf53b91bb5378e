package com.gpupool.rotator.exception;

import lombok.Getter;

/**
 * 账号池异常基类
 */
@Getter
public class PoolException extends RuntimeException {

    private final int statusCode;

    public PoolException(String message) {
        super(message);
        this.statusCode = 500;
    }

    public PoolException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PoolException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 500;
    }

    public PoolException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

}
