package com.gpupool.rotator.pool;

/**
 * 账号订阅档位
 */
public enum AccountTier {
    FREE,
    PRO,
    PRO_PLUS
}
