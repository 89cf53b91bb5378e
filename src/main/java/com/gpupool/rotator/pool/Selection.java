package com.gpupool.rotator.pool;

/**
 * 选择结果
 *
 * @param emergency 是否为应急接管
 */
public record Selection(Account account, boolean emergency) {
}
