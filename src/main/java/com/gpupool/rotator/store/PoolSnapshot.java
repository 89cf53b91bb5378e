package com.gpupool.rotator.store;

import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.pool.PoolSettings;

import java.util.List;

/**
 * @param accounts 按注册顺序
 * @param settings 未保存过时为 null
 */
public record PoolSnapshot(List<AccountSnapshot> accounts, PoolSettings settings) {

    public static PoolSnapshot empty() {
        return new PoolSnapshot(List.of(), null);
    }
}
