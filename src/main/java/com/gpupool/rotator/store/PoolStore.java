package com.gpupool.rotator.store;

import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.pool.PoolSettings;

import java.util.List;

/**
 * 账号池持久化
 */
public interface PoolStore {

    /**
     * 读取已保存的账号和设置；从未保存过时 settings 为 null
     */
    PoolSnapshot loadPool();

    /**
     * 整体覆盖保存
     */
    void savePool(List<AccountSnapshot> accounts, PoolSettings settings);
}
