package com.gpupool.rotator.provision;

import com.gpupool.rotator.pool.AccountSnapshot;

/**
 * 远程计算会话的开通/释放/健康检查
 * <p>
 * 调度器只在工作线程上调用，实现可以阻塞；抛出的异常按失败结果处理
 */
public interface Provisioner {

    /**
     * 开通会话，返回时节点应已可用
     */
    ProvisionResult startSession(AccountSnapshot account);

    /**
     * 释放会话（尽力而为）
     */
    void stopSession(AccountSnapshot account);

    /**
     * 健康检查，成功时可附带资源遥测
     */
    ProvisionResult healthCheck(AccountSnapshot account);
}
