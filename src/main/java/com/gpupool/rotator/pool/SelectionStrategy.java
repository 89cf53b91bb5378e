package com.gpupool.rotator.pool;

import java.util.List;

/**
 * 账号选择策略接口
 */
public interface SelectionStrategy {

    /**
     * 从可用账号列表中选择一个
     *
     * @param available      可用账号（已按资格过滤，保持注册顺序），非空
     * @param ordered        注册表中的全部账号（轮询用来定位上次选中的位置）
     * @param lastSelectedId 上次选中的账号，可为 null
     * @return 选中的账号
     */
    Account select(List<Account> available, List<Account> ordered, String lastSelectedId);
}
