package com.gpupool.rotator.pool;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 候选账号选择器
 * <p>
 * 支持 3 种策略：priority / round-robin / least-used。
 * 正常候选为空且开启自动故障转移时，退回应急账号。
 * 选择本身无副作用，轮询游标由调度器在真正切换后推进
 */
public class AccountSelector {

    /**
     * 优先级升序 → 最久未使用（从未使用排最前）→ id，保证全序
     */
    static final Comparator<Account> PRIORITY_ORDER = Comparator
            .comparingInt(Account::priority)
            .thenComparing(Account::lastUsedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(Account::id);

    private static final Set<AccountStatus> EMERGENCY_READY =
            EnumSet.of(AccountStatus.ACTIVE, AccountStatus.COOLDOWN, AccountStatus.QUOTA_EXHAUSTED);

    private final Map<RotationStrategy, SelectionStrategy> strategies = new EnumMap<>(RotationStrategy.class);

    public AccountSelector() {
        strategies.put(RotationStrategy.PRIORITY, new PriorityStrategy());
        strategies.put(RotationStrategy.ROUND_ROBIN, new RoundRobinStrategy());
        strategies.put(RotationStrategy.LEAST_USED, new LeastUsedStrategy());
    }

    /**
     * 正常资格：启用、ACTIVE、有剩余配额、非应急账号
     */
    public boolean isEligible(Account account) {
        return account.enabled()
                && account.status() == AccountStatus.ACTIVE
                && account.hasQuota()
                && !account.emergency();
    }

    /**
     * 应急资格：忽略配额和冷却，但不接管故障、挂起、暂停或运行中的账号
     */
    public boolean isEmergencyCandidate(Account account) {
        return account.emergency() && account.enabled() && EMERGENCY_READY.contains(account.status());
    }

    public Optional<Selection> select(List<Account> accounts, PoolSettings settings, String lastSelectedId) {
        List<Account> available = accounts.stream().filter(this::isEligible).toList();
        if (!available.isEmpty()) {
            SelectionStrategy strategy = strategies.get(settings.strategy());
            return Optional.of(new Selection(strategy.select(available, accounts, lastSelectedId), false));
        }
        if (!settings.autoFailover()) {
            return Optional.empty();
        }
        return accounts.stream()
                .filter(this::isEmergencyCandidate)
                .min(PRIORITY_ORDER)
                .map(a -> new Selection(a, true));
    }

    public long eligibleCount(List<Account> accounts) {
        return accounts.stream().filter(this::isEligible).count();
    }

    // ==================== 策略实现 ====================

    private static class PriorityStrategy implements SelectionStrategy {
        @Override
        public Account select(List<Account> available, List<Account> ordered, String lastSelectedId) {
            return available.stream().min(PRIORITY_ORDER).orElseThrow();
        }
    }

    /**
     * 严格按注册顺序循环，从上次选中账号的下一个位置继续，与优先级无关
     */
    private static class RoundRobinStrategy implements SelectionStrategy {
        @Override
        public Account select(List<Account> available, List<Account> ordered, String lastSelectedId) {
            Set<String> availableIds = new HashSet<>();
            for (Account a : available) {
                availableIds.add(a.id());
            }
            int lastPos = -1;
            for (int i = 0; i < ordered.size(); i++) {
                if (ordered.get(i).id().equals(lastSelectedId)) {
                    lastPos = i;
                    break;
                }
            }
            int n = ordered.size();
            for (int step = 1; step <= n; step++) {
                Account candidate = ordered.get(Math.floorMod(lastPos + step, n));
                if (availableIds.contains(candidate.id())) {
                    return candidate;
                }
            }
            return available.get(0);
        }
    }

    private static class LeastUsedStrategy implements SelectionStrategy {
        @Override
        public Account select(List<Account> available, List<Account> ordered, String lastSelectedId) {
            return available.stream()
                    .min(Comparator.comparing(Account::usedToday).thenComparing(PRIORITY_ORDER))
                    .orElseThrow();
        }
    }
}
