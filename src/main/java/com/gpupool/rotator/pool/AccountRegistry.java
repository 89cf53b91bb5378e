package com.gpupool.rotator.pool;

import com.gpupool.rotator.exception.AccountNotFoundException;
import com.gpupool.rotator.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 账号注册表
 * <p>
 * 账号的唯一持有者。保持插入顺序（轮询策略依赖该顺序），
 * 所有状态迁移都经过 {@link #transition} 并由 {@link AccountStatus} 的迁移表把关。
 * 本类不加锁，由调度器的锁串行化访问
 */
public class AccountRegistry {

    private static final Logger log = LoggerFactory.getLogger(AccountRegistry.class);
    private static final int MAX_NAME_LENGTH = 200;

    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private final AccountDefaults defaults;

    public AccountRegistry(AccountDefaults defaults) {
        this.defaults = defaults;
    }

    // ==================== CRUD ====================

    public Account add(AccountSpec spec, Instant now) {
        validate(spec, null);
        Account account = new Account(UUID.randomUUID().toString(), now);
        applySpec(account, spec);
        account.setLastResetDay(QuotaTracker.utcDay(now));
        accounts.put(account.id(), account);
        log.info("添加账号: id={}, name={}, provider={}", account.id(), account.name(), account.provider());
        return account;
    }

    /**
     * 整体替换配置属性，保留运行时状态和统计
     */
    public Account update(AccountSpec spec, Instant now) {
        if (spec == null || spec.id() == null) {
            throw new ValidationException("更新账号必须指定 id");
        }
        Account account = get(spec.id());
        validate(spec, spec.id());
        applySpec(account, spec);
        account.setUpdatedAt(now);
        log.info("更新账号: id={}, name={}", account.id(), account.name());
        return account;
    }

    public Account remove(String id) {
        Account removed = accounts.remove(id);
        if (removed == null) {
            throw new AccountNotFoundException(id);
        }
        log.info("删除账号: id={}, name={}", id, removed.name());
        return removed;
    }

    public Account get(String id) {
        Account account = id != null ? accounts.get(id) : null;
        if (account == null) {
            throw new AccountNotFoundException(id);
        }
        return account;
    }

    public Optional<Account> find(String id) {
        return Optional.ofNullable(id != null ? accounts.get(id) : null);
    }

    /**
     * 按注册顺序返回内部账号视图（仅供池内组件使用）
     */
    public List<Account> all() {
        return Collections.unmodifiableList(new ArrayList<>(accounts.values()));
    }

    public List<AccountSnapshot> snapshots() {
        List<AccountSnapshot> result = new ArrayList<>(accounts.size());
        for (Account a : accounts.values()) {
            result.add(a.snapshot());
        }
        return result;
    }

    public int size() {
        return accounts.size();
    }

    /**
     * 用持久化快照替换全部账号
     */
    public void restore(List<AccountSnapshot> snapshots) {
        accounts.clear();
        for (AccountSnapshot s : snapshots) {
            accounts.put(s.id(), Account.restore(s));
        }
    }

    // ==================== 状态迁移 ====================

    /**
     * 迁移账号状态，返回迁移前的状态；相同状态视为无操作
     *
     * @throws IllegalStateException 迁移表不允许的迁移
     */
    public AccountStatus transition(Account account, AccountStatus target, Instant now) {
        AccountStatus from = account.status();
        if (from == target) {
            return from;
        }
        if (!from.canTransitionTo(target)) {
            throw new IllegalStateException("非法状态迁移: " + account.name() + " " + from + " -> " + target);
        }
        if (from == AccountStatus.COOLDOWN) {
            account.setCooldown(null, null);
        }
        if (from == AccountStatus.RUNNING) {
            account.setSessionStartTime(null);
            account.setTelemetry(null);
        }
        if (target != AccountStatus.ERROR && target != AccountStatus.DISCONNECTED) {
            account.setNextRetryAt(null);
        }
        if (target == AccountStatus.RUNNING) {
            account.setSessionStartTime(now);
        }
        account.setStatus(target);
        account.setUpdatedAt(now);
        log.debug("账号状态迁移: {} {} -> {}", account.name(), from, target);
        return from;
    }

    /**
     * 进入冷却；冷却时长为 0 时直接回到 ACTIVE（无配额则 QUOTA_EXHAUSTED）
     */
    public AccountStatus startCooldown(Account account, CooldownCause cause, Duration cooldown, Instant now) {
        if (cooldown.isZero()) {
            return transition(account, account.hasQuota() ? AccountStatus.ACTIVE : AccountStatus.QUOTA_EXHAUSTED, now);
        }
        AccountStatus from = transition(account, AccountStatus.COOLDOWN, now);
        account.setCooldown(now.plus(cooldown), cause);
        return from;
    }

    /**
     * 冷却到期：有配额回到 ACTIVE，否则等待每日重置
     */
    public AccountStatus expireCooldown(Account account, Instant now) {
        return transition(account, account.hasQuota() ? AccountStatus.ACTIVE : AccountStatus.QUOTA_EXHAUSTED, now);
    }

    // ==================== 运行时记录 ====================

    public void markSessionStarted(Account account, Instant now) {
        account.incrementTotalSessions();
        account.setLastUsedAt(now);
        account.setUpdatedAt(now);
    }

    public void recordSuccess(Account account, Instant now) {
        account.recordSuccess();
        account.setLastUsedAt(now);
        account.setUpdatedAt(now);
    }

    /**
     * 记录一次失败，返回连续失败次数
     */
    public int recordFailure(Account account, String error, Instant now) {
        int consecutive = account.recordFailure(error);
        account.setUpdatedAt(now);
        return consecutive;
    }

    public void recordError(Account account, String error, Instant now) {
        account.setLastError(error);
        account.setUpdatedAt(now);
    }

    public void clearFailures(Account account, Instant now) {
        account.clearFailures();
        account.setUpdatedAt(now);
    }

    public void scheduleRetry(Account account, Instant at) {
        account.setNextRetryAt(at);
    }

    public void updateTelemetry(Account account, ResourceTelemetry telemetry, Instant now) {
        if (account.status() != AccountStatus.RUNNING) {
            return;
        }
        account.setTelemetry(telemetry);
        account.setUpdatedAt(now);
    }

    public void recordReboot(Account account, Instant now) {
        account.incrementReboots();
        account.setUpdatedAt(now);
    }

    // ==================== 校验 ====================

    private void applySpec(Account account, AccountSpec spec) {
        String name = spec.name().trim();
        account.applyConfig(
                name,
                spec.displayName() != null && !spec.displayName().isBlank() ? spec.displayName().trim() : name,
                spec.provider() != null ? spec.provider() : defaults.provider(),
                spec.tier() != null ? spec.tier() : defaults.tier(),
                spec.priority() != null ? spec.priority() : defaults.priority(),
                spec.enabled() == null || spec.enabled(),
                spec.emergency() != null && spec.emergency(),
                spec.endpoint() != null && !spec.endpoint().isBlank() ? spec.endpoint().trim() : null,
                spec.dailyQuota() != null ? spec.dailyQuota() : defaults.dailyQuota(),
                spec.maxSessionTime() != null ? spec.maxSessionTime() : defaults.maxSessionTime());
    }

    private void validate(AccountSpec spec, String selfId) {
        if (spec == null || spec.name() == null || spec.name().isBlank()) {
            throw new ValidationException("账号名称不能为空");
        }
        String name = spec.name().trim();
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("账号名称过长: " + name.length());
        }
        for (Account other : accounts.values()) {
            if (!other.id().equals(selfId) && other.name().equalsIgnoreCase(name)) {
                throw new ValidationException("账号已存在: " + name);
            }
        }
        if (spec.priority() != null && spec.priority() < 0) {
            throw new ValidationException("优先级不能为负数: " + spec.priority());
        }
        requirePositive(spec.dailyQuota(), "dailyQuota");
        requirePositive(spec.maxSessionTime(), "maxSessionTime");
        if (spec.endpoint() != null && !spec.endpoint().isBlank()) {
            validateEndpoint(spec.endpoint().trim());
        }
    }

    private static void requirePositive(Duration value, String field) {
        if (value != null && (value.isZero() || value.isNegative())) {
            throw new ValidationException(field + " 必须大于 0");
        }
    }

    private static void validateEndpoint(String endpoint) {
        try {
            URI uri = URI.create(endpoint);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ValidationException("节点地址必须是 http(s) URL: " + endpoint);
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException("节点地址格式错误: " + endpoint);
        }
    }
}
