package com.gpupool.rotator.scheduler;

import com.gpupool.rotator.event.EventLog;
import com.gpupool.rotator.event.PoolEvent;
import com.gpupool.rotator.event.PoolEventBus;
import com.gpupool.rotator.event.PoolEventListener;
import com.gpupool.rotator.event.PoolEventType;
import com.gpupool.rotator.event.PoolTopic;
import com.gpupool.rotator.event.Severity;
import com.gpupool.rotator.exception.IneligibleAccountException;
import com.gpupool.rotator.exception.ProvisioningException;
import com.gpupool.rotator.exception.ValidationException;
import com.gpupool.rotator.pool.Account;
import com.gpupool.rotator.pool.AccountRegistry;
import com.gpupool.rotator.pool.AccountSelector;
import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.pool.AccountSpec;
import com.gpupool.rotator.pool.AccountStatus;
import com.gpupool.rotator.pool.CooldownCause;
import com.gpupool.rotator.pool.PoolSettings;
import com.gpupool.rotator.pool.QuotaTracker;
import com.gpupool.rotator.pool.Selection;
import com.gpupool.rotator.pool.Session;
import com.gpupool.rotator.pool.SessionMonitor;
import com.gpupool.rotator.pool.SwitchReason;
import com.gpupool.rotator.provision.FailurePolicy;
import com.gpupool.rotator.provision.OperationKind;
import com.gpupool.rotator.provision.ProvisionResult;
import com.gpupool.rotator.provision.ProvisioningExecutor;
import com.gpupool.rotator.store.PoolSnapshot;
import com.gpupool.rotator.store.PoolStore;
import com.gpupool.rotator.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 账号池调度器
 * <p>
 * 持有全部池状态，是唯一的对外入口：
 * - tick 驱动配额累计、每日重置、冷却到期、故障复查、切换判断
 * - Provisioner 调用异步执行，结果在下一个 tick 开头应用
 * - 事件在持锁状态下按提交顺序记录和分发
 */
public class RotationScheduler {

    private static final Logger log = LoggerFactory.getLogger(RotationScheduler.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final AccountRegistry registry;
    private final QuotaTracker quotaTracker;
    private final SessionMonitor monitor;
    private final AccountSelector selector = new AccountSelector();
    private final FailurePolicy failurePolicy = new FailurePolicy();
    private final ProvisioningExecutor provisioning;
    private final PoolStore store;
    private final EventLog eventLog;
    private final PoolEventBus eventBus;
    private final Metrics metrics;
    private final PoolSettings defaultSettings;

    // 进行中的 Provisioner 操作（每个账号最多一个），结果按 opId 匹配
    private final Map<String, PendingOp> pending = new HashMap<>();
    private final Queue<Outcome> outcomes = new ConcurrentLinkedQueue<>();
    private final AtomicLong opSeq = new AtomicLong();
    // 同一账号的开通和释放按提交顺序串行执行，释放总是排在仍在进行的开通之后
    private final Map<String, CompletableFuture<ProvisionResult>> lifecycle = new ConcurrentHashMap<>();

    private PoolSettings settings;
    private Session current;
    private boolean connected;
    private Instant accruedUntil;
    private Instant nextHealthCheckAt;
    private boolean engaged;
    private String lastSelectedId;
    private String prestartId;
    private boolean prestartReady;
    private boolean exhaustedEpisode;
    private boolean dirty;
    private long eventSeq;

    public RotationScheduler(Clock clock, AccountRegistry registry, ProvisioningExecutor provisioning,
                             PoolStore store, EventLog eventLog, PoolEventBus eventBus, Metrics metrics,
                             PoolSettings defaultSettings) {
        this.clock = clock;
        this.registry = registry;
        this.quotaTracker = new QuotaTracker(registry);
        this.monitor = new SessionMonitor(quotaTracker);
        this.provisioning = provisioning;
        this.store = store;
        this.eventLog = eventLog;
        this.eventBus = eventBus;
        this.metrics = metrics;
        defaultSettings.validate();
        this.defaultSettings = defaultSettings;
        this.settings = defaultSettings;
    }

    // ==================== 启动加载 / 保存 ====================

    /**
     * 从存储加载账号和设置；残留的 RUNNING 状态恢复为 ACTIVE
     */
    public void load() {
        lock.lock();
        try {
            Instant now = clock.instant();
            PoolSnapshot snapshot;
            try {
                snapshot = store.loadPool();
            } catch (RuntimeException e) {
                log.error("加载账号池失败, 以空池启动", e);
                snapshot = PoolSnapshot.empty();
            }
            registry.restore(snapshot.accounts());
            settings = snapshot.settings() != null ? snapshot.settings() : defaultSettings;
            for (Account a : registry.all()) {
                if (a.status() == AccountStatus.RUNNING) {
                    registry.transition(a, AccountStatus.ACTIVE, now);
                    dirty = true;
                }
            }
            log.info("账号池已加载: {} 个账号, 策略={}", registry.size(), settings.strategy());
        } finally {
            lock.unlock();
        }
    }

    public void save() {
        lock.lock();
        try {
            persist();
        } finally {
            lock.unlock();
        }
    }

    // ==================== tick ====================

    public void tick() {
        tick(clock.instant());
    }

    /**
     * 唯一的时间驱动入口
     */
    public void tick(Instant now) {
        lock.lock();
        try {
            drainOutcomes(now);
            accrueCurrent(now);
            for (Account a : registry.all()) {
                applyDailyReset(a, now);
            }
            for (Account a : registry.all()) {
                expireCooldown(a, now);
                scheduleRetryCheck(a, now);
            }
            if (current != null) {
                evaluateCurrent(now);
            }
            if (engaged && current == null) {
                acquire(now, null);
            }
            updateGauges();
            if (dirty) {
                persist();
            }
        } finally {
            lock.unlock();
        }
    }

    private void drainOutcomes(Instant now) {
        Outcome outcome;
        while ((outcome = outcomes.poll()) != null) {
            applyOutcome(outcome, now);
        }
    }

    private void applyDailyReset(Account a, Instant now) {
        applyDailyReset(a, now, now);
    }

    /**
     * @param resetAt 判定日期用的时间点，跨日累计时为当天零点
     */
    private void applyDailyReset(Account a, Instant resetAt, Instant now) {
        AccountStatus before = quotaTracker.resetIfDue(a, resetAt);
        if (before == null) {
            return;
        }
        emit(event(PoolEventType.QUOTA_RESET, a).message("每日配额已重置"), now);
        if (before != a.status()) {
            emit(event(PoolEventType.STATUS_CHANGED, a).statusChange(before, a.status())
                    .message("配额重置后恢复可用"), now);
        }
        dirty = true;
    }

    private void expireCooldown(Account a, Instant now) {
        if (a.status() != AccountStatus.COOLDOWN || a.cooldownUntil() == null || now.isBefore(a.cooldownUntil())) {
            return;
        }
        AccountStatus from = registry.expireCooldown(a, now);
        emit(event(PoolEventType.STATUS_CHANGED, a).statusChange(from, a.status()).message("冷却结束"), now);
        dirty = true;
    }

    private void scheduleRetryCheck(Account a, Instant now) {
        boolean failed = a.status() == AccountStatus.ERROR || a.status() == AccountStatus.DISCONNECTED;
        if (!failed || !a.enabled() || a.nextRetryAt() == null || now.isBefore(a.nextRetryAt())
                || pending.containsKey(a.id())) {
            return;
        }
        registry.scheduleRetry(a, null);
        log.info("故障账号健康复查: {} (连续失败 {} 次)", a.label(), a.consecutiveFailures());
        submitTracked(OperationKind.RETRY, a);
    }

    private void evaluateCurrent(Instant now) {
        Account a = registry.find(current.accountId()).orElse(null);
        if (a == null) {
            current = null;
            return;
        }
        boolean normalAvailable = current.emergency() && selector.eligibleCount(registry.all()) > 0;
        Optional<SwitchReason> reason = monitor.evaluate(current, a, settings, now, normalAvailable);
        if (reason.isPresent()) {
            switchFrom(a, reason.get(), now);
            return;
        }
        if (settings.autoPrestart() && !current.emergency()
                && monitor.timeUntilSwitch(current, a, now).compareTo(settings.prestartLeadTime()) <= 0) {
            prestart(now);
        }
        if (!now.isBefore(nextHealthCheckAt) && !pending.containsKey(a.id())) {
            nextHealthCheckAt = now.plus(settings.healthCheckInterval());
            submitTracked(OperationKind.HEALTH, a);
        }
    }

    // ==================== 切换 ====================

    /**
     * 一个 tick 最多切换一次；软条件（低配额、交还应急账号）无可替换账号时保持当前会话
     */
    private void switchFrom(Account outgoing, SwitchReason reason, Instant now) {
        Optional<Selection> next = pickNext();
        String nextId = next.map(s -> s.account().id()).orElse(null);
        emit(event(PoolEventType.SWITCH_REQUIRED, outgoing)
                .severity(reason.isHard() ? Severity.WARNING : Severity.INFO)
                .related(nextId)
                .reason(reason.name())
                .message(next.map(s -> "需要切换到 " + s.account().label()).orElse("需要切换, 暂无可用账号")), now);

        if (!reason.isHard() && next.isEmpty()) {
            log.info("低配额但没有可替换账号, 保持当前会话: {}", outgoing.label());
            return;
        }

        switch (reason) {
            case QUOTA_EXHAUSTED -> closeSession(outgoing, null, CooldownCause.QUOTA_EXHAUSTED, now, "配额耗尽");
            case SESSION_LIMIT -> closeSession(outgoing, null, CooldownCause.SESSION_LIMIT, now, "会话达到上限");
            case LOW_QUOTA -> closeSession(outgoing, null, CooldownCause.LOW_QUOTA, now, "配额偏低提前轮换");
            case ACCOUNT_DISABLED -> closeSession(outgoing, AccountStatus.ACTIVE, null, now, "账号已禁用");
            case NORMAL_AVAILABLE -> closeSession(outgoing, AccountStatus.ACTIVE, null, now, "正常账号已恢复, 交还应急账号");
        }

        if (next.isPresent()) {
            activate(next.get(), outgoing, now);
        } else {
            acquire(now, outgoing);
        }
    }

    /**
     * 已预热且仍满足资格的候选优先，其次是选择器的结果
     */
    private Optional<Selection> pickNext() {
        if (prestartId != null) {
            Optional<Account> warm = registry.find(prestartId).filter(selector::isEligible);
            if (warm.isPresent()) {
                return Optional.of(new Selection(warm.get(), false));
            }
        }
        return selector.select(registry.all(), settings, lastSelectedId);
    }

    private boolean acquire(Instant now, Account previous) {
        Optional<Selection> selection = pickNext();
        if (selection.isEmpty()) {
            if (!exhaustedEpisode) {
                exhaustedEpisode = true;
                PoolEvent.Builder b = PoolEvent.builder(PoolEventType.POOL_EXHAUSTED)
                        .severity(Severity.CRITICAL)
                        .message("没有可用的计算账号");
                if (previous != null) {
                    b.related(previous.id());
                }
                emit(b, now);
            }
            return false;
        }
        activate(selection.get(), previous, now);
        return true;
    }

    private void activate(Selection selection, Account previous, Instant now) {
        Account a = selection.account();
        if (prestartId != null && !prestartId.equals(a.id())) {
            cancelPrestart();
        }
        boolean warm = a.id().equals(prestartId);
        boolean warmReady = warm && prestartReady;
        prestartId = null;
        prestartReady = false;

        move(a, AccountStatus.RUNNING, now, selection.emergency() ? "应急接管" : "成为当前会话");
        registry.markSessionStarted(a, now);
        current = new Session(UUID.randomUUID().toString(), a.id(), now, selection.emergency());
        connected = warmReady;
        accruedUntil = now;
        nextHealthCheckAt = now.plus(settings.healthCheckInterval());
        lastSelectedId = a.id();
        exhaustedEpisode = false;
        dirty = true;

        emit(event(PoolEventType.SESSION_STARTED, a).message("会话开始"), now);
        if (previous != null) {
            emit(event(PoolEventType.ACCOUNT_ROTATED, previous).related(a.id())
                    .message("轮换: " + previous.label() + " -> " + a.label()), now);
        }
        if (selection.emergency()) {
            emit(event(PoolEventType.EMERGENCY_ACTIVATED, a).severity(Severity.CRITICAL)
                    .message("账号池耗尽, 启用应急账号"), now);
        }
        if (warmReady) {
            emit(event(PoolEventType.CONNECTED, a).message("使用已预热的节点"), now);
        } else if (!warm) {
            submitTracked(OperationKind.START, a);
        }
        log.info("当前会话: {} (emergency={}, warm={})", a.label(), selection.emergency(), warm);
    }

    /**
     * 结束当前会话并迁移出 RUNNING；cause 不为空时进入冷却
     */
    private void closeSession(Account a, AccountStatus target, CooldownCause cause, Instant now, String reason) {
        pending.remove(a.id());
        detachSession(a, now, reason);
        if (cause != null) {
            AccountStatus from = registry.startCooldown(a, cause, settings.cooldown(), now);
            emit(event(PoolEventType.STATUS_CHANGED, a).statusChange(from, a.status())
                    .reason(cause.name()).message(reason), now);
            dirty = true;
        } else {
            move(a, target, now, reason);
        }
        stopRemote(a);
    }

    private void detachSession(Account a, Instant now, String reason) {
        Session ended = current;
        current = null;
        connected = false;
        monitor.sessionEnded(ended.sessionId());
        emit(event(PoolEventType.SESSION_ENDED, a)
                .message(reason + ", 时长 " + formatDuration(ended.duration(now))), now);
    }

    private void accrueCurrent(Instant now) {
        if (current == null || !now.isAfter(accruedUntil)) {
            return;
        }
        Account a = registry.find(current.accountId()).orElse(null);
        if (a == null) {
            return;
        }
        // 跨 UTC 零点时按日切分，零点后的部分计入新的一天
        Instant from = accruedUntil;
        LocalDate day = QuotaTracker.utcDay(from);
        while (day.isBefore(QuotaTracker.utcDay(now))) {
            Instant midnight = day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            accrue(a, Duration.between(from, midnight), now);
            applyDailyReset(a, midnight, now);
            from = midnight;
            day = day.plusDays(1);
        }
        accrue(a, Duration.between(from, now), now);
        accruedUntil = now;
    }

    private void accrue(Account a, Duration elapsed, Instant now) {
        QuotaTracker.Accrual accrual = quotaTracker.accrue(a, elapsed, settings.lowQuotaThresholdPercent());
        dirty = true;
        if (accrual.crossedLow()) {
            emit(event(PoolEventType.QUOTA_WARNING, a).severity(Severity.WARNING)
                    .message(String.format("剩余配额 %.1f%%", quotaTracker.percentRemaining(a))), now);
        }
        if (accrual.crossedZero()) {
            emit(event(PoolEventType.QUOTA_EXCEEDED, a).severity(Severity.WARNING)
                    .message("今日配额已用完"), now);
        } else if (accrual.hasOverflow() && !current.emergency()) {
            emit(event(PoolEventType.QUOTA_EXCEEDED, a).severity(Severity.WARNING)
                    .message("超出配额运行 " + formatDuration(accrual.overflow())), now);
        }
    }

    // ==================== 预热 ====================

    private Optional<Account> prestart(Instant now) {
        Optional<Selection> selection = selector.select(registry.all(), settings, lastSelectedId);
        if (selection.isEmpty() || selection.get().emergency()) {
            return Optional.empty();
        }
        Account candidate = selection.get().account();
        if (candidate.id().equals(prestartId)) {
            return Optional.of(candidate);
        }
        if (prestartId != null) {
            cancelPrestart();
        }
        prestartId = candidate.id();
        prestartReady = false;
        PoolEvent.Builder b = event(PoolEventType.PRESTART_TRIGGERED, candidate).message("预热下一个候选");
        if (current != null) {
            b.related(current.accountId());
        }
        emit(b, now);
        submitTracked(OperationKind.PRESTART, candidate);
        return Optional.of(candidate);
    }

    private void cancelPrestart() {
        String id = prestartId;
        prestartId = null;
        prestartReady = false;
        PendingOp op = pending.get(id);
        if (op != null && op.kind() == OperationKind.PRESTART) {
            pending.remove(id);
        }
        registry.find(id).ifPresent(a -> {
            log.info("取消过期的预热: {}", a.label());
            stopRemote(a);
        });
    }

    // ==================== Provisioner 结果 ====================

    private void submitTracked(OperationKind kind, Account a) {
        AccountSnapshot snapshot = a.snapshot();
        CompletableFuture<ProvisionResult> future = kind == OperationKind.START || kind == OperationKind.PRESTART
                ? sequenced(a.id(), () -> provisioning.submit(kind, snapshot))
                : provisioning.submit(kind, snapshot);
        track(kind, a.id(), future);
    }

    /**
     * 排在该账号上一个开通/释放操作之后提交；前一个已完成时直接提交
     */
    private CompletableFuture<ProvisionResult> sequenced(String accountId,
                                                         Supplier<CompletableFuture<ProvisionResult>> call) {
        CompletableFuture<ProvisionResult> previous = lifecycle.get(accountId);
        CompletableFuture<ProvisionResult> future = previous == null || previous.isDone()
                ? call.get()
                : previous.thenCompose(ignored -> call.get());
        lifecycle.put(accountId, future);
        future.whenComplete((result, ex) -> lifecycle.remove(accountId, future));
        return future;
    }

    private void track(OperationKind kind, String accountId, CompletableFuture<ProvisionResult> future) {
        long opId = opSeq.incrementAndGet();
        pending.put(accountId, new PendingOp(opId, kind));
        future.thenAccept(result -> outcomes.add(new Outcome(opId, accountId, kind, result)));
    }

    /**
     * 释放远端会话；已取消但仍在进行的开通完成后才会执行
     */
    private void stopRemote(Account a) {
        AccountSnapshot snapshot = a.snapshot();
        sequenced(a.id(), () -> provisioning.submit(OperationKind.STOP, snapshot));
    }

    private void applyOutcome(Outcome outcome, Instant now) {
        PendingOp op = pending.get(outcome.accountId());
        if (op == null || op.opId() != outcome.opId()) {
            log.debug("丢弃过期的 Provisioner 结果: op={}, account={}", outcome.kind(), outcome.accountId());
            return;
        }
        pending.remove(outcome.accountId());
        Account a = registry.find(outcome.accountId()).orElse(null);
        if (a == null) {
            return;
        }
        boolean isCurrent = current != null && current.accountId().equals(a.id());
        ProvisionResult result = outcome.result();
        switch (outcome.kind()) {
            case START, PRESTART -> {
                if (isCurrent) {
                    onSessionStarted(a, result, now);
                } else if (a.id().equals(prestartId)) {
                    onPrestarted(a, result, now);
                }
            }
            case HEALTH -> {
                if (isCurrent) {
                    onHealthChecked(a, result, now);
                }
            }
            case RETRY -> onRetryChecked(a, result, now);
            default -> log.debug("忽略 Provisioner 结果: {}", outcome.kind());
        }
    }

    private void onSessionStarted(Account a, ProvisionResult result, Instant now) {
        if (result.success()) {
            connected = true;
            registry.clearFailures(a, now);
            if (result.telemetry() != null) {
                registry.updateTelemetry(a, result.telemetry(), now);
            }
            emit(event(PoolEventType.CONNECTED, a).message("节点已就绪"), now);
            dirty = true;
        } else {
            applyFailure(a, result.message(), result.fatal(), AccountStatus.ERROR, now);
        }
    }

    private void onPrestarted(Account a, ProvisionResult result, Instant now) {
        if (result.success()) {
            prestartReady = true;
            log.info("预热完成: {}", a.label());
        } else {
            prestartId = null;
            prestartReady = false;
            applyFailure(a, result.message(), result.fatal(), AccountStatus.ERROR, now);
        }
    }

    private void onHealthChecked(Account a, ProvisionResult result, Instant now) {
        if (result.success()) {
            if (result.telemetry() != null) {
                registry.updateTelemetry(a, result.telemetry(), now);
                dirty = true;
            }
            return;
        }
        emit(event(PoolEventType.DISCONNECTED, a).severity(Severity.WARNING).message(result.message()), now);
        applyFailure(a, result.message(), result.fatal(), AccountStatus.DISCONNECTED, now);
    }

    private void onRetryChecked(Account a, ProvisionResult result, Instant now) {
        if (a.status() != AccountStatus.ERROR && a.status() != AccountStatus.DISCONNECTED) {
            return;
        }
        if (result.success()) {
            AccountStatus from = a.status();
            registry.clearFailures(a, now);
            move(a, AccountStatus.ACTIVE, now, "健康复查通过");
            emit(event(PoolEventType.ACCOUNT_RECOVERED, a).statusChange(from, AccountStatus.ACTIVE)
                    .message("自动恢复"), now);
        } else {
            applyFailure(a, result.message(), result.fatal(), AccountStatus.ERROR, now);
        }
    }

    /**
     * 失败计入预算：未超预算进入 ERROR/DISCONNECTED 并安排复查，超预算或致命错误挂起
     */
    private void applyFailure(Account a, String error, boolean fatal, AccountStatus failureStatus, Instant now) {
        int consecutive = registry.recordFailure(a, error, now);
        int budget = settings.maxConsecutiveFailures();
        boolean suspend = failurePolicy.shouldSuspend(consecutive, fatal, budget);
        boolean wasCurrent = current != null && current.accountId().equals(a.id());

        pending.remove(a.id());
        if (wasCurrent) {
            detachSession(a, now, "节点故障");
        }
        if (a.id().equals(prestartId)) {
            prestartId = null;
            prestartReady = false;
        }

        AccountStatus target = suspend ? AccountStatus.SUSPENDED : failureStatus;
        if (target == AccountStatus.DISCONNECTED && a.status() != AccountStatus.RUNNING) {
            target = AccountStatus.ERROR;
        }
        if (a.status().canTransitionTo(target)) {
            move(a, target, now, error);
        } else if (a.status() != target) {
            log.warn("账号失败但无法迁移状态: {} {} -> {}", a.label(), a.status(), target);
        }
        if (!suspend && (a.status() == AccountStatus.ERROR || a.status() == AccountStatus.DISCONNECTED)) {
            registry.scheduleRetry(a, now.plus(failurePolicy.retryDelay(settings.errorRetryDelay(), consecutive)));
        }

        emit(event(PoolEventType.ERROR, a)
                .severity(failurePolicy.severity(consecutive, suspend, budget))
                .reason(suspend ? AccountStatus.SUSPENDED.name() : null)
                .message(error + " (连续失败 " + consecutive + "/" + budget + ")"), now);
        if (suspend) {
            log.warn("账号已挂起: {}, fatal={}, 连续失败 {} 次", a.label(), fatal, consecutive);
        }
        if (wasCurrent) {
            stopRemote(a);
        }
        dirty = true;
    }

    // ==================== 命令 ====================

    public AccountSnapshot addAccount(AccountSpec spec) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Account a = registry.add(spec, now);
            emit(event(PoolEventType.ACCOUNT_ADDED, a).message("添加账号"), now);
            dirty = true;
            persist();
            return a.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 配置整体替换，运行时状态保留；禁用当前账号在下一个 tick 生效
     */
    public AccountSnapshot updateAccount(AccountSpec spec) {
        lock.lock();
        try {
            Account a = registry.update(spec, clock.instant());
            dirty = true;
            persist();
            return a.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public void removeAccount(String id) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Account a = registry.get(id);
            if (isCurrent(a)) {
                accrueCurrent(now);
                closeSession(a, AccountStatus.ACTIVE, null, now, "账号已删除");
            }
            if (id.equals(prestartId)) {
                cancelPrestart();
            }
            pending.remove(id);
            registry.remove(id);
            emit(event(PoolEventType.ACCOUNT_REMOVED, a).message("删除账号"), now);
            dirty = true;
            persist();
        } finally {
            lock.unlock();
        }
    }

    public PoolSettings updateSettings(PoolSettings newSettings) {
        if (newSettings == null) {
            throw new ValidationException("设置不能为空");
        }
        newSettings.validate();
        lock.lock();
        try {
            Instant now = clock.instant();
            settings = newSettings;
            emit(PoolEvent.builder(PoolEventType.SETTINGS_UPDATED)
                    .message("策略=" + newSettings.strategy() + ", 冷却=" + formatDuration(newSettings.cooldown())), now);
            dirty = true;
            persist();
            return settings;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 手动切换；force 可越过资格检查，但不能越过挂起和禁用
     */
    public AccountSnapshot setActive(String id, boolean force) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Account a = registry.get(id);
            if (isCurrent(a)) {
                return a.snapshot();
            }
            if (a.status() == AccountStatus.SUSPENDED || !a.enabled()) {
                throw new IneligibleAccountException(id, a.status(), "账号已挂起或禁用: " + a.label());
            }
            if (force ? !a.status().canTransitionTo(AccountStatus.RUNNING) : !selector.isEligible(a)) {
                throw new IneligibleAccountException(id, a.status(),
                        "账号不满足切换条件: " + a.label() + " (" + a.status() + ")");
            }
            Account previous = null;
            if (current != null) {
                previous = registry.get(current.accountId());
                accrueCurrent(now);
                closeSession(previous, AccountStatus.ACTIVE, null, now, "手动切换");
            }
            engaged = true;
            activate(new Selection(a, a.emergency()), previous, now);
            persist();
            return a.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 开启自动轮换并立即尝试获取会话
     */
    public Optional<SessionInfo> startSession() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (!engaged) {
                log.info("开启自动轮换");
            }
            engaged = true;
            if (current == null) {
                acquire(now, null);
            }
            if (dirty) {
                persist();
            }
            return sessionInfo(now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 结束当前会话（不冷却）并关闭自动轮换
     */
    public Optional<AccountSnapshot> endSession() {
        lock.lock();
        try {
            Instant now = clock.instant();
            engaged = false;
            if (prestartId != null) {
                cancelPrestart();
            }
            if (current == null) {
                return Optional.empty();
            }
            Account a = registry.get(current.accountId());
            accrueCurrent(now);
            closeSession(a, AccountStatus.ACTIVE, null, now, "手动结束");
            log.info("关闭自动轮换, 会话已结束: {}", a.label());
            persist();
            return Optional.of(a.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public AccountSnapshot pauseAccount(String id) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Account a = registry.get(id);
            if (a.status() != AccountStatus.RUNNING) {
                throw new IneligibleAccountException(id, a.status(), "只能暂停运行中的账号: " + a.label());
            }
            accrueCurrent(now);
            closeSession(a, AccountStatus.PAUSED, null, now, "手动暂停");
            persist();
            return a.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public AccountSnapshot resumeAccount(String id) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Account a = registry.get(id);
            if (a.status() != AccountStatus.PAUSED) {
                throw new IneligibleAccountException(id, a.status(), "账号未暂停: " + a.label());
            }
            move(a, AccountStatus.ACTIVE, now, "手动恢复");
            persist();
            return a.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 重启当前会话的节点，会话本身保持不变
     */
    public AccountSnapshot restartSession() {
        lock.lock();
        try {
            Instant now = clock.instant();
            if (current == null) {
                throw new IneligibleAccountException(null, null, "当前没有运行中的会话");
            }
            Account a = registry.get(current.accountId());
            registry.recordReboot(a, now);
            connected = false;
            emit(event(PoolEventType.REBOOTING, a).severity(Severity.WARNING)
                    .message("重启节点, 第 " + a.rebootCount() + " 次"), now);
            AccountSnapshot snapshot = a.snapshot();
            track(OperationKind.START, a.id(), sequenced(a.id(), () -> provisioning.restart(snapshot)));
            dirty = true;
            persist();
            return a.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 健康检查通过后恢复为 ACTIVE；检查在锁外同步执行
     *
     * @throws ProvisioningException 健康检查失败，账号状态不变
     */
    public AccountSnapshot recoverAccount(String id, boolean force) {
        AccountSnapshot target;
        lock.lock();
        try {
            Account a = registry.get(id);
            checkRecoverable(a, force);
            target = a.snapshot();
        } finally {
            lock.unlock();
        }

        ProvisionResult result = provisioning.runNow(OperationKind.RECOVER, target);

        lock.lock();
        try {
            Instant now = clock.instant();
            Account a = registry.get(id);
            if (a.status() == AccountStatus.ACTIVE) {
                return a.snapshot();
            }
            checkRecoverable(a, force);
            if (!result.success()) {
                registry.recordError(a, result.message(), now);
                emit(event(PoolEventType.ERROR, a).severity(Severity.WARNING)
                        .message("恢复失败: " + result.message()), now);
                dirty = true;
                persist();
                throw new ProvisioningException(id, "恢复失败: " + result.message(), result.fatal());
            }
            AccountStatus from = a.status();
            pending.remove(id);
            registry.clearFailures(a, now);
            move(a, AccountStatus.ACTIVE, now, "手动恢复");
            emit(event(PoolEventType.ACCOUNT_RECOVERED, a).statusChange(from, AccountStatus.ACTIVE)
                    .message(force ? "强制恢复" : "手动恢复"), now);
            persist();
            return a.snapshot();
        } finally {
            lock.unlock();
        }
    }

    private static void checkRecoverable(Account a, boolean force) {
        switch (a.status()) {
            case ERROR, DISCONNECTED, SUSPENDED -> {
            }
            case COOLDOWN, QUOTA_EXHAUSTED, PAUSED -> {
                if (!force) {
                    throw new IneligibleAccountException(a.id(), a.status(),
                            "账号处于 " + a.status() + ", 需要 force 才能恢复");
                }
            }
            default -> throw new IneligibleAccountException(a.id(), a.status(),
                    "账号无需恢复: " + a.label() + " (" + a.status() + ")");
        }
    }

    public AccountSnapshot resetDailyQuota(String id) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Account a = registry.get(id);
            resetQuota(a, now);
            persist();
            return a.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public int resetAllDailyQuotas() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<Account> all = registry.all();
            for (Account a : all) {
                resetQuota(a, now);
            }
            log.info("手动重置全部配额: {} 个账号", all.size());
            persist();
            return all.size();
        } finally {
            lock.unlock();
        }
    }

    private void resetQuota(Account a, Instant now) {
        AccountStatus before = quotaTracker.reset(a, now);
        emit(event(PoolEventType.QUOTA_RESET, a).message("手动重置配额"), now);
        if (before != a.status()) {
            emit(event(PoolEventType.STATUS_CHANGED, a).statusChange(before, a.status())
                    .message("配额重置后恢复可用"), now);
        }
        dirty = true;
    }

    public void recordTaskStarted(String id) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Account a = registry.get(id);
            emit(event(PoolEventType.TASK_STARTED, a).message("任务开始"), now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 任务失败消耗失败预算，达到上限挂起
     */
    public AccountSnapshot recordTaskResult(String id, boolean success, String message) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Account a = registry.get(id);
            if (success) {
                registry.recordSuccess(a, now);
                emit(event(PoolEventType.TASK_COMPLETED, a).message(message != null ? message : "任务完成"), now);
            } else {
                String error = message != null ? message : "任务失败";
                int consecutive = registry.recordFailure(a, error, now);
                int budget = settings.maxConsecutiveFailures();
                boolean suspend = failurePolicy.shouldSuspend(consecutive, false, budget)
                        && a.status().canTransitionTo(AccountStatus.SUSPENDED);
                emit(event(PoolEventType.TASK_FAILED, a)
                        .severity(failurePolicy.severity(consecutive, suspend, budget))
                        .message(error + " (连续失败 " + consecutive + "/" + budget + ")"), now);
                if (suspend) {
                    if (isCurrent(a)) {
                        accrueCurrent(now);
                        pending.remove(a.id());
                        detachSession(a, now, "连续任务失败");
                        stopRemote(a);
                    }
                    if (a.id().equals(prestartId)) {
                        cancelPrestart();
                    }
                    move(a, AccountStatus.SUSPENDED, now, "连续失败 " + consecutive + " 次");
                }
            }
            dirty = true;
            persist();
            return a.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 预热当前首选候选（不含当前账号）；同一候选重复调用无效果
     */
    public Optional<AccountSnapshot> prestartNext() {
        lock.lock();
        try {
            return prestart(clock.instant()).map(Account::snapshot);
        } finally {
            lock.unlock();
        }
    }

    // ==================== 查询 ====================

    public PoolStatus getPoolStatus() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<Account> all = registry.all();
            int available = 0, running = 0, cooldown = 0, quotaExhausted = 0, error = 0;
            int suspended = 0, paused = 0, disabled = 0, emergencyReady = 0;
            for (Account a : all) {
                if (selector.isEligible(a)) available++;
                if (selector.isEmergencyCandidate(a)) emergencyReady++;
                if (!a.enabled()) disabled++;
                switch (a.status()) {
                    case RUNNING -> running++;
                    case COOLDOWN -> cooldown++;
                    case QUOTA_EXHAUSTED -> quotaExhausted++;
                    case ERROR, DISCONNECTED -> error++;
                    case SUSPENDED -> suspended++;
                    case PAUSED -> paused++;
                    default -> {
                    }
                }
            }
            boolean poolAvailable = current != null || available > 0
                    || (settings.autoFailover() && emergencyReady > 0);
            return new PoolStatus(all.size(), available, running, cooldown, quotaExhausted, error, suspended,
                    paused, disabled, emergencyReady, poolAvailable, engaged, settings.strategy(),
                    sessionInfo(now).orElse(null), prestartId);
        } finally {
            lock.unlock();
        }
    }

    public List<AccountSnapshot> getAllAccounts() {
        lock.lock();
        try {
            return registry.snapshots();
        } finally {
            lock.unlock();
        }
    }

    public AccountSnapshot getAccount(String id) {
        lock.lock();
        try {
            return registry.get(id).snapshot();
        } finally {
            lock.unlock();
        }
    }

    public PoolSettings getSettings() {
        lock.lock();
        try {
            return settings;
        } finally {
            lock.unlock();
        }
    }

    public PoolStats getStats() {
        lock.lock();
        try {
            Instant now = clock.instant();
            long sessions = 0, success = 0, failures = 0;
            Duration used = Duration.ZERO;
            Duration remaining = Duration.ZERO;
            for (Account a : registry.all()) {
                sessions += a.totalSessions();
                success += a.successCount();
                failures += a.failureCount();
                used = used.plus(a.usedToday());
                if (!a.emergency()) {
                    remaining = remaining.plus(a.remainingQuota());
                }
            }
            double rate = success + failures == 0 ? 100.0 : success * 100.0 / (success + failures);
            Instant nextSwitch = sessionInfo(now).map(s -> now.plus(s.timeUntilSwitch())).orElse(null);
            return new PoolStats(eventLog.total(), eventLog.countsByType(), eventLog.countsBySeverity(),
                    eventLog.count(PoolEventType.ACCOUNT_ROTATED),
                    eventLog.count(PoolEventType.EMERGENCY_ACTIVATED),
                    eventLog.count(PoolEventType.POOL_EXHAUSTED),
                    sessions, success, failures, rate, used, remaining, nextSwitch);
        } finally {
            lock.unlock();
        }
    }

    public List<PoolEvent> getRecentEvents(int n) {
        return eventLog.recent(Math.max(0, n));
    }

    public Optional<SessionInfo> currentSession() {
        lock.lock();
        try {
            return sessionInfo(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public boolean isEngaged() {
        lock.lock();
        try {
            return engaged;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 订阅 ====================

    public Disposable subscribe(PoolTopic topic, PoolEventListener listener) {
        return eventBus.subscribe(topic, listener);
    }

    public Flux<PoolEvent> events() {
        return eventBus.flux();
    }

    // ==================== 内部 ====================

    private Optional<SessionInfo> sessionInfo(Instant now) {
        if (current == null) {
            return Optional.empty();
        }
        Account a = registry.find(current.accountId()).orElse(null);
        if (a == null) {
            return Optional.empty();
        }
        return Optional.of(new SessionInfo(current.sessionId(), a.id(), a.label(), current.startedAt(),
                current.duration(now), current.emergency(), connected, monitor.timeUntilSwitch(current, a, now)));
    }

    private boolean isCurrent(Account a) {
        return current != null && current.accountId().equals(a.id());
    }

    private void move(Account a, AccountStatus target, Instant now, String message) {
        AccountStatus from = registry.transition(a, target, now);
        if (from != target) {
            emit(event(PoolEventType.STATUS_CHANGED, a).statusChange(from, target).message(message), now);
            dirty = true;
        }
    }

    private static PoolEvent.Builder event(PoolEventType type, Account a) {
        return PoolEvent.builder(type).account(a.id(), a.label());
    }

    private void emit(PoolEvent.Builder builder, Instant now) {
        PoolEvent event = builder.build(++eventSeq, now);
        eventLog.append(event);
        metrics.recordEvent(event.type().name());
        switch (event.severity()) {
            case CRITICAL -> log.error("[{}] {} {}", event.type(), event.accountName(), event.message());
            case WARNING -> log.warn("[{}] {} {}", event.type(), event.accountName(), event.message());
            default -> log.info("[{}] {} {}", event.type(), event.accountName(), event.message());
        }
        eventBus.publish(event);
    }

    private void persist() {
        try {
            store.savePool(registry.snapshots(), settings);
            dirty = false;
        } catch (RuntimeException e) {
            log.error("保存账号池失败, 下次 tick 重试", e);
        }
    }

    private void updateGauges() {
        List<Account> all = registry.all();
        metrics.setGauge("accounts_total", all.size());
        metrics.setGauge("accounts_available", selector.eligibleCount(all));
        metrics.setGauge("session_active", current != null ? 1 : 0);
        metrics.setGauge("session_emergency", current != null && current.emergency() ? 1 : 0);
    }

    private static String formatDuration(Duration d) {
        long minutes = d.toMinutes();
        return minutes >= 60 ? (minutes / 60) + "h" + (minutes % 60) + "m" : minutes + "m";
    }

    private record PendingOp(long opId, OperationKind kind) {
    }

    private record Outcome(long opId, String accountId, OperationKind kind, ProvisionResult result) {
    }
}
