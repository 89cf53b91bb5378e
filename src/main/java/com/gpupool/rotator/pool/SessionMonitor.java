package com.gpupool.rotator.pool;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 会话监视器
 * <p>
 * 每个 tick 评估一次当前会话，按 {@link SwitchReason} 声明顺序返回第一个尚未上报的切换条件。
 * 同一会话内每个条件只上报一次
 */
public class SessionMonitor {

    private final QuotaTracker quotaTracker;
    private final Set<SwitchReason> raised = EnumSet.noneOf(SwitchReason.class);
    private String trackedSessionId;

    public SessionMonitor(QuotaTracker quotaTracker) {
        this.quotaTracker = quotaTracker;
    }

    public Optional<SwitchReason> evaluate(Session session, Account account, PoolSettings settings, Instant now) {
        return evaluate(session, account, settings, now, false);
    }

    /**
     * @param normalAvailable 当前是否存在满足正常资格的账号，仅对应急会话有意义
     */
    public Optional<SwitchReason> evaluate(Session session, Account account, PoolSettings settings, Instant now,
                                           boolean normalAvailable) {
        track(session);
        for (SwitchReason reason : SwitchReason.values()) {
            if (holds(reason, session, account, settings, now, normalAvailable) && raised.add(reason)) {
                return Optional.of(reason);
            }
        }
        return Optional.empty();
    }

    /**
     * 会话结束后清空上报记录
     */
    public void sessionEnded(String sessionId) {
        if (sessionId != null && sessionId.equals(trackedSessionId)) {
            trackedSessionId = null;
            raised.clear();
        }
    }

    public boolean hasRaised(String sessionId, SwitchReason reason) {
        return sessionId.equals(trackedSessionId) && raised.contains(reason);
    }

    /**
     * 距离下一次硬切换的时间：会话剩余时长与剩余配额取小；应急会话不看配额
     */
    public Duration timeUntilSwitch(Session session, Account account, Instant now) {
        Duration sessionLeft = account.maxSessionTime().minus(session.duration(now));
        if (sessionLeft.isNegative()) {
            sessionLeft = Duration.ZERO;
        }
        if (session.emergency()) {
            return sessionLeft;
        }
        Duration quotaLeft = account.remainingQuota();
        return quotaLeft.compareTo(sessionLeft) < 0 ? quotaLeft : sessionLeft;
    }

    private boolean holds(SwitchReason reason, Session session, Account account, PoolSettings settings, Instant now,
                          boolean normalAvailable) {
        return switch (reason) {
            // 应急账号本就忽略配额
            case QUOTA_EXHAUSTED -> !session.emergency() && !account.hasQuota();
            case SESSION_LIMIT -> session.duration(now).compareTo(account.maxSessionTime()) >= 0;
            case LOW_QUOTA -> !session.emergency() && settings.autoRotateOnQuotaLow()
                    && quotaTracker.isLow(account, settings.lowQuotaThresholdPercent());
            case ACCOUNT_DISABLED -> !account.enabled();
            case NORMAL_AVAILABLE -> session.emergency() && normalAvailable;
        };
    }

    private void track(Session session) {
        if (!session.sessionId().equals(trackedSessionId)) {
            trackedSessionId = session.sessionId();
            raised.clear();
        }
    }
}
