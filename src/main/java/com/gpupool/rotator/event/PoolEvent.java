package com.gpupool.rotator.event;

import com.gpupool.rotator.pool.AccountStatus;

import java.time.Instant;

/**
 * 池事件（只追加，不可变）
 *
 * @param id               单调递增序号
 * @param accountId        相关账号，池级事件为 null
 * @param oldStatus        状态变更前，仅 STATUS_CHANGED 有值
 * @param newStatus        状态变更后
 * @param relatedAccountId 轮换目标/下一个候选
 * @param reason           切换原因等附加说明
 */
public record PoolEvent(
        long id,
        Instant timestamp,
        PoolEventType type,
        Severity severity,
        String accountId,
        String accountName,
        String message,
        AccountStatus oldStatus,
        AccountStatus newStatus,
        String relatedAccountId,
        String reason) {

    public static Builder builder(PoolEventType type) {
        return new Builder(type);
    }

    public static final class Builder {

        private final PoolEventType type;
        private Severity severity = Severity.INFO;
        private String accountId;
        private String accountName;
        private String message = "";
        private AccountStatus oldStatus;
        private AccountStatus newStatus;
        private String relatedAccountId;
        private String reason;

        private Builder(PoolEventType type) {
            this.type = type;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder account(String accountId, String accountName) {
            this.accountId = accountId;
            this.accountName = accountName;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder statusChange(AccountStatus oldStatus, AccountStatus newStatus) {
            this.oldStatus = oldStatus;
            this.newStatus = newStatus;
            return this;
        }

        public Builder related(String relatedAccountId) {
            this.relatedAccountId = relatedAccountId;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public PoolEvent build(long id, Instant timestamp) {
            return new PoolEvent(id, timestamp, type, severity, accountId, accountName, message,
                    oldStatus, newStatus, relatedAccountId, reason);
        }
    }
}
