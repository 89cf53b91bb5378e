package com.gpupool.rotator.pool;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class AccountStatusTest {

    @Test
    @DisplayName("Suspended accounts can only go back to Active")
    void suspendedOnlyRecoversToActive() {
        assertThat(AccountStatus.SUSPENDED.allowedTargets()).containsExactly(AccountStatus.ACTIVE);
    }

    @Test
    @DisplayName("Running can leave to every status except itself")
    void runningCanLeaveEverywhere() {
        assertThat(AccountStatus.RUNNING.allowedTargets())
                .contains(AccountStatus.ACTIVE, AccountStatus.COOLDOWN, AccountStatus.ERROR,
                        AccountStatus.DISCONNECTED, AccountStatus.SUSPENDED, AccountStatus.PAUSED)
                .doesNotContain(AccountStatus.RUNNING);
    }

    @Test
    @DisplayName("Cooldown cannot jump straight to Error or Suspended")
    void cooldownCannotFail() {
        assertThat(AccountStatus.COOLDOWN.canTransitionTo(AccountStatus.ERROR)).isFalse();
        assertThat(AccountStatus.COOLDOWN.canTransitionTo(AccountStatus.SUSPENDED)).isFalse();
        assertThat(AccountStatus.COOLDOWN.canTransitionTo(AccountStatus.ACTIVE)).isTrue();
    }

    @Test
    @DisplayName("Disconnected is only reachable from Running")
    void disconnectedOnlyFromRunning() {
        for (AccountStatus status : AccountStatus.values()) {
            boolean allowed = status.canTransitionTo(AccountStatus.DISCONNECTED);
            assertThat(allowed).as(status.name()).isEqualTo(status == AccountStatus.RUNNING);
        }
    }

    @ParameterizedTest
    @EnumSource(value = AccountStatus.class, names = {"ERROR", "DISCONNECTED", "SUSPENDED"})
    @DisplayName("Failure statuses are flagged as failures")
    void failureStatuses(AccountStatus status) {
        assertThat(status.isFailure()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = AccountStatus.class, names = {"ACTIVE", "RUNNING", "COOLDOWN", "QUOTA_EXHAUSTED", "PAUSED"})
    @DisplayName("Healthy statuses are not failures")
    void healthyStatuses(AccountStatus status) {
        assertThat(status.isFailure()).isFalse();
    }
}
