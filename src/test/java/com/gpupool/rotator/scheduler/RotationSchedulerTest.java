package com.gpupool.rotator.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gpupool.rotator.event.EventLog;
import com.gpupool.rotator.event.PoolEvent;
import com.gpupool.rotator.event.PoolEventBus;
import com.gpupool.rotator.event.PoolEventType;
import com.gpupool.rotator.event.PoolTopic;
import com.gpupool.rotator.event.Severity;
import com.gpupool.rotator.exception.AccountNotFoundException;
import com.gpupool.rotator.exception.IneligibleAccountException;
import com.gpupool.rotator.exception.ProvisioningException;
import com.gpupool.rotator.exception.ValidationException;
import com.gpupool.rotator.pool.Account;
import com.gpupool.rotator.pool.AccountDefaults;
import com.gpupool.rotator.pool.AccountRegistry;
import com.gpupool.rotator.pool.AccountSnapshot;
import com.gpupool.rotator.pool.AccountSpec;
import com.gpupool.rotator.pool.AccountStatus;
import com.gpupool.rotator.pool.CooldownCause;
import com.gpupool.rotator.pool.PoolSettings;
import com.gpupool.rotator.pool.RotationStrategy;
import com.gpupool.rotator.provision.ProvisionResult;
import com.gpupool.rotator.provision.ProvisioningExecutor;
import com.gpupool.rotator.provision.ProvisioningTimeouts;
import com.gpupool.rotator.store.PoolSnapshot;
import com.gpupool.rotator.store.PoolStore;
import com.gpupool.rotator.support.FakeProvisioner;
import com.gpupool.rotator.support.MutableClock;
import com.gpupool.rotator.util.Metrics;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RotationSchedulerTest {

    private static final Instant T0 = Instant.parse("2026-03-10T08:00:00Z");

    private MutableClock clock;
    private FakeProvisioner provisioner;
    private PoolStore store;
    private EventLog eventLog;
    private Metrics metrics;
    private RotationScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        provisioner = new FakeProvisioner();
        store = mock(PoolStore.class);
        when(store.loadPool()).thenReturn(PoolSnapshot.empty());
        eventLog = new EventLog(2000);
        metrics = new Metrics();
        scheduler = newScheduler(noPrestart(), Runnable::run);
    }

    private RotationScheduler newScheduler(PoolSettings settings, Executor executor) {
        ProvisioningExecutor provisioning = new ProvisioningExecutor(provisioner, executor,
                ProvisioningTimeouts.defaults(), metrics);
        return new RotationScheduler(clock, new AccountRegistry(AccountDefaults.standard()), provisioning, store,
                eventLog, new PoolEventBus(), metrics, settings);
    }

    private static PoolSettings noPrestart() {
        return PoolSettings.defaults().withPrestart(false, Duration.ofMinutes(5));
    }

    private AccountSnapshot add(String name, int priority, long quotaMinutes, long maxSessionMinutes) {
        return scheduler.addAccount(AccountSpec.of(name).withPriority(priority)
                .withQuota(Duration.ofMinutes(quotaMinutes), Duration.ofMinutes(maxSessionMinutes)));
    }

    private AccountSnapshot add(String name, int priority) {
        return add(name, priority, 720, 720);
    }

    private void tickAt(long minutes) {
        clock.set(T0.plus(Duration.ofMinutes(minutes)));
        scheduler.tick();
    }

    private AccountSnapshot account(AccountSnapshot a) {
        return scheduler.getAccount(a.id());
    }

    private String currentId() {
        return scheduler.currentSession().map(SessionInfo::accountId).orElse(null);
    }

    /**
     * Events of one type in commit order.
     */
    private List<PoolEvent> events(PoolEventType type) {
        List<PoolEvent> all = new ArrayList<>(eventLog.recent(Integer.MAX_VALUE));
        Collections.reverse(all);
        return all.stream().filter(e -> e.type() == type).toList();
    }

    @Nested
    @DisplayName("session limit and cooldown")
    class SessionLimit {

        @Test
        @DisplayName("raises one switch at the limit and cools the outgoing account down")
        void switchesAtLimit() {
            AccountSnapshot a = add("a", 10, 720, 120);
            AccountSnapshot b = add("b", 20);

            assertThat(scheduler.startSession()).get().extracting(SessionInfo::accountId).isEqualTo(a.id());
            tickAt(1);
            tickAt(119);
            assertThat(events(PoolEventType.SWITCH_REQUIRED)).isEmpty();

            tickAt(120);
            tickAt(121);
            tickAt(125);

            List<PoolEvent> switches = events(PoolEventType.SWITCH_REQUIRED);
            assertThat(switches).singleElement().satisfies(e -> {
                assertThat(e.accountId()).isEqualTo(a.id());
                assertThat(e.relatedAccountId()).isEqualTo(b.id());
                assertThat(e.reason()).isEqualTo("SESSION_LIMIT");
                assertThat(e.severity()).isEqualTo(Severity.WARNING);
            });
            AccountSnapshot outgoing = account(a);
            assertThat(outgoing.status()).isEqualTo(AccountStatus.COOLDOWN);
            assertThat(outgoing.cooldownCause()).isEqualTo(CooldownCause.SESSION_LIMIT);
            assertThat(outgoing.cooldownUntil()).isEqualTo(T0.plus(Duration.ofMinutes(180)));
            assertThat(outgoing.usedToday()).isEqualTo(Duration.ofMinutes(120));
            assertThat(currentId()).isEqualTo(b.id());
            assertThat(events(PoolEventType.ACCOUNT_ROTATED)).singleElement()
                    .satisfies(e -> assertThat(e.relatedAccountId()).isEqualTo(b.id()));
        }

        @Test
        @DisplayName("cooldown expires back to Active at its deadline")
        void cooldownExpires() {
            AccountSnapshot a = add("a", 10, 720, 60);
            add("b", 20);
            scheduler.startSession();

            tickAt(60);
            tickAt(119);
            assertThat(account(a).status()).isEqualTo(AccountStatus.COOLDOWN);

            tickAt(120);
            assertThat(account(a).status()).isEqualTo(AccountStatus.ACTIVE);
            assertThat(account(a).cooldownUntil()).isNull();
        }

        @Test
        @DisplayName("zero cooldown returns the outgoing account straight to Active")
        void zeroCooldown() {
            scheduler.updateSettings(noPrestart().withCooldown(Duration.ZERO));
            AccountSnapshot a = add("a", 10, 720, 60);
            add("b", 20);
            scheduler.startSession();

            tickAt(60);

            assertThat(account(a).status()).isEqualTo(AccountStatus.ACTIVE);
        }
    }

    @Nested
    @DisplayName("quota")
    class Quota {

        @Test
        @DisplayName("low quota rotates early once usage passes the threshold")
        void lowQuotaRotation() {
            AccountSnapshot a = add("a", 10, 100, 720);
            AccountSnapshot b = add("b", 20);
            scheduler.startSession();

            tickAt(90);
            assertThat(events(PoolEventType.SWITCH_REQUIRED)).isEmpty();
            assertThat(events(PoolEventType.QUOTA_WARNING)).isEmpty();

            tickAt(91);
            assertThat(events(PoolEventType.QUOTA_WARNING)).hasSize(1);
            assertThat(events(PoolEventType.SWITCH_REQUIRED)).singleElement().satisfies(e -> {
                assertThat(e.reason()).isEqualTo("LOW_QUOTA");
                assertThat(e.severity()).isEqualTo(Severity.INFO);
            });
            assertThat(account(a).status()).isEqualTo(AccountStatus.COOLDOWN);
            assertThat(account(a).cooldownCause()).isEqualTo(CooldownCause.LOW_QUOTA);
            assertThat(currentId()).isEqualTo(b.id());
        }

        @Test
        @DisplayName("low quota without a replacement keeps running until the quota is gone")
        void lowQuotaWithoutReplacement() {
            AccountSnapshot a = add("a", 10, 100, 720);
            scheduler.startSession();

            tickAt(91);
            assertThat(events(PoolEventType.SWITCH_REQUIRED)).singleElement()
                    .satisfies(e -> assertThat(e.relatedAccountId()).isNull());
            assertThat(currentId()).isEqualTo(a.id());

            tickAt(100);
            tickAt(101);
            assertThat(events(PoolEventType.QUOTA_EXCEEDED)).hasSize(1);
            assertThat(account(a).status()).isEqualTo(AccountStatus.COOLDOWN);
            assertThat(account(a).cooldownCause()).isEqualTo(CooldownCause.QUOTA_EXHAUSTED);
            assertThat(account(a).remainingQuota()).isEqualTo(Duration.ZERO);
            assertThat(scheduler.currentSession()).isEmpty();
            assertThat(events(PoolEventType.POOL_EXHAUSTED)).singleElement()
                    .satisfies(e -> assertThat(e.severity()).isEqualTo(Severity.CRITICAL));
            assertThat(scheduler.getPoolStatus().poolAvailable()).isFalse();
        }

        @Test
        @DisplayName("the daily reset at UTC midnight revives an exhausted account")
        void dailyReset() {
            AccountSnapshot a = add("a", 10, 60, 720);
            scheduler.startSession();

            tickAt(60);
            tickAt(120);
            assertThat(account(a).status()).isEqualTo(AccountStatus.QUOTA_EXHAUSTED);

            clock.set(Instant.parse("2026-03-11T00:00:01Z"));
            scheduler.tick();

            assertThat(events(PoolEventType.QUOTA_RESET)).hasSize(1);
            assertThat(account(a).usedToday()).isEqualTo(Duration.ZERO);
            assertThat(account(a).status()).isEqualTo(AccountStatus.RUNNING);
            assertThat(currentId()).isEqualTo(a.id());
        }

        @Test
        @DisplayName("a tick interval spanning midnight charges the new day with its share")
        void accrualSplitAtMidnight() {
            AccountSnapshot a = add("a", 10);
            clock.set(Instant.parse("2026-03-10T22:30:00Z"));
            scheduler.startSession();
            clock.set(Instant.parse("2026-03-10T23:00:00Z"));
            scheduler.tick();
            assertThat(account(a).usedToday()).isEqualTo(Duration.ofMinutes(30));

            clock.set(Instant.parse("2026-03-11T01:00:00Z"));
            scheduler.tick();

            assertThat(account(a).usedToday()).isEqualTo(Duration.ofMinutes(60));
            assertThat(account(a).lastResetDay()).isEqualTo(LocalDate.of(2026, 3, 11));
            assertThat(account(a).status()).isEqualTo(AccountStatus.RUNNING);
            assertThat(events(PoolEventType.QUOTA_RESET)).hasSize(1);
        }

        @Test
        @DisplayName("manual reset returns every exhausted account to Active")
        void manualReset() {
            AccountSnapshot a = add("a", 10, 60, 720);
            add("b", 20, 60, 720);
            scheduler.startSession();
            tickAt(60);
            tickAt(120);
            scheduler.endSession();

            assertThat(scheduler.resetAllDailyQuotas()).isEqualTo(2);

            assertThat(scheduler.getAllAccounts()).allSatisfy(s -> {
                assertThat(s.status()).isEqualTo(AccountStatus.ACTIVE);
                assertThat(s.usedToday()).isEqualTo(Duration.ZERO);
            });
            assertThat(account(a).lastResetDay()).isEqualTo(LocalDate.of(2026, 3, 10));
        }
    }

    @Nested
    @DisplayName("emergency failover")
    class Emergency {

        @Test
        @DisplayName("takes over when the normal pool runs dry")
        void takesOver() {
            AccountSnapshot a = add("a", 10, 60, 720);
            AccountSnapshot backup = scheduler.addAccount(AccountSpec.of("backup").withEmergency(true));
            scheduler.startSession();
            assertThat(currentId()).isEqualTo(a.id());

            tickAt(60);

            assertThat(currentId()).isEqualTo(backup.id());
            assertThat(scheduler.currentSession()).get().extracting(SessionInfo::emergency).isEqualTo(true);
            assertThat(events(PoolEventType.EMERGENCY_ACTIVATED)).singleElement()
                    .satisfies(e -> assertThat(e.severity()).isEqualTo(Severity.CRITICAL));
            PoolStatus status = scheduler.getPoolStatus();
            assertThat(status.available()).isZero();
            assertThat(status.poolAvailable()).isTrue();
        }

        @Test
        @DisplayName("hands the session back once a normal account is eligible again")
        void handsBack() {
            AccountSnapshot a = add("a", 10, 720, 60);
            AccountSnapshot backup = scheduler.addAccount(AccountSpec.of("backup").withEmergency(true));
            scheduler.startSession();
            tickAt(60);
            assertThat(currentId()).isEqualTo(backup.id());

            tickAt(119);
            assertThat(currentId()).isEqualTo(backup.id());

            tickAt(120);

            assertThat(currentId()).isEqualTo(a.id());
            assertThat(scheduler.currentSession()).get().extracting(SessionInfo::emergency).isEqualTo(false);
            assertThat(account(backup).status()).isEqualTo(AccountStatus.ACTIVE);
            assertThat(events(PoolEventType.SWITCH_REQUIRED)).last().satisfies(e -> {
                assertThat(e.accountId()).isEqualTo(backup.id());
                assertThat(e.relatedAccountId()).isEqualTo(a.id());
                assertThat(e.reason()).isEqualTo("NORMAL_AVAILABLE");
                assertThat(e.severity()).isEqualTo(Severity.INFO);
            });
            assertThat(events(PoolEventType.ACCOUNT_ROTATED)).last()
                    .satisfies(e -> assertThat(e.accountId()).isEqualTo(backup.id()));
        }

        @Test
        @DisplayName("stays unused when failover is switched off")
        void failoverOff() {
            scheduler.updateSettings(noPrestart().withAutoFailover(false));
            add("a", 10, 60, 720);
            scheduler.addAccount(AccountSpec.of("backup").withEmergency(true));
            scheduler.startSession();

            tickAt(60);

            assertThat(scheduler.currentSession()).isEmpty();
            PoolStatus status = scheduler.getPoolStatus();
            assertThat(status.emergencyReady()).isEqualTo(1);
            assertThat(status.poolAvailable()).isFalse();
            assertThat(events(PoolEventType.POOL_EXHAUSTED)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("prestart")
    class Prestart {

        private AccountSnapshot a;
        private AccountSnapshot b;
        private AccountSnapshot c;

        @BeforeEach
        void setUpPool() {
            scheduler = newScheduler(PoolSettings.defaults(), Runnable::run);
            a = add("a", 10, 720, 60);
            b = add("b", 20);
            c = add("c", 30);
            scheduler.startSession();
        }

        @Test
        @DisplayName("prestarting the same candidate twice has no extra effect")
        void idempotent() {
            assertThat(scheduler.prestartNext()).get().extracting(AccountSnapshot::id).isEqualTo(b.id());
            assertThat(scheduler.prestartNext()).get().extracting(AccountSnapshot::id).isEqualTo(b.id());

            assertThat(events(PoolEventType.PRESTART_TRIGGERED)).hasSize(1);
            assertThat(provisioner.started()).containsExactly("a", "b");
            assertThat(scheduler.getPoolStatus().prestartAccountId()).isEqualTo(b.id());
        }

        @Test
        @DisplayName("the warmed candidate wins the cutover even if a better one appears")
        void warmCandidateWins() {
            tickAt(55);
            assertThat(events(PoolEventType.PRESTART_TRIGGERED)).singleElement()
                    .satisfies(e -> assertThat(e.accountId()).isEqualTo(b.id()));
            tickAt(56);
            scheduler.updateAccount(AccountSpec.of("c").withId(c.id()).withPriority(1));

            tickAt(60);

            assertThat(currentId()).isEqualTo(b.id());
            assertThat(scheduler.currentSession()).get().extracting(SessionInfo::connected).isEqualTo(true);
            assertThat(provisioner.started()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("a stale prestart is cancelled when the preferred candidate changes")
        void stalePrestartCancelled() {
            tickAt(55);
            scheduler.updateAccount(AccountSpec.of("c").withId(c.id()).withPriority(1));

            tickAt(56);

            assertThat(provisioner.stopped()).contains("b");
            assertThat(scheduler.getPoolStatus().prestartAccountId()).isEqualTo(c.id());

            tickAt(60);
            assertThat(currentId()).isEqualTo(c.id());
            assertThat(account(b).status()).isEqualTo(AccountStatus.ACTIVE);
        }

        @Test
        @DisplayName("ending the session drops the prestart")
        void endSessionCancels() {
            scheduler.prestartNext();

            scheduler.endSession();

            assertThat(scheduler.getPoolStatus().prestartAccountId()).isNull();
            assertThat(provisioner.stopped()).contains("a", "b");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("repeated failures escalate to Suspended and stop the retries")
        void retryBudget() {
            AccountSnapshot a = add("a", 10);
            provisioner.failStart("a", ProvisionResult.failure("boom"));
            provisioner.failHealth("a", ProvisionResult.failure("still down"));
            scheduler.startSession();

            tickAt(1);
            assertThat(account(a).status()).isEqualTo(AccountStatus.ERROR);
            assertThat(account(a).nextRetryAt()).isEqualTo(T0.plus(Duration.ofMinutes(2)));
            assertThat(scheduler.currentSession()).isEmpty();

            tickAt(2);
            tickAt(3);
            assertThat(account(a).status()).isEqualTo(AccountStatus.ERROR);
            assertThat(account(a).nextRetryAt()).isEqualTo(T0.plus(Duration.ofMinutes(5)));

            tickAt(5);
            tickAt(6);
            tickAt(60);

            AccountSnapshot suspended = account(a);
            assertThat(suspended.status()).isEqualTo(AccountStatus.SUSPENDED);
            assertThat(suspended.consecutiveFailures()).isEqualTo(3);
            assertThat(suspended.nextRetryAt()).isNull();
            assertThat(events(PoolEventType.ERROR)).extracting(PoolEvent::severity)
                    .containsExactly(Severity.WARNING, Severity.WARNING, Severity.CRITICAL);
            assertThat(provisioner.healthChecked()).hasSize(2);
        }

        @Test
        @DisplayName("a passing retry check recovers the account automatically")
        void autoRecovery() {
            AccountSnapshot a = add("a", 10);
            provisioner.failStart("a", ProvisionResult.failure("boom"));
            scheduler.startSession();
            tickAt(1);
            provisioner.heal("a");

            tickAt(2);
            tickAt(3);

            assertThat(events(PoolEventType.ACCOUNT_RECOVERED)).hasSize(1);
            assertThat(account(a).consecutiveFailures()).isZero();
            assertThat(currentId()).isEqualTo(a.id());
        }

        @Test
        @DisplayName("a fatal start failure suspends at once")
        void fatalSuspends() {
            AccountSnapshot a = add("a", 10);
            AccountSnapshot b = add("b", 20);
            provisioner.failStart("a", ProvisionResult.fatal("banned"));
            scheduler.startSession();

            tickAt(1);

            assertThat(account(a).status()).isEqualTo(AccountStatus.SUSPENDED);
            assertThat(currentId()).isEqualTo(b.id());
        }

        @Test
        @DisplayName("a failed health check disconnects the current account and rotates")
        void healthFailureRotates() {
            AccountSnapshot a = add("a", 10);
            AccountSnapshot b = add("b", 20);
            scheduler.startSession();
            provisioner.failHealth("a", ProvisionResult.failure("timeout"));

            tickAt(1);
            tickAt(2);

            assertThat(account(a).status()).isEqualTo(AccountStatus.DISCONNECTED);
            assertThat(account(a).nextRetryAt()).isEqualTo(T0.plus(Duration.ofMinutes(3)));
            assertThat(events(PoolEventType.DISCONNECTED)).hasSize(1);
            assertThat(currentId()).isEqualTo(b.id());
        }

        @Test
        @DisplayName("outcomes of cancelled operations are discarded")
        void cancelledOutcomeDiscarded() {
            List<Runnable> deferred = new ArrayList<>();
            scheduler = newScheduler(noPrestart(), deferred::add);
            AccountSnapshot a = add("a", 10);
            provisioner.failStart("a", ProvisionResult.failure("late failure"));
            scheduler.startSession();

            scheduler.endSession();
            while (!deferred.isEmpty()) {
                deferred.remove(0).run();
            }
            tickAt(1);

            assertThat(account(a).status()).isEqualTo(AccountStatus.ACTIVE);
            assertThat(account(a).consecutiveFailures()).isZero();
            assertThat(events(PoolEventType.ERROR)).isEmpty();
            assertThat(events(PoolEventType.CONNECTED)).isEmpty();
        }

        @Test
        @DisplayName("task failures consume the budget and suspend the current account at the limit")
        void taskFailures() {
            AccountSnapshot a = add("a", 10);
            scheduler.startSession();
            tickAt(1);

            scheduler.recordTaskResult(a.id(), false, "OOM");
            scheduler.recordTaskResult(a.id(), false, "OOM");
            assertThat(account(a).status()).isEqualTo(AccountStatus.RUNNING);

            scheduler.recordTaskResult(a.id(), false, "OOM");

            assertThat(account(a).status()).isEqualTo(AccountStatus.SUSPENDED);
            assertThat(scheduler.currentSession()).isEmpty();
            assertThat(events(PoolEventType.TASK_FAILED)).extracting(PoolEvent::severity)
                    .containsExactly(Severity.WARNING, Severity.WARNING, Severity.CRITICAL);
        }

        @Test
        @DisplayName("a task success resets the consecutive counter")
        void taskSuccessResets() {
            AccountSnapshot a = add("a", 10);
            scheduler.recordTaskStarted(a.id());
            scheduler.recordTaskResult(a.id(), false, null);
            scheduler.recordTaskResult(a.id(), true, null);

            AccountSnapshot s = account(a);
            assertThat(s.consecutiveFailures()).isZero();
            assertThat(s.successCount()).isEqualTo(1);
            assertThat(s.failureCount()).isEqualTo(1);
            assertThat(events(PoolEventType.TASK_STARTED)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("recovery")
    class Recovery {

        @Test
        @DisplayName("refuses accounts that need no recovery")
        void refusesActive() {
            AccountSnapshot a = add("a", 10);

            assertThatThrownBy(() -> scheduler.recoverAccount(a.id(), true))
                    .isInstanceOf(IneligibleAccountException.class);
            assertThatThrownBy(() -> scheduler.recoverAccount("missing", false))
                    .isInstanceOf(AccountNotFoundException.class);
        }

        @Test
        @DisplayName("cooldown needs force")
        void cooldownNeedsForce() {
            AccountSnapshot a = add("a", 10, 720, 60);
            scheduler.startSession();
            tickAt(60);
            assertThat(account(a).status()).isEqualTo(AccountStatus.COOLDOWN);

            assertThatThrownBy(() -> scheduler.recoverAccount(a.id(), false))
                    .isInstanceOf(IneligibleAccountException.class);

            AccountSnapshot recovered = scheduler.recoverAccount(a.id(), true);
            assertThat(recovered.status()).isEqualTo(AccountStatus.ACTIVE);
            assertThat(recovered.cooldownUntil()).isNull();
        }

        @Test
        @DisplayName("a failing health check leaves the status unchanged")
        void failedRecovery() {
            AccountSnapshot a = add("a", 10);
            provisioner.failStart("a", ProvisionResult.failure("boom"));
            scheduler.startSession();
            tickAt(1);
            provisioner.failHealth("a", ProvisionResult.failure("still down"));

            assertThatThrownBy(() -> scheduler.recoverAccount(a.id(), false))
                    .isInstanceOf(ProvisioningException.class)
                    .hasMessageContaining("still down");
            assertThat(account(a).status()).isEqualTo(AccountStatus.ERROR);
            assertThat(account(a).lastError()).isEqualTo("still down");
        }

        @Test
        @DisplayName("a suspended account comes back with a clean failure record")
        void suspendedRecovers() {
            AccountSnapshot a = add("a", 10);
            for (int i = 0; i < 3; i++) {
                scheduler.recordTaskResult(a.id(), false, "crash");
            }
            assertThat(account(a).status()).isEqualTo(AccountStatus.SUSPENDED);

            AccountSnapshot recovered = scheduler.recoverAccount(a.id(), false);

            assertThat(recovered.status()).isEqualTo(AccountStatus.ACTIVE);
            assertThat(recovered.consecutiveFailures()).isZero();
            assertThat(events(PoolEventType.ACCOUNT_RECOVERED)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("manual control")
    class ManualControl {

        @Test
        @DisplayName("setActive switches without cooling the previous account")
        void setActive() {
            AccountSnapshot a = add("a", 10);
            AccountSnapshot b = add("b", 20);
            scheduler.startSession();

            scheduler.setActive(b.id(), false);

            assertThat(currentId()).isEqualTo(b.id());
            assertThat(account(a).status()).isEqualTo(AccountStatus.ACTIVE);
            assertThat(events(PoolEventType.ACCOUNT_ROTATED)).hasSize(1);
            assertThat(scheduler.isEngaged()).isTrue();
        }

        @Test
        @DisplayName("force overrides eligibility but never suspension or disabling")
        void forceRules() {
            AccountSnapshot a = add("a", 10);
            AccountSnapshot b = add("b", 20);
            AccountSnapshot off = scheduler.addAccount(AccountSpec.of("off").withEnabled(false));
            scheduler.setActive(b.id(), false);
            scheduler.pauseAccount(b.id());
            scheduler.setActive(a.id(), false);

            assertThatThrownBy(() -> scheduler.setActive(b.id(), false))
                    .isInstanceOf(IneligibleAccountException.class);
            assertThatThrownBy(() -> scheduler.setActive(off.id(), true))
                    .isInstanceOf(IneligibleAccountException.class);

            scheduler.setActive(b.id(), true);
            assertThat(currentId()).isEqualTo(b.id());
        }

        @Test
        @DisplayName("pause frees the session and resume makes the account selectable again")
        void pauseResume() {
            AccountSnapshot a = add("a", 10);
            AccountSnapshot b = add("b", 20);
            scheduler.startSession();

            assertThat(scheduler.pauseAccount(a.id()).status()).isEqualTo(AccountStatus.PAUSED);
            assertThat(scheduler.currentSession()).isEmpty();
            tickAt(1);
            assertThat(currentId()).isEqualTo(b.id());

            assertThatThrownBy(() -> scheduler.pauseAccount(a.id())).isInstanceOf(IneligibleAccountException.class);
            assertThat(scheduler.resumeAccount(a.id()).status()).isEqualTo(AccountStatus.ACTIVE);
            assertThatThrownBy(() -> scheduler.resumeAccount(a.id())).isInstanceOf(IneligibleAccountException.class);
        }

        @Test
        @DisplayName("ending the session disengages rotation")
        void endSession() {
            AccountSnapshot a = add("a", 10);
            scheduler.startSession();
            clock.set(T0.plus(Duration.ofMinutes(30)));

            assertThat(scheduler.endSession()).get().satisfies(s -> {
                assertThat(s.id()).isEqualTo(a.id());
                assertThat(s.status()).isEqualTo(AccountStatus.ACTIVE);
                assertThat(s.usedToday()).isEqualTo(Duration.ofMinutes(30));
            });
            tickAt(31);

            assertThat(scheduler.isEngaged()).isFalse();
            assertThat(scheduler.currentSession()).isEmpty();
            assertThat(provisioner.stopped()).containsExactly("a");
            assertThat(scheduler.endSession()).isEmpty();
        }

        @Test
        @DisplayName("a disabled current account is rotated out on the next tick")
        void disabledRotatedOut() {
            AccountSnapshot a = add("a", 10);
            AccountSnapshot b = add("b", 20);
            scheduler.startSession();

            scheduler.updateAccount(AccountSpec.of("a").withId(a.id()).withEnabled(false));
            assertThat(currentId()).isEqualTo(a.id());

            tickAt(1);

            assertThat(events(PoolEventType.SWITCH_REQUIRED)).singleElement()
                    .satisfies(e -> assertThat(e.reason()).isEqualTo("ACCOUNT_DISABLED"));
            assertThat(account(a).status()).isEqualTo(AccountStatus.ACTIVE);
            assertThat(currentId()).isEqualTo(b.id());
        }

        @Test
        @DisplayName("removing the current account ends its session")
        void removeCurrent() {
            AccountSnapshot a = add("a", 10);
            AccountSnapshot b = add("b", 20);
            scheduler.startSession();

            scheduler.removeAccount(a.id());

            assertThat(scheduler.currentSession()).isEmpty();
            assertThat(scheduler.getAllAccounts()).extracting(AccountSnapshot::id).containsExactly(b.id());
            assertThat(events(PoolEventType.ACCOUNT_REMOVED)).hasSize(1);
            assertThat(provisioner.stopped()).contains("a");

            tickAt(1);
            assertThat(currentId()).isEqualTo(b.id());
        }

        @Test
        @DisplayName("restart keeps the session and counts the reboot")
        void restart() {
            AccountSnapshot a = add("a", 10);
            assertThatThrownBy(() -> scheduler.restartSession()).isInstanceOf(IneligibleAccountException.class);
            String sessionId = scheduler.startSession().orElseThrow().sessionId();
            tickAt(1);

            assertThat(scheduler.restartSession().rebootCount()).isEqualTo(1);
            assertThat(scheduler.currentSession()).get().extracting(SessionInfo::connected).isEqualTo(false);
            tickAt(2);

            assertThat(scheduler.currentSession()).get().satisfies(s -> {
                assertThat(s.sessionId()).isEqualTo(sessionId);
                assertThat(s.connected()).isTrue();
            });
            assertThat(events(PoolEventType.REBOOTING)).hasSize(1);
            assertThat(provisioner.started()).containsExactly("a", "a");
            assertThat(account(a).status()).isEqualTo(AccountStatus.RUNNING);
        }
    }

    @Nested
    @DisplayName("settings and persistence")
    class SettingsAndPersistence {

        @Test
        @DisplayName("invalid settings are rejected and the old ones stay")
        void invalidSettings() {
            assertThatThrownBy(() -> scheduler.updateSettings(null)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> scheduler.updateSettings(noPrestart().withLowQuota(0, true)))
                    .isInstanceOf(ValidationException.class);

            PoolSettings next = noPrestart().withStrategy(RotationStrategy.LEAST_USED);
            assertThat(scheduler.updateSettings(next)).isEqualTo(next);
            assertThat(scheduler.getSettings()).isEqualTo(next);
            assertThat(events(PoolEventType.SETTINGS_UPDATED)).hasSize(1);
        }

        @Test
        @DisplayName("loading restores settings and turns leftover Running accounts into Active")
        void loadNormalisesRunning() {
            AccountRegistry other = new AccountRegistry(AccountDefaults.standard());
            Account stale = other.add(AccountSpec.of("stale"), T0);
            other.transition(stale, AccountStatus.RUNNING, T0);
            PoolSettings saved = noPrestart().withStrategy(RotationStrategy.ROUND_ROBIN);
            when(store.loadPool()).thenReturn(new PoolSnapshot(List.of(stale.snapshot()), saved));

            scheduler.load();

            AccountSnapshot loaded = scheduler.getAccount(stale.id());
            assertThat(loaded.status()).isEqualTo(AccountStatus.ACTIVE);
            assertThat(loaded.sessionStartTime()).isNull();
            assertThat(scheduler.getSettings()).isEqualTo(saved);
            assertThat(scheduler.currentSession()).isEmpty();

            scheduler.tick();
            verify(store).savePool(anyList(), any());
        }

        @Test
        @DisplayName("a failing store does not break commands or ticks and is retried")
        void storeFailure() {
            doThrow(new IllegalStateException("disk full")).doNothing().when(store).savePool(anyList(), any());

            AccountSnapshot a = add("a", 10);
            tickAt(1);

            assertThat(scheduler.getAccount(a.id())).isNotNull();
            verify(store, times(2)).savePool(anyList(), any());
        }

        @Test
        @DisplayName("unknown accounts raise not-found")
        void unknownAccount() {
            assertThatThrownBy(() -> scheduler.getAccount("nope")).isInstanceOf(AccountNotFoundException.class);
            assertThatThrownBy(() -> scheduler.removeAccount("nope")).isInstanceOf(AccountNotFoundException.class);
            assertThatThrownBy(() -> scheduler.setActive("nope", true)).isInstanceOf(AccountNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("events and stats")
    class EventsAndStats {

        @Test
        @DisplayName("subscribers see events in commit order with increasing ids")
        void commitOrder() {
            List<PoolEvent> seen = new ArrayList<>();
            List<PoolEvent> rotations = new ArrayList<>();
            scheduler.subscribe(PoolTopic.POOL_EVENT, seen::add);
            scheduler.subscribe(PoolTopic.ACCOUNT_ROTATED, rotations::add);
            add("a", 10, 720, 60);
            add("b", 20);
            scheduler.startSession();
            tickAt(60);

            assertThat(seen).extracting(PoolEvent::id).isSorted().doesNotHaveDuplicates();
            assertThat(seen).extracting(PoolEvent::type)
                    .containsSubsequence(PoolEventType.SWITCH_REQUIRED, PoolEventType.SESSION_ENDED,
                            PoolEventType.SESSION_STARTED, PoolEventType.ACCOUNT_ROTATED);
            assertThat(rotations).hasSize(1);
            assertThat(scheduler.getRecentEvents(1)).singleElement()
                    .extracting(PoolEvent::id).isEqualTo(seen.get(seen.size() - 1).id());
        }

        @Test
        @DisplayName("stats aggregate sessions, usage and event counts")
        void stats() {
            add("a", 10, 720, 60);
            add("b", 20, 100, 720);
            scheduler.startSession();
            tickAt(60);
            tickAt(70);

            PoolStats stats = scheduler.getStats();

            assertThat(stats.totalSessions()).isEqualTo(2);
            assertThat(stats.rotations()).isEqualTo(1);
            assertThat(stats.usedToday()).isEqualTo(Duration.ofMinutes(70));
            assertThat(stats.remainingToday()).isEqualTo(Duration.ofMinutes(660 + 90));
            assertThat(stats.nextSwitchTime()).isEqualTo(T0.plus(Duration.ofMinutes(160)));
            assertThat(stats.eventsByType()).containsEntry(PoolEventType.SESSION_STARTED, 2L);
            assertThat(metrics.get("events_session_started")).isEqualTo(2);
            assertThat(metrics.gauge("session_active")).isEqualTo(1);
        }
    }
}
